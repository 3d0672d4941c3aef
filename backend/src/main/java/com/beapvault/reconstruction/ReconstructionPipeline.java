package com.beapvault.reconstruction;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.beapvault.config.BeapProperties;
import com.beapvault.crypto.ContentHasher;
import com.beapvault.evaluation.VerificationStatus;
import com.beapvault.tools.BundledTool;
import com.beapvault.tools.RasterFormat;
import com.beapvault.tools.ToolExecutionLog;
import com.beapvault.tools.ToolExecutionLogEntry;
import com.beapvault.tools.ToolOperation;
import com.beapvault.tools.ToolRegistry;
import com.beapvault.tools.ToolStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns the attachments of an accepted message into hash-bound semantic text and
 * page rasters using the bundled tools.
 *
 * <p><b>Gating:</b> {@link #run} refuses with {@link ReconstructionRefusedException}
 * unless the message is {@link VerificationStatus#ACCEPTED} and the tool registry is
 * verified. The check happens before any tool starts.
 *
 * <p><b>Isolation:</b> attachments are processed concurrently on the bounded
 * reconstruction pool, and every tool call goes through the {@link ToolExecutor}. A
 * failing, crashing or slow attachment degrades to an unavailable entry and never
 * affects its siblings.
 */
@Service
public class ReconstructionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReconstructionPipeline.class);

    private static final Duration DEADLINE_SLACK = Duration.ofSeconds(1);

    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final ToolExecutionLog executionLog;
    private final ContentHasher hasher;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Duration toolTimeout;
    private final int memoryLimitMb;
    private final Clock clock;

    @Autowired
    public ReconstructionPipeline(ToolRegistry toolRegistry, ToolExecutor toolExecutor, ContentHasher hasher,
                                  ObjectMapper objectMapper,
                                  @Qualifier("reconstructionExecutor") Executor executor,
                                  BeapProperties properties, Clock clock) {
        this(toolRegistry, toolExecutor, hasher, objectMapper, executor,
                properties.tools().timeout(), properties.tools().memoryLimitMb(), clock);
    }

    public ReconstructionPipeline(ToolRegistry toolRegistry, ToolExecutor toolExecutor, ContentHasher hasher,
                                  ObjectMapper objectMapper, Executor executor,
                                  Duration toolTimeout, int memoryLimitMb, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.executionLog = toolRegistry.getExecutionLog();
        this.hasher = hasher;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.toolTimeout = toolTimeout;
        this.memoryLimitMb = memoryLimitMb;
        this.clock = clock;
    }

    public static boolean canReconstruct(VerificationStatus status) {
        return status == VerificationStatus.ACCEPTED;
    }

    /** Throws if a message in {@code status} may not be reconstructed right now. */
    public void checkPreconditions(VerificationStatus status) {
        if (!canReconstruct(status)) {
            throw new ReconstructionRefusedException(
                    "Reconstruction is only allowed for accepted messages (status: " + status + ")");
        }
        if (!toolRegistry.areToolsReady()) {
            throw new ReconstructionRefusedException("Bundled tools are not installed and verified");
        }
    }

    public ReconstructionResult run(ReconstructionRequest request) {
        checkPreconditions(request.verificationStatus());
        long start = clock.millis();
        try {
            List<CompletableFuture<AttachmentOutcome>> futures = new ArrayList<>();
            for (ReconstructionAttachment attachment : request.attachments()) {
                futures.add(submit(request.messageId(), attachment));
            }

            List<SemanticTextEntry> texts = new ArrayList<>();
            List<RasterRef> rasters = new ArrayList<>();
            for (CompletableFuture<AttachmentOutcome> future : futures) {
                AttachmentOutcome outcome = future.join();
                texts.add(outcome.text());
                if (outcome.raster() != null) {
                    rasters.add(outcome.raster());
                }
            }
            long duration = clock.millis() - start;
            log.info("Reconstructed {} attachment(s) of message {} in {} ms",
                    texts.size(), request.messageId(), duration);
            return ReconstructionResult.completed(texts, rasters, duration);
        } catch (RuntimeException e) {
            log.error("Reconstruction of message {} failed", request.messageId(), e);
            return ReconstructionResult.failed(e.getMessage(), clock.millis() - start);
        }
    }

    public boolean validateReconstructionIntegrity(SemanticTextEntry entry) {
        return hasher.sha256(entry.text()).equals(entry.textHash());
    }

    // ── Per attachment ───────────────────────────────────────────────────────

    /**
     * Schedules one attachment. Its deadline starts when a worker picks it up, so time
     * spent queued behind siblings does not count against it. A full pool degrades only
     * this attachment.
     */
    private CompletableFuture<AttachmentOutcome> submit(String messageId, ReconstructionAttachment attachment) {
        CompletableFuture<AttachmentOutcome> outcome = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                outcome.completeOnTimeout(unavailable(attachment), attachmentDeadline().toMillis(),
                        TimeUnit.MILLISECONDS);
                try {
                    outcome.complete(reconstructAttachment(messageId, attachment));
                } catch (RuntimeException e) {
                    log.warn("Attachment {} of message {} could not be reconstructed: {}",
                            attachment.artefactId(), messageId, e.toString());
                    outcome.complete(unavailable(attachment));
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Reconstruction pool rejected attachment {} of message {}", attachment.artefactId(), messageId);
            outcome.complete(unavailable(attachment));
        }
        return outcome;
    }

    private AttachmentOutcome reconstructAttachment(String messageId, ReconstructionAttachment attachment) {
        SemanticTextEntry text;
        try {
            text = extractSemanticText(messageId, attachment);
        } catch (RuntimeException e) {
            log.warn("Semantic text of attachment {} of message {} unavailable: {}",
                    attachment.artefactId(), messageId, e.toString());
            text = unavailableText(attachment);
        }

        RasterRef raster = null;
        if (toolRegistry.canRasterize(attachment.mimeType())) {
            try {
                raster = rasterize(messageId, attachment);
            } catch (RuntimeException e) {
                log.warn("Raster of attachment {} of message {} unavailable: {}",
                        attachment.artefactId(), messageId, e.toString());
            }
        }
        return new AttachmentOutcome(text, raster);
    }

    private SemanticTextEntry extractSemanticText(String messageId, ReconstructionAttachment attachment) {
        BundledTool parser = toolRegistry.getParser().orElse(null);
        if (parser == null || parser.status() != ToolStatus.INSTALLED || !parser.supports(attachment.mimeType())) {
            return unavailableText(attachment);
        }
        ToolExecutionResult result = execute(parser, ToolOperation.PARSE, messageId, attachment);
        if (!result.success()) {
            log.warn("Parser failed for attachment {} of message {}: {}",
                    attachment.artefactId(), messageId, result.error());
            return unavailableText(attachment);
        }
        String text = result.stdout() == null ? "" : result.stdout();
        return new SemanticTextEntry(attachment.artefactId(), text, SemanticTextSource.TIKA, false,
                hasher.sha256(text), attachment.mimeType(), clock.millis());
    }

    private RasterRef rasterize(String messageId, ReconstructionAttachment attachment) {
        BundledTool rasterizer = toolRegistry.getRasterizer().orElseThrow();
        ToolExecutionResult result = execute(rasterizer, ToolOperation.RASTERIZE, messageId, attachment);
        if (!result.success()) {
            log.warn("Rasterizer failed for attachment {} of message {}: {}",
                    attachment.artefactId(), messageId, result.error());
            return null;
        }

        RasterToolOutput output;
        try {
            output = objectMapper.readValue(result.stdout(), RasterToolOutput.class);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Rasterizer returned malformed output", e);
        }
        RasterFormat format = rasterizer.outputFormat() == null ? RasterFormat.WEBP : rasterizer.outputFormat();
        List<RasterPage> pages = output.pages() == null ? List.of() : output.pages().stream()
                .filter(Objects::nonNull)
                .map(p -> new RasterPage(p.pageNumber(), p.dataRef(), p.width(), p.height(), format,
                        hasher.sha256(p.dataRef() == null ? "" : p.dataRef())))
                .toList();
        return new RasterRef(attachment.artefactId(), pages, format, pages.size(), clock.millis(),
                attachment.originalHash());
    }

    private ToolExecutionResult execute(BundledTool tool, ToolOperation operation, String messageId,
                                        ReconstructionAttachment attachment) {
        String requestId = messageId + ":" + attachment.artefactId() + ":" + operation.name().toLowerCase();
        ToolExecutionResult result = toolExecutor.execute(new ToolExecutionRequest(tool, operation,
                attachment.encryptedRef(), attachment.mimeType(), toolTimeout, memoryLimitMb, requestId));
        executionLog.record(new ToolExecutionLogEntry(clock.millis(), tool.id(), tool.version(), tool.hash(),
                requestId, operation, result.success(), result.timedOut(), result.durationMs(), result.error()));
        return result;
    }

    private SemanticTextEntry unavailableText(ReconstructionAttachment attachment) {
        return new SemanticTextEntry(attachment.artefactId(), "", SemanticTextSource.NONE, true,
                hasher.sha256(""), attachment.mimeType(), clock.millis());
    }

    private AttachmentOutcome unavailable(ReconstructionAttachment attachment) {
        return new AttachmentOutcome(unavailableText(attachment), null);
    }

    /** Parse and rasterize run back to back, each bounded by the tool timeout. */
    private Duration attachmentDeadline() {
        return toolTimeout.multipliedBy(2).plus(DEADLINE_SLACK);
    }

    private record AttachmentOutcome(SemanticTextEntry text, RasterRef raster) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RasterToolOutput(List<RasterToolPage> pages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RasterToolPage(int pageNumber, int width, int height, String dataRef) {
    }
}
