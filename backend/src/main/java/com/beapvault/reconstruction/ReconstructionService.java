package com.beapvault.reconstruction;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.beapvault.audit.AuditActor;
import com.beapvault.audit.AuditEventType;
import com.beapvault.audit.AuditLedger;
import com.beapvault.audit.AuditMetadata;
import com.beapvault.audit.AuditRefs;
import com.beapvault.crypto.ContentHasher;
import com.beapvault.message.BeapFolder;
import com.beapvault.message.BeapMessage;
import com.beapvault.message.BeapMessageStore;
import com.beapvault.message.MessageNotFoundException;

/**
 * Reconstructs a stored message and records the attempt in the audit ledger:
 * {@code reconstructed.started}, then {@code reconstructed.completed} or
 * {@code reconstructed.failed}.
 */
@Service
public class ReconstructionService {

    private static final Logger log = LoggerFactory.getLogger(ReconstructionService.class);

    private final BeapMessageStore messageStore;
    private final ReconstructionPipeline pipeline;
    private final ReconstructionRecordStore records;
    private final AuditLedger ledger;
    private final ContentHasher hasher;
    private final Clock clock;

    public ReconstructionService(BeapMessageStore messageStore, ReconstructionPipeline pipeline,
                                 ReconstructionRecordStore records, AuditLedger ledger, ContentHasher hasher,
                                 Clock clock) {
        this.messageStore = messageStore;
        this.pipeline = pipeline;
        this.records = records;
        this.ledger = ledger;
        this.hasher = hasher;
        this.clock = clock;
    }

    /**
     * @throws MessageNotFoundException        if the message does not exist
     * @throws ReconstructionRefusedException if the message is archived, not accepted, or tools are not ready
     */
    public ReconstructionRecord reconstruct(String messageId) {
        BeapMessage message = messageStore.getMessageById(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        if (message.folder() == BeapFolder.ARCHIVED) {
            throw new ReconstructionRefusedException("Archived messages cannot be reconstructed again");
        }
        pipeline.checkPreconditions(message.verificationStatus());

        String envelopeHash = message.envelope() == null ? null : message.envelope().envelopeHash();
        int version = records.get(messageId).map(r -> r.version() + 1).orElse(1);
        ReconstructionRecord running = ReconstructionRecord.running(messageId, envelopeHash, clock.millis(), version);
        records.save(running);
        ledger.appendEvent(messageId, AuditEventType.RECONSTRUCTED_STARTED, AuditActor.SYSTEM,
                "Content reconstruction started",
                AuditRefs.builder().envelopeHash(envelopeHash).build(),
                AuditMetadata.builder().attachmentCount(message.attachments().size()).build());

        ReconstructionRequest request = new ReconstructionRequest(messageId, message.verificationStatus(),
                message.attachments().stream()
                        .map(a -> new ReconstructionAttachment(a.artefactId(), a.name(), a.mimeType(), a.size(),
                                a.encryptedRef(), a.originalHash()))
                        .toList(),
                envelopeHash);
        ReconstructionResult result = pipeline.run(request);

        ReconstructionRecord finished = running.finished(result, clock.millis());
        records.save(finished);

        if (result.success()) {
            ledger.appendEvent(messageId, AuditEventType.RECONSTRUCTED_COMPLETED, AuditActor.SYSTEM,
                    "Content reconstruction completed",
                    AuditRefs.builder()
                            .envelopeHash(envelopeHash)
                            .artefactHashes(artefactHashes(finished))
                            .reconstructionHash(hasher.hashOf(finished))
                            .build(),
                    AuditMetadata.builder()
                            .attachmentCount(result.semanticTextByArtefact().size())
                            .durationMs(result.durationMs())
                            .build());
        } else {
            log.warn("Reconstruction of message {} failed: {}", messageId, result.error());
            ledger.appendEvent(messageId, AuditEventType.RECONSTRUCTED_FAILED, AuditActor.SYSTEM,
                    "Content reconstruction failed",
                    AuditRefs.builder().envelopeHash(envelopeHash).build(),
                    AuditMetadata.builder().durationMs(result.durationMs()).note(result.error()).build());
        }
        return finished;
    }

    /** Text hashes of extracted entries followed by the hash of every raster page. */
    private static List<String> artefactHashes(ReconstructionRecord record) {
        List<String> hashes = new ArrayList<>();
        record.semanticTextByArtefact().stream()
                .filter(e -> !e.unavailable())
                .map(SemanticTextEntry::textHash)
                .forEach(hashes::add);
        record.rasterRefs().forEach(r -> r.pages().forEach(p -> hashes.add(p.imageHash())));
        return hashes;
    }
}
