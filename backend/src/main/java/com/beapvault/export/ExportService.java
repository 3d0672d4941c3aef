package com.beapvault.export;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.beapvault.archive.ArchiveRecord;
import com.beapvault.archive.ArchiveRecordStore;
import com.beapvault.audit.AuditActor;
import com.beapvault.audit.AuditEvent;
import com.beapvault.audit.AuditEventType;
import com.beapvault.audit.AuditLedger;
import com.beapvault.audit.AuditLedgerException;
import com.beapvault.audit.AuditRefs;
import com.beapvault.crypto.ContentHasher;
import com.beapvault.evaluation.CapsuleMetadata;
import com.beapvault.evaluation.EnvelopeSummary;
import com.beapvault.evaluation.EvaluationStep;
import com.beapvault.evaluation.RejectionCode;
import com.beapvault.evaluation.VerificationStatus;
import com.beapvault.message.BeapFolder;
import com.beapvault.message.BeapMessage;
import com.beapvault.message.BeapMessageStore;
import com.beapvault.reconstruction.ReconstructionRecord;
import com.beapvault.reconstruction.ReconstructionRecordStore;
import com.beapvault.reconstruction.ReconstructionState;
import com.beapvault.tools.RasterFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Produces verifiable artifacts from the audit ledger: a standalone audit-log export
 * and a proof bundle of hash-bound JSON files.
 *
 * <p>Exports never contain decrypted originals, secrets or keys. Raster pages appear
 * with their image hashes only, not their data references.
 *
 * <p>A failed export returns {@link ExportResult#failure} and no artifact. Every
 * successful export is itself recorded in the ledger ({@code exported.audit} or
 * {@code exported.proof}). Those trailing export events are left out of the exported
 * chain, so re-exporting an unchanged log reproduces the same export hash.
 */
@Service
public class ExportService {

    private static final Logger log = LoggerFactory.getLogger(ExportService.class);

    static final String EXPORT_VERSION = "1.0";
    static final String NO_EVENTS = "No audit events found for this message";
    static final String MESSAGE_NOT_FOUND = "Message not found";
    static final String NOT_REJECTED = "Message is not rejected";

    static final String VERIFICATION_INSTRUCTIONS = String.join("\n",
            "To verify this proof bundle:",
            "1. Compute SHA-256 hash of each file and compare with hashes in manifest",
            "2. Verify audit log chain integrity by checking prevEventHash linking",
            "3. Confirm envelope summary matches expected message data",
            "4. For accepted messages: verify semantic text and raster hashes",
            "5. For rejected messages: verify rejection reason is present",
            "",
            "Note: This bundle does NOT contain decrypted originals or secrets.");

    static final String REJECTED_VERIFICATION_INSTRUCTIONS = "Verify rejection reason and audit chain integrity.";

    private final AuditLedger ledger;
    private final BeapMessageStore messageStore;
    private final ReconstructionRecordStore reconstructions;
    private final ArchiveRecordStore archiveRecords;
    private final ContentHasher hasher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExportService(AuditLedger ledger, BeapMessageStore messageStore, ReconstructionRecordStore reconstructions,
                         ArchiveRecordStore archiveRecords, ContentHasher hasher, ObjectMapper objectMapper,
                         Clock clock) {
        this.ledger = ledger;
        this.messageStore = messageStore;
        this.reconstructions = reconstructions;
        this.archiveRecords = archiveRecords;
        this.hasher = hasher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ExportResult<AuditLogExport> exportAuditLog(String messageId) {
        ExportResult<AuditLogExport> result = buildAuditLogExport(messageId);
        if (result.success()) {
            ledger.appendEvent(messageId, AuditEventType.EXPORTED_AUDIT, AuditActor.USER, "Audit log exported",
                    AuditRefs.builder().exportHash(result.data().exportHash()).build(), null);
            log.info("Exported audit log of message {} ({} events)", messageId, result.data().events().size());
        }
        return result;
    }

    public ExportResult<ProofBundle> buildProofBundle(String messageId) {
        Optional<BeapMessage> message = messageStore.getMessageById(messageId);
        if (message.isEmpty()) {
            return ExportResult.failure(MESSAGE_NOT_FOUND);
        }
        return buildBundle(message.get(), false, VERIFICATION_INSTRUCTIONS);
    }

    /**
     * Proof bundle for a rejected message: envelope summary, rejection reason and
     * audit log only.
     */
    public ExportResult<ProofBundle> exportRejectedProof(String messageId) {
        Optional<BeapMessage> message = messageStore.getMessageById(messageId);
        if (message.isEmpty()) {
            return ExportResult.failure(MESSAGE_NOT_FOUND);
        }
        BeapMessage m = message.get();
        if (m.folder() != BeapFolder.REJECTED && m.verificationStatus() != VerificationStatus.REJECTED) {
            return ExportResult.failure(NOT_REJECTED);
        }
        return buildBundle(m, true, REJECTED_VERIFICATION_INSTRUCTIONS);
    }

    // ── Audit log ────────────────────────────────────────────────────────────

    private ExportResult<AuditLogExport> buildAuditLogExport(String messageId) {
        List<AuditEvent> events = ledger.getEvents(messageId);
        if (events.isEmpty()) {
            return ExportResult.failure(NO_EVENTS);
        }
        ChainVerification verification = new ChainVerification(
                events.get(events.size() - 1).eventHash(), events.size(), ledger.verifyChain(events));
        // trailing export records are verified but not hashed
        List<AuditEvent> hashed = exportableEvents(events);
        String exportHash = hasher.hashOf(new ExportHashInput(EXPORT_VERSION, messageId, hashed,
                hashed.isEmpty() ? null : hashed.get(hashed.size() - 1).eventHash(), verification.verified()));
        return ExportResult.success(new AuditLogExport(EXPORT_VERSION, clock.millis(), messageId, events,
                verification, exportHash));
    }

    /** The chain up to and including its last event that is not itself an export record. */
    private static List<AuditEvent> exportableEvents(List<AuditEvent> events) {
        int end = events.size();
        while (end > 0 && events.get(end - 1).type().isExport()) {
            end--;
        }
        return events.subList(0, end);
    }

    // ── Proof bundle ─────────────────────────────────────────────────────────

    private ExportResult<ProofBundle> buildBundle(BeapMessage message, boolean rejectedOnly, String instructions) {
        String messageId = message.id();
        try {
            ExportResult<AuditLogExport> auditExport = buildAuditLogExport(messageId);
            if (!auditExport.success()) {
                return ExportResult.failure(auditExport.error());
            }

            List<BundleFile> files = new ArrayList<>();
            List<ManifestFile> entries = new ArrayList<>();

            add(files, entries, "envelope.json", BundleFileType.ENVELOPE, new EnvelopeFile(
                    messageId,
                    message.fingerprintFull() != null ? message.fingerprintFull() : message.fingerprint(),
                    message.deliveryMethod(), message.direction(), message.timestamp(), message.title(),
                    message.senderName(), message.channelSite(), message.status(),
                    message.envelopeSummary(), message.capsuleMetadata()));

            Optional<ReconstructionRecord> reconstruction = rejectedOnly ? Optional.empty()
                    : reconstructions.get(messageId).filter(r -> r.state() == ReconstructionState.DONE);
            if (reconstruction.isPresent() && !reconstruction.get().semanticTextByArtefact().isEmpty()) {
                add(files, entries, "semantic_text.json", BundleFileType.SEMANTIC_TEXT,
                        reconstruction.get().semanticTextByArtefact());
            }
            if (reconstruction.isPresent() && !reconstruction.get().rasterRefs().isEmpty()) {
                add(files, entries, "raster_metadata.json", BundleFileType.RASTER,
                        reconstruction.get().rasterRefs().stream()
                                .map(r -> new RasterMetadata(r.artefactId(), r.totalPages(), r.format(),
                                        r.pages().stream()
                                                .map(p -> new RasterPageMetadata(p.pageNumber(), p.width(),
                                                        p.height(), p.imageHash()))
                                                .toList(),
                                        r.originalHash()))
                                .toList());
            }
            if (message.rejectionReason() != null) {
                add(files, entries, "rejection_reason.json", BundleFileType.REJECTION_REASON, new RejectionFile(
                        message.rejectionReason().code(), message.rejectionReason().humanSummary(),
                        message.rejectionReason().details(), message.rejectionReason().timestamp(),
                        message.rejectionReason().failedStep()));
            }
            add(files, entries, "audit_log.json", BundleFileType.AUDIT_LOG, auditExport.data());

            Optional<ArchiveRecord> archive = archiveRecords.get(messageId);
            ProofBundleManifest unsigned = new ProofBundleManifest(
                    EXPORT_VERSION,
                    clock.millis(),
                    messageId,
                    new ProofBundleManifest.MessageSummary(message.title(), message.status(), message.direction(),
                            message.timestamp(),
                            archive.map(ArchiveRecord::archivedAt).orElse(null),
                            archive.map(ArchiveRecord::auditChainHash).orElse(null)),
                    entries,
                    null,
                    instructions);
            ProofBundleManifest manifest = unsigned.withBundleHash(hasher.hashOf(unsigned));
            files.add(0, new BundleFile("manifest.json", pretty(manifest)));

            ledger.appendEvent(messageId, AuditEventType.EXPORTED_PROOF, AuditActor.USER, "Proof bundle exported",
                    AuditRefs.builder()
                            .exportHash(manifest.bundleHash())
                            .envelopeHash(message.envelope() == null ? null : message.envelope().envelopeHash())
                            .build(),
                    null);
            log.info("Built proof bundle for message {} ({} files)", messageId, files.size());
            return ExportResult.success(new ProofBundle(manifest, files));
        } catch (AuditLedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Proof bundle for message {} failed", messageId, e);
            return ExportResult.failure(e.getMessage() == null ? "Proof bundle export failed" : e.getMessage());
        }
    }

    private void add(List<BundleFile> files, List<ManifestFile> entries, String path, BundleFileType type,
                     Object value) {
        String content = pretty(value);
        files.add(new BundleFile(path, content));
        entries.add(new ManifestFile(path, type, hasher.sha256(content),
                content.getBytes(StandardCharsets.UTF_8).length));
    }

    private String pretty(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bundle file", e);
        }
    }

    // ── File shapes ──────────────────────────────────────────────────────────

    private record ExportHashInput(String version, String messageId, List<AuditEvent> events, String headHash,
                                   boolean verified) {
    }

    record EnvelopeFile(String messageId, String fingerprint, String deliveryMethod, String direction,
                        long timestamp, String title, String senderName, String channelSite, String status,
                        EnvelopeSummary envelopeSummary, CapsuleMetadata capsuleMetadata) {
    }

    record RasterMetadata(String artefactId, int totalPages, RasterFormat format, List<RasterPageMetadata> pages,
                          String originalHash) {
    }

    record RasterPageMetadata(int pageNumber, int width, int height, String imageHash) {
    }

    record RejectionFile(RejectionCode code, String summary, String details, long timestamp,
                         EvaluationStep failedStep) {
    }
}
