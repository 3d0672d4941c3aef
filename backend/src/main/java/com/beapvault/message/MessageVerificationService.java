package com.beapvault.message;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.beapvault.audit.AuditActor;
import com.beapvault.audit.AuditEventType;
import com.beapvault.audit.AuditLedger;
import com.beapvault.audit.AuditMetadata;
import com.beapvault.audit.AuditRefs;
import com.beapvault.crypto.ContentHasher;
import com.beapvault.evaluation.BeapEnvelope;
import com.beapvault.evaluation.EvaluationPipeline;
import com.beapvault.evaluation.EvaluationResult;
import com.beapvault.evaluation.EvaluationStep;
import com.beapvault.evaluation.IncomingMessage;
import com.beapvault.evaluation.RejectionCode;
import com.beapvault.evaluation.RejectionReason;
import com.beapvault.evaluation.StepsCompleted;
import com.beapvault.evaluation.VerificationStatus;
import com.datastax.oss.driver.api.core.uuid.Uuids;

/**
 * Message lifecycle around the evaluation pipeline: import, verification and the
 * outbox delivery events.
 *
 * <p>Every state change is paired with exactly one audit event. The ledger append
 * comes after the store update it describes, and a ledger failure propagates.
 */
@Service
public class MessageVerificationService {

    private static final Logger log = LoggerFactory.getLogger(MessageVerificationService.class);

    private final BeapMessageStore messageStore;
    private final EvaluationPipeline pipeline;
    private final AuditLedger ledger;
    private final ContentHasher hasher;
    private final Clock clock;

    public MessageVerificationService(BeapMessageStore messageStore, EvaluationPipeline pipeline, AuditLedger ledger,
                                      ContentHasher hasher, Clock clock) {
        this.messageStore = messageStore;
        this.pipeline = pipeline;
        this.ledger = ledger;
        this.hasher = hasher;
        this.clock = clock;
    }

    /**
     * Stores {@code incoming} as a {@code pending_verification} inbox message and records
     * the import. A missing id gets a time-based UUID.
     *
     * @throws MessageArchivedException if a message with the same id is already archived
     */
    public BeapMessage importMessage(IncomingMessage incoming) {
        String id = incoming.id() == null || incoming.id().isBlank() ? Uuids.timeBased().toString() : incoming.id();
        if (messageStore.getMessageById(id).filter(m -> m.folder() == BeapFolder.ARCHIVED).isPresent()) {
            throw new MessageArchivedException(id);
        }
        BeapEnvelope envelope = incoming.envelope();
        String fingerprint = envelope == null ? null : envelope.senderFingerprint();

        BeapMessage message = new BeapMessage(
                id,
                BeapFolder.INBOX,
                "pending_verification",
                VerificationStatus.PENDING_VERIFICATION,
                null,
                BeapMessage.INBOUND,
                incoming.importSource() == null ? null : incoming.importSource().name().toLowerCase(Locale.ROOT),
                incoming.capsuleMetadata() == null ? "BEAP Message" : incoming.capsuleMetadata().title(),
                incoming.importedAt() > 0 ? incoming.importedAt() : clock.millis(),
                shortFingerprint(fingerprint),
                fingerprint,
                null,
                null,
                incoming.encryptedCapsule(),
                attachmentsOf(incoming),
                envelope,
                null,
                incoming.capsuleMetadata(),
                null,
                0);
        messageStore.save(message);

        ledger.appendEvent(id, AuditEventType.IMPORTED, AuditActor.SYSTEM,
                "Message imported from " + (message.deliveryMethod() == null ? "unknown source" : message.deliveryMethod()),
                AuditRefs.builder()
                        .envelopeHash(envelope == null ? null : envelope.envelopeHash())
                        .capsuleHash(incoming.encryptedCapsule() == null ? null : hasher.sha256(incoming.encryptedCapsule()))
                        .build(),
                AuditMetadata.builder()
                        .attachmentCount(message.attachments().size())
                        .build());
        log.info("Imported message {}", id);
        return message;
    }

    /**
     * Evaluates the stored message and records the verdict. An unknown or archived
     * message yields an {@code evaluation_error} rejection and leaves both the store and
     * the ledger untouched.
     */
    public EvaluationResult verify(String messageId) {
        BeapMessage message = messageStore.getMessageById(messageId).orElse(null);
        if (message == null) {
            return notEvaluated("Message not found.", "No message with id " + messageId);
        }
        if (message.folder() == BeapFolder.ARCHIVED) {
            return notEvaluated("Message is archived.", "Archived message " + messageId + " cannot be re-verified");
        }

        messageStore.save(message.verifying());
        EvaluationResult result = pipeline.evaluate(new IncomingMessage(message.id(), message.envelope(),
                message.capsuleMetadata(), message.capsuleRef(), List.of(), null, message.timestamp()));

        String envelopeHash = message.envelope() == null ? null : message.envelope().envelopeHash();
        if (result.passed()) {
            messageStore.save(message.accepted(result.envelopeSummary(), result.capsuleMetadata()));
            ledger.appendEvent(messageId, AuditEventType.VERIFIED_ACCEPTED, AuditActor.SYSTEM,
                    "Message passed envelope verification",
                    AuditRefs.builder().envelopeHash(envelopeHash).build(), null);
        } else {
            RejectionReason reason = result.rejectionReason();
            messageStore.save(message.rejected(reason, result.envelopeSummary()));
            ledger.appendEvent(messageId, AuditEventType.VERIFIED_REJECTED, AuditActor.SYSTEM,
                    "Message rejected: " + reason.humanSummary(),
                    AuditRefs.builder().envelopeHash(envelopeHash).build(),
                    AuditMetadata.builder()
                            .rejectionCode(reason.code().code())
                            .failedStep(reason.failedStep().code())
                            .build());
        }
        return result;
    }

    public EvaluationResult importAndVerify(IncomingMessage incoming) {
        BeapMessage message = importMessage(incoming);
        return verify(message.id());
    }

    public void recordDispatch(String messageId, String method) {
        BeapMessage message = messageStore.getMessageById(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        messageStore.save(message.withDelivery("pending", method, message.deliveryAttempts() + 1));
        ledger.appendEvent(messageId, AuditEventType.DISPATCHED, AuditActor.SYSTEM,
                "Message dispatched via " + method, AuditRefs.none(),
                AuditMetadata.builder().deliveryMethod(method).build());
    }

    /** A confirmed delivery is the user's acknowledgement; a failure is observed by the system. */
    public void recordDelivery(String messageId, boolean confirmed, String method) {
        BeapMessage message = messageStore.getMessageById(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        String deliveryStatus = confirmed ? sentStatusFor(method) : "failed";
        messageStore.save(message.withDelivery(deliveryStatus, method, message.deliveryAttempts()));

        String dispatchEventId = ledger.getEventsOfType(messageId, AuditEventType.DISPATCHED).stream()
                .reduce((first, second) -> second)
                .map(e -> e.eventId())
                .orElse(null);
        ledger.appendEvent(messageId,
                confirmed ? AuditEventType.DELIVERY_CONFIRMED : AuditEventType.DELIVERY_FAILED,
                confirmed ? AuditActor.USER : AuditActor.SYSTEM,
                confirmed ? "Delivery confirmed" : "Delivery failed",
                AuditRefs.builder().dispatchEventId(dispatchEventId).build(),
                AuditMetadata.builder().deliveryMethod(method).build());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private EvaluationResult notEvaluated(String summary, String details) {
        long now = clock.millis();
        return EvaluationResult.rejected(new RejectionReason(RejectionCode.EVALUATION_ERROR, summary, details,
                now, EvaluationStep.ENVELOPE_VERIFICATION), null, StepsCompleted.NONE, now);
    }

    static String sentStatusFor(String method) {
        if ("chat".equals(method)) return "sent_chat";
        if ("download".equals(method) || "manual".equals(method)) return "sent_manual";
        return "sent";
    }

    private static String shortFingerprint(String fingerprint) {
        if (fingerprint == null) return null;
        return fingerprint.length() <= 12 ? fingerprint : fingerprint.substring(0, 12);
    }

    /** The original hash binds each attachment to the encrypted artefact it was imported as. */
    private List<MessageAttachment> attachmentsOf(IncomingMessage incoming) {
        List<String> refs = incoming.encryptedArtefacts();
        List<String> names = incoming.capsuleMetadata() == null ? List.of() : incoming.capsuleMetadata().attachmentNames();
        return IntStream.range(0, refs.size())
                .mapToObj(i -> new MessageAttachment(
                        "art_" + i,
                        i < names.size() ? names.get(i) : "attachment-" + i,
                        mimeTypeOf(i < names.size() ? names.get(i) : ""),
                        0L,
                        refs.get(i),
                        hasher.sha256(refs.get(i))))
                .toList();
    }

    /** Best effort from the file extension; unknown types are never parsed. */
    static String mimeTypeOf(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        String ext = dot < 0 ? "" : lower.substring(dot + 1);
        switch (ext) {
            case "pdf": return "application/pdf";
            case "doc": return "application/msword";
            case "docx": return "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
            case "xls": return "application/vnd.ms-excel";
            case "xlsx": return "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
            case "ppt": return "application/vnd.ms-powerpoint";
            case "pptx": return "application/vnd.openxmlformats-officedocument.presentationml.presentation";
            case "txt": return "text/plain";
            case "html": case "htm": return "text/html";
            case "csv": return "text/csv";
            case "rtf": return "application/rtf";
            case "epub": return "application/epub+zip";
            default: return "application/octet-stream";
        }
    }
}
