package com.beapvault.archive;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.beapvault.audit.AuditActor;
import com.beapvault.audit.AuditEvent;
import com.beapvault.audit.AuditEventType;
import com.beapvault.audit.AuditLedger;
import com.beapvault.audit.AuditLedgerException;
import com.beapvault.audit.AuditRefs;
import com.beapvault.crypto.ContentHasher;
import com.beapvault.evaluation.VerificationStatus;
import com.beapvault.message.BeapFolder;
import com.beapvault.message.BeapMessage;
import com.beapvault.message.BeapMessageStore;
import com.beapvault.message.MessageNotFoundException;
import com.beapvault.reconstruction.ReconstructionRecord;
import com.beapvault.reconstruction.ReconstructionRecordStore;
import com.beapvault.reconstruction.ReconstructionState;
import com.beapvault.reconstruction.SemanticTextEntry;

/**
 * Freezes a message into an {@link ArchiveRecord}.
 *
 * <p>Eligibility: inbox messages must be accepted, outbox messages must have a
 * confirmed delivery, rejected messages may always be archived, and a message is
 * archived at most once. Archives of the same message are serialized, so of two
 * concurrent calls exactly one succeeds. The record is stored before the
 * {@code archived} event is logged and withdrawn if logging fails, so a message never
 * carries an {@code archived} event without its record.
 *
 * <p>Failures are returned as an unsuccessful {@link ArchiveOutcome}, except a ledger
 * failure, which propagates.
 */
@Service
public class ArchivalService {

    private static final Logger log = LoggerFactory.getLogger(ArchivalService.class);

    private final BeapMessageStore messageStore;
    private final ReconstructionRecordStore reconstructions;
    private final ArchiveRecordStore archiveRecords;
    private final AuditLedger ledger;
    private final ContentHasher hasher;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ArchivalService(BeapMessageStore messageStore, ReconstructionRecordStore reconstructions,
                           ArchiveRecordStore archiveRecords, AuditLedger ledger, ContentHasher hasher, Clock clock) {
        this.messageStore = messageStore;
        this.reconstructions = reconstructions;
        this.archiveRecords = archiveRecords;
        this.ledger = ledger;
        this.hasher = hasher;
        this.clock = clock;
    }

    public ArchiveEligibility checkEligibility(BeapMessage message) {
        boolean hasReconstruction = reconstructions.getState(message.id()) == ReconstructionState.DONE;
        boolean delivered = isDeliveryConfirmed(message);

        if (message.folder() == BeapFolder.ARCHIVED || archiveRecords.isArchived(message.id())
                || !ledger.getEventsOfType(message.id(), AuditEventType.ARCHIVED).isEmpty()) {
            return new ArchiveEligibility(false, ArchiveEligibility.ALREADY_ARCHIVED, message.status(),
                    hasReconstruction, delivered);
        }
        switch (message.folder()) {
            case INBOX: {
                boolean accepted = message.verificationStatus() == VerificationStatus.ACCEPTED
                        || "accepted".equals(message.status());
                return new ArchiveEligibility(accepted, accepted ? null : ArchiveEligibility.INBOX_NOT_ACCEPTED,
                        message.status(), hasReconstruction, delivered);
            }
            case OUTBOX:
                return new ArchiveEligibility(delivered, delivered ? null : ArchiveEligibility.OUTBOX_NOT_DELIVERED,
                        message.status(), hasReconstruction, delivered);
            case REJECTED:
                return new ArchiveEligibility(true, null, message.status(), hasReconstruction, delivered);
            default:
                return new ArchiveEligibility(false, ArchiveEligibility.UNKNOWN_FOLDER, message.status(),
                        hasReconstruction, delivered);
        }
    }

    /** @throws MessageNotFoundException if the message does not exist */
    public ArchiveEligibility checkEligibility(String messageId) {
        return checkEligibility(messageStore.getMessageById(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId)));
    }

    public ArchiveOutcome archive(String messageId) {
        ReentrantLock lock = locks.computeIfAbsent(messageId, id -> new ReentrantLock());
        lock.lock();
        try {
            Optional<BeapMessage> found = messageStore.getMessageById(messageId);
            if (found.isEmpty()) {
                return ArchiveOutcome.failed("Message not found");
            }
            BeapMessage message = found.get();
            ArchiveEligibility eligibility = checkEligibility(message);
            if (!eligibility.eligible()) {
                return ArchiveOutcome.failed(eligibility.reason());
            }

            ArchiveRecord record = buildRecord(message);
            if (!archiveRecords.saveIfAbsent(record)) {
                return ArchiveOutcome.failed(ArchiveEligibility.ALREADY_ARCHIVED);
            }
            try {
                ledger.appendEvent(messageId, AuditEventType.ARCHIVED, AuditActor.USER, "Message archived",
                        refsFor(record), null);
            } catch (AuditLedgerException e) {
                archiveRecords.discard(messageId);
                throw e;
            }
            messageStore.moveToFolder(messageId, BeapFolder.ARCHIVED);
            messageStore.updateMessageStatus(messageId, "archived");
            log.info("Archived message {}", messageId);
            return ArchiveOutcome.archived(record);
        } catch (AuditLedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Archiving message {} failed", messageId, e);
            return ArchiveOutcome.failed(e.getMessage() == null ? "Archive failed" : e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    public Optional<ArchiveRecord> getArchiveRecord(String messageId) {
        return archiveRecords.get(messageId);
    }

    public boolean isArchived(String messageId) {
        return archiveRecords.isArchived(messageId);
    }

    // ── Record construction ──────────────────────────────────────────────────

    private ArchiveRecord buildRecord(BeapMessage message) {
        String id = message.id();
        Optional<ReconstructionRecord> reconstruction = reconstructions.get(id)
                .filter(r -> r.state() == ReconstructionState.DONE);

        ArchiveRecord.MessageSnapshot snapshot = new ArchiveRecord.MessageSnapshot(
                message.title(), message.status(), message.direction(), message.deliveryMethod(),
                message.timestamp(), message.fingerprint(), message.fingerprintFull(),
                message.senderName(), message.channelSite());

        String fingerprint = message.fingerprintFull() != null ? message.fingerprintFull() : message.fingerprint();
        String envelopeHash = hasher.hashOf(new EnvelopeIdentity(id, fingerprint,
                message.deliveryMethod(), message.timestamp()));
        ArchiveRecord.EnvelopeRef envelopeRef = new ArchiveRecord.EnvelopeRef(envelopeHash, message.envelopeSummary());

        ArchiveRecord.CapsuleRef capsuleRef = new ArchiveRecord.CapsuleRef(
                message.capsuleRef() == null ? null : hasher.sha256(message.capsuleRef()),
                reconstruction.map(r -> hasher.hashOf(r.semanticTextByArtefact())).orElse(null),
                message.attachments().size());

        ArchiveRecord.ReconstructionRef reconstructionRef = reconstruction
                .map(r -> new ArchiveRecord.ReconstructionRef(
                        hasher.hashOf(r),
                        r.semanticTextByArtefact().stream().map(SemanticTextEntry::textHash).toList(),
                        r.rasterRefs().stream()
                                .flatMap(raster -> raster.pages().stream())
                                .map(page -> page.imageHash())
                                .toList()))
                .orElse(null);

        List<String> ingressEventIds = eventIds(id, AuditEventType.IMPORTED);
        List<String> dispatchEventIds = eventIds(id, AuditEventType.DISPATCHED);
        String auditChainHash = ledger.getLastEvent(id).map(AuditEvent::eventHash).orElse("");

        return new ArchiveRecord(id, clock.millis(), AuditActor.USER, snapshot, envelopeRef, capsuleRef,
                reconstructionRef, ingressEventIds, dispatchEventIds, auditChainHash, message.rejectionReason());
    }

    private List<String> eventIds(String messageId, AuditEventType type) {
        return ledger.getEventsOfType(messageId, type).stream()
                .map(AuditEvent::eventId)
                .toList();
    }

    private static AuditRefs refsFor(ArchiveRecord record) {
        AuditRefs.Builder refs = AuditRefs.builder()
                .envelopeHash(record.envelopeRef().envelopeHash())
                .capsuleHash(record.capsuleRef().capsuleHash());
        if (!record.ingressEventIds().isEmpty()) {
            refs.ingressEventId(record.ingressEventIds().get(0));
        }
        if (!record.dispatchEventIds().isEmpty()) {
            refs.dispatchEventId(record.dispatchEventIds().get(record.dispatchEventIds().size() - 1));
        }
        if (record.reconstructionRef() != null) {
            refs.artefactHashes(record.reconstructionRef().rasterHashes())
                    .reconstructionHash(record.reconstructionRef().reconstructionHash());
        }
        return refs.build();
    }

    private static boolean isDeliveryConfirmed(BeapMessage message) {
        String status = message.deliveryStatus();
        return "sent".equals(status) || "sent_manual".equals(status) || "sent_chat".equals(status);
    }

    /** Identity fields an archived envelope reference is bound to. */
    record EnvelopeIdentity(String id, String fingerprint, String deliveryMethod, long timestamp) {
    }
}
