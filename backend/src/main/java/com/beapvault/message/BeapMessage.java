package com.beapvault.message;

import java.util.List;

import com.beapvault.evaluation.BeapEnvelope;
import com.beapvault.evaluation.CapsuleMetadata;
import com.beapvault.evaluation.EnvelopeSummary;
import com.beapvault.evaluation.RejectionReason;
import com.beapvault.evaluation.VerificationStatus;

/**
 * A message as the vault stores it.
 *
 * @param status         user-facing lifecycle label, e.g. {@code pending_verification},
 *                       {@code accepted}, {@code rejected} or {@code archived}
 * @param deliveryStatus outbox only: {@code pending}, {@code sent}, {@code sent_manual},
 *                       {@code sent_chat} or {@code failed}
 * @param direction      {@code inbound} or {@code outbound}
 */
public record BeapMessage(
        String id,
        BeapFolder folder,
        String status,
        VerificationStatus verificationStatus,
        String deliveryStatus,
        String direction,
        String deliveryMethod,
        String title,
        long timestamp,
        String fingerprint,
        String fingerprintFull,
        String senderName,
        String channelSite,
        String capsuleRef,
        List<MessageAttachment> attachments,
        BeapEnvelope envelope,
        EnvelopeSummary envelopeSummary,
        CapsuleMetadata capsuleMetadata,
        RejectionReason rejectionReason,
        int deliveryAttempts) {

    public static final String INBOUND = "inbound";
    public static final String OUTBOUND = "outbound";

    public BeapMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public BeapMessage withFolder(BeapFolder folder) {
        return new BeapMessage(id, folder, status, verificationStatus, deliveryStatus, direction, deliveryMethod,
                title, timestamp, fingerprint, fingerprintFull, senderName, channelSite, capsuleRef, attachments,
                envelope, envelopeSummary, capsuleMetadata, rejectionReason, deliveryAttempts);
    }

    public BeapMessage withStatus(String status) {
        return new BeapMessage(id, folder, status, verificationStatus, deliveryStatus, direction, deliveryMethod,
                title, timestamp, fingerprint, fingerprintFull, senderName, channelSite, capsuleRef, attachments,
                envelope, envelopeSummary, capsuleMetadata, rejectionReason, deliveryAttempts);
    }

    public BeapMessage verifying() {
        return new BeapMessage(id, folder, "verifying", VerificationStatus.VERIFYING, deliveryStatus, direction,
                deliveryMethod, title, timestamp, fingerprint, fingerprintFull, senderName, channelSite, capsuleRef,
                attachments, envelope, envelopeSummary, capsuleMetadata, rejectionReason, deliveryAttempts);
    }

    public BeapMessage accepted(EnvelopeSummary summary, CapsuleMetadata capsule) {
        return new BeapMessage(id, BeapFolder.INBOX, "accepted", VerificationStatus.ACCEPTED, deliveryStatus,
                direction, deliveryMethod, title, timestamp, fingerprint, fingerprintFull, senderName, channelSite,
                capsuleRef, attachments, envelope, summary, capsule == null ? capsuleMetadata : capsule, null,
                deliveryAttempts);
    }

    public BeapMessage rejected(RejectionReason reason, EnvelopeSummary summary) {
        return new BeapMessage(id, BeapFolder.REJECTED, "rejected", VerificationStatus.REJECTED, deliveryStatus,
                direction, deliveryMethod, title, timestamp, fingerprint, fingerprintFull, senderName, channelSite,
                capsuleRef, attachments, envelope, summary == null ? envelopeSummary : summary, capsuleMetadata,
                reason, deliveryAttempts);
    }

    public BeapMessage withDelivery(String deliveryStatus, String deliveryMethod, int deliveryAttempts) {
        return new BeapMessage(id, folder, status, verificationStatus, deliveryStatus, direction, deliveryMethod,
                title, timestamp, fingerprint, fingerprintFull, senderName, channelSite, capsuleRef, attachments,
                envelope, envelopeSummary, capsuleMetadata, rejectionReason, deliveryAttempts);
    }
}
