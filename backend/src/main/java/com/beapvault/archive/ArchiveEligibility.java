package com.beapvault.archive;

/**
 * @param reason why the message cannot be archived; {@code null} when eligible
 */
public record ArchiveEligibility(
        boolean eligible,
        String reason,
        String status,
        boolean hasReconstruction,
        boolean hasDeliveryConfirmation) {

    static final String ALREADY_ARCHIVED = "Message is already archived";
    static final String INBOX_NOT_ACCEPTED = "Inbox messages must be accepted before archiving";
    static final String OUTBOX_NOT_DELIVERED = "Outbox messages must have delivery confirmed before archiving";
    static final String UNKNOWN_FOLDER = "Unknown folder type";
}
