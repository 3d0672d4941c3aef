package com.beapvault.archive;

public record ArchiveOutcome(boolean success, String error, ArchiveRecord record) {

    static ArchiveOutcome archived(ArchiveRecord record) {
        return new ArchiveOutcome(true, null, record);
    }

    static ArchiveOutcome failed(String error) {
        return new ArchiveOutcome(false, error, null);
    }
}
