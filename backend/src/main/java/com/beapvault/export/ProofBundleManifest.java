package com.beapvault.export;

import java.util.List;

/**
 * Index of a proof bundle. {@code bundleHash} is the SHA-256 of the canonical JSON of
 * this manifest with {@code bundleHash} left out.
 */
public record ProofBundleManifest(
        String version,
        long createdAt,
        String messageId,
        MessageSummary messageSummary,
        List<ManifestFile> files,
        String bundleHash,
        String verificationInstructions) {

    public ProofBundleManifest {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * @param archivedAt     set when the message has been archived
     * @param archiveChainHash ledger head recorded in the archive record
     */
    public record MessageSummary(
            String title,
            String status,
            String direction,
            long timestamp,
            Long archivedAt,
            String archiveChainHash) {
    }

    ProofBundleManifest withBundleHash(String bundleHash) {
        return new ProofBundleManifest(version, createdAt, messageId, messageSummary, files, bundleHash,
                verificationInstructions);
    }
}
