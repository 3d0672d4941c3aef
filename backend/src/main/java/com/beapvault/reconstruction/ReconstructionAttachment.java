package com.beapvault.reconstruction;

/**
 * An attachment to reconstruct. {@code encryptedRef} points at the artefact, which the
 * tool reads itself; the vault never hands decrypted bytes to the pipeline.
 */
public record ReconstructionAttachment(
        String artefactId,
        String name,
        String mimeType,
        long size,
        String encryptedRef,
        String originalHash) {
}
