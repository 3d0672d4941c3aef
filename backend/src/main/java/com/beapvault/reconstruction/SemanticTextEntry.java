package com.beapvault.reconstruction;

/**
 * Plain text extracted from one attachment. An unavailable entry has empty text,
 * source {@link SemanticTextSource#NONE} and the hash of the empty string.
 */
public record SemanticTextEntry(
        String artefactId,
        String text,
        SemanticTextSource source,
        boolean unavailable,
        String textHash,
        String mimeType,
        long extractedAt) {
}
