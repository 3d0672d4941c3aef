package com.beapvault.message;

public record MessageAttachment(
        String artefactId,
        String name,
        String mimeType,
        long size,
        String encryptedRef,
        String originalHash) {
}
