package com.beapvault.evaluation;

import java.util.List;

/**
 * What can be said about the capsule without decrypting it.
 */
public record CapsuleMetadata(
        String capsuleId,
        String title,
        int attachmentCount,
        List<String> attachmentNames,
        int sessionRefCount,
        boolean hasDataRequest,
        Long contentLengthHint) {

    public CapsuleMetadata {
        attachmentNames = attachmentNames == null ? List.of() : List.copyOf(attachmentNames);
    }
}
