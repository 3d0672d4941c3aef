package com.beapvault.evaluation;

import java.util.List;

/**
 * A package as it arrives at the vault: the envelope (possibly absent), the capsule
 * metadata and opaque references to the still-encrypted capsule and artefacts.
 */
public record IncomingMessage(
        String id,
        BeapEnvelope envelope,
        CapsuleMetadata capsuleMetadata,
        String encryptedCapsule,
        List<String> encryptedArtefacts,
        ImportSource importSource,
        long importedAt) {

    public IncomingMessage {
        encryptedArtefacts = encryptedArtefacts == null ? List.of() : List.copyOf(encryptedArtefacts);
    }
}
