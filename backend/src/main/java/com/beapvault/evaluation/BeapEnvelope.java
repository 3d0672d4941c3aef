package com.beapvault.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The signed outer envelope of a BEAP package, holding identity, integrity and
 * boundary metadata only. The capsule content is never part of it.
 *
 * <p>Declaration lists keep {@code null} to mean "absent", which the boundary
 * check rejects, as opposed to an empty list, which it also rejects, but for a
 * caller that did send the field.
 */
public record BeapEnvelope(
        String envelopeId,
        String packageId,
        String envelopeHash,
        SignatureStatus signatureStatus,
        String senderFingerprint,
        String receiverFingerprint,
        String handshakeRef,
        IngressChannel ingressChannel,
        String emailProviderId,
        List<IngressDeclaration> ingressDeclarations,
        List<EgressDeclaration> egressDeclarations,
        long createdAt,
        Long expiresAt) {

    public BeapEnvelope {
        ingressDeclarations = frozen(ingressDeclarations);
        egressDeclarations = frozen(egressDeclarations);
    }

    private static <T> List<T> frozen(List<T> list) {
        // null elements are legal input and must reach the boundary check
        return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
    }
}
