package com.beapvault.evaluation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Display-safe projection of an envelope, suitable for audit exports and UI.
 * Fingerprints and ids are shortened; nothing here can be used to impersonate a sender.
 */
public record EnvelopeSummary(
        String envelopeIdShort,
        String senderFingerprintDisplay,
        String channelDisplay,
        String ingressSummary,
        String egressSummary,
        long createdAt,
        ExpiryStatus expiryStatus,
        String signatureStatusDisplay,
        String hashVerificationDisplay) {

    public static EnvelopeSummary of(BeapEnvelope envelope, long now) {
        ExpiryStatus expiry;
        if (envelope.expiresAt() == null) {
            expiry = ExpiryStatus.NO_EXPIRY;
        } else {
            expiry = envelope.expiresAt() < now ? ExpiryStatus.EXPIRED : ExpiryStatus.VALID;
        }
        IngressChannel channel = envelope.ingressChannel() == null ? IngressChannel.UNKNOWN : envelope.ingressChannel();
        return new EnvelopeSummary(
                shorten(envelope.envelopeId(), 8),
                fingerprintDisplay(envelope.senderFingerprint()),
                channel.displayName(),
                ingressSummary(envelope.ingressDeclarations()),
                egressSummary(envelope.egressDeclarations()),
                envelope.createdAt(),
                expiry,
                signatureDisplay(envelope.signatureStatus()),
                envelope.envelopeHash() == null || envelope.envelopeHash().isBlank()
                        ? "Hash missing" : "Hash present");
    }

    private static String shorten(String value, int length) {
        if (value == null) return "";
        return value.length() <= length ? value : value.substring(0, length) + "…";
    }

    private static String fingerprintDisplay(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) return "Unknown sender";
        if (fingerprint.length() <= 16) return fingerprint;
        return fingerprint.substring(0, 8) + "…" + fingerprint.substring(fingerprint.length() - 8);
    }

    private static String signatureDisplay(SignatureStatus status) {
        if (status == null) return "Signature missing";
        switch (status) {
            case VALID: return "Signature valid";
            case INVALID: return "Signature invalid";
            case MISSING: return "Signature missing";
            default: return "Signature unknown";
        }
    }

    private static String ingressSummary(List<IngressDeclaration> declarations) {
        if (declarations == null || declarations.isEmpty()) return "No ingress declared";
        return declarations.stream()
                .filter(Objects::nonNull)
                .map(d -> (d.type() == null ? "?" : d.type().name().toLowerCase())
                        + ":" + d.source() + (d.verified() ? " (verified)" : ""))
                .collect(Collectors.joining(", "));
    }

    private static String egressSummary(List<EgressDeclaration> declarations) {
        if (declarations == null || declarations.isEmpty()) return "No egress declared";
        return declarations.stream()
                .filter(Objects::nonNull)
                .map(d -> (d.type() == null ? "?" : d.type().name().toLowerCase()) + ":" + d.target())
                .collect(Collectors.joining(", "));
    }
}
