package com.beapvault.evaluation;

/**
 * Decides the signature status of an envelope. Implementations that perform real
 * cryptographic verification can replace {@link DeclaredSignatureVerifier}.
 */
public interface SignatureVerifier {

    SignatureStatus verify(BeapEnvelope envelope);
}
