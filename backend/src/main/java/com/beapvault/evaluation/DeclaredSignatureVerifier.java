package com.beapvault.evaluation;

import org.springframework.stereotype.Component;

/**
 * Trusts the signature status the envelope carries, as produced by the import layer.
 * An absent status counts as {@link SignatureStatus#MISSING}.
 */
@Component
public class DeclaredSignatureVerifier implements SignatureVerifier {

    @Override
    public SignatureStatus verify(BeapEnvelope envelope) {
        return envelope.signatureStatus() == null ? SignatureStatus.MISSING : envelope.signatureStatus();
    }
}
