package com.beapvault.reconstruction;

import java.util.List;

import com.beapvault.evaluation.VerificationStatus;

public record ReconstructionRequest(
        String messageId,
        VerificationStatus verificationStatus,
        List<ReconstructionAttachment> attachments,
        String envelopeHash) {

    public ReconstructionRequest {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
