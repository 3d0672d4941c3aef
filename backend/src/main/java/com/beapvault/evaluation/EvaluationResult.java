package com.beapvault.evaluation;

/**
 * Outcome of one evaluation attempt. Re-evaluating a message produces a new result.
 */
public record EvaluationResult(
        boolean passed,
        EvaluationStatus status,
        RejectionReason rejectionReason,
        EnvelopeSummary envelopeSummary,
        CapsuleMetadata capsuleMetadata,
        StepsCompleted stepsCompleted,
        long evaluatedAt) {

    public static EvaluationResult accepted(EnvelopeSummary summary, CapsuleMetadata capsuleMetadata, long evaluatedAt) {
        return new EvaluationResult(true, EvaluationStatus.ACCEPTED, null, summary, capsuleMetadata,
                StepsCompleted.ALL, evaluatedAt);
    }

    public static EvaluationResult rejected(RejectionReason reason, EnvelopeSummary summary,
                                            StepsCompleted steps, long evaluatedAt) {
        return new EvaluationResult(false, EvaluationStatus.REJECTED, reason, summary, null, steps, evaluatedAt);
    }
}
