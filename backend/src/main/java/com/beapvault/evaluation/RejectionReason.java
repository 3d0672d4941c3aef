package com.beapvault.evaluation;

public record RejectionReason(
        RejectionCode code,
        String humanSummary,
        String details,
        long timestamp,
        EvaluationStep failedStep) {
}
