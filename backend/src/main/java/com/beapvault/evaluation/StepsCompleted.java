package com.beapvault.evaluation;

/** Which evaluation steps passed before the pipeline stopped. */
public record StepsCompleted(boolean envelopeVerification, boolean boundaryCheck, boolean wrguardIntersection) {

    public static final StepsCompleted NONE = new StepsCompleted(false, false, false);
    public static final StepsCompleted ALL = new StepsCompleted(true, true, true);

    public StepsCompleted withEnvelopeVerification() {
        return new StepsCompleted(true, boundaryCheck, wrguardIntersection);
    }

    public StepsCompleted withBoundaryCheck() {
        return new StepsCompleted(envelopeVerification, true, wrguardIntersection);
    }

    public StepsCompleted withWrguardIntersection() {
        return new StepsCompleted(envelopeVerification, boundaryCheck, true);
    }
}
