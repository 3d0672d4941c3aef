package com.beapvault.reconstruction;

import java.util.List;

/**
 * Stored outcome of the latest reconstruction of a message. {@code version} grows by
 * one with each reconstruction attempt.
 */
public record ReconstructionRecord(
        String messageId,
        ReconstructionState state,
        String error,
        List<SemanticTextEntry> semanticTextByArtefact,
        List<RasterRef> rasterRefs,
        long startedAt,
        Long completedAt,
        String envelopeHash,
        int version) {

    public ReconstructionRecord {
        semanticTextByArtefact = semanticTextByArtefact == null ? List.of() : List.copyOf(semanticTextByArtefact);
        rasterRefs = rasterRefs == null ? List.of() : List.copyOf(rasterRefs);
    }

    static ReconstructionRecord running(String messageId, String envelopeHash, long startedAt, int version) {
        return new ReconstructionRecord(messageId, ReconstructionState.RUNNING, null, List.of(), List.of(),
                startedAt, null, envelopeHash, version);
    }

    ReconstructionRecord finished(ReconstructionResult result, long completedAt) {
        return new ReconstructionRecord(messageId,
                result.success() ? ReconstructionState.DONE : ReconstructionState.FAILED,
                result.error(), result.semanticTextByArtefact(), result.rasterRefs(),
                startedAt, completedAt, envelopeHash, version);
    }
}
