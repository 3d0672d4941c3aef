package com.beapvault.reconstruction;

import java.util.List;

public record ReconstructionResult(
        boolean success,
        String error,
        List<SemanticTextEntry> semanticTextByArtefact,
        List<RasterRef> rasterRefs,
        long durationMs) {

    public ReconstructionResult {
        semanticTextByArtefact = semanticTextByArtefact == null ? List.of() : List.copyOf(semanticTextByArtefact);
        rasterRefs = rasterRefs == null ? List.of() : List.copyOf(rasterRefs);
    }

    static ReconstructionResult completed(List<SemanticTextEntry> texts, List<RasterRef> rasters, long durationMs) {
        return new ReconstructionResult(true, null, texts, rasters, durationMs);
    }

    static ReconstructionResult failed(String error, long durationMs) {
        return new ReconstructionResult(false, error, List.of(), List.of(), durationMs);
    }
}
