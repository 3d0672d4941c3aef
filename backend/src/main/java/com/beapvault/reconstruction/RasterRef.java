package com.beapvault.reconstruction;

import java.util.List;

import com.beapvault.tools.RasterFormat;

public record RasterRef(
        String artefactId,
        List<RasterPage> pages,
        RasterFormat format,
        int totalPages,
        long rasterizedAt,
        String originalHash) {

    public RasterRef {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }
}
