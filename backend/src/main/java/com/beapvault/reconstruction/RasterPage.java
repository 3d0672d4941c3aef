package com.beapvault.reconstruction;

import com.beapvault.tools.RasterFormat;

public record RasterPage(
        int pageNumber,
        String dataRef,
        int width,
        int height,
        RasterFormat format,
        String imageHash) {
}
