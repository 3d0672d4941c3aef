package com.beapvault.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Definitions of the tools the vault ships with. The set is closed: the registry
 * never accepts a tool id that is not listed here.
 */
public final class BundledTools {

    public static final String REGISTRY_VERSION = "1.0.0";
    public static final String APACHE_TIKA = "apache-tika";
    public static final String PDFIUM = "pdfium";

    /** Hash value the installer writes before it has measured the real binary. */
    public static final String PLACEHOLDER_HASH = "placeholder-hash-will-be-set-by-installer";
    public static final String THIRD_PARTY_PATH = "/third_party/beap_tools/";

    public static final List<String> TIKA_SUPPORTED_TYPES = List.of(
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/vnd.ms-excel",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/vnd.ms-powerpoint",
            "application/vnd.openxmlformats-officedocument.presentationml.presentation",
            "text/plain",
            "text/html",
            "text/csv",
            "application/rtf",
            "application/epub+zip");

    public static final List<String> PDFIUM_SUPPORTED_TYPES = List.of("application/pdf");

    private BundledTools() {}

    static Map<String, BundledTool> defaults() {
        Map<String, BundledTool> tools = new LinkedHashMap<>();
        tools.put(APACHE_TIKA, new BundledTool(
                APACHE_TIKA,
                "Apache Tika",
                "Semantic parser for extracting text from documents",
                ToolCategory.PARSER,
                "2.9.1",
                PLACEHOLDER_HASH,
                THIRD_PARTY_PATH + "tika/tika-app.jar",
                new LicenseInfo(LicenseIdentifier.APACHE_2_0, "Apache License 2.0",
                        List.of("The Apache Software Foundation"), "https://tika.apache.org/"),
                TIKA_SUPPORTED_TYPES,
                null,
                ToolStatus.NOT_INSTALLED,
                null,
                0L));
        tools.put(PDFIUM, new BundledTool(
                PDFIUM,
                "PDFium",
                "Deterministic rasterizer for document previews",
                ToolCategory.RASTERIZER,
                "6312",
                PLACEHOLDER_HASH,
                THIRD_PARTY_PATH + "pdfium/pdfium-render",
                new LicenseInfo(LicenseIdentifier.BSD_3_CLAUSE, "BSD 3-Clause License",
                        List.of("The PDFium Authors"), "https://pdfium.googlesource.com/pdfium/"),
                PDFIUM_SUPPORTED_TYPES,
                RasterFormat.WEBP,
                ToolStatus.NOT_INSTALLED,
                null,
                0L));
        return tools;
    }
}
