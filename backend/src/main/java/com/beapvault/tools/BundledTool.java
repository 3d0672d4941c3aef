package com.beapvault.tools;

import java.util.List;

/**
 * A locally installed third-party tool. Tools are installed by the installer and
 * never fetched at runtime; {@code hash} is the SHA-256 of the installed binary.
 *
 * @param supportedFormats MIME types the tool accepts
 * @param outputFormat     image format produced; rasterizers only
 */
public record BundledTool(
        String id,
        String name,
        String description,
        ToolCategory category,
        String version,
        String hash,
        String installPath,
        LicenseInfo license,
        List<String> supportedFormats,
        RasterFormat outputFormat,
        ToolStatus status,
        String error,
        long installedAt) {

    public BundledTool {
        supportedFormats = supportedFormats == null ? List.of() : List.copyOf(supportedFormats);
    }

    public boolean supports(String mimeType) {
        return mimeType != null && supportedFormats.contains(mimeType.toLowerCase(java.util.Locale.ROOT));
    }

    BundledTool installed(String version, String hash, String installPath, long installedAt) {
        return new BundledTool(id, name, description, category, version, hash, installPath, license,
                supportedFormats, outputFormat, ToolStatus.INSTALLED, null, installedAt);
    }

    BundledTool failed(String error) {
        return new BundledTool(id, name, description, category, version, hash, installPath, license,
                supportedFormats, outputFormat, ToolStatus.ERROR, error, installedAt);
    }
}
