package com.beapvault.export;

/**
 * @param hash SHA-256 of the file's exact content
 * @param size content length in UTF-8 bytes
 */
public record ManifestFile(String path, BundleFileType type, String hash, long size) {
}
