package com.beapvault.export;

public record BundleFile(String path, String content) {
}
