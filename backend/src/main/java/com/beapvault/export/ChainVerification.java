package com.beapvault.export;

public record ChainVerification(String headHash, int eventCount, boolean verified) {
}
