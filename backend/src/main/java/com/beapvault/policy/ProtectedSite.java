package com.beapvault.policy;

/**
 * A web domain the user allows as a {@code web} egress target.
 * Subdomains of {@link #domain()} are covered too.
 */
public record ProtectedSite(String domain, String source, String description, boolean enabled) {
}
