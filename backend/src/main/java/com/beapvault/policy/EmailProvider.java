package com.beapvault.policy;

/**
 * An email account the local user has connected. Only {@link ProviderConnectionStatus#CONNECTED}
 * providers satisfy the email-channel policy check.
 */
public record EmailProvider(
        String id,
        String type,
        String name,
        String email,
        ProviderConnectionStatus status,
        boolean defaultProvider) {

    public boolean isConnected() {
        return status == ProviderConnectionStatus.CONNECTED;
    }
}
