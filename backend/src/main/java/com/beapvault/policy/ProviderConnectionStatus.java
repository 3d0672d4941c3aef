package com.beapvault.policy;

public enum ProviderConnectionStatus {
    CONNECTED,
    DISCONNECTED,
    CONNECTING,
    ERROR,
    EXPIRED
}
