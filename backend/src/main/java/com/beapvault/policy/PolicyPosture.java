package com.beapvault.policy;

public enum PolicyPosture {
    RESTRICTIVE,
    BALANCED,
    PERMISSIVE
}
