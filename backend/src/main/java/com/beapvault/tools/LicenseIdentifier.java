package com.beapvault.tools;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SPDX identifiers of the licenses a bundled tool may carry. Only permissive
 * licenses are listed; copyleft tools cannot be registered.
 */
public enum LicenseIdentifier {
    APACHE_2_0("Apache-2.0"),
    BSD_3_CLAUSE("BSD-3-Clause"),
    BSD_2_CLAUSE("BSD-2-Clause"),
    MIT("MIT"),
    ISC("ISC");

    private final String spdxId;

    LicenseIdentifier(String spdxId) {
        this.spdxId = spdxId;
    }

    @JsonValue
    public String spdxId() {
        return spdxId;
    }
}
