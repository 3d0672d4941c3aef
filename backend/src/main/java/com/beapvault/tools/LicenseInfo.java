package com.beapvault.tools;

import java.util.List;

public record LicenseInfo(
        LicenseIdentifier identifier,
        String name,
        List<String> copyrightHolders,
        String upstreamUrl) {

    public LicenseInfo {
        copyrightHolders = copyrightHolders == null ? List.of() : List.copyOf(copyrightHolders);
    }
}
