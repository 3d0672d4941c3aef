package com.beapvault.policy;

public record PolicyOverview(PolicyPosture ingressPosture, PolicyPosture egressPosture) {

    public static PolicyOverview restrictive() {
        return new PolicyOverview(PolicyPosture.RESTRICTIVE, PolicyPosture.RESTRICTIVE);
    }
}
