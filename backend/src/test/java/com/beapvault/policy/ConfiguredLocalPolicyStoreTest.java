package com.beapvault.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.beapvault.config.BeapProperties;

class ConfiguredLocalPolicyStoreTest {

    @Test
    void emptyConfiguration_shouldBeRestrictive() {
        ConfiguredLocalPolicyStore store = new ConfiguredLocalPolicyStore(BeapProperties.defaults());

        assertEquals(PolicyOverview.restrictive(), store.getPolicyOverview());
        assertTrue(store.getProviders().isEmpty());
        assertTrue(store.getEnabledSites().isEmpty());
    }

    @Test
    void getEnabledSites_shouldSkipDisabledSites() {
        BeapProperties.Policy policy = new BeapProperties.Policy(Duration.ofSeconds(1), PolicyPosture.BALANCED,
                PolicyPosture.PERMISSIVE, List.of(), List.of(
                        new ProtectedSite("outlook.com", "default", "Outlook.com", true),
                        new ProtectedSite("example.org", "user", "Disabled", false)));
        ConfiguredLocalPolicyStore store = new ConfiguredLocalPolicyStore(new BeapProperties(null, policy, null));

        assertEquals(List.of("outlook.com"), store.getEnabledSites().stream().map(ProtectedSite::domain).toList());
        assertEquals(PolicyPosture.BALANCED, store.getPolicyOverview().ingressPosture());
        assertEquals(PolicyPosture.PERMISSIVE, store.getPolicyOverview().egressPosture());
    }
}
