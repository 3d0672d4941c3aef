package com.beapvault.policy;

import java.util.List;

import org.springframework.stereotype.Component;

import com.beapvault.config.BeapProperties;

/**
 * {@link LocalPolicyStore} backed by the {@code beap.policy} configuration section.
 */
@Component
public class ConfiguredLocalPolicyStore implements LocalPolicyStore {

    private final BeapProperties.Policy policy;

    public ConfiguredLocalPolicyStore(BeapProperties properties) {
        this.policy = properties.policy();
    }

    @Override
    public List<EmailProvider> getProviders() {
        return policy.providers();
    }

    @Override
    public List<ProtectedSite> getEnabledSites() {
        return policy.protectedSites().stream()
                .filter(ProtectedSite::enabled)
                .toList();
    }

    @Override
    public PolicyOverview getPolicyOverview() {
        return new PolicyOverview(policy.ingressPosture(), policy.egressPosture());
    }
}
