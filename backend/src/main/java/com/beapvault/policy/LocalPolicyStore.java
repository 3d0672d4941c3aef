package com.beapvault.policy;

import java.util.List;

/**
 * Read-only view of the user's local policy: connected email providers,
 * protected web sites and the ingress/egress postures.
 *
 * <p>The evaluation pipeline bounds every call with a timeout, so implementations
 * may be slow, but they should not block indefinitely.
 */
public interface LocalPolicyStore {

    List<EmailProvider> getProviders();

    /** Protected sites with {@code enabled = true}. */
    List<ProtectedSite> getEnabledSites();

    PolicyOverview getPolicyOverview();
}
