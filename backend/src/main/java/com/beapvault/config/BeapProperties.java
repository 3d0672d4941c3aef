package com.beapvault.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.beapvault.policy.EmailProvider;
import com.beapvault.policy.PolicyPosture;
import com.beapvault.policy.ProtectedSite;

/**
 * Typed view of the {@code beap.*} configuration tree.
 *
 * <p>Every section has safe defaults so the vault starts fail-closed even with an
 * empty configuration: restrictive postures, no providers, no protected sites.
 */
@ConfigurationProperties(prefix = "beap")
public record BeapProperties(Storage storage, Policy policy, Tools tools) {

    public BeapProperties {
        if (storage == null) storage = new Storage(null, null);
        if (policy == null) policy = new Policy(null, null, null, null, null);
        if (tools == null) tools = new Tools(null, 0, 0);
    }

    /**
     * @param backend {@code memory} or {@code cassandra}
     * @param timeout upper bound for a single storage round trip
     */
    public record Storage(String backend, Duration timeout) {
        public Storage {
            if (backend == null) backend = "cassandra";
            if (timeout == null) timeout = Duration.ofSeconds(5);
        }
    }

    public record Policy(
            Duration lookupTimeout,
            PolicyPosture ingressPosture,
            PolicyPosture egressPosture,
            List<EmailProvider> providers,
            List<ProtectedSite> protectedSites) {
        public Policy {
            if (lookupTimeout == null) lookupTimeout = Duration.ofSeconds(2);
            if (ingressPosture == null) ingressPosture = PolicyPosture.RESTRICTIVE;
            if (egressPosture == null) egressPosture = PolicyPosture.RESTRICTIVE;
            providers = providers == null ? List.of() : List.copyOf(providers);
            protectedSites = protectedSites == null ? List.of() : List.copyOf(protectedSites);
        }
    }

    /**
     * @param timeout       wall-clock limit per tool process
     * @param memoryLimitMb memory ceiling per tool process
     * @param workerThreads size of the reconstruction worker pool
     */
    public record Tools(Duration timeout, int memoryLimitMb, int workerThreads) {
        public Tools {
            if (timeout == null) timeout = Duration.ofSeconds(30);
            if (memoryLimitMb <= 0) memoryLimitMb = 256;
            if (workerThreads <= 0) workerThreads = 4;
        }
    }

    public static BeapProperties defaults() {
        return new BeapProperties(null, null, null);
    }
}
