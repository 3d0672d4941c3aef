package com.beapvault.storage;

import java.util.Optional;

/**
 * Durable key-value backend holding the audit ledger, tool registry, archive
 * records and reconstruction records across restarts.
 *
 * <p>Keys are namespaced by the owning component, e.g. {@code beap-audit-store:<messageId>}
 * or {@code beap-tool-registry}. Implementations must bound every call in time and
 * surface failures as unchecked exceptions; callers decide whether a failure is fatal.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);
}
