package com.beapvault.tools;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Service;

import com.beapvault.storage.JsonDocumentStore;

/**
 * Registry of the bundled parser and rasterizer.
 *
 * <p>Tools start out {@link ToolStatus#NOT_INSTALLED}. The installer calls
 * {@link #registerTool} for each tool, then {@link #verifyAllTools()} checks that every
 * tool is installed with a measured hash. Reconstruction is only allowed once
 * {@link #areToolsReady()} is true; any later registration clears readiness until the
 * next verification.
 *
 * <p>The registry is persisted under {@code beap-tool-registry} and restored by
 * {@link #load()} at startup.
 */
@Service
public class ToolRegistry implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    static final String STORAGE_KEY = "beap-tool-registry";
    static final String HASH_VERIFICATION_FAILED = "Hash verification failed or tool not properly installed";
    private static final int DIAGNOSTIC_EXECUTIONS = 50;

    private final JsonDocumentStore documents;
    private final ToolExecutionLog executionLog;
    private final Clock clock;

    private volatile ToolRegistrySnapshot state = initialState();

    public ToolRegistry(JsonDocumentStore documents, ToolExecutionLog executionLog, Clock clock) {
        this.documents = documents;
        this.executionLog = executionLog;
        this.clock = clock;
    }

    @Override
    public void afterPropertiesSet() {
        load();
    }

    public ToolRegistrySnapshot getRegistry() {
        return state;
    }

    public Optional<BundledTool> getTool(String toolId) {
        return Optional.ofNullable(state.tools().get(toolId));
    }

    public List<BundledTool> getToolsByCategory(ToolCategory category) {
        return state.tools().values().stream()
                .filter(t -> t.category() == category)
                .toList();
    }

    public Optional<BundledTool> getParser() {
        return getTool(BundledTools.APACHE_TIKA);
    }

    public Optional<BundledTool> getRasterizer() {
        return getTool(BundledTools.PDFIUM);
    }

    public boolean isFormatSupported(String mimeType) {
        return getParser().map(p -> p.supports(mimeType)).orElse(false);
    }

    public boolean canRasterize(String mimeType) {
        return getRasterizer()
                .map(r -> r.status() == ToolStatus.INSTALLED && r.supports(mimeType))
                .orElse(false);
    }

    public boolean areToolsReady() {
        return state.allVerified();
    }

    /**
     * Records an installed tool.
     *
     * @return {@code false} if {@code toolId} is not a bundled tool
     */
    public synchronized boolean registerTool(String toolId, String version, String hash, String installPath) {
        BundledTool current = state.tools().get(toolId);
        if (current == null) {
            log.error("Refusing to register unknown tool {}", toolId);
            return false;
        }
        Map<String, BundledTool> tools = new LinkedHashMap<>(state.tools());
        tools.put(toolId, current.installed(version, hash, installPath, clock.millis()));
        update(new ToolRegistrySnapshot(tools, state.registryVersion(), state.lastVerified(), false));
        log.info("Registered tool {} version {}", toolId, version);
        return true;
    }

    /**
     * Checks every tool is installed and carries a real hash. Tools still holding the
     * installer placeholder are marked {@link ToolStatus#ERROR}.
     *
     * @return {@code true} if every tool verified
     */
    public synchronized boolean verifyAllTools() {
        Map<String, BundledTool> tools = new LinkedHashMap<>(state.tools());
        boolean allValid = true;
        for (Map.Entry<String, BundledTool> entry : tools.entrySet()) {
            BundledTool tool = entry.getValue();
            if (tool.status() != ToolStatus.INSTALLED) {
                allValid = false;
                continue;
            }
            if (tool.hash() == null || tool.hash().isBlank() || BundledTools.PLACEHOLDER_HASH.equals(tool.hash())) {
                entry.setValue(tool.failed(HASH_VERIFICATION_FAILED));
                allValid = false;
            }
        }
        update(new ToolRegistrySnapshot(tools, state.registryVersion(), clock.millis(), allValid));
        if (allValid) {
            log.info("All bundled tools verified");
        } else {
            log.warn("Bundled tool verification failed; reconstruction stays disabled");
        }
        return allValid;
    }

    public ToolDiagnosticReport generateDiagnosticReport() {
        ToolRegistrySnapshot snapshot = state;
        return new ToolDiagnosticReport(
                clock.millis(),
                snapshot.registryVersion(),
                exportToolInfo(),
                snapshot.allVerified(),
                snapshot.lastVerified(),
                executionLog.recent(DIAGNOSTIC_EXECUTIONS));
    }

    /** License and version attestation for every bundled tool. */
    public List<ToolDiagnosticInfo> exportToolInfo() {
        return BundledTools.defaults().keySet().stream()
                .map(id -> state.tools().get(id))
                .map(ToolDiagnosticInfo::of)
                .toList();
    }

    public ToolExecutionLog getExecutionLog() {
        return executionLog;
    }

    /**
     * Restores the persisted registry. Unknown tool ids in storage are ignored, and
     * bundled tools missing from storage keep their defaults.
     */
    public synchronized void load() {
        Optional<ToolRegistrySnapshot> stored = documents.read(STORAGE_KEY, ToolRegistrySnapshot.class);
        if (stored.isEmpty()) {
            state = initialState();
            return;
        }
        Map<String, BundledTool> tools = BundledTools.defaults();
        for (String id : tools.keySet()) {
            BundledTool persisted = stored.get().tools().get(id);
            if (persisted != null) {
                tools.put(id, persisted);
            }
        }
        state = new ToolRegistrySnapshot(tools, BundledTools.REGISTRY_VERSION,
                stored.get().lastVerified(), stored.get().allVerified());
        log.info("Loaded tool registry (allVerified={})", state.allVerified());
    }

    /** Back to the uninstalled defaults; storage is not touched. */
    public synchronized void reset() {
        state = initialState();
    }

    private void update(ToolRegistrySnapshot next) {
        documents.write(STORAGE_KEY, next);
        state = next;
    }

    private static ToolRegistrySnapshot initialState() {
        return new ToolRegistrySnapshot(BundledTools.defaults(), BundledTools.REGISTRY_VERSION, 0L, false);
    }
}
