package com.beapvault.export;

import java.util.List;

/**
 * A proof bundle: the manifest plus every file, {@code manifest.json} first.
 */
public record ProofBundle(ProofBundleManifest manifest, List<BundleFile> files) {

    public ProofBundle {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
