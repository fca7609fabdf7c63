package de.htwsaar.assetguard.fingerprint.resolve;

import de.htwsaar.assetguard.common.util.PathUtils;
import de.htwsaar.assetguard.fingerprint.manifest.ManifestStore;
import java.util.Objects;

/**
 * Übersetzt logische Asset-Pfade in die öffentliche URL der gefingerprinteten Datei.
 *
 * <p>Ohne Manifest-Eintrag wird der logische Pfad zurückgegeben; das Ergebnis beginnt immer mit
 * genau einem Slash.</p>
 */
public class AssetPathResolver {

    private final ManifestStore store;

    public AssetPathResolver(ManifestStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * @param logicalPath z. B. {@code css/app.css} oder {@code /css/app.css}
     * @return z. B. {@code /css/app.1a2b3c4d.css}
     */
    public String resolve(String logicalPath) {
        if (logicalPath == null || logicalPath.isBlank()) {
            return "/";
        }
        String key = PathUtils.toLogicalPath(logicalPath);
        return PathUtils.ensureLeadingSlash(store.lookup(key));
    }
}
