package de.htwsaar.assetguard.fingerprint.manifest;

import de.htwsaar.assetguard.common.util.PathUtils;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Unveränderliche Zuordnung logischer Pfad → gefingerprinteter logischer Pfad.
 *
 * <p>Schlüssel sind sortiert, damit das persistierte Artefakt bei gleichem Input byte-identisch ist.</p>
 */
public final class AssetManifest {

    private static final AssetManifest EMPTY = new AssetManifest(Map.of());

    private final SortedMap<String, String> entries;

    /**
     * @param entries Einträge; Schlüssel und Werte werden normalisiert, leere Schlüssel verworfen
     */
    public AssetManifest(Map<String, String> entries) {
        TreeMap<String, String> copy = new TreeMap<>();
        if (entries != null) {
            entries.forEach((k, v) -> {
                String key = PathUtils.toLogicalPath(k);
                String value = PathUtils.toLogicalPath(v);
                if (!key.isEmpty() && !value.isEmpty()) {
                    copy.put(key, value);
                }
            });
        }
        this.entries = Collections.unmodifiableSortedMap(copy);
    }

    public static AssetManifest empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /** @return sortierte, unveränderliche Sicht */
    public SortedMap<String, String> entries() {
        return entries;
    }

    /**
     * @param logicalPath logischer Pfad, ein führender Slash wird ignoriert
     * @return gefingerprinteter Pfad, falls vorhanden
     */
    public Optional<String> lookup(String logicalPath) {
        if (logicalPath == null) return Optional.empty();
        return Optional.ofNullable(entries.get(PathUtils.stripLeadingSlash(logicalPath)));
    }

    /**
     * @param logicalPath logischer Pfad
     * @return gefingerprinteter Pfad oder die Eingabe unverändert
     */
    public String fingerprintedOr(String logicalPath) {
        if (logicalPath == null) {
            return null;
        }
        return entries.getOrDefault(PathUtils.stripLeadingSlash(logicalPath), logicalPath);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssetManifest other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "AssetManifest" + entries;
    }
}
