package de.htwsaar.assetguard.fingerprint.manifest;

import de.htwsaar.assetguard.common.serialization.AssetGuardSerializationException;
import de.htwsaar.assetguard.common.serialization.JacksonCodec;
import de.htwsaar.assetguard.common.util.PathUtils;
import de.htwsaar.assetguard.fingerprint.domain.FingerprintException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Besitzt das Manifest-Artefakt: Akkumulator für den Build und geladene Sicht für die Laufzeit.
 *
 * <p>Build-Seite ({@link #reset()}, {@link #record}, {@link #persist()}) ist für genau einen Schreiber
 * gedacht. Laufzeit-Seite ({@link #load()}, {@link #lookup}) liest lock-frei einen unveränderlichen
 * Snapshot; das erste Laden passiert höchstens einmal gleichzeitig.</p>
 */
public class ManifestStore {

    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    /** Standard-Dateiname des Artefakts im Output-Verzeichnis. */
    public static final String DEFAULT_FILE_NAME = "asset-manifest.json";

    private final Path manifestFile;
    private final Path publicDir;

    private final Map<String, String> accumulator = new LinkedHashMap<>();
    private final Object loadLock = new Object();
    private volatile AssetManifest loaded;

    /**
     * @param manifestFile Pfad des Artefakts
     * @param publicDir    Verzeichnis der ausgelieferten Dateien; wenn gesetzt, werden Einträge ohne
     *                     Datei beim Laden verworfen. Darf {@code null} sein.
     */
    public ManifestStore(Path manifestFile, Path publicDir) {
        this.manifestFile = Objects.requireNonNull(manifestFile, "manifestFile must not be null")
                .toAbsolutePath().normalize();
        this.publicDir = publicDir != null ? publicDir.toAbsolutePath().normalize() : null;
    }

    public ManifestStore(Path manifestFile) {
        this(manifestFile, null);
    }

    public Path manifestFile() {
        return manifestFile;
    }

    // ---------- Build-Seite ----------

    /** Leert den Akkumulator vor einem neuen Lauf. */
    public synchronized void reset() {
        accumulator.clear();
    }

    /**
     * Trägt eine Zuordnung ein oder überschreibt sie.
     *
     * @param logicalPath       logischer Pfad
     * @param fingerprintedPath gefingerprinteter logischer Pfad
     */
    public synchronized void record(String logicalPath, String fingerprintedPath) {
        String key = PathUtils.toLogicalPath(logicalPath);
        String value = PathUtils.toLogicalPath(fingerprintedPath);
        if (key.isEmpty() || value.isEmpty()) {
            throw new FingerprintException("Manifest entry must not be empty: '" + logicalPath + "' -> '"
                    + fingerprintedPath + "'");
        }
        accumulator.put(key, value);
    }

    /** @return unveränderliche Sicht auf den aktuellen Akkumulator */
    public synchronized AssetManifest snapshot() {
        return new AssetManifest(accumulator);
    }

    /**
     * Schreibt den Akkumulator atomar als JSON-Artefakt und verwirft die geladene Sicht.
     *
     * @return geschriebener Pfad
     * @throws FingerprintException wenn das Artefakt nicht geschrieben werden kann
     */
    public synchronized Path persist() {
        AssetManifest manifest = snapshot();
        String json = JacksonCodec.toPrettyJson(manifest.entries());
        Path dir = manifestFile.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, manifestFile.getFileName().toString(), ".tmp");
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, manifestFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, manifestFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new FingerprintException("Failed to write manifest " + manifestFile, e);
        }
        log.info("Wrote manifest {} with {} entries", manifestFile, manifest.size());
        invalidate();
        return manifestFile;
    }

    // ---------- Laufzeit-Seite ----------

    /**
     * Lädt das Artefakt beim ersten Aufruf und liefert danach immer denselben Snapshot.
     *
     * @return geladenes Manifest; leer, wenn das Artefakt fehlt oder defekt ist
     */
    public AssetManifest load() {
        AssetManifest current = loaded;
        if (current != null) {
            return current;
        }
        synchronized (loadLock) {
            if (loaded == null) {
                loaded = readArtifact();
            }
            return loaded;
        }
    }

    /** Vergisst die geladene Sicht, der nächste {@link #load()} liest neu. */
    public void invalidate() {
        synchronized (loadLock) {
            loaded = null;
        }
    }

    /**
     * @param logicalPath logischer Pfad, ein führender Slash wird entfernt
     * @return gefingerprinteter Pfad oder die Eingabe unverändert
     */
    public String lookup(String logicalPath) {
        return load().fingerprintedOr(logicalPath);
    }

    private AssetManifest readArtifact() {
        String json;
        try {
            json = Files.readString(manifestFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.warn("Asset manifest {} not found, serving logical paths unchanged", manifestFile);
            return AssetManifest.empty();
        } catch (IOException e) {
            log.error("Unable to read asset manifest {}", manifestFile, e);
            return AssetManifest.empty();
        }

        Map<String, String> entries;
        try {
            entries = JacksonCodec.fromJsonStringMap(json);
        } catch (AssetGuardSerializationException e) {
            log.error("Asset manifest {} is malformed, serving logical paths unchanged", manifestFile, e);
            return AssetManifest.empty();
        }

        AssetManifest manifest = new AssetManifest(entries);
        if (publicDir != null) {
            manifest = dropStaleEntries(manifest);
        }
        log.info("Loaded asset manifest {} with {} entries", manifestFile, manifest.size());
        return manifest;
    }

    private AssetManifest dropStaleEntries(AssetManifest manifest) {
        Map<String, String> kept = new LinkedHashMap<>();
        manifest.entries().forEach((logical, fingerprinted) -> {
            if (Files.isRegularFile(publicDir.resolve(fingerprinted))) {
                kept.put(logical, fingerprinted);
            } else {
                log.warn("Dropping manifest entry {} -> {}: file missing in {}", logical, fingerprinted, publicDir);
            }
        });
        return kept.size() == manifest.size() ? manifest : new AssetManifest(kept);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Unable to delete temporary manifest {}", tmp, e);
        }
    }
}
