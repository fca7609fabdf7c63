package de.htwsaar.assetguard.fingerprint.pipeline;

import de.htwsaar.assetguard.common.util.PathUtils;
import de.htwsaar.assetguard.fingerprint.discovery.AssetDiscovery;
import de.htwsaar.assetguard.fingerprint.discovery.AssetRoot;
import de.htwsaar.assetguard.fingerprint.domain.Asset;
import de.htwsaar.assetguard.fingerprint.domain.AssetOrigin;
import de.htwsaar.assetguard.fingerprint.domain.Fingerprint;
import de.htwsaar.assetguard.fingerprint.domain.FingerprintException;
import de.htwsaar.assetguard.fingerprint.domain.FingerprintedName;
import de.htwsaar.assetguard.fingerprint.manifest.AssetManifest;
import de.htwsaar.assetguard.fingerprint.manifest.ManifestStore;
import de.htwsaar.assetguard.fingerprint.rewrite.ReferenceRewriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Build-Schritt: findet Assets, hasht sie, schreibt Stylesheets um, kopiert alles ins Output-Verzeichnis
 * und persistiert das Manifest.
 *
 * <p>Pro Root werden zuerst alle Nicht-Stylesheets verarbeitet, danach die Stylesheets. Ein Stylesheet
 * wird zuerst umgeschrieben und dann gehasht, sein Fingerprint spiegelt also die neuen Referenzen wider.
 * Jede Datei landet unter ihrem Original- und unter ihrem Fingerprint-Namen im Output.</p>
 */
public class FingerprintPipeline {

    private static final Logger log = LoggerFactory.getLogger(FingerprintPipeline.class);

    private final AssetDiscovery discovery;
    private final ManifestStore store;
    private final ReferenceRewriter rewriter;
    private final Path outputDir;
    private final Clock clock;

    public FingerprintPipeline(AssetDiscovery discovery, ManifestStore store, ReferenceRewriter rewriter,
                               Path outputDir, Clock clock) {
        this.discovery = Objects.requireNonNull(discovery, "discovery must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter must not be null");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public FingerprintPipeline(ManifestStore store, Path outputDir) {
        this(new AssetDiscovery(), store, new ReferenceRewriter(), outputDir, Clock.systemUTC());
    }

    /**
     * Führt einen kompletten Lauf aus. Das Manifest wird vorher geleert und am Ende persistiert.
     *
     * @param roots Quellverzeichnisse in Verarbeitungsreihenfolge
     * @return Bericht
     * @throws FingerprintException bei Schreibfehlern im Output oder beim Manifest
     */
    public FingerprintReport run(List<AssetRoot> roots) {
        Instant startedAt = clock.instant();
        store.reset();
        createDirectories(outputDir);

        Map<AssetOrigin, Map<String, String>> knownByOrigin = new EnumMap<>(AssetOrigin.class);
        Counters counters = new Counters();
        List<String> failedRoots = new ArrayList<>();

        for (AssetRoot root : roots) {
            try {
                processRoot(root, knownByOrigin.computeIfAbsent(root.origin(), o -> new HashMap<>()), counters);
            } catch (AssetRootAbortedException e) {
                log.error("Aborted asset root {}: {}", e.getRoot(), e.getMessage(), e.getCause());
                failedRoots.add(e.getRoot() + ": " + e.getMessage());
            }
        }

        Path manifestFile = store.persist();
        AssetManifest manifest = store.snapshot();
        Instant finishedAt = clock.instant();
        log.info("Fingerprinted {} assets, rewrote {} stylesheets, copied {} files, {} roots failed",
                counters.fingerprinted, counters.rewritten, counters.copied, failedRoots.size());
        return new FingerprintReport(counters.fingerprinted, counters.rewritten, counters.copied, counters.skipped,
                failedRoots, manifestFile, manifest, startedAt, finishedAt);
    }

    private void processRoot(AssetRoot root, Map<String, String> known, Counters counters) {
        Path dir = root.directory().toAbsolutePath().normalize();
        List<Asset> assets = readAll(root, dir, counters);

        List<Asset> stylesheets = new ArrayList<>();
        for (Asset asset : assets) {
            if (asset.isStylesheet() && !root.isPassthrough(asset.logicalPath())) {
                stylesheets.add(asset);
                continue;
            }
            if (root.isPassthrough(asset.logicalPath())) {
                write(asset.logicalPath(), asset.content());
                counters.copied++;
                continue;
            }
            publish(asset.logicalPath(), asset.content(), known);
            counters.fingerprinted++;
        }

        for (Asset stylesheet : stylesheets) {
            String css = new String(stylesheet.content(), StandardCharsets.UTF_8);
            String rewritten = rewriter.rewrite(css, stylesheet.logicalPath(), known);
            if (!rewritten.equals(css)) {
                counters.rewritten++;
                log.debug("Rewrote references in {}", stylesheet.logicalPath());
            }
            publish(stylesheet.logicalPath(), rewritten.getBytes(StandardCharsets.UTF_8), known);
            counters.fingerprinted++;
        }
    }

    /**
     * Liest alle Dateien eines Roots, bevor etwas geschrieben wird, damit ein Abbruch keine Teil-Einträge
     * im Manifest hinterlässt.
     */
    private List<Asset> readAll(AssetRoot root, Path dir, Counters counters) {
        List<Path> files;
        try (Stream<Path> stream = discovery.discover(root, outputDir)) {
            files = stream.sorted().collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw new AssetRootAbortedException(dir, "Unable to list files", e);
        }

        List<Asset> assets = new ArrayList<>(files.size());
        for (Path file : files) {
            String logical = root.logicalPathOf(dir.relativize(file));
            try {
                assets.add(new Asset(file, logical, Files.readAllBytes(file), root.origin()));
            } catch (IOException e) {
                if (root.origin() == AssetOrigin.APPLICATION) {
                    throw new AssetRootAbortedException(dir, "Unable to read " + file, e);
                }
                log.warn("Skipping unreadable vendored asset {}", file, e);
                counters.skipped++;
            }
        }
        return assets;
    }

    private void publish(String logicalPath, byte[] content, Map<String, String> known) {
        FingerprintedName name = FingerprintedName.of(
                PathUtils.lastSegment(logicalPath), Fingerprint.of(content));
        String fingerprintedPath = name.applyTo(logicalPath);
        write(logicalPath, content);
        write(fingerprintedPath, content);
        store.record(logicalPath, fingerprintedPath);
        known.put(logicalPath, fingerprintedPath);
    }

    private void write(String logicalPath, byte[] content) {
        Path target = outputDir.resolve(logicalPath).normalize();
        if (!target.startsWith(outputDir)) {
            throw new FingerprintException("Asset path escapes output directory: " + logicalPath);
        }
        createDirectories(target.getParent());
        try {
            Files.write(target, content);
        } catch (IOException e) {
            throw new FingerprintException("Failed to write " + target, e);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new FingerprintException("Failed to create directory " + dir, e);
        }
    }

    private static final class Counters {
        int fingerprinted;
        int rewritten;
        int copied;
        int skipped;
    }
}
