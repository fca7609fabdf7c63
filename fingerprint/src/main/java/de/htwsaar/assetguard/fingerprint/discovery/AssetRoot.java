package de.htwsaar.assetguard.fingerprint.discovery;

import de.htwsaar.assetguard.common.util.PathUtils;
import de.htwsaar.assetguard.fingerprint.domain.AssetOrigin;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Quellverzeichnis für den Fingerprint-Lauf.
 *
 * @param directory             Wurzelverzeichnis
 * @param origin                Herkunft aller Dateien darunter
 * @param publicPrefix          Präfix der logischen Pfade (z. B. {@code vendor}), leer für keinen
 * @param includes              Glob-Muster relativ zum Wurzelverzeichnis
 * @param passthroughExtensions Endungen, die unverändert kopiert und nicht gefingerprintet werden
 */
public record AssetRoot(
        Path directory,
        AssetOrigin origin,
        String publicPrefix,
        List<String> includes,
        Set<String> passthroughExtensions) {

    /** Standard-Muster: Stylesheets, Skripte, Source-Maps, Bilder und Fonts. */
    public static final List<String> DEFAULT_INCLUDES = List.of(
            "**/*.css", "**/*.js", "**/*.map",
            "**/*.png", "**/*.jpg", "**/*.jpeg", "**/*.gif", "**/*.svg", "**/*.ico", "**/*.webp", "**/*.avif",
            "**/*.woff", "**/*.woff2", "**/*.ttf", "**/*.eot");

    /** Vendor-Fonts tragen bereits einen Hash im Namen. */
    public static final Set<String> DEFAULT_VENDOR_PASSTHROUGH = Set.of("woff", "woff2");

    public AssetRoot {
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        publicPrefix = normalizePrefix(publicPrefix);
        includes = includes == null || includes.isEmpty() ? DEFAULT_INCLUDES : List.copyOf(includes);
        passthroughExtensions = passthroughExtensions == null
                ? Set.of()
                : passthroughExtensions.stream()
                        .map(e -> e.trim().toLowerCase())
                        .map(e -> e.startsWith(".") ? e.substring(1) : e)
                        .filter(e -> !e.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Anwendungs-Assets mit Standard-Mustern.
     *
     * @param directory    Verzeichnis
     * @param publicPrefix Präfix oder {@code null}
     * @return Root
     */
    public static AssetRoot application(Path directory, String publicPrefix) {
        return new AssetRoot(directory, AssetOrigin.APPLICATION, publicPrefix, DEFAULT_INCLUDES, Set.of());
    }

    /**
     * Vendor-Assets mit Standard-Mustern; {@code woff}/{@code woff2} werden nur kopiert.
     *
     * @param directory    Verzeichnis
     * @param publicPrefix Präfix oder {@code null}
     * @return Root
     */
    public static AssetRoot vendored(Path directory, String publicPrefix) {
        return new AssetRoot(
                directory, AssetOrigin.VENDORED, publicPrefix, DEFAULT_INCLUDES, DEFAULT_VENDOR_PASSTHROUGH);
    }

    /**
     * Liest eine Root-Angabe der Form {@code DIR} oder {@code DIR=PREFIX}.
     *
     * @param value  Angabe aus CLI oder Properties
     * @param origin Herkunft
     * @return Root mit den Standardwerten der Herkunft
     * @throws IllegalArgumentException bei leerer Angabe
     */
    public static AssetRoot parse(String value, AssetOrigin origin) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Asset root must not be blank");
        }
        String s = value.trim();
        int eq = s.indexOf('=');
        Path dir = Path.of(eq >= 0 ? s.substring(0, eq).trim() : s);
        String prefix = eq >= 0 ? s.substring(eq + 1) : "";
        return origin == AssetOrigin.VENDORED ? vendored(dir, prefix) : application(dir, prefix);
    }

    /**
     * Kopie mit anderen Mustern bzw. Passthrough-Endungen; {@code null} behält den aktuellen Wert.
     *
     * @param newIncludes    Glob-Muster
     * @param newPassthrough Endungen
     * @return neuer Root
     */
    public AssetRoot with(List<String> newIncludes, Set<String> newPassthrough) {
        return new AssetRoot(directory, origin, publicPrefix,
                newIncludes != null && !newIncludes.isEmpty() ? newIncludes : includes,
                newPassthrough != null ? newPassthrough : passthroughExtensions);
    }

    /**
     * Bildet einen Pfad relativ zum Root auf den logischen Pfad ab.
     *
     * @param relative relativer Pfad
     * @return logischer Pfad, z. B. {@code vendor/assets/images/crest.png}
     */
    public String logicalPathOf(Path relative) {
        String rel = PathUtils.toLogicalPath(relative.toString());
        return publicPrefix.isEmpty() ? rel : publicPrefix + "/" + rel;
    }

    /**
     * @param logicalPath logischer Pfad
     * @return {@code true}, wenn die Datei nur kopiert werden soll
     */
    public boolean isPassthrough(String logicalPath) {
        return passthroughExtensions.contains(PathUtils.extension(logicalPath));
    }

    private static String normalizePrefix(String prefix) {
        String p = PathUtils.toLogicalPath(prefix);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }
}
