package de.htwsaar.assetguard.fingerprint.domain;

import de.htwsaar.assetguard.common.util.PathUtils;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Ein zum Hashen eingelesenes Asset.
 *
 * <p>Identität ist der absolute Quellpfad. Der Inhalt wird beim Erzeugen und beim Lesen kopiert,
 * damit der gehashte Stand unveränderlich bleibt.</p>
 *
 * @param source      absoluter Quellpfad
 * @param logicalPath logischer Pfad ohne führenden Slash, z. B. {@code css/app.css}
 * @param content     Datei-Bytes
 * @param origin      Herkunft
 */
public record Asset(Path source, String logicalPath, byte[] content, AssetOrigin origin) {

    private static final Map<String, String> CONTENT_TYPES = Map.ofEntries(
            Map.entry("css", "text/css"),
            Map.entry("js", "text/javascript"),
            Map.entry("mjs", "text/javascript"),
            Map.entry("map", "application/json"),
            Map.entry("json", "application/json"),
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("ico", "image/x-icon"),
            Map.entry("webp", "image/webp"),
            Map.entry("avif", "image/avif"),
            Map.entry("woff", "font/woff"),
            Map.entry("woff2", "font/woff2"),
            Map.entry("ttf", "font/ttf"),
            Map.entry("eot", "application/vnd.ms-fontobject"));

    public Asset {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        source = source.toAbsolutePath().normalize();
        logicalPath = PathUtils.toLogicalPath(logicalPath);
        content = Objects.requireNonNull(content, "content must not be null").clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    /** @return Dateiname (letztes Segment des logischen Pfads) */
    public String fileName() {
        return PathUtils.lastSegment(logicalPath);
    }

    /** @return MIME-Type anhand der Endung, Fallback {@code application/octet-stream} */
    public String contentType() {
        return CONTENT_TYPES.getOrDefault(PathUtils.extension(logicalPath), "application/octet-stream");
    }

    /** @return {@code true} für Stylesheets, die Referenzen auf andere Assets enthalten können */
    public boolean isStylesheet() {
        return "css".equals(PathUtils.extension(logicalPath));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Asset other && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return "Asset[" + logicalPath + " <- " + source + ", " + origin + "]";
    }
}
