package de.htwsaar.assetguard.common.util;

/**
 * Small path helpers shared by the build pipeline, the web layer and the CLI.
 */
public final class PathUtils {

    private PathUtils() {}

    /**
     * Entfernt genau einen führenden Slash.
     *
     * @param path Pfad, z. B. {@code /css/app.css}
     * @return Pfad ohne führenden Slash; bei {@code null} ebenfalls {@code null}
     */
    public static String stripLeadingSlash(String path) {
        if (path == null) return null;
        return path.startsWith("/") ? path.substring(1) : path;
    }

    /**
     * Stellt sicher, dass ein Pfad mit genau einem Slash beginnt.
     *
     * @param path Pfad mit oder ohne führenden Slash
     * @return URL-Pfad, bei {@code null} oder leer {@code "/"}
     */
    public static String ensureLeadingSlash(String path) {
        if (path == null || path.isBlank()) return "/";
        String p = path.trim();
        while (p.startsWith("/")) p = p.substring(1);
        return "/" + p;
    }

    /**
     * Wandelt Backslashes in Slashes um und entfernt führende Slashes.
     *
     * @param path roher Pfad (z. B. aus {@link java.nio.file.Path#toString()})
     * @return logischer Pfad im Format {@code dir/file.ext}
     */
    public static String toLogicalPath(String path) {
        if (path == null) return "";
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("/")) p = p.substring(1);
        return p;
    }

    /**
     * Entfernt Query-String und Fragment.
     *
     * @param path Pfad, ggf. mit {@code ?query} oder {@code #fragment}
     * @return reiner Pfad
     */
    public static String stripQueryAndFragment(String path) {
        if (path == null) return null;
        int cut = path.length();
        int q = path.indexOf('?');
        int h = path.indexOf('#');
        if (q >= 0) cut = Math.min(cut, q);
        if (h >= 0) cut = Math.min(cut, h);
        return path.substring(0, cut);
    }

    /**
     * Liefert die Dateiendung des letzten Pfadsegments in Kleinbuchstaben.
     *
     * @param path Pfad
     * @return Endung ohne Punkt oder {@code ""}, wenn keine vorhanden ist
     */
    public static String extension(String path) {
        if (path == null) return "";
        String name = lastSegment(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) return "";
        return name.substring(dot + 1).toLowerCase();
    }

    /**
     * Liefert das letzte Segment eines {@code /}-getrennten Pfads.
     *
     * @param path Pfad
     * @return letztes Segment (kann leer sein)
     */
    public static String lastSegment(String path) {
        if (path == null) return "";
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
