package de.htwsaar.assetguard.web.route;

import de.htwsaar.assetguard.common.util.PathUtils;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Set;

/**
 * Ordnet Request-Pfade einer {@link RouteClass} zu.
 *
 * <p>Einzige Klassifikation im Request-Pfad: Policy-Engine, Header-Stripper und Final-Override
 * verwenden dieselbe Instanz, damit sie nie unterschiedlich entscheiden.</p>
 *
 * <ul>
 *   <li>{@code /api}, {@code /api/**} → API (segmentgenau, {@code /apikeys} ist keine API)</li>
 *   <li>{@code /health}, {@code /health/**} → HEALTH</li>
 *   <li>Endung aus {@link #STATIC_EXTENSIONS} → STATIC_ASSET</li>
 *   <li>letztes Segment ohne Punkt (auch {@code /}) → HTML_PAGE</li>
 *   <li>sonst OTHER</li>
 * </ul>
 */
public class RouteClassifier {

    public static final Set<String> STATIC_EXTENSIONS = Set.of(
            "css", "js", "map", "png", "jpg", "jpeg", "gif", "ico", "svg",
            "woff", "woff2", "ttf", "eot", "webp", "avif");

    /**
     * @param path Request-Pfad, Query-String und Fragment werden ignoriert
     * @return Routenklasse
     */
    public RouteClass classify(String path) {
        String p = PathUtils.stripQueryAndFragment(path);
        if (p == null || p.isBlank()) {
            return RouteClass.HTML_PAGE;
        }
        p = PathUtils.ensureLeadingSlash(p);

        if (isUnder(p, "/api")) return RouteClass.API;
        if (isUnder(p, "/health")) return RouteClass.HEALTH;

        String last = PathUtils.lastSegment(p);
        if (STATIC_EXTENSIONS.contains(PathUtils.extension(last))) {
            return RouteClass.STATIC_ASSET;
        }
        if (last.indexOf('.') < 0) {
            return RouteClass.HTML_PAGE;
        }
        return RouteClass.OTHER;
    }

    /**
     * Klassifiziert den Pfad innerhalb der Anwendung (ohne Context-Path).
     *
     * @param request Request
     * @return Routenklasse
     */
    public RouteClass classify(HttpServletRequest request) {
        return classify(pathWithinApplication(request));
    }

    /**
     * @param request Request
     * @return Request-URI ohne Context-Path
     */
    public static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String ctx = request.getContextPath();
        if (uri == null) return "/";
        if (ctx != null && !ctx.isEmpty() && uri.startsWith(ctx)) {
            uri = uri.substring(ctx.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }

    private static boolean isUnder(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }
}
