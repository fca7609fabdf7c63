package de.htwsaar.assetguard.web.headers;

import de.htwsaar.assetguard.web.route.RouteClass;
import de.htwsaar.assetguard.web.route.RouteClassifier;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entfernt veraltete Security-Header aus HTML-Antworten.
 *
 * <p>HTML ist eine Antwort, wenn der Request HTML akzeptiert (auch ohne {@code Accept} oder mit
 * {@code *}{@code /*}), der {@code Content-Type} beim Commit {@code text/html} ist oder die Route eine
 * HTML-Seite ist.</p>
 */
public class LegacyHeaderStripper implements HeaderGuard {

    private static final Logger log = LoggerFactory.getLogger(LegacyHeaderStripper.class);

    public static final List<String> LEGACY_HEADERS = List.of(
            "X-DNS-Prefetch-Control", "X-Permitted-Cross-Domain-Policies", "X-XSS-Protection");

    private final RouteClassifier classifier;

    public LegacyHeaderStripper(RouteClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public void register(HttpServletRequest request, HeaderGuardResponseWrapper response) {
        String accept = request.getHeader("Accept");
        RouteClass route = classifier.classify(request);

        response.holdBack(LEGACY_HEADERS);
        response.onBeforeCommit(() -> {
            if (isHtmlResponse(accept, response.getContentType(), route)) {
                response.dropHeld(LEGACY_HEADERS);
                response.lock(LEGACY_HEADERS);
                log.debug("Stripped legacy headers from {}", request.getRequestURI());
            }
        });
    }

    /**
     * @param accept      {@code Accept}-Header des Requests, darf {@code null} sein
     * @param contentType {@code Content-Type} der Response, darf {@code null} sein
     * @param route       Routenklasse
     * @return {@code true}, wenn eines der drei HTML-Signale greift
     */
    public boolean isHtmlResponse(String accept, String contentType, RouteClass route) {
        return route == RouteClass.HTML_PAGE || acceptsHtml(accept) || isHtmlContentType(contentType);
    }

    /**
     * Inhaltsverhandlung wie bei einem Browser-Request: fehlt {@code Accept}, ist HTML akzeptiert.
     * Der spezifischste passende Medienbereich ({@code text/html} vor {@code text/*} vor {@code *}{@code /*})
     * entscheidet, {@code q=0} lehnt ab. {@code application/xhtml+xml} mit {@code q>0} zählt ebenfalls.
     */
    static boolean acceptsHtml(String accept) {
        if (accept == null || accept.isBlank()) {
            return true;
        }
        int bestSpecificity = -1;
        double bestQuality = 0.0;
        for (String part : accept.split(",")) {
            String[] params = part.split(";");
            String type = params[0].trim().toLowerCase(Locale.ROOT);
            double quality = quality(params);
            if (type.equals("application/xhtml+xml") && quality > 0.0) {
                return true;
            }
            int specificity = specificity(type);
            if (specificity > bestSpecificity) {
                bestSpecificity = specificity;
                bestQuality = quality;
            }
        }
        return bestSpecificity >= 0 && bestQuality > 0.0;
    }

    private static int specificity(String type) {
        switch (type) {
            case "text/html":
                return 2;
            case "text/*":
                return 1;
            case "*/*":
            case "*":
                return 0;
            default:
                return -1;
        }
    }

    private static double quality(String[] params) {
        for (int i = 1; i < params.length; i++) {
            String p = params[i].trim().toLowerCase(Locale.ROOT);
            if (p.startsWith("q=")) {
                try {
                    return Double.parseDouble(p.substring(2).trim());
                } catch (NumberFormatException e) {
                    return 1.0;
                }
            }
        }
        return 1.0;
    }

    static boolean isHtmlContentType(String contentType) {
        if (contentType == null) {
            return false;
        }
        int semi = contentType.indexOf(';');
        String type = (semi >= 0 ? contentType.substring(0, semi) : contentType).trim();
        return type.equalsIgnoreCase("text/html");
    }
}
