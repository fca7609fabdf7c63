package de.htwsaar.assetguard.web.cache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ergebnis der Cache-Policy für einen Request.
 *
 * @param kind       Art der Entscheidung
 * @param directive  Wert für {@code Cache-Control}, {@code null} bei {@link Kind#NO_POLICY}
 * @param vary       Wert für {@code Vary}, {@code null} bei {@link Kind#NO_POLICY}
 * @param ttlSeconds max-age in Sekunden, 0 ohne Caching
 */
public record CacheDecision(Kind kind, String directive, String vary, long ttlSeconds) {

    public static final String CACHE_CONTROL = "Cache-Control";
    public static final String VARY = "Vary";
    public static final String PRAGMA = "Pragma";
    public static final String EXPIRES = "Expires";

    public static final String VARY_ACCEPT_ENCODING = "Accept-Encoding";
    public static final String NO_STORE_DIRECTIVE = "no-cache, no-store, must-revalidate";

    private static final CacheDecision NO_POLICY = new CacheDecision(Kind.NO_POLICY, null, null, 0);
    private static final CacheDecision NO_STORE =
            new CacheDecision(Kind.NO_STORE, NO_STORE_DIRECTIVE, VARY_ACCEPT_ENCODING, 0);

    public enum Kind {
        /** Keine Header, nachgelagerte Schichten entscheiden. */
        NO_POLICY,
        /** Entwicklung: nichts cachen. */
        NO_STORE,
        STATIC_ASSET,
        PAGE
    }

    public static CacheDecision noPolicy() {
        return NO_POLICY;
    }

    public static CacheDecision noStore() {
        return NO_STORE;
    }

    public static CacheDecision staticAsset(long maxAge, long staleWhileRevalidate) {
        return new CacheDecision(Kind.STATIC_ASSET, publicDirective(maxAge, staleWhileRevalidate),
                VARY_ACCEPT_ENCODING, maxAge);
    }

    public static CacheDecision page(long maxAge, long staleWhileRevalidate) {
        return new CacheDecision(Kind.PAGE, publicDirective(maxAge, staleWhileRevalidate),
                VARY_ACCEPT_ENCODING, maxAge);
    }

    /**
     * Header, die die Entscheidung setzt. {@code NO_STORE} ergänzt {@code Pragma} und {@code Expires}
     * für HTTP/1.0-Caches.
     *
     * @return Header-Name → Wert in Setz-Reihenfolge, leer bei {@link Kind#NO_POLICY}
     */
    public Map<String, String> headers() {
        if (kind == Kind.NO_POLICY) {
            return Map.of();
        }
        Map<String, String> h = new LinkedHashMap<>();
        h.put(CACHE_CONTROL, directive);
        if (kind == Kind.NO_STORE) {
            h.put(PRAGMA, "no-cache");
            h.put(EXPIRES, "0");
        }
        h.put(VARY, vary);
        return Collections.unmodifiableMap(h);
    }

    private static String publicDirective(long maxAge, long staleWhileRevalidate) {
        return "public, max-age=" + maxAge + ", stale-while-revalidate=" + staleWhileRevalidate;
    }
}
