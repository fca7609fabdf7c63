package de.htwsaar.assetguard.web.cache;

/**
 * Laufzeit-Konfiguration der Cache-Policy, live änderbar ohne Neustart.
 *
 * @param staticMaxAge                  max-age für statische Assets in s
 * @param staticStaleWhileRevalidate    stale-while-revalidate für statische Assets in s
 * @param pageMaxAge                    max-age für Seiten in s
 * @param pageStaleWhileRevalidate      stale-while-revalidate für Seiten in s
 * @param overrideEnabled               ob der Final-Override aktiv ist
 * @param staticOverrideDirective       finaler {@code Cache-Control}-Wert für statische Assets
 * @param pageOverrideDirective         finaler {@code Cache-Control}-Wert für HTML-Seiten
 */
public record CacheRuntimeConfig(
        long staticMaxAge,
        long staticStaleWhileRevalidate,
        long pageMaxAge,
        long pageStaleWhileRevalidate,
        boolean overrideEnabled,
        String staticOverrideDirective,
        String pageOverrideDirective) {

    public static final long DEFAULT_STATIC_MAX_AGE = 604_800;
    public static final long DEFAULT_STATIC_SWR = 86_400;
    public static final long DEFAULT_MAX_AGE = 3_600;
    public static final long DEFAULT_PAGE_SWR = 60;
    public static final String DEFAULT_STATIC_OVERRIDE =
            "public, max-age=31536000, immutable, stale-while-revalidate=2592000";
    public static final String DEFAULT_PAGE_OVERRIDE = "public, max-age=86400, stale-while-revalidate=3600";

    /** Werte, die bei fehlender oder fehlerhafter Konfiguration gelten. */
    public static final CacheRuntimeConfig DEFAULTS = new CacheRuntimeConfig(
            DEFAULT_STATIC_MAX_AGE, DEFAULT_STATIC_SWR, DEFAULT_MAX_AGE, DEFAULT_PAGE_SWR,
            true, DEFAULT_STATIC_OVERRIDE, DEFAULT_PAGE_OVERRIDE);

    public CacheRuntimeConfig {
        staticMaxAge = Math.max(0, staticMaxAge);
        staticStaleWhileRevalidate = Math.max(0, staticStaleWhileRevalidate);
        pageMaxAge = Math.max(0, pageMaxAge);
        pageStaleWhileRevalidate = Math.max(0, pageStaleWhileRevalidate);
        staticOverrideDirective = orDefault(staticOverrideDirective, DEFAULT_STATIC_OVERRIDE);
        pageOverrideDirective = orDefault(pageOverrideDirective, DEFAULT_PAGE_OVERRIDE);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
