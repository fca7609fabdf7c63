package de.htwsaar.assetguard.web.cache;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-sicherer Store der Cache-Policy-Konfiguration.
 *
 * <p>Engine und Final-Override lesen pro Request über {@link #current()}, Admin-Updates greifen damit
 * ab dem nächsten Request.</p>
 */
public class CacheConfigService {

    private final AtomicReference<CacheRuntimeConfig> ref;

    /**
     * @param initial Startkonfiguration aus den Properties (darf nicht {@code null} sein)
     */
    public CacheConfigService(CacheRuntimeConfig initial) {
        this.ref = new AtomicReference<>(Objects.requireNonNull(initial, "initial config must not be null"));
    }

    /** @return aktuelle Konfiguration */
    public CacheRuntimeConfig current() {
        return ref.get();
    }

    /**
     * Ersetzt die Konfiguration vollständig.
     *
     * @param next neue Konfiguration
     * @return die vorherige Konfiguration
     */
    public CacheRuntimeConfig update(CacheRuntimeConfig next) {
        return ref.getAndSet(Objects.requireNonNull(next, "next config must not be null"));
    }

    /**
     * Partielles Update: nur nicht-{@code null}-Felder werden übernommen.
     *
     * @return aktualisierte Konfiguration
     */
    public CacheRuntimeConfig patch(
            Long staticMaxAge,
            Long staticStaleWhileRevalidate,
            Long pageMaxAge,
            Long pageStaleWhileRevalidate,
            Boolean overrideEnabled,
            String staticOverrideDirective,
            String pageOverrideDirective) {

        return ref.updateAndGet(cur -> new CacheRuntimeConfig(
                staticMaxAge != null ? staticMaxAge : cur.staticMaxAge(),
                staticStaleWhileRevalidate != null ? staticStaleWhileRevalidate : cur.staticStaleWhileRevalidate(),
                pageMaxAge != null ? pageMaxAge : cur.pageMaxAge(),
                pageStaleWhileRevalidate != null ? pageStaleWhileRevalidate : cur.pageStaleWhileRevalidate(),
                overrideEnabled != null ? overrideEnabled : cur.overrideEnabled(),
                staticOverrideDirective != null ? staticOverrideDirective : cur.staticOverrideDirective(),
                pageOverrideDirective != null ? pageOverrideDirective : cur.pageOverrideDirective()));
    }
}
