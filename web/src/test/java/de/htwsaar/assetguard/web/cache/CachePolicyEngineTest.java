package de.htwsaar.assetguard.web.cache;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import de.htwsaar.assetguard.web.route.RouteClassifier;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CachePolicyEngineTest {

    private final CacheConfigService config = new CacheConfigService(CacheRuntimeConfig.DEFAULTS);

    private CachePolicyEngine engine(String env) {
        return new CachePolicyEngine(new RouteClassifier(), config, () -> env);
    }

    @Test
    void developmentDisablesCachingForPages() {
        CacheDecision d = engine("development").decide("GET", "/dashboard", () -> false);

        assertEquals(CacheDecision.Kind.NO_STORE, d.kind());
        assertEquals(Map.of(
                "Cache-Control", "no-cache, no-store, must-revalidate",
                "Pragma", "no-cache",
                "Expires", "0",
                "Vary", "Accept-Encoding"), d.headers());
    }

    @Test
    void productionStaticAssetGetsStaticPolicy() {
        CacheDecision d = engine("production").decide("GET", "/css/app.css", () -> false);

        assertEquals(CacheDecision.Kind.STATIC_ASSET, d.kind());
        assertEquals("public, max-age=604800, stale-while-revalidate=86400", d.directive());
        assertEquals("Accept-Encoding", d.vary());
        assertEquals(604800, d.ttlSeconds());
        assertFalse(d.headers().containsKey("Pragma"));
    }

    @Test
    void productionPageUsesDefaultMaxAge() {
        CacheDecision d = engine("production").decide("HEAD", "/start", null);

        assertEquals(CacheDecision.Kind.PAGE, d.kind());
        assertEquals("public, max-age=3600, stale-while-revalidate=60", d.directive());
    }

    @Test
    void authenticatedRequestGetsNoHeaders() {
        CacheDecision d = engine("production").decide("GET", "/account", () -> true);

        assertEquals(CacheDecision.Kind.NO_POLICY, d.kind());
        assertTrue(d.headers().isEmpty());
    }

    @Test
    void developmentWinsOverAuthentication() {
        assertEquals(CacheDecision.Kind.NO_STORE, engine("Development").decide("GET", "/account", () -> true).kind());
    }

    @Test
    void throwingAuthPredicateCountsAsAnonymous() {
        CacheDecision d = engine("production").decide("GET", "/account", () -> {
            throw new IllegalStateException("session store down");
        });

        assertEquals(CacheDecision.Kind.PAGE, d.kind());
    }

    @Test
    void unsafeMethodsApiAndHealthGetNoPolicy() {
        CachePolicyEngine e = engine("development");
        assertEquals(CacheDecision.Kind.NO_POLICY, e.decide("POST", "/dashboard", () -> false).kind());
        assertEquals(CacheDecision.Kind.NO_POLICY, e.decide("DELETE", "/css/app.css", () -> false).kind());
        assertEquals(CacheDecision.Kind.NO_POLICY, e.decide("GET", "/api/assets/resolve", () -> false).kind());
        assertEquals(CacheDecision.Kind.NO_POLICY, e.decide("GET", "/health/ready", () -> false).kind());
        assertEquals(CacheDecision.Kind.NO_POLICY, e.decide(null, "/dashboard", () -> false).kind());
    }

    @Test
    void failingLookupsFallBackToSafeDefaults() {
        CacheConfigService broken = mock(CacheConfigService.class);
        when(broken.current()).thenThrow(new IllegalStateException("config backend down"));
        CachePolicyEngine e = new CachePolicyEngine(new RouteClassifier(), broken, () -> {
            throw new IllegalStateException("no environment");
        });

        CacheDecision d = e.decide("GET", "/css/app.css", () -> false);

        assertEquals("public, max-age=604800, stale-while-revalidate=86400", d.directive());
    }

    @Test
    void blankEnvironmentMeansProduction() {
        assertEquals(CacheDecision.Kind.PAGE, engine(null).decide("GET", "/", () -> false).kind());
        assertEquals(CacheDecision.Kind.PAGE, engine(" ").decide("GET", "/", () -> false).kind());
    }

    @Test
    void liveConfigChangesApplyToNextDecision() {
        CachePolicyEngine e = engine("production");
        config.patch(120L, null, 30L, 5L, null, null, null);

        assertEquals("public, max-age=120, stale-while-revalidate=86400",
                e.decide("GET", "/img/logo.png", () -> false).directive());
        assertEquals("public, max-age=30, stale-while-revalidate=5", e.decide("GET", "/", () -> false).directive());
    }
}
