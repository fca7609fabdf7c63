package de.htwsaar.assetguard.web.headers;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.assetguard.web.auth.PrincipalAuthenticationProbe;
import de.htwsaar.assetguard.web.cache.CacheConfigService;
import de.htwsaar.assetguard.web.cache.CachePolicyEngine;
import de.htwsaar.assetguard.web.cache.CacheRuntimeConfig;
import de.htwsaar.assetguard.web.route.RouteClassifier;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class FinalCacheOverrideTest {

    private static final String STATIC = CacheRuntimeConfig.DEFAULT_STATIC_OVERRIDE;
    private static final String PAGE = CacheRuntimeConfig.DEFAULT_PAGE_OVERRIDE;

    private final CacheConfigService config = new CacheConfigService(CacheRuntimeConfig.DEFAULTS);

    private FinalCacheOverride override(String env) {
        CachePolicyEngine engine = new CachePolicyEngine(new RouteClassifier(), config, () -> env);
        return new FinalCacheOverride(engine, new PrincipalAuthenticationProbe());
    }

    @Test
    void directivesPerRouteClass() {
        FinalCacheOverride o = override("production");

        assertEquals(STATIC, o.directiveFor("GET", "/css/app.1a2b3c4d.css", () -> false));
        assertEquals(PAGE, o.directiveFor("HEAD", "/dashboard", () -> false));
        assertNull(o.directiveFor("GET", "/", () -> false));
        assertNull(o.directiveFor("GET", "/?ref=home", () -> false));
        assertNull(o.directiveFor("GET", "/api/assets/resolve", () -> false));
        assertNull(o.directiveFor("GET", "/health", () -> false));
        assertNull(o.directiveFor("GET", "/robots.txt", () -> false));
        assertNull(o.directiveFor("POST", "/css/app.css", () -> false));
    }

    @Test
    void authenticatedPagesAreNotMadePublic() {
        FinalCacheOverride o = override("production");

        assertNull(o.directiveFor("GET", "/account", () -> true));
        assertEquals(STATIC, o.directiveFor("GET", "/img/logo.png", () -> true));
    }

    @Test
    void developmentStillPinsStaticAssets() {
        assertEquals(STATIC, override("development").directiveFor("GET", "/css/app.css", () -> false));
        assertEquals(PAGE, override("development").directiveFor("GET", "/dashboard", () -> false));
    }

    @Test
    void disabledOverrideLeavesHeadersAlone() {
        config.patch(null, null, null, null, false, null, null);
        assertNull(override("production").directiveFor("GET", "/css/app.css", () -> false));
    }

    @Test
    void finalValueWinsOverHandlerWritesBeforeAndAfterFlush() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/img/logo.png");
        MockHttpServletResponse response = new MockHttpServletResponse();

        HttpServlet handler = new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
                resp.setHeader("Cache-Control", "no-cache");
                resp.setHeader("Vary", "Origin");
                resp.setContentType("image/png");
                resp.getOutputStream().write(new byte[] {1, 2, 3});
                resp.flushBuffer();
                resp.setHeader("Cache-Control", "private, no-store");
                resp.addHeader("Vary", "Cookie");
            }
        };

        new HeaderGuardFilter(override("production")).doFilter(request, response, new MockFilterChain(handler));

        assertEquals(STATIC, response.getHeader("Cache-Control"));
        assertEquals(1, response.getHeaders("Cache-Control").size());
        assertEquals("Accept-Encoding", response.getHeader("Vary"));
        assertEquals(1, response.getHeaders("Vary").size());
    }

    @Test
    void errorResponsesAreNotPinned() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/img/missing.png");
        MockHttpServletResponse response = new MockHttpServletResponse();

        HttpServlet handler = new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
                resp.sendError(404);
            }
        };

        new HeaderGuardFilter(override("production")).doFilter(request, response, new MockFilterChain(handler));

        assertEquals(404, response.getStatus());
        assertNull(response.getHeader("Cache-Control"));
    }

    @Test
    void rootPageKeepsEnginePolicy() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        MockHttpServletResponse response = new MockHttpServletResponse();

        HttpServlet handler = new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
                resp.setHeader("Cache-Control", "public, max-age=3600, stale-while-revalidate=60");
                resp.getWriter().write("<html></html>");
            }
        };

        new HeaderGuardFilter(override("production")).doFilter(request, response, new MockFilterChain(handler));

        assertEquals("public, max-age=3600, stale-while-revalidate=60", response.getHeader("Cache-Control"));
    }

    @Test
    void bodylessResponseIsOverriddenAtFilterEnd() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("HEAD", "/dashboard");
        MockHttpServletResponse response = new MockHttpServletResponse();

        new HeaderGuardFilter(override("production")).doFilter(request, response, new MockFilterChain());

        assertEquals(PAGE, response.getHeader("Cache-Control"));
    }
}
