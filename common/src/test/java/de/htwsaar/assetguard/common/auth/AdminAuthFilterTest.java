package de.htwsaar.assetguard.common.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class AdminAuthFilterTest {

    private final AdminAuthFilter filter = new AdminAuthFilter("s3cret");

    @Test
    void adminRouteWithoutTokenIsUnauthorized() throws Exception {
        MockHttpServletResponse response = run("/api/admin/assets/manifest", null, new AtomicBoolean());

        assertEquals(401, response.getStatus());
    }

    @Test
    void adminRouteWithWrongTokenIsForbidden() throws Exception {
        AtomicBoolean passed = new AtomicBoolean();
        MockHttpServletResponse response = run("/api/admin/cache/config", "wrong", passed);

        assertEquals(403, response.getStatus());
        assertFalse(passed.get());
    }

    @Test
    void adminRouteWithValidTokenPasses() throws Exception {
        AtomicBoolean passed = new AtomicBoolean();
        MockHttpServletResponse response = run("/api/admin/assets/manifest/reload", "s3cret", passed);

        assertEquals(200, response.getStatus());
        assertTrue(passed.get());
    }

    @Test
    void publicRoutesAreNotChecked() throws Exception {
        AtomicBoolean passed = new AtomicBoolean();
        run("/api/assets/resolve", null, passed);

        assertTrue(passed.get());
        assertFalse(AdminAuthFilter.isAdminRoute("/css/admin/app.css"));
    }

    @Test
    void blankTokenConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AdminAuthFilter(" "));
    }

    @Test
    void configCreatesFilterWithDefaultToken() {
        SecurityConfig config = new SecurityConfig();
        org.springframework.test.util.ReflectionTestUtils.setField(config, "adminToken", "token");

        assertTrue(config.adminAuthFilter() instanceof AdminAuthFilter);
    }

    private MockHttpServletResponse run(String uri, String token, AtomicBoolean passed) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", uri);
        if (token != null) {
            request.addHeader(AdminAuthFilter.AUTH_HEADER, token);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> passed.set(true);
        filter.doFilter(request, response, chain);
        return response;
    }
}
