package de.htwsaar.assetguard.common.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Filter that protects the admin endpoints (manifest reload, rebuild, live cache configuration)
 * by validating a shared admin token.
 */
public class AdminAuthFilter extends OncePerRequestFilter {

    /** Name of the HTTP header expected to carry the admin token. */
    public static final String AUTH_HEADER = "X-Admin-Token";

    /** Path prefix of all admin routes. */
    public static final String ADMIN_PREFIX = "/api/admin/";

    /** Token value configured on the server that incoming admin requests must match. */
    private final String expectedToken;

    /**
     * Creates a new admin authentication filter.
     *
     * @param expectedToken the token that must match the value provided in the admin header
     */
    public AdminAuthFilter(String expectedToken) {
        if (expectedToken == null || expectedToken.isBlank()) {
            throw new IllegalArgumentException("admin token must not be blank");
        }
        this.expectedToken = expectedToken;
    }

    /**
     * Checks requests to admin routes for the presence and validity of the admin token.
     * A missing token yields 401 Unauthorized, an invalid one 403 Forbidden.
     *
     * @param request the HTTP request
     * @param response the HTTP response
     * @param filterChain the remaining filter chain
     * @throws ServletException if filtering fails
     * @throws IOException if an I/O error occurs
     */
    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (isAdminRoute(request.getRequestURI())) {
            String providedToken = request.getHeader(AUTH_HEADER);

            if (providedToken == null || providedToken.isBlank()) {
                response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing Admin Token");
                return;
            }

            if (!matches(providedToken)) {
                response.sendError(HttpServletResponse.SC_FORBIDDEN, "Invalid Admin Token");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    static boolean isAdminRoute(String requestUri) {
        return requestUri != null && requestUri.startsWith(ADMIN_PREFIX);
    }

    private boolean matches(String providedToken) {
        return MessageDigest.isEqual(
                expectedToken.getBytes(StandardCharsets.UTF_8), providedToken.getBytes(StandardCharsets.UTF_8));
    }
}
