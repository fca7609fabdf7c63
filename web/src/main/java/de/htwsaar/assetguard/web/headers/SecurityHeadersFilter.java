package de.htwsaar.assetguard.web.headers;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Setzt die Standard-Security-Header vor der Weiterverarbeitung.
 *
 * <p>Enthält auch die drei Legacy-Header; für HTML-Antworten entfernt sie der {@link LegacyHeaderStripper}
 * wieder.</p>
 */
public class SecurityHeadersFilter extends OncePerRequestFilter {

    public static final Map<String, String> DEFAULT_HEADERS;

    static {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("X-Content-Type-Options", "nosniff");
        h.put("X-Frame-Options", "SAMEORIGIN");
        h.put("Referrer-Policy", "no-referrer");
        h.put("Cross-Origin-Opener-Policy", "same-origin");
        h.put("X-DNS-Prefetch-Control", "off");
        h.put("X-Permitted-Cross-Domain-Policies", "none");
        h.put("X-XSS-Protection", "0");
        DEFAULT_HEADERS = Collections.unmodifiableMap(h);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        DEFAULT_HEADERS.forEach(response::setHeader);
        filterChain.doFilter(request, response);
    }
}
