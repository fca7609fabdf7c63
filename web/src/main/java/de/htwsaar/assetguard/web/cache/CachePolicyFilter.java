package de.htwsaar.assetguard.web.cache;

import de.htwsaar.assetguard.web.auth.AuthenticationProbe;
import de.htwsaar.assetguard.web.route.RouteClassifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Setzt die Header der {@link CachePolicyEngine} vor der Weiterverarbeitung.
 *
 * <p>Handler dürfen die Header danach überschreiben; das letzte Wort hat der Final-Override.</p>
 */
public class CachePolicyFilter extends OncePerRequestFilter {

    private final CachePolicyEngine engine;
    private final AuthenticationProbe authenticationProbe;

    public CachePolicyFilter(CachePolicyEngine engine, AuthenticationProbe authenticationProbe) {
        this.engine = engine;
        this.authenticationProbe = authenticationProbe;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        CacheDecision decision = engine.decide(
                request.getMethod(),
                RouteClassifier.pathWithinApplication(request),
                () -> authenticationProbe.isAuthenticated(request));

        decision.headers().forEach(response::setHeader);
        filterChain.doFilter(request, response);
    }
}
