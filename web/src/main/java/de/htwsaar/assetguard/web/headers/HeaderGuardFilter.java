package de.htwsaar.assetguard.web.headers;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter für eine {@link HeaderGuard}.
 *
 * <p>Der äußerste dieser Filter legt den {@link HeaderGuardResponseWrapper} an und schließt ihn nach der
 * Kette ab; innere Filter hängen sich an denselben Wrapper.</p>
 */
public class HeaderGuardFilter extends OncePerRequestFilter {

    private final HeaderGuard guard;

    public HeaderGuardFilter(HeaderGuard guard) {
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        HeaderGuardResponseWrapper existing = HeaderGuardResponseWrapper.find(response);
        if (existing != null) {
            guard.register(request, existing);
            filterChain.doFilter(request, response);
            return;
        }

        HeaderGuardResponseWrapper wrapper = new HeaderGuardResponseWrapper(response);
        guard.register(request, wrapper);
        try {
            filterChain.doFilter(request, wrapper);
        } finally {
            wrapper.complete();
        }
    }

    /**
     * Eigener Marker je Guard-Typ, damit mehrere Instanzen dieses Filters in einer Kette auch ohne
     * Filternamen alle laufen.
     */
    @Override
    protected String getAlreadyFilteredAttributeName() {
        return HeaderGuardFilter.class.getName() + "." + guard.getClass().getName() + ALREADY_FILTERED_SUFFIX;
    }
}
