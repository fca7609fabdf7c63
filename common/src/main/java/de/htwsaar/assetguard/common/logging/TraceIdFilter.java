package de.htwsaar.assetguard.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter zur Erzeugung und Verwaltung einer Trace-ID.
 * Für jede eingehende HTTP-Anfrage wird eine Trace-ID erzeugt oder aus einem
 * Request-Header übernommen, im MDC abgelegt und im Response-Header zurückgegeben,
 * sodass Cache-Entscheidungen im Log einer Anfrage zugeordnet werden können.
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen werden kann */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = request.getHeader(TRACE_ID_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Kontext nach der Anfrage wieder entfernen (Thread-Pool!)
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
