package de.htwsaar.offlinecache.common.logging;

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
 *
 * <p>Jede abgefangene Anfrage (Seitenabruf, API-Call oder Control-Nachricht) erhält eine Trace-ID,
 * die entweder aus dem Request-Header übernommen oder neu erzeugt wird. Die ID liegt für die Dauer
 * der Anfrage im MDC und wird im Response-Header an den Aufrufer zurückgegeben, sodass
 * Cache-Entscheidungen im Log einer konkreten Anfrage zugeordnet werden können.</p>
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen und in den sie zurückgeschrieben wird */
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
            // Worker-Threads werden wiederverwendet: Kontext immer entfernen
            MDC.remove(TRACE_ID_KEY);
        }
    }

    /**
     * Asynchrone Dispatches (z. B. {@code CompletableFuture}-Antworten) laufen erneut durch den Filter,
     * damit auch die Antwortphase die Trace-ID im MDC hat.
     */
    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }
}
