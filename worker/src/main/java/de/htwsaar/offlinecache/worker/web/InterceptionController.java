package de.htwsaar.offlinecache.worker.web;

import de.htwsaar.offlinecache.worker.dispatch.RequestDispatcher;
import de.htwsaar.offlinecache.worker.domain.CapturedResponse;
import de.htwsaar.offlinecache.worker.domain.InterceptedRequest;
import de.htwsaar.offlinecache.worker.domain.Resolution;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter für abgefangene Anfragen: jede Anfrage außerhalb von {@code /_worker} landet hier.
 *
 * <p>Kein Fachcode hier, nur Übersetzung zwischen Servlet-Welt und {@link InterceptedRequest} bzw.
 * {@link CapturedResponse}. Die Herkunft der Antwort steht im Header {@code X-Cache}.</p>
 */
@RestController
@Profile("worker")
public class InterceptionController {

    static final String X_CACHE = "X-Cache";

    private final RequestDispatcher dispatcher;

    /**
     * Constructor Injection.
     *
     * @param dispatcher Request-Dispatcher
     */
    public InterceptionController(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Fängt eine Anfrage ab und liefert die Antwort der gewählten Strategie.
     *
     * @param request Servlet-Request
     * @param body    Request-Body (optional)
     * @return Future der Antwort inkl. {@code X-Cache}
     */
    @RequestMapping("/**")
    public CompletableFuture<ResponseEntity<byte[]>> intercept(
            HttpServletRequest request, @RequestBody(required = false) byte[] body) {
        return dispatcher.dispatch(toIntercepted(request, body)).thenApply(InterceptionController::toEntity);
    }

    static InterceptedRequest toIntercepted(HttpServletRequest request, byte[] body) {
        StringBuffer url = request.getRequestURL();
        if (request.getQueryString() != null) {
            url.append('?').append(request.getQueryString());
        }

        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, Collections.list(request.getHeaders(name)));
        }
        return new InterceptedRequest(request.getMethod(), URI.create(url.toString()), headers, body);
    }

    private static ResponseEntity<byte[]> toEntity(Resolution resolution) {
        CapturedResponse response = resolution.response();
        HttpHeaders headers = new HttpHeaders();
        response.headers().forEach(headers::addAll);
        headers.set(X_CACHE, resolution.decision().name());
        return ResponseEntity.status(response.status()).headers(headers).body(response.body());
    }
}
