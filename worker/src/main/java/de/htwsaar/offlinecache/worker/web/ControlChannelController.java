package de.htwsaar.offlinecache.worker.web;

import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import de.htwsaar.offlinecache.common.serialization.OfflineCacheSerializationException;
import de.htwsaar.offlinecache.worker.control.ControlChannel;
import de.htwsaar.offlinecache.worker.control.ControlMessageException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * HTTP-Adapter des Control-Channels: Envelope rein, {@code <KOMMANDO>_RESPONSE} raus.
 *
 * <p>Unbekannte oder fehlerhafte Nachrichten werden mit {@code 400} und
 * {@code {type: "ERROR", payload: {error}}} beantwortet.</p>
 */
@RestController
@RequestMapping("/_worker")
@Profile("worker")
public class ControlChannelController {

    private static final Logger log = LoggerFactory.getLogger(ControlChannelController.class);

    static final String ERROR_TYPE = "ERROR";

    private final ControlChannel controlChannel;

    /**
     * Constructor Injection.
     *
     * @param controlChannel fachlicher Control-Channel
     */
    public ControlChannelController(ControlChannel controlChannel) {
        this.controlChannel = controlChannel;
    }

    /**
     * Nimmt eine Nachricht des Hosts entgegen.
     *
     * @param body JSON-Envelope {@code {type, payload?}}
     * @return Future der Antwort an den Absender
     */
    @PostMapping(value = "/messages", produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<ControlEnvelope>> post(@RequestBody(required = false) String body) {
        ControlEnvelope envelope = parse(body);
        return controlChannel.handle(envelope).thenApply(ResponseEntity::ok);
    }

    @ExceptionHandler(ControlMessageException.class)
    public ResponseEntity<ControlEnvelope> onInvalidMessage(ControlMessageException ex) {
        log.debug("Rejected control message: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ControlEnvelope(ERROR_TYPE, Map.of("error", ex.getMessage())));
    }

    private static ControlEnvelope parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ControlMessageException("Message body must not be empty");
        }
        try {
            return JacksonCodec.fromJson(body, ControlEnvelope.class);
        } catch (OfflineCacheSerializationException ex) {
            throw new ControlMessageException("Malformed message: " + ex.getMessage());
        }
    }
}
