package de.htwsaar.offlinecache.cli.command.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.service.ControlChannelClient;
import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import java.io.PrintWriter;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Option;

/**
 * Gemeinsamer Ablauf aller Control-Channel-Commands: Kommando senden, Antwort prüfen, Payload ausgeben.
 *
 * <p>Exit-Codes:
 * - 0: OK
 * - 2: HTTP-Fehlerstatus (non-2xx), z. B. unbekanntes Kommando
 * - 1: Exception/Netzwerkfehler
 */
abstract class ControlCommandSupport implements Callable<Integer> {

    static final ObjectMapper MAPPER = new ObjectMapper();

    protected final CliContext ctx;

    @Option(
            names = {"-H", "--host"},
            paramLabel = "WORKER_URL",
            description = "Basis-URL des Workers, z.B. http://localhost:8080 (Standard: aktuelles Ziel, siehe OFFLINE_CACHE_HOST)")
    URI host;

    @Option(
            names = "--json",
            defaultValue = "false",
            description = "Vollständige Antwort pretty-printed ausgeben")
    boolean printJson;

    ControlCommandSupport(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /** Kommando, das an den Worker gesendet wird. */
    abstract ControlEnvelope envelope();

    /**
     * Gibt den Payload der Antwort für Menschen lesbar aus.
     *
     * @param payload Payload-Objekt der Antwort (nie {@code null}, ggf. leer)
     * @param out Ziel-Output
     */
    abstract void printPayload(JsonNode payload, PrintWriter out);

    @Override
    public Integer call() {
        PrintWriter out = ctx.out();
        PrintWriter err = ctx.err();
        ControlEnvelope envelope = envelope();

        try {
            ControlChannelClient client = new ControlChannelClient(ctx.httpClient(), ctx.defaultRequestTimeout());
            HttpCallResult result = client.send(ctx.workerUrl(host), envelope);

            if (result.isIoError()) {
                err.printf("[WORKER] %s failed: %s%n", envelope.type(), result.error());
                err.flush();
                return 1;
            }
            if (!result.is2xx()) {
                err.printf("[WORKER] %s failed: HTTP %d%n", envelope.type(), result.statusCode());
                String detail = errorDetail(result.body());
                if (!detail.isBlank()) err.println(detail);
                err.flush();
                return 2;
            }

            JsonNode reply = MAPPER.readTree(result.body());
            if (printJson) {
                out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(reply));
            } else {
                printPayload(reply.path("payload"), out);
            }
            out.flush();
            return 0;
        } catch (Exception ex) {
            err.printf("[WORKER] %s failed: %s%n", envelope.type(), ex.getMessage());
            err.flush();
            return 1;
        }
    }

    /** Liest {@code payload.error} aus einer Fehlerantwort; sonst der Body unverändert. */
    static String errorDetail(String body) {
        if (body == null || body.isBlank()) return "";
        try {
            JsonNode error = MAPPER.readTree(body).path("payload").path("error");
            return error.isTextual() ? error.asText() : body;
        } catch (Exception ex) {
            return body;
        }
    }
}
