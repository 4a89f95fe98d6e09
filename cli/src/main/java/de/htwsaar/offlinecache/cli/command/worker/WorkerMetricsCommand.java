package de.htwsaar.offlinecache.cli.command.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.service.ControlChannelClient;
import java.io.PrintWriter;
import java.net.URI;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Ruft {@code GET /_worker/admin/stats} auf und gibt die Laufzeitmetriken formatiert aus.
 *
 * <p>Exit-Codes:
 * - 0: OK
 * - 2: HTTP-Fehlerstatus (non-2xx)
 * - 1: Exception/Netzwerkfehler
 */
@Command(
        name = "metrics",
        description = "Show request metrics of the worker",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  offline-cache metrics -H http://localhost:8080",
            "  offline-cache metrics --window-sec 10 --json"
        })
public final class WorkerMetricsCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CliContext ctx;

    @Option(
            names = {"-H", "--host"},
            paramLabel = "WORKER_URL",
            description = "Basis-URL des Workers, z.B. http://localhost:8080 (Standard: aktuelles Ziel, siehe OFFLINE_CACHE_HOST)")
    private URI host;

    @Option(
            names = "--window-sec",
            defaultValue = "60",
            paramLabel = "SECONDS",
            description = "Zeitfenster in Sekunden für exakte Requests/Fenster (min. 1)")
    private int windowSec;

    @Option(names = "--json", defaultValue = "false", description = "Vollständige JSON-Antwort pretty-printed ausgeben")
    private boolean printJson;

    public WorkerMetricsCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        PrintWriter out = ctx.out();
        PrintWriter err = ctx.err();
        int safeWindow = Math.max(1, windowSec);

        try {
            ControlChannelClient client = new ControlChannelClient(ctx.httpClient(), ctx.defaultRequestTimeout());
            HttpCallResult result =
                    client.get(ctx.workerUrl(host), "_worker/admin/stats?windowSec=" + safeWindow);

            if (result.isIoError()) {
                err.println("[WORKER] Metrics request failed: " + result.error());
                err.flush();
                return 1;
            }
            if (!result.is2xx()) {
                err.printf("[WORKER] Metrics request failed: HTTP %d%n", result.statusCode());
                if (result.body() != null && !result.body().isBlank()) {
                    err.println(result.body());
                }
                err.flush();
                return 2;
            }

            JsonNode root = MAPPER.readTree(result.body());
            if (printJson) {
                out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root));
                out.flush();
                return 0;
            }

            out.println("[WORKER] Metrics");
            out.printf("  windowSec         : %d%n", safeWindow);
            out.printf("  totalRequests     : %d%n", root.path("totalRequests").asLong());
            out.printf("  requestsPerWindow : %d%n", root.path("requestsPerWindow").asLong());
            out.printf("  cacheHitRatio     : %.4f%n", root.path("cacheHitRatio").asDouble());
            out.printf("  cachedEntries     : %d%n", root.path("cachedEntries").asLong());
            printCounters(out, "byStrategy", root.path("byStrategy"));
            printCounters(out, "byDecision", root.path("byDecision"));
            out.flush();
            return 0;
        } catch (Exception ex) {
            err.println("[WORKER] Metrics request failed: " + ex.getMessage());
            err.flush();
            return 1;
        }
    }

    private static void printCounters(PrintWriter out, String title, JsonNode counters) {
        out.printf("  %s:%n", title);
        if (!counters.isObject() || counters.isEmpty()) {
            out.println("    (none)");
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = counters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            out.printf("    %-22s : %d%n", entry.getKey(), Math.max(0L, entry.getValue().asLong(0L)));
        }
    }
}
