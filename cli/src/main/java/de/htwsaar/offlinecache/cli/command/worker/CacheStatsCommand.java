package de.htwsaar.offlinecache.cli.command.worker;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.dto.ControlMessageType;
import java.io.PrintWriter;
import java.util.Iterator;
import java.util.Map;
import picocli.CommandLine.Command;

/**
 * Zeigt alle Cache-Partitionen des Workers mit Anzahl und URLs der Einträge.
 */
@Command(
        name = "stats",
        description = "Show cache partitions and their entries",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {"  offline-cache stats", "  offline-cache stats -H http://localhost:8080 --json"})
public final class CacheStatsCommand extends ControlCommandSupport {

    public CacheStatsCommand(CliContext ctx) {
        super(ctx);
    }

    @Override
    ControlEnvelope envelope() {
        return ControlEnvelope.command(ControlMessageType.CACHE_STATS);
    }

    @Override
    void printPayload(JsonNode payload, PrintWriter out) {
        out.println("[WORKER] Cache Stats");
        out.printf("  totalCaches  : %d%n", payload.path("totalCaches").asInt());
        out.printf("  totalEntries : %d%n", payload.path("totalEntries").asInt());

        JsonNode caches = payload.path("caches");
        if (!caches.isObject() || caches.isEmpty()) {
            out.println("  (no caches)");
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = caches.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> cache = it.next();
            out.printf("  %s (%d)%n", cache.getKey(), cache.getValue().path("count").asInt());
            for (JsonNode url : cache.getValue().path("urls")) {
                out.printf("    %s%n", url.asText());
            }
        }
    }
}
