package de.htwsaar.offlinecache.cli.command.worker;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.dto.ControlMessageType;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Lädt URLs in die dynamische Partition des Workers. Fehlgeschlagene URLs werden nur gemeldet;
 * der Exit-Code bleibt 0, solange der Worker geantwortet hat.
 */
@Command(
        name = "precache",
        description = "Fetch URLs into the worker's dynamic cache",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {"  offline-cache precache /about.html /help.html"})
public final class PrecacheCommand extends ControlCommandSupport {

    @Parameters(arity = "1..*", paramLabel = "URL", description = "Wurzelrelative oder absolute URLs")
    List<String> urls = new ArrayList<>();

    public PrecacheCommand(CliContext ctx) {
        super(ctx);
    }

    @Override
    ControlEnvelope envelope() {
        return ControlEnvelope.command(ControlMessageType.PRECACHE_URLS, Map.of("urls", List.copyOf(urls)));
    }

    @Override
    void printPayload(JsonNode payload, PrintWriter out) {
        Set<String> cached = new LinkedHashSet<>();
        for (JsonNode url : payload.path("cached")) {
            cached.add(url.asText());
        }
        out.printf("[WORKER] Cached %d of %d URL(s)%n", cached.size(), urls.size());
        for (String url : urls) {
            out.printf("  %s %s%n", cached.contains(url) ? "ok    " : "failed", url);
        }
    }
}
