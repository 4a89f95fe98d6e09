package de.htwsaar.offlinecache.cli.command.worker;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.dto.ControlMessageType;
import java.io.PrintWriter;
import picocli.CommandLine.Command;

/** Löscht alle vom Worker verwalteten Cache-Partitionen. */
@Command(
        name = "clear",
        description = "Delete all managed cache partitions",
        mixinStandardHelpOptions = true)
public final class ClearCacheCommand extends ControlCommandSupport {

    public ClearCacheCommand(CliContext ctx) {
        super(ctx);
    }

    @Override
    ControlEnvelope envelope() {
        return ControlEnvelope.command(ControlMessageType.CLEAR_CACHE);
    }

    @Override
    void printPayload(JsonNode payload, PrintWriter out) {
        out.printf("[WORKER] Cleared %d cache partition(s)%n", payload.path("cleared").asInt());
    }
}
