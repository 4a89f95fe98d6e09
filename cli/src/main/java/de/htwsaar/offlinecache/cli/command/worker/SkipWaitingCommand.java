package de.htwsaar.offlinecache.cli.command.worker;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.common.dto.ControlEnvelope;
import de.htwsaar.offlinecache.common.dto.ControlMessageType;
import java.io.PrintWriter;
import picocli.CommandLine.Command;

/** Aktiviert einen installierten, wartenden Worker. */
@Command(
        name = "skip-waiting",
        description = "Activate an installed worker that is still waiting",
        mixinStandardHelpOptions = true)
public final class SkipWaitingCommand extends ControlCommandSupport {

    public SkipWaitingCommand(CliContext ctx) {
        super(ctx);
    }

    @Override
    ControlEnvelope envelope() {
        return ControlEnvelope.command(ControlMessageType.SKIP_WAITING);
    }

    @Override
    void printPayload(JsonNode payload, PrintWriter out) {
        out.printf("[WORKER] State: %s%n", payload.path("state").asText("n/a"));
    }
}
