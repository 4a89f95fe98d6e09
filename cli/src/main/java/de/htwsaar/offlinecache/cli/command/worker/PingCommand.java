package de.htwsaar.offlinecache.cli.command.worker;

import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.service.ControlChannelClient;
import java.io.PrintWriter;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Health- bzw. Readiness-Check gegen den Worker.
 *
 * <p>Exit-Codes:
 * - 0: HTTP 2xx
 * - 2: HTTP non-2xx (z. B. Worker noch nicht aktiv)
 * - 1: Exception/Netzwerkfehler
 */
@Command(
        name = "ping",
        description = "Health or readiness check",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {"  offline-cache ping", "  offline-cache ping -H http://localhost:8080 --ready"})
public final class PingCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(
            names = {"-H", "--host"},
            paramLabel = "WORKER_URL",
            description = "Basis-URL des Workers, z.B. http://localhost:8080 (Standard: aktuelles Ziel, siehe OFFLINE_CACHE_HOST)")
    private URI host;

    @Option(names = "--ready", defaultValue = "false", description = "Readiness statt Health prüfen")
    private boolean ready;

    public PingCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        PrintWriter out = ctx.out();
        PrintWriter err = ctx.err();

        try {
            ControlChannelClient client = new ControlChannelClient(ctx.httpClient(), ctx.defaultRequestTimeout());
            HttpCallResult result = client.get(ctx.workerUrl(host), ready ? "_worker/ready" : "_worker/health");
            if (result.isIoError()) {
                err.println("[WORKER] Ping failed: " + result.error());
                err.flush();
                return 1;
            }

            out.println("Status: " + result.statusCode());
            out.println(result.body());
            out.flush();
            return result.is2xx() ? 0 : 2;
        } catch (Exception ex) {
            err.println("[WORKER] Ping failed: " + ex.getMessage());
            err.flush();
            return 1;
        }
    }
}
