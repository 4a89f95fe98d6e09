package de.htwsaar.offlinecache.cli.command.worker;

import de.htwsaar.offlinecache.cli.di.WorkerTarget;
import java.io.PrintWriter;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Zeigt oder wechselt den Worker, den Commands ohne {@code -H} ansprechen.
 *
 * <p>Exit-Codes: 0 OK, 2 ungültige URL.
 */
@Command(
        name = "target",
        description = "Show or switch the worker used when -H is omitted",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {"  offline-cache target", "  offline-cache target http://localhost:9090"})
public final class TargetCommand implements Callable<Integer> {

    private final WorkerTarget target;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "WORKER_URL", description = "Neue Basis-URL")
    private String url;

    public TargetCommand(WorkerTarget target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (url == null) {
            out.println("Target: " + target.current());
            out.flush();
            return 0;
        }
        try {
            URI next = target.switchTo(url);
            out.println("Target: " + next);
            out.flush();
            return 0;
        } catch (IllegalArgumentException ex) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("[WORKER] " + ex.getMessage());
            err.flush();
            return 2;
        }
    }
}
