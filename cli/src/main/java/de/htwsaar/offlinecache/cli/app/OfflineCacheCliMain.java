package de.htwsaar.offlinecache.cli.app;

import de.htwsaar.offlinecache.cli.command.root.OfflineCacheRootCommand;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.di.ContextFactory;
import de.htwsaar.offlinecache.cli.di.WorkerTarget;
import de.htwsaar.offlinecache.cli.shell.OfflineCacheInteractiveShell;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.time.Duration;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;

/**
 * Einstiegspunkt der Offline-Cache CLI.
 *
 * <p>Mit Argumenten läuft genau ein Befehl, Fehler gehen nach stderr und der Exit-Code wird
 * durchgereicht. Ohne Argumente startet die interaktive Shell. Der Standard-Worker kommt aus
 * {@code -Doffline-cache.host} oder {@code OFFLINE_CACHE_HOST}.
 */
public final class OfflineCacheCliMain {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private OfflineCacheCliMain() {}

    /**
     * @param args Kommandozeilenargumente (kann leer sein)
     * @throws Exception bei Terminal-Initialisierung
     */
    public static void main(String[] args) throws Exception {
        WorkerTarget target;
        try {
            target = WorkerTarget.fromEnvironment(System.getenv(), System.getProperties());
        } catch (IllegalArgumentException ex) {
            System.err.println("[CLI] " + ex.getMessage());
            System.exit(2);
            return;
        }

        boolean oneShot = args != null && args.length > 0;
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            PrintWriter out = terminal.writer();
            PrintWriter err = oneShot ? new PrintWriter(System.err, true) : out;
            CliContext ctx = new CliContext(terminal, out, err, newHttpClient(), REQUEST_TIMEOUT, target);
            CommandLine cmd = newCommandLine(ctx);

            if (oneShot) {
                int rc = cmd.execute(args);
                out.flush();
                System.exit(rc);
            }
            new OfflineCacheInteractiveShell(cmd, ctx).run();
        }
    }

    /** Kommandobaum, dessen Picocli-Ausgaben (Usage, Fehler) in die Kontext-Writer gehen. */
    public static CommandLine newCommandLine(CliContext ctx) {
        return new CommandLine(OfflineCacheRootCommand.class, new ContextFactory(ctx))
                .setOut(ctx.out())
                .setErr(ctx.err());
    }

    private static HttpClient newHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }
}
