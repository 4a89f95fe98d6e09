package de.htwsaar.offlinecache.cli.command.root;

import de.htwsaar.offlinecache.cli.command.worker.CacheStatsCommand;
import de.htwsaar.offlinecache.cli.command.worker.ClearCacheCommand;
import de.htwsaar.offlinecache.cli.command.worker.PingCommand;
import de.htwsaar.offlinecache.cli.command.worker.PrecacheCommand;
import de.htwsaar.offlinecache.cli.command.worker.SkipWaitingCommand;
import de.htwsaar.offlinecache.cli.command.worker.TargetCommand;
import de.htwsaar.offlinecache.cli.command.worker.WorkerMetricsCommand;
import de.htwsaar.offlinecache.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Registriert die Control-Channel-Kommandos ({@code stats}, {@code clear}, {@code precache},
 * {@code skip-waiting}), die Betriebs-Kommandos {@code ping} und {@code metrics} sowie {@code target}
 * für den Standard-Worker.
 */
@Command(
        name = "offline-cache",
        description = "Offline-Cache Worker CLI",
        mixinStandardHelpOptions = true,
        subcommands = {
            CacheStatsCommand.class,
            ClearCacheCommand.class,
            PrecacheCommand.class,
            SkipWaitingCommand.class,
            PingCommand.class,
            WorkerMetricsCommand.class,
            TargetCommand.class,
            HelpCommand.class
        })
public final class OfflineCacheRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext
     */
    public OfflineCacheRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /** Zeigt die Usage, wenn kein Subcommand angegeben ist. */
    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `offline-cache help <command>` oder starte ohne Args für die interaktive Shell.");
        ctx.out().flush();
    }
}
