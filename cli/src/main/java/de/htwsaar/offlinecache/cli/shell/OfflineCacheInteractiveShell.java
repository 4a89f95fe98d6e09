package de.htwsaar.offlinecache.cli.shell;

import de.htwsaar.offlinecache.cli.di.CliContext;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.Parser;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.jline.utils.InfoCmp;
import picocli.CommandLine;
import picocli.shell.jline3.PicocliCommands;

/**
 * Interaktive Shell für die Offline-Cache CLI.
 *
 * <p>Jede Zeile ist ein Picocli-Kommando gegen den aktuellen Worker; der Prompt zeigt dessen
 * Host, {@code target <url>} wechselt ihn. Eingebaut sind nur {@code cls} sowie {@code exit}/{@code quit}.
 * Ctrl+C verwirft die Eingabe, Ctrl+D beendet.
 */
public final class OfflineCacheInteractiveShell {

    /** Ergebnis einer Eingabezeile. */
    enum Step {
        CONTINUE,
        EXIT
    }

    private static final Set<String> EXIT_WORDS = Set.of("exit", "quit");
    private static final String CLEAR_SCREEN = "cls";

    private final CommandLine cmd;
    private final CliContext ctx;
    private final Path historyFile;
    private final Parser parser = new DefaultParser();

    public OfflineCacheInteractiveShell(CommandLine cmd, CliContext ctx) {
        this(cmd, ctx, Path.of(".offline-cache.history"));
    }

    /**
     * @param cmd Root-CommandLine
     * @param ctx CLI-Kontext; liefert Terminal, Ausgaben und das aktuelle Ziel
     * @param historyFile Datei für die Eingabe-History
     */
    public OfflineCacheInteractiveShell(CommandLine cmd, CliContext ctx, Path historyFile) {
        this.cmd = Objects.requireNonNull(cmd, "cmd");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.historyFile = Objects.requireNonNull(historyFile, "historyFile");
    }

    /** Liest Zeilen bis {@code exit} oder Ctrl+D. */
    public void run() {
        LineReader reader = LineReaderBuilder.builder()
                .terminal(ctx.terminal())
                .completer(new AggregateCompleter(
                        new PicocliCommands(cmd).compileCompleters(),
                        new StringsCompleter(CLEAR_SCREEN, "exit", "quit")))
                .parser(parser)
                .variable(LineReader.HISTORY_FILE, historyFile)
                .build();

        PrintWriter out = ctx.out();
        out.printf("Offline-Cache Shell, target %s%n", ctx.target().current());
        out.println("'help' lists commands, 'target <url>' switches the worker, 'exit' quits.");
        out.flush();

        while (true) {
            String line;
            try {
                line = reader.readLine(styledPrompt());
            } catch (UserInterruptException e) {
                continue;
            } catch (EndOfFileException e) {
                return;
            }
            if (dispatch(line) == Step.EXIT) return;
        }
    }

    /** Prompt ohne ANSI-Farben, z. B. {@code offline-cache@localhost:8080> }. */
    String promptText() {
        return "offline-cache@" + ctx.target().label() + "> ";
    }

    /**
     * Führt eine Eingabezeile aus.
     *
     * @param input rohe Zeile
     * @return {@link Step#EXIT} für {@code exit}/{@code quit}, sonst {@link Step#CONTINUE}
     */
    Step dispatch(String input) {
        String line = input == null ? "" : input.trim();
        if (line.isEmpty()) return Step.CONTINUE;

        String keyword = line.toLowerCase(Locale.ROOT);
        if (EXIT_WORDS.contains(keyword)) return Step.EXIT;
        if (keyword.equals(CLEAR_SCREEN)) {
            ctx.terminal().puts(InfoCmp.Capability.clear_screen);
            ctx.terminal().flush();
            return Step.CONTINUE;
        }

        PrintWriter err = ctx.err();
        try {
            List<String> words = parser.parse(line, 0).words();
            int exitCode = cmd.execute(words.toArray(new String[0]));
            if (exitCode != 0) {
                err.printf("[SHELL] '%s' exited with code %d%n", words.get(0), exitCode);
            }
        } catch (RuntimeException ex) {
            err.printf("[SHELL] cannot run '%s': %s%n", line, ex.getMessage());
        }
        err.flush();
        return Step.CONTINUE;
    }

    private String styledPrompt() {
        return new AttributedStringBuilder()
                .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN).bold())
                .append(promptText())
                .toAnsi(ctx.terminal());
    }
}
