package de.htwsaar.offlinecache.cli.shell;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.offlinecache.cli.app.OfflineCacheCliMain;
import de.htwsaar.offlinecache.cli.di.CliContext;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OfflineCacheInteractiveShellTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CliContext ctx;
    private OfflineCacheInteractiveShell shell;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        ctx = new CliContext(
                new DumbTerminal(new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream()),
                new PrintWriter(out, true),
                new PrintWriter(err, true),
                HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                Duration.ofSeconds(2));
        shell = new OfflineCacheInteractiveShell(
                OfflineCacheCliMain.newCommandLine(ctx), ctx, tempDir.resolve("history"));
    }

    @Test
    void promptShowsCurrentTargetAndFollowsTargetCommand() {
        assertEquals("offline-cache@localhost:8080> ", shell.promptText());

        assertEquals(OfflineCacheInteractiveShell.Step.CONTINUE, shell.dispatch("target http://127.0.0.1:9090"));

        assertEquals("offline-cache@127.0.0.1:9090> ", shell.promptText());
    }

    @Test
    void exitWordsEndTheShellCaseInsensitively() {
        assertEquals(OfflineCacheInteractiveShell.Step.EXIT, shell.dispatch("  EXIT "));
        assertEquals(OfflineCacheInteractiveShell.Step.EXIT, shell.dispatch("quit"));
        assertEquals(OfflineCacheInteractiveShell.Step.CONTINUE, shell.dispatch("   "));
        assertEquals(OfflineCacheInteractiveShell.Step.CONTINUE, shell.dispatch("cls"));
    }

    @Test
    void failingCommandReportsExitCodeAndKeepsRunning() {
        shell.dispatch("target http://localhost:1");

        OfflineCacheInteractiveShell.Step step = shell.dispatch("stats");

        assertEquals(OfflineCacheInteractiveShell.Step.CONTINUE, step);
        assertTrue(err.toString().contains("CACHE_STATS failed"));
        assertTrue(err.toString().contains("'stats' exited with code 1"));
    }

    @Test
    void unknownCommandIsReportedByPicocli() {
        shell.dispatch("purge-everything");

        assertTrue(err.toString().contains("purge-everything"));
        assertTrue(err.toString().contains("exited with code 2"));
    }
}
