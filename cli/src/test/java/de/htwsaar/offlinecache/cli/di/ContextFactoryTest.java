package de.htwsaar.offlinecache.cli.di;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ContextFactoryTest {

    static final class NeedsContext {
        final CliContext ctx;

        NeedsContext(CliContext ctx) {
            this.ctx = ctx;
        }
    }

    static final class NeedsTarget {
        final WorkerTarget target;

        NeedsTarget(WorkerTarget target) {
            this.target = target;
        }
    }

    static final class Plain {
        final String name = "plain";
    }

    @Test
    void injectsContextTargetOrDelegatesToFallback() throws Exception {
        CliContext ctx = new CliContext(
                new DumbTerminal(new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream()),
                new PrintWriter(new StringWriter()),
                new PrintWriter(new StringWriter()),
                HttpClient.newHttpClient(),
                Duration.ofSeconds(1));
        ContextFactory factory = new ContextFactory(ctx, CommandLine.defaultFactory());

        assertSame(ctx, factory.create(NeedsContext.class).ctx);
        assertSame(ctx.target(), factory.create(NeedsTarget.class).target);
        assertEquals("plain", factory.create(Plain.class).name);
    }

    @Test
    void workerTarget_prefersSystemPropertyOverEnvironment() {
        Properties properties = new Properties();
        properties.setProperty(WorkerTarget.HOST_PROPERTY, "http://worker-a:9000");
        Map<String, String> env = Map.of(WorkerTarget.HOST_ENV, "http://worker-b:9001");

        assertEquals(URI.create("http://worker-a:9000"), WorkerTarget.fromEnvironment(env, properties).current());
        assertEquals(URI.create("http://worker-b:9001"), WorkerTarget.fromEnvironment(env, new Properties()).current());
        assertEquals(URI.create(WorkerTarget.DEFAULT_HOST),
                WorkerTarget.fromEnvironment(Map.of(), new Properties()).current());
    }

    @Test
    void workerTarget_rejectsNonHttpUrlsAndKeepsCurrent() {
        WorkerTarget target = WorkerTarget.localDefault();

        assertThrows(IllegalArgumentException.class, () -> target.switchTo("ftp://worker"));
        assertThrows(IllegalArgumentException.class, () -> target.switchTo("worker:8080/path"));
        assertEquals("localhost:8080", target.label());

        target.switchTo("https://cache.example");
        assertEquals("cache.example", target.label());
    }
}
