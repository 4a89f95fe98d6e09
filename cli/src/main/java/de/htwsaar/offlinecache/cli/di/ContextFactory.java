package de.htwsaar.offlinecache.cli.di;

import java.lang.reflect.Constructor;
import java.util.Objects;
import picocli.CommandLine;

/**
 * Picocli-Factory für die Offline-Cache Commands.
 *
 * <p>Ein Konstruktor {@code (CliContext)} erhält den gemeinsamen Kontext, ein Konstruktor
 * {@code (WorkerTarget)} nur das aktuelle Ziel. Alles andere erzeugt die Fallback-Factory.
 */
public final class ContextFactory implements CommandLine.IFactory {
    private final CliContext ctx;
    private final CommandLine.IFactory fallback;

    public ContextFactory(CliContext ctx) {
        this(ctx, CommandLine.defaultFactory());
    }

    ContextFactory(CliContext ctx, CommandLine.IFactory fallback) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        Constructor<K> withContext = constructor(cls, CliContext.class);
        if (withContext != null) return withContext.newInstance(ctx);

        Constructor<K> withTarget = constructor(cls, WorkerTarget.class);
        if (withTarget != null) return withTarget.newInstance(ctx.target());

        return fallback.create(cls);
    }

    private static <K> Constructor<K> constructor(Class<K> cls, Class<?> parameter) {
        try {
            Constructor<K> c = cls.getDeclaredConstructor(parameter);
            c.setAccessible(true);
            return c;
        } catch (NoSuchMethodException ex) {
            return null;
        }
    }
}
