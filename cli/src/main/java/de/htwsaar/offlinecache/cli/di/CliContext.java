package de.htwsaar.offlinecache.cli.di;

import java.io.PrintWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import org.jline.terminal.Terminal;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Enthält Terminal, Ausgabekanäle, HTTP-Client, Timeout und das aktuelle {@link WorkerTarget},
 * keine fachlichen Services.
 */
public final class CliContext {
    private final Terminal terminal;
    private final PrintWriter out;
    private final PrintWriter err;
    private final HttpClient httpClient;
    private final Duration defaultRequestTimeout;
    private final WorkerTarget target;

    /** Kontext mit {@link WorkerTarget#localDefault()} als Ziel. */
    public CliContext(
            Terminal terminal,
            PrintWriter out,
            PrintWriter err,
            HttpClient httpClient,
            Duration defaultRequestTimeout) {
        this(terminal, out, err, httpClient, defaultRequestTimeout, WorkerTarget.localDefault());
    }

    /**
     * @param terminal JLine-Terminal für die interaktive Shell
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param httpClient gemeinsamer HTTP-Client für Worker-Aufrufe
     * @param defaultRequestTimeout Standard-Timeout für HTTP-Requests
     * @param target Worker, den Commands ohne {@code -H} ansprechen
     */
    public CliContext(
            Terminal terminal,
            PrintWriter out,
            PrintWriter err,
            HttpClient httpClient,
            Duration defaultRequestTimeout,
            WorkerTarget target) {
        this.terminal = Objects.requireNonNull(terminal, "terminal");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.defaultRequestTimeout = Objects.requireNonNull(defaultRequestTimeout, "defaultRequestTimeout");
        this.target = Objects.requireNonNull(target, "target");
    }

    public Terminal terminal() {
        return terminal;
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public Duration defaultRequestTimeout() {
        return defaultRequestTimeout;
    }

    public WorkerTarget target() {
        return target;
    }

    /**
     * Effektive Worker-URL eines Commands.
     *
     * @param hostOption Wert von {@code -H} oder {@code null}
     * @return die Option, falls gesetzt, sonst das aktuelle Ziel
     */
    public URI workerUrl(URI hostOption) {
        return hostOption != null ? hostOption : target.current();
    }
}
