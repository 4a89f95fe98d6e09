package de.htwsaar.offlinecache.cli.util;

import java.net.URI;
import java.util.Objects;

/**
 * URI helpers for resolving worker endpoints relative to the {@code --host} option.
 */
public final class UriUtils {
    private UriUtils() {}

    public static URI ensureTrailingSlash(URI uri) {
        Objects.requireNonNull(uri, "uri");
        String s = uri.toString();
        return URI.create(s.endsWith("/") ? s : s + "/");
    }

    /**
     * Löst einen Endpunkt-Pfad relativ zur Basis-URL auf; ein führender Slash wird ignoriert,
     * damit ein Kontextpfad im Host erhalten bleibt.
     *
     * @param host Basis-URL des Workers
     * @param path Endpunkt-Pfad, z. B. {@code _worker/messages}
     * @return absolute URI
     */
    public static URI resolve(URI host, String path) {
        String relative = path == null ? "" : path.trim();
        while (relative.startsWith("/")) relative = relative.substring(1);
        return ensureTrailingSlash(host).resolve(relative);
    }
}
