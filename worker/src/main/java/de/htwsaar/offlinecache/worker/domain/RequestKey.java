package de.htwsaar.offlinecache.worker.domain;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Normalisierte Identität einer Anfrage und damit Schlüssel eines Cache-Eintrags.
 *
 * @param method HTTP-Methode in Großbuchstaben
 * @param url    absolute URL ohne Fragment
 */
public record RequestKey(String method, String url) {

    public RequestKey {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
    }

    /**
     * Normalisiert Methode und URL: Methode in Großbuchstaben, Fragment ({@code #...}) entfernt.
     *
     * @param method HTTP-Methode
     * @param url    Anfrage-URL
     * @return Schlüssel
     */
    public static RequestKey of(String method, URI url) {
        Objects.requireNonNull(url, "url must not be null");
        String m = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        return new RequestKey(m, stripFragment(url.toString()));
    }

    /** GET-Schlüssel, z. B. für Manifest- und Precache-Einträge. */
    public static RequestKey get(URI url) {
        return of("GET", url);
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }
}
