package de.htwsaar.offlinecache.worker.config;

import java.util.List;
import java.util.regex.Pattern;

/**
 * URL-Muster je Strategie, in fester Prioritätsreihenfolge ausgewertet.
 *
 * @param cacheFirst           Asset-Endungen und gehashte Bundles
 * @param networkFirst         API-, Auth- und externe KI-Endpunkte
 * @param staleWhileRevalidate HTML, Navigation und Web-Manifest
 */
public record PatternTable(List<Pattern> cacheFirst, List<Pattern> networkFirst, List<Pattern> staleWhileRevalidate) {

    public PatternTable {
        cacheFirst = List.copyOf(cacheFirst);
        networkFirst = List.copyOf(networkFirst);
        staleWhileRevalidate = List.copyOf(staleWhileRevalidate);
    }

    /** Standardtabelle der Frontend-Anwendung (Vite-Build). */
    public static PatternTable defaults() {
        return new PatternTable(
                compile(List.of(
                        "\\.(?:js|css|png|jpg|jpeg|svg|gif|ico|woff|woff2|ttf)$",
                        "/assets/",
                        "chunk-[a-zA-Z0-9]+\\.js$",
                        "index-[a-zA-Z0-9]+\\.(js|css)$")),
                compile(List.of("/api/", "gemini", "/auth/")),
                compile(List.of("\\.(?:html)$", "/$", "/manifest\\.json$")));
    }

    /**
     * Kompiliert reguläre Ausdrücke; leere Einträge werden ignoriert.
     *
     * @param regexes Ausdrücke
     * @return kompilierte Muster
     */
    public static List<Pattern> compile(List<String> regexes) {
        return regexes.stream()
                .filter(r -> r != null && !r.isBlank())
                .map(String::trim)
                .map(Pattern::compile)
                .toList();
    }
}
