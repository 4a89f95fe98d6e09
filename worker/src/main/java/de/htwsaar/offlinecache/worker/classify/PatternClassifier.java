package de.htwsaar.offlinecache.worker.classify;

import de.htwsaar.offlinecache.worker.config.CacheEngineConfig;
import de.htwsaar.offlinecache.worker.config.PatternTable;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Ordnet einer URL (Pfad + Query) eine {@link StrategyTag} zu.
 *
 * <p>Reine, totale Funktion. Reihenfolge: Cache-First, Network-First, Stale-While-Revalidate;
 * der erste Treffer gewinnt, ohne Treffer gilt Network-Only. Muster werden gesucht
 * ({@link java.util.regex.Matcher#find()}), nicht vollständig gematcht.</p>
 */
@Component
public class PatternClassifier {

    private final PatternTable patterns;

    /**
     * Erstellt den Klassifizierer aus der Engine-Konfiguration.
     *
     * @param config Engine-Konfiguration (darf nicht {@code null} sein)
     */
    public PatternClassifier(CacheEngineConfig config) {
        this.patterns = Objects.requireNonNull(config, "config must not be null").patterns();
    }

    /**
     * Bestimmt die Strategie für eine URL.
     *
     * @param url Pfad plus Query, z. B. {@code /api/patients?page=2}; {@code null} gilt als leer
     * @return Strategie, nie {@code null}
     */
    public StrategyTag classify(String url) {
        String candidate = url == null ? "" : url;
        if (matchesAny(patterns.cacheFirst(), candidate)) return StrategyTag.CACHE_FIRST;
        if (matchesAny(patterns.networkFirst(), candidate)) return StrategyTag.NETWORK_FIRST;
        if (matchesAny(patterns.staleWhileRevalidate(), candidate)) return StrategyTag.STALE_WHILE_REVALIDATE;
        return StrategyTag.NETWORK_ONLY;
    }

    private static boolean matchesAny(List<Pattern> list, String url) {
        for (Pattern p : list) {
            if (p.matcher(url).find()) return true;
        }
        return false;
    }
}
