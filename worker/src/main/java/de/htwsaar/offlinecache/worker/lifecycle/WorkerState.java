package de.htwsaar.offlinecache.worker.lifecycle;

/**
 * Zustände des Workers, von der Installation bis zur Kontrolle aller Anfragen.
 */
public enum WorkerState {
    UNINSTALLED,
    INSTALLING,
    /** installiert, wartet auf Aktivierung */
    INSTALLED,
    ACTIVATING,
    /** kontrolliert alle Anfragen */
    ACTIVE,
    /** strikte Installation fehlgeschlagen */
    REDUNDANT
}
