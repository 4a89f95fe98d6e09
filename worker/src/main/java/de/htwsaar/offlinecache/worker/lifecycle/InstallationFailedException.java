package de.htwsaar.offlinecache.worker.lifecycle;

import java.util.List;

/**
 * Strikte Installation: mindestens ein Manifest-Eintrag konnte nicht gecacht werden.
 */
public class InstallationFailedException extends RuntimeException {

    private final List<String> failedUrls;

    /**
     * @param failedUrls nicht gecachte Manifest-URLs
     */
    public InstallationFailedException(List<String> failedUrls) {
        super("Precache failed for " + failedUrls);
        this.failedUrls = List.copyOf(failedUrls);
    }

    public List<String> getFailedUrls() {
        return failedUrls;
    }
}
