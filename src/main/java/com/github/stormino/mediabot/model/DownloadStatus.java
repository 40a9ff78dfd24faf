package com.github.stormino.mediabot.model;

/**
 * Live status reported to progress listeners.
 */
public enum DownloadStatus {
    QUEUED("Queued"),
    RESOLVING("Resolving source"),
    DOWNLOADING("Downloading"),
    RETRYING("Retrying"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    EVICTED("Expired in queue");

    private final String displayName;

    DownloadStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EVICTED;
    }
}
