package com.github.stormino.mediabot.model;

/**
 * Closed taxonomy of extraction failures. Drives every escalation decision.
 */
public enum ErrorKind {
    NETWORK_ERROR("Network error"),
    INVALID_COOKIES("Invalid cookies"),
    BOT_DETECTION("Bot detection"),
    VIDEO_UNAVAILABLE("Video unavailable"),
    FRAGMENT_ERROR("Fragment error"),
    POSTPROCESSING_ERROR("Postprocessing error"),
    DISK_SPACE_ERROR("Disk space error"),
    UNKNOWN("Unknown");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
