package com.github.stormino.mediabot.exception;

/**
 * Thrown when no registered backend claims a URL. Never retried.
 */
public class UnsupportedSourceException extends DownloadException {

    private final String url;

    public UnsupportedSourceException(String url) {
        super("No source backend supports " + url);
        this.url = url;
    }

    public UnsupportedSourceException(String message, String url) {
        super(message);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
