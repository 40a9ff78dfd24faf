package com.github.stormino.mediabot.exception;

/**
 * Exception thrown when a transfer grows past the configured size cap.
 */
public class FileTooLargeException extends DownloadException {

    private final long limitBytes;
    private final long actualBytes;

    public FileTooLargeException(long limitBytes, long actualBytes) {
        super(String.format("File too large: %d bytes exceeds limit of %d bytes", actualBytes, limitBytes));
        this.limitBytes = limitBytes;
        this.actualBytes = actualBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }

    public long getActualBytes() {
        return actualBytes;
    }
}
