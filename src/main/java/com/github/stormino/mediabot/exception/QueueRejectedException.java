package com.github.stormino.mediabot.exception;

/**
 * Exception thrown when the task queue refuses a new task.
 */
public class QueueRejectedException extends DownloadException {

    public enum Reason {
        QUEUE_FULL,
        DUPLICATE
    }

    private final Reason reason;

    public QueueRejectedException(String message, Reason reason) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
