package com.github.stormino.mediabot.model;

/**
 * Status of a mirrored queue row.
 */
public enum TaskStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    EVICTED("evicted");

    private final String dbValue;

    TaskStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EVICTED;
    }

    public static TaskStatus fromDbValue(String value) {
        for (TaskStatus status : values()) {
            if (status.dbValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
