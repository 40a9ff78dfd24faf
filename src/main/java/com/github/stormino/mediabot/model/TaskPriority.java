package com.github.stormino.mediabot.model;

import java.util.Locale;

/**
 * Queue priority derived from the subscription plan. Declaration order is the total order.
 */
public enum TaskPriority {
    LOW(0),
    MEDIUM(1),
    HIGH(2);

    private final int level;

    TaskPriority(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * vip maps to HIGH, premium to MEDIUM, anything else (including null) to LOW.
     */
    public static TaskPriority fromPlan(String plan) {
        if (plan == null) {
            return LOW;
        }
        return switch (plan.trim().toLowerCase(Locale.ROOT)) {
            case "vip" -> HIGH;
            case "premium" -> MEDIUM;
            default -> LOW;
        };
    }

    public static TaskPriority fromLevel(int level) {
        for (TaskPriority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        return LOW;
    }
}
