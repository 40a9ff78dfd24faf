package com.github.stormino.mediabot.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Formatting and parsing of the sizes, speeds and durations printed by the extraction tool.
 */
@UtilityClass
public class FormatUtils {

    private static final long KIB = 1024L;
    private static final long MIB = KIB * 1024;
    private static final long GIB = MIB * 1024;

    /**
     * Format bytes per second to human-readable speed string.
     *
     * @param bytesPerSecond Speed in bytes per second
     * @return Formatted string like "5.23 MiB/s" or "512 B/s"
     */
    public static String formatSpeed(long bytesPerSecond) {
        return formatSize(bytesPerSecond) + "/s";
    }

    /**
     * Format bytes using binary units, the way the extraction tool prints them.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.50 GiB", "10.00 MiB" or "789 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= GIB) {
            return String.format(Locale.ROOT, "%.2f GiB", bytes / (double) GIB);
        } else if (bytes >= MIB) {
            return String.format(Locale.ROOT, "%.2f MiB", bytes / (double) MIB);
        } else if (bytes >= KIB) {
            return String.format(Locale.ROOT, "%.2f KiB", bytes / (double) KIB);
        } else {
            return String.format(Locale.ROOT, "%d B", bytes);
        }
    }

    /**
     * Parse a size token such as {@code 10.00MiB}, {@code ~1.2GiB}, {@code 500KB} or {@code 500.00KiB/s}.
     *
     * @param token Size token, optionally with a trailing "/s"
     * @return Size in bytes, or null if the token is not a size
     */
    public static Long parseSize(String token) {
        if (token == null) {
            return null;
        }
        String value = token.trim();
        if (value.startsWith("~")) {
            value = value.substring(1);
        }
        if (value.endsWith("/s")) {
            value = value.substring(0, value.length() - 2);
        }

        long multiplier;
        String number;
        if (value.endsWith("GiB") || value.endsWith("GB")) {
            multiplier = GIB;
            number = value.substring(0, value.indexOf('G'));
        } else if (value.endsWith("MiB") || value.endsWith("MB")) {
            multiplier = MIB;
            number = value.substring(0, value.indexOf('M'));
        } else if (value.endsWith("KiB") || value.endsWith("KB") || value.endsWith("kB")) {
            multiplier = KIB;
            number = value.substring(0, value.length() - (value.endsWith("KiB") ? 3 : 2));
        } else if (value.endsWith("B")) {
            multiplier = 1;
            number = value.substring(0, value.length() - 1);
        } else {
            return null;
        }

        try {
            return (long) (Double.parseDouble(number) * multiplier);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parse a clock value such as {@code 00:10} or {@code 1:02:03}.
     *
     * @param clock mm:ss or hh:mm:ss
     * @return Seconds, or null if the value is not a clock
     */
    public static Long parseClock(String clock) {
        if (clock == null || clock.isBlank()) {
            return null;
        }
        String[] parts = clock.trim().split(":");
        if (parts.length < 2 || parts.length > 3) {
            return null;
        }
        try {
            long seconds = 0;
            for (String part : parts) {
                seconds = seconds * 60 + Long.parseLong(part);
            }
            return seconds;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Format duration in seconds to compact time string.
     *
     * @param seconds Duration in seconds
     * @return Formatted string like "02:15:30" or "45:12"
     */
    public static String formatDurationCompact(long seconds) {
        if (seconds < 0) {
            return "00:00";
        }

        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (hours > 0) {
            return String.format("%02d:%02d:%02d", hours, minutes, secs);
        } else {
            return String.format("%02d:%02d", minutes, secs);
        }
    }
}
