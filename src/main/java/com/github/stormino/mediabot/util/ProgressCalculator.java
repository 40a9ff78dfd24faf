package com.github.stormino.mediabot.util;

import com.github.stormino.mediabot.model.SourceProgress;
import lombok.experimental.UtilityClass;

/**
 * Builds progress snapshots for transfers that only report byte counts.
 */
@UtilityClass
public class ProgressCalculator {

    /**
     * Progress percentage clamped to 0-100, or 0 when the total is unknown.
     */
    public static double percent(long downloadedBytes, Long totalBytes) {
        if (totalBytes == null || totalBytes <= 0 || downloadedBytes <= 0) {
            return 0.0;
        }
        return Math.min(100.0, downloadedBytes * 100.0 / totalBytes);
    }

    /**
     * Average speed since the transfer started, or null before the first byte.
     */
    public static Long speed(long transferredBytes, long elapsedMillis) {
        if (transferredBytes <= 0 || elapsedMillis <= 0) {
            return null;
        }
        return transferredBytes * 1000 / elapsedMillis;
    }

    /**
     * Seconds remaining at the given speed, or null when it cannot be estimated.
     */
    public static Long eta(long downloadedBytes, Long totalBytes, Long bytesPerSecond) {
        if (totalBytes == null || totalBytes <= 0 || bytesPerSecond == null || bytesPerSecond <= 0) {
            return null;
        }
        long remaining = totalBytes - downloadedBytes;
        return remaining <= 0 ? 0L : remaining / bytesPerSecond;
    }

    /**
     * Snapshot for a byte-counting transfer.
     *
     * @param downloadedBytes bytes on disk, including any resumed prefix
     * @param totalBytes      full size, or null when unknown
     * @param sessionBytes    bytes received in this session, used for speed
     * @param elapsedMillis   time since this session started
     */
    public static SourceProgress snapshot(long downloadedBytes, Long totalBytes,
                                          long sessionBytes, long elapsedMillis) {
        Long speed = speed(sessionBytes, elapsedMillis);
        return SourceProgress.builder()
                .percent(percent(downloadedBytes, totalBytes))
                .speedBytesPerSec(speed)
                .etaSeconds(eta(downloadedBytes, totalBytes, speed))
                .downloadedBytes(downloadedBytes)
                .totalBytes(totalBytes)
                .build();
    }
}
