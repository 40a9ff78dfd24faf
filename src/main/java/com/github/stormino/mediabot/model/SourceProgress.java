package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time progress of one attempt. Percent may drop back to zero when a new tier or proxy starts.
 */
@Data
@Builder
public class SourceProgress {

    private final double percent;
    private final Long speedBytesPerSec;
    private final Long etaSeconds;
    private final Long downloadedBytes;
    private final Long totalBytes;

    public static SourceProgress of(double percent) {
        return SourceProgress.builder().percent(percent).build();
    }
}
