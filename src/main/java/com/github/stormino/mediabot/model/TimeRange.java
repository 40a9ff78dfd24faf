package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

/**
 * Clip bounds in the extraction tool's notation, e.g. "00:01:30" or "90".
 */
@Data
@Builder
public class TimeRange {

    private final String start;
    private final String end;

    public static TimeRange of(String start, String end) {
        return TimeRange.builder().start(start).end(end).build();
    }

    public String toSection() {
        return "*" + start + "-" + end;
    }
}
