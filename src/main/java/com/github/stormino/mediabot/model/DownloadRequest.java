package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder
public class DownloadRequest {

    private final String url;
    private final Path outputPath;
    private final String format;
    private final String audioBitrate;
    private final String videoQuality;
    private final Long maxFileSize;
    private final TimeRange timeRange;

    public MediaKind getMediaKind() {
        return MediaKind.fromFormat(format);
    }

    public boolean hasTimeRange() {
        return timeRange != null;
    }
}
