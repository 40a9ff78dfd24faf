package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * What a backend actually wrote. The path may differ from the requested one.
 */
@Data
@Builder
public class DownloadOutput {

    private final Path filePath;
    private final Integer durationSecs;
    private final long fileSize;
    private final String mimeHint;

    /**
     * True when the file came from the tier that skips post-processing.
     */
    private final boolean postprocessingSkipped;

    @Builder.Default
    private final List<AdditionalFile> additionalFiles = List.of();
}
