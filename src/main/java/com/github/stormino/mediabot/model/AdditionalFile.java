package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Extra item of a multi-item post.
 */
@Data
@Builder
public class AdditionalFile {

    private final Path path;
    private final String mimeType;
    private final Integer durationSecs;
}
