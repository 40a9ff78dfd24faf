package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MediaMetadata {

    private final String title;

    @Builder.Default
    private final String artist = "";
}
