package com.github.stormino.mediabot.model;

import java.util.Locale;
import java.util.Set;

public enum MediaKind {
    AUDIO,
    VIDEO,
    SUBTITLE;

    private static final Set<String> SUBTITLE_FORMATS = Set.of("srt", "txt");

    /**
     * mp3 is audio, srt and txt are subtitle tracks, every other container is treated as video.
     */
    public static MediaKind fromFormat(String format) {
        if (format == null) {
            return VIDEO;
        }
        String normalized = format.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("mp3")) {
            return AUDIO;
        }
        return SUBTITLE_FORMATS.contains(normalized) ? SUBTITLE : VIDEO;
    }
}
