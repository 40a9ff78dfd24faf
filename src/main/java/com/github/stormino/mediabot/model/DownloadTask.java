package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * One confirmed user request. Never mutated after it is queued.
 */
@Data
@Builder
public class DownloadTask {

    @Builder.Default
    private final String id = UUID.randomUUID().toString();

    private final String url;
    private final long chatId;

    /**
     * Originating chat message, used by the UI for reactions.
     */
    private final Integer messageId;

    /**
     * Message showing the queue position, if one was sent.
     */
    private final Integer queueMessageId;

    private final boolean video;
    private final String format;
    private final String videoQuality;
    private final String audioBitrate;
    private final TimeRange timeRange;

    @Builder.Default
    private final TaskPriority priority = TaskPriority.LOW;

    @Builder.Default
    private final Instant createdAt = Instant.now();

    public MediaKind getMediaKind() {
        if (MediaKind.fromFormat(format) == MediaKind.SUBTITLE) {
            return MediaKind.SUBTITLE;
        }
        return video ? MediaKind.VIDEO : MediaKind.AUDIO;
    }

    /**
     * Identity used to reject the same request while it is still queued or running.
     */
    public String getDedupKey() {
        return url + "|" + chatId + "|" + format;
    }

    public String getDisplayName() {
        return String.format("%s [%s, chat %d]", url, format, chatId);
    }
}
