package com.github.stormino.mediabot.model;

import com.github.stormino.mediabot.util.FormatUtils;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class ProgressUpdate {

    private String taskId;
    private Long chatId;
    private DownloadStatus status;
    private Double progress;
    private Long downloadedBytes;
    private Long totalBytes;
    private String downloadSpeed;  // Human readable: "5.2 MB/s"
    private Long etaSeconds;
    private String message;
    private String errorMessage;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public static ProgressUpdate fromSource(DownloadTask task, SourceProgress progress) {
        return ProgressUpdate.builder()
                .taskId(task.getId())
                .chatId(task.getChatId())
                .status(DownloadStatus.DOWNLOADING)
                .progress(progress.getPercent())
                .downloadedBytes(progress.getDownloadedBytes())
                .totalBytes(progress.getTotalBytes())
                .downloadSpeed(progress.getSpeedBytesPerSec() != null
                        ? FormatUtils.formatSpeed(progress.getSpeedBytesPerSec())
                        : null)
                .etaSeconds(progress.getEtaSeconds())
                .build();
    }

    public static ProgressUpdate status(DownloadTask task, DownloadStatus status, String message) {
        return ProgressUpdate.builder()
                .taskId(task.getId())
                .chatId(task.getChatId())
                .status(status)
                .progress(status == DownloadStatus.COMPLETED ? 100.0 : null)
                .message(message)
                .build();
    }

    public static ProgressUpdate error(DownloadTask task, String errorMessage) {
        return ProgressUpdate.builder()
                .taskId(task.getId())
                .chatId(task.getChatId())
                .status(DownloadStatus.FAILED)
                .errorMessage(errorMessage)
                .build();
    }
}
