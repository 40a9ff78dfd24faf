package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

/**
 * Terminal outcome of one queued task, as reported by a worker.
 */
@Data
@Builder
public class DownloadResult {

    private final String taskId;

    /**
     * Whether the download was successful.
     */
    private final boolean success;

    @Builder.Default
    private final ResultStatus status = ResultStatus.SUCCESS;

    /**
     * Output written by the backend, only set on success.
     */
    private final DownloadOutput output;

    /**
     * Name of the backend that handled the task.
     */
    private final String backendName;

    /**
     * Classified kind of the final failure, if any.
     */
    private final ErrorKind errorKind;

    /**
     * Raw diagnostic text, for logs and the mirror row.
     */
    private final String errorMessage;

    /**
     * Message safe to show to the requesting user.
     */
    private final String userMessage;

    private final Throwable cause;

    public enum ResultStatus {
        /**
         * Download completed successfully.
         */
        SUCCESS,

        /**
         * Download failed after all retries.
         */
        FAILED,

        /**
         * No backend claims the URL. Never retried.
         */
        UNSUPPORTED,

        /**
         * Refused before transfer, e.g. a livestream or an oversized file.
         */
        REJECTED
    }

    public static DownloadResult success(String taskId, String backendName, DownloadOutput output) {
        return DownloadResult.builder()
                .taskId(taskId)
                .success(true)
                .status(ResultStatus.SUCCESS)
                .backendName(backendName)
                .output(output)
                .build();
    }

    public static DownloadResult failure(String taskId, ErrorKind errorKind, String errorMessage,
                                         String userMessage, Throwable cause) {
        return DownloadResult.builder()
                .taskId(taskId)
                .success(false)
                .status(ResultStatus.FAILED)
                .errorKind(errorKind)
                .errorMessage(errorMessage)
                .userMessage(userMessage)
                .cause(cause)
                .build();
    }

    public static DownloadResult unsupported(String taskId, String url) {
        return DownloadResult.builder()
                .taskId(taskId)
                .success(false)
                .status(ResultStatus.UNSUPPORTED)
                .errorMessage("No source backend supports " + url)
                .userMessage("This link is not supported.")
                .build();
    }

    public static DownloadResult rejected(String taskId, String errorMessage, String userMessage) {
        return DownloadResult.builder()
                .taskId(taskId)
                .success(false)
                .status(ResultStatus.REJECTED)
                .errorMessage(errorMessage)
                .userMessage(userMessage)
                .build();
    }

    /**
     * Whether a later retry of the same task could succeed.
     */
    public boolean isRetryable() {
        return status == ResultStatus.FAILED
                && errorKind != ErrorKind.VIDEO_UNAVAILABLE
                && errorKind != ErrorKind.DISK_SPACE_ERROR;
    }
}
