package com.github.stormino.mediabot.service.queue;

import com.github.stormino.mediabot.model.DownloadTask;

import java.util.List;

/**
 * Durable copy of the queue used for crash recovery. Calls are fire-and-forget:
 * implementations must not throw and must not block the caller for long.
 */
public interface TaskMirror {

    TaskMirror NOOP = new TaskMirror() {
    };

    default void enqueued(DownloadTask task) {
    }

    default void processing(String taskId) {
    }

    default void completed(String taskId) {
    }

    default void failed(String taskId, String errorMessage) {
    }

    default void evicted(List<String> taskIds) {
    }
}
