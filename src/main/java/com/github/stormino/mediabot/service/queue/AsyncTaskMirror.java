package com.github.stormino.mediabot.service.queue;

import com.github.stormino.mediabot.model.DownloadTask;
import com.github.stormino.mediabot.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Writes queue changes to {@link TaskQueueRepository} off the caller's thread.
 *
 * <p>Writes go through a single-threaded executor so a task's rows change in the order its
 * transitions happened. A storage outage only degrades crash recovery, so failures are logged
 * and dropped.</p>
 */
@Slf4j
@Service
public class AsyncTaskMirror implements TaskMirror {

    private final TaskQueueRepository repository;
    private final Executor executor;

    public AsyncTaskMirror(TaskQueueRepository repository, @Qualifier("mirrorExecutor") Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    @Override
    public void enqueued(DownloadTask task) {
        submit(task.getId(), "insert", () -> repository.upsertPending(task));
    }

    @Override
    public void processing(String taskId) {
        setStatus(taskId, TaskStatus.PROCESSING);
    }

    @Override
    public void completed(String taskId) {
        setStatus(taskId, TaskStatus.COMPLETED);
    }

    @Override
    public void failed(String taskId, String errorMessage) {
        submit(taskId, "mark failed", () -> repository.markFailed(taskId, errorMessage));
    }

    @Override
    public void evicted(List<String> taskIds) {
        taskIds.forEach(id -> setStatus(id, TaskStatus.EVICTED));
    }

    private void setStatus(String taskId, TaskStatus status) {
        submit(taskId, "set " + status, () -> repository.updateStatus(taskId, status));
    }

    private void submit(String taskId, String operation, Runnable write) {
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.warn("Failed to {} for task {}: {}", operation, taskId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Mirror is shutting down, dropped {} for task {}", operation, taskId);
        }
    }
}
