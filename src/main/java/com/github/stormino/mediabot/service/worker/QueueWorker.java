package com.github.stormino.mediabot.service.worker;

import com.github.stormino.mediabot.config.MediaBotProperties;
import com.github.stormino.mediabot.exception.DownloadException;
import com.github.stormino.mediabot.exception.ExtractionException;
import com.github.stormino.mediabot.exception.FileTooLargeException;
import com.github.stormino.mediabot.exception.UnsupportedSourceException;
import com.github.stormino.mediabot.model.DownloadOutput;
import com.github.stormino.mediabot.model.DownloadRequest;
import com.github.stormino.mediabot.model.DownloadResult;
import com.github.stormino.mediabot.model.DownloadStatus;
import com.github.stormino.mediabot.model.DownloadTask;
import com.github.stormino.mediabot.model.ErrorKind;
import com.github.stormino.mediabot.model.MediaKind;
import com.github.stormino.mediabot.model.ProgressUpdate;
import com.github.stormino.mediabot.service.backend.HttpSourceBackend;
import com.github.stormino.mediabot.service.backend.SourceBackend;
import com.github.stormino.mediabot.service.backend.SourceRegistry;
import com.github.stormino.mediabot.service.classifier.ErrorClassifier;
import com.github.stormino.mediabot.service.progress.ProgressBroadcastService;
import com.github.stormino.mediabot.service.queue.PriorityTaskQueue;
import com.github.stormino.mediabot.service.queue.TaskMirror;
import com.github.stormino.mediabot.util.FormatUtils;
import com.github.stormino.mediabot.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Takes tasks off the queue and runs them through the matching backend.
 * Every task ends with a terminal progress update, a mirror status and a released dedup key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueWorker {

    private final PriorityTaskQueue queue;
    private final SourceRegistry sourceRegistry;
    private final TaskMirror mirror;
    private final ProgressBroadcastService progressBroadcast;
    private final ErrorClassifier classifier;
    private final MediaBotProperties properties;

    private volatile boolean running = true;

    /**
     * Worker loop. Returns when the context closes or the thread is interrupted.
     */
    @Async("downloadExecutor")
    public void runLoop(int workerId) {
        log.info("Worker {} started", workerId);
        long pollInterval = properties.getDownload().getWorkerPollIntervalMs();
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                if (!runOnce()) {
                    Thread.sleep(pollInterval);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Worker {} hit an unexpected error: {}", workerId, e.getMessage(), e);
            }
        }
        log.info("Worker {} stopped", workerId);
    }

    /**
     * Process the next queued task, if any.
     *
     * @return false when the queue was empty
     */
    public boolean runOnce() {
        Optional<DownloadTask> next = queue.dequeue();
        if (next.isEmpty()) {
            return false;
        }
        DownloadTask task = next.get();
        try {
            DownloadResult result = processTask(task);
            if (result.isSuccess()) {
                mirror.completed(task.getId());
            } else {
                mirror.failed(task.getId(), result.getErrorMessage());
            }
        } finally {
            queue.markFinished(task);
        }
        return true;
    }

    /**
     * Run one task to a terminal result. Never throws.
     */
    public DownloadResult processTask(DownloadTask task) {
        log.info("Processing task: {} [{}]", task.getDisplayName(), task.getId());
        publish(ProgressUpdate.status(task, DownloadStatus.RESOLVING, "Resolving source"));

        DownloadResult result;
        String backendName = null;
        try {
            SourceBackend backend = sourceRegistry.resolve(task.getUrl())
                    .orElseThrow(() -> new UnsupportedSourceException(task.getUrl()));
            backendName = backend.name();

            if (backend.isLivestream(task.getUrl())) {
                result = DownloadResult.rejected(task.getId(), "Livestream refused: " + task.getUrl(),
                        "Livestreams cannot be downloaded.");
            } else {
                DownloadRequest request = buildRequest(task, backend);
                publish(ProgressUpdate.status(task, DownloadStatus.DOWNLOADING, "Downloading via " + backendName));
                DownloadOutput output = backend.download(request,
                        progress -> publish(ProgressUpdate.fromSource(task, progress)));
                result = DownloadResult.success(task.getId(), backendName, output);
            }
        } catch (UnsupportedSourceException e) {
            result = DownloadResult.unsupported(task.getId(), task.getUrl());
        } catch (FileTooLargeException e) {
            result = DownloadResult.rejected(task.getId(), e.getMessage(),
                    "The file is too large (limit " + FormatUtils.formatSize(e.getLimitBytes()) + ").");
        } catch (ExtractionException e) {
            result = failure(task, e.getErrorKind(),
                    e.getDiagnostic() != null ? e.getDiagnostic() : e.getMessage(), e);
        } catch (DownloadException e) {
            result = failure(task, classifier.classify(e.getMessage()), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in task {}: {}", task.getId(), e.getMessage(), e);
            result = failure(task, ErrorKind.UNKNOWN, String.valueOf(e.getMessage()), e);
        }

        if (result.isSuccess()) {
            log.info("Task {} completed via {}: {}", task.getId(), backendName, result.getOutput().getFilePath());
            publish(ProgressUpdate.status(task, DownloadStatus.COMPLETED, "Download completed"));
        } else {
            log.warn("Task {} ended {}: {}", task.getId(), result.getStatus(), result.getErrorMessage());
            publish(ProgressUpdate.error(task, result.getUserMessage()));
        }
        return result;
    }

    private DownloadResult failure(DownloadTask task, ErrorKind kind, String diagnostic, Throwable cause) {
        if (classifier.shouldNotifyAdmin(kind)) {
            log.error("Task {} needs attention ({}): {}", task.getId(), kind, classifier.recommendation(kind));
        }
        return DownloadResult.failure(task.getId(), kind, diagnostic, classifier.userMessage(kind), cause);
    }

    DownloadRequest buildRequest(DownloadTask task, SourceBackend backend) {
        MediaBotProperties.Download download = properties.getDownload();
        return DownloadRequest.builder()
                .url(task.getUrl())
                .outputPath(outputPathFor(task, backend))
                .format(task.getFormat())
                .audioBitrate(task.getAudioBitrate() != null ? task.getAudioBitrate() : download.getDefaultAudioBitrate())
                .videoQuality(task.getVideoQuality() != null ? task.getVideoQuality() : download.getDefaultVideoQuality())
                .maxFileSize(download.getMaxFileSizeBytes())
                .timeRange(task.getTimeRange())
                .build();
    }

    private Path outputPathFor(DownloadTask task, SourceBackend backend) {
        String extension = task.getFormat();
        if (HttpSourceBackend.NAME.equals(backend.name())) {
            String urlExtension = PathUtils.getUrlExtension(task.getUrl());
            if (!urlExtension.isEmpty()) {
                extension = urlExtension;
            }
        }
        if (extension == null || extension.isBlank()) {
            extension = switch (task.getMediaKind()) {
                case AUDIO -> "mp3";
                case VIDEO -> "mp4";
                case SUBTITLE -> "srt";
            };
        }
        return Paths.get(properties.getDownload().getDownloadDir(), task.getId() + "." + extension);
    }

    private void publish(ProgressUpdate update) {
        try {
            progressBroadcast.broadcastProgress(update);
        } catch (RuntimeException e) {
            log.warn("Progress broadcast failed for task {}: {}", update.getTaskId(), e.getMessage());
        }
    }

    @EventListener(ContextClosedEvent.class)
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }
}
