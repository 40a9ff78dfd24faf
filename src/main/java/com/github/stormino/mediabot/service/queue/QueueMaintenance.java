package com.github.stormino.mediabot.service.queue;

import com.github.stormino.mediabot.config.MediaBotProperties;
import com.github.stormino.mediabot.model.DownloadTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Startup recovery from the mirror table and periodic eviction of stale tasks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueMaintenance {

    private final PriorityTaskQueue queue;
    private final TaskQueueRepository repository;
    private final MediaBotProperties properties;

    @Order(0)
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getQueue().isRecoverOnStartup()) {
            recover();
        }
    }

    /**
     * Re-queue rows a previous run left pending or processing, oldest first.
     *
     * @return number of restored tasks
     */
    public int recover() {
        List<DownloadTask> pending;
        try {
            pending = repository.findRecoverable();
        } catch (RuntimeException e) {
            log.error("Queue recovery skipped, mirror unreadable: {}", e.getMessage());
            return 0;
        }
        int restored = 0;
        for (DownloadTask task : pending) {
            if (queue.restore(task)) {
                restored++;
            }
        }
        if (restored > 0) {
            log.info("Recovered {} of {} unfinished tasks", restored, pending.size());
        }
        return restored;
    }

    @Scheduled(fixedRateString = "${mediabot.queue.eviction-interval-ms:600000}",
            initialDelayString = "${mediabot.queue.eviction-interval-ms:600000}")
    public void evictStale() {
        int evicted = queue.evictOlderThan(Duration.ofMinutes(properties.getQueue().getMaxAgeMinutes()));
        log.debug("Eviction pass removed {} tasks", evicted);
    }
}
