package com.github.stormino.mediabot.service.worker;

import com.github.stormino.mediabot.config.MediaBotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts one worker loop per download thread once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueWorkerPool {

    private final QueueWorker worker;
    private final MediaBotProperties properties;

    @Order(10)
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        int workers = properties.getDownload().getParallelDownloads();
        for (int i = 1; i <= workers; i++) {
            worker.runLoop(i);
        }
        log.info("Started {} download workers", workers);
    }
}
