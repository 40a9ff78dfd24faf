package com.github.stormino.mediabot.service.process;

import com.github.stormino.mediabot.config.MediaBotProperties;
import com.github.stormino.mediabot.exception.DownloadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Caps concurrent ffmpeg-class work (probes, conversions) independently of the download pool.
 */
@Slf4j
@Component
public class ProcessingSemaphore {

    private final Semaphore semaphore;
    private final int permits;
    private final Duration acquireTimeout;

    @Autowired
    public ProcessingSemaphore(MediaBotProperties properties) {
        this(properties.getProcessing().getMaxConcurrent(),
                Duration.ofSeconds(properties.getProcessing().getAcquireTimeoutSeconds()));
    }

    public ProcessingSemaphore(int permits, Duration acquireTimeout) {
        this.semaphore = new Semaphore(permits, true);
        this.permits = permits;
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * Run the work holding one permit.
     *
     * @throws DownloadException when no permit frees up within the timeout, or the work throws a checked exception
     */
    public <T> T withPermit(Callable<T> work) {
        boolean acquired;
        try {
            acquired = semaphore.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadException("Interrupted while waiting for a processing slot", e);
        }
        if (!acquired) {
            throw new DownloadException("No processing slot free within " + acquireTimeout.toSeconds() + "s");
        }
        try {
            return work.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new DownloadException("Processing failed: " + e.getMessage(), e);
        } finally {
            semaphore.release();
        }
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int inUse() {
        return permits - semaphore.availablePermits();
    }
}
