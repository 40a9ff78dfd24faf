package com.github.stormino.mediabot.service.progress;

import com.github.stormino.mediabot.model.ProgressUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Fans progress updates out to SSE clients and in-process listeners.
 *
 * <p>Delivery runs on the progress executor in publish order; {@link #broadcastProgress}
 * only queues the update.</p>
 */
@Slf4j
@Service
public class ProgressBroadcastService {

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    // chat front ends, notifiers
    private final CopyOnWriteArrayList<Consumer<ProgressUpdate>> listeners = new CopyOnWriteArrayList<>();

    private final OrderedDispatcher<ProgressUpdate> dispatcher;

    /**
     * Delivers on the publishing thread.
     */
    public ProgressBroadcastService() {
        this(Runnable::run);
    }

    @Autowired
    public ProgressBroadcastService(@Qualifier("progressExecutor") Executor executor) {
        this.dispatcher = new OrderedDispatcher<>("progress broadcast", this::deliver, executor);
    }

    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> removeEmitter(emitter));
        emitter.onTimeout(() -> removeEmitter(emitter));
        emitter.onError(e -> removeEmitter(emitter));

        log.info("New SSE emitter registered. Total: {}", emitters.size());
        return emitter;
    }

    public void registerListener(Consumer<ProgressUpdate> listener) {
        listeners.add(listener);
        log.info("Progress listener registered. Total: {}", listeners.size());
    }

    public void unregisterListener(Consumer<ProgressUpdate> listener) {
        listeners.remove(listener);
    }

    public void broadcastProgress(ProgressUpdate update) {
        dispatcher.accept(update);
    }

    private void deliver(ProgressUpdate update) {
        log.debug("Progress for task {}: {} {}%", update.getTaskId(), update.getStatus(), update.getProgress());

        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name("progress")
                        .data(update));
            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to send SSE event: {}", e.getMessage());
                removeEmitter(emitter);
            }
        }

        for (Consumer<ProgressUpdate> listener : listeners) {
            try {
                listener.accept(update);
            } catch (RuntimeException e) {
                log.error("Progress listener failed, dropping it: {}", e.getMessage(), e);
                listeners.remove(listener);
            }
        }
    }

    private void removeEmitter(SseEmitter emitter) {
        if (emitters.remove(emitter)) {
            log.info("SSE emitter removed. Remaining: {}", emitters.size());
        }
    }

    public int getActiveConnections() {
        return emitters.size();
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public int getPendingUpdates() {
        return dispatcher.backlog();
    }
}
