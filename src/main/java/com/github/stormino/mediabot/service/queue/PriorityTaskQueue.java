package com.github.stormino.mediabot.service.queue;

import com.github.stormino.mediabot.config.MediaBotProperties;
import com.github.stormino.mediabot.exception.QueueRejectedException;
import com.github.stormino.mediabot.model.DownloadTask;
import com.github.stormino.mediabot.model.TaskPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory priority queue of pending downloads. Higher priority first, FIFO within a priority.
 *
 * <p>All state is guarded by one lock; the durable mirror is called after the lock is released.
 * A task's dedup key stays reserved from enqueue until {@link #markFinished} or eviction.</p>
 */
@Slf4j
@Service
public class PriorityTaskQueue {

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> -e.task.getPriority().getLevel())
            .thenComparingLong(e -> e.sequence);

    private final Object lock = new Object();
    private final TreeSet<Entry> entries = new TreeSet<>(ORDER);
    private final Set<String> activeKeys = new HashSet<>();
    private final AtomicLong sequence = new AtomicLong();

    private final int maxSize;
    private final TaskMirror mirror;
    private final QueueGauges gauges;
    private final Clock clock;

    @Autowired
    public PriorityTaskQueue(MediaBotProperties properties, TaskMirror mirror, QueueGauges gauges) {
        this(properties.getQueue().getMaxSize(), mirror, gauges, Clock.systemUTC());
    }

    public PriorityTaskQueue(int maxSize, TaskMirror mirror, QueueGauges gauges, Clock clock) {
        this.maxSize = maxSize;
        this.mirror = mirror;
        this.gauges = gauges;
        this.clock = clock;
    }

    /**
     * Queue a task and mirror it as pending.
     *
     * @return 1-based position of the task
     * @throws QueueRejectedException when the queue is full or the same request is already active
     */
    public int enqueue(DownloadTask task) {
        int position = insert(task);
        mirror.enqueued(task);
        log.info("Queued {} [{}] with priority {} at position {}",
                task.getDisplayName(), task.getId(), task.getPriority(), position);
        return position;
    }

    /**
     * Re-queue a task read back from storage without mirroring it again.
     *
     * @return false when it was rejected
     */
    public boolean restore(DownloadTask task) {
        try {
            insert(task);
            return true;
        } catch (QueueRejectedException e) {
            log.warn("Not restoring task {}: {}", task.getId(), e.getMessage());
            return false;
        }
    }

    private int insert(DownloadTask task) {
        synchronized (lock) {
            if (activeKeys.contains(task.getDedupKey())) {
                throw new QueueRejectedException("This download is already queued",
                        QueueRejectedException.Reason.DUPLICATE);
            }
            if (entries.size() >= maxSize) {
                throw new QueueRejectedException("Queue is full (" + maxSize + " tasks)",
                        QueueRejectedException.Reason.QUEUE_FULL);
            }
            Entry entry = new Entry(task, sequence.incrementAndGet());
            entries.add(entry);
            activeKeys.add(task.getDedupKey());
            refreshGauges();
            return entries.headSet(entry).size() + 1;
        }
    }

    /**
     * Take the next task and mirror it as processing.
     */
    public Optional<DownloadTask> dequeue() {
        DownloadTask task;
        synchronized (lock) {
            Entry first = entries.pollFirst();
            if (first == null) {
                return Optional.empty();
            }
            task = first.task;
            refreshGauges();
        }
        mirror.processing(task.getId());
        return Optional.of(task);
    }

    /**
     * Release the dedup key of a task that left the queue through {@link #dequeue()}.
     */
    public void markFinished(DownloadTask task) {
        synchronized (lock) {
            activeKeys.remove(task.getDedupKey());
        }
    }

    /**
     * 1-based position of the caller's earliest queued task, empty when none is queued.
     */
    public Optional<Integer> positionOf(long chatId) {
        synchronized (lock) {
            int position = 0;
            for (Entry entry : entries) {
                position++;
                if (entry.task.getChatId() == chatId) {
                    return Optional.of(position);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * The caller's queued tasks in dequeue order.
     */
    public List<DownloadTask> snapshotFor(long chatId) {
        synchronized (lock) {
            List<DownloadTask> tasks = new ArrayList<>();
            for (Entry entry : entries) {
                if (entry.task.getChatId() == chatId) {
                    tasks.add(entry.task);
                }
            }
            return tasks;
        }
    }

    /**
     * Drop tasks queued longer than {@code maxAge} and mirror them as evicted.
     *
     * @return number of evicted tasks
     */
    public int evictOlderThan(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<String> evicted = new ArrayList<>();
        synchronized (lock) {
            Iterator<Entry> iterator = entries.iterator();
            while (iterator.hasNext()) {
                DownloadTask task = iterator.next().task;
                if (task.getCreatedAt().isBefore(cutoff)) {
                    iterator.remove();
                    activeKeys.remove(task.getDedupKey());
                    evicted.add(task.getId());
                }
            }
            if (!evicted.isEmpty()) {
                refreshGauges();
            }
        }
        if (!evicted.isEmpty()) {
            mirror.evicted(evicted);
            log.info("Evicted {} tasks older than {}", evicted.size(), maxAge);
        }
        return evicted.size();
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Map<TaskPriority, Integer> depthByPriority() {
        synchronized (lock) {
            return countByPriority();
        }
    }

    private Map<TaskPriority, Integer> countByPriority() {
        Map<TaskPriority, Integer> counts = new EnumMap<>(TaskPriority.class);
        for (TaskPriority priority : TaskPriority.values()) {
            counts.put(priority, 0);
        }
        for (Entry entry : entries) {
            counts.merge(entry.task.getPriority(), 1, Integer::sum);
        }
        return counts;
    }

    private void refreshGauges() {
        gauges.update(countByPriority());
    }

    private static final class Entry {
        private final DownloadTask task;
        private final long sequence;

        private Entry(DownloadTask task, long sequence) {
            this.task = task;
            this.sequence = sequence;
        }
    }
}
