package com.github.stormino.mediabot.service.queue;

import com.github.stormino.mediabot.model.TaskPriority;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue depth by priority. Updates are plain atomic writes, safe to call under the queue lock.
 */
@Component
public class QueueGauges {

    private final EnumMap<TaskPriority, AtomicInteger> depth = new EnumMap<>(TaskPriority.class);
    private final AtomicInteger total = new AtomicInteger();

    public QueueGauges() {
        for (TaskPriority priority : TaskPriority.values()) {
            depth.put(priority, new AtomicInteger());
        }
    }

    void update(Map<TaskPriority, Integer> counts) {
        int sum = 0;
        for (TaskPriority priority : TaskPriority.values()) {
            int count = counts.getOrDefault(priority, 0);
            depth.get(priority).set(count);
            sum += count;
        }
        total.set(sum);
    }

    public int getDepth(TaskPriority priority) {
        return depth.get(priority).get();
    }

    public int getTotal() {
        return total.get();
    }

    public Map<String, Integer> snapshot() {
        Map<String, Integer> snapshot = new LinkedHashMap<>();
        for (TaskPriority priority : TaskPriority.values()) {
            snapshot.put(priority.name().toLowerCase(Locale.ROOT), depth.get(priority).get());
        }
        snapshot.put("total", total.get());
        return snapshot;
    }
}
