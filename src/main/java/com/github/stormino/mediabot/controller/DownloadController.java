package com.github.stormino.mediabot.controller;

import com.github.stormino.mediabot.exception.QueueRejectedException;
import com.github.stormino.mediabot.model.DownloadTask;
import com.github.stormino.mediabot.model.MediaKind;
import com.github.stormino.mediabot.model.TaskPriority;
import com.github.stormino.mediabot.model.TimeRange;
import com.github.stormino.mediabot.service.engine.EngineStats;
import com.github.stormino.mediabot.service.queue.PriorityTaskQueue;
import com.github.stormino.mediabot.service.queue.QueueGauges;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DownloadController {

    private final PriorityTaskQueue queue;
    private final QueueGauges gauges;
    private final EngineStats engineStats;

    /**
     * Queue a download. The plan decides the priority.
     */
    @PostMapping("/downloads")
    public ResponseEntity<Map<String, Object>> enqueue(
            @RequestParam String url,
            @RequestParam long chatId,
            @RequestParam(defaultValue = "mp3") String format,
            @RequestParam(required = false) String plan,
            @RequestParam(required = false) String quality,
            @RequestParam(required = false) String bitrate,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {

        if ((start == null) != (end == null)) {
            return ResponseEntity.badRequest().body(Map.of("error", "start and end must be given together"));
        }

        DownloadTask task = DownloadTask.builder()
                .url(url)
                .chatId(chatId)
                .format(format)
                .video(MediaKind.fromFormat(format) == MediaKind.VIDEO)
                .videoQuality(quality)
                .audioBitrate(bitrate)
                .timeRange(start != null ? TimeRange.of(start, end) : null)
                .priority(TaskPriority.fromPlan(plan))
                .build();

        log.info("Enqueue request from chat {}: {} ({})", chatId, url, format);
        int position = queue.enqueue(task);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("taskId", task.getId());
        body.put("position", position);
        body.put("priority", task.getPriority());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/queue/position/{chatId}")
    public ResponseEntity<Map<String, Object>> position(@PathVariable long chatId) {
        return queue.positionOf(chatId)
                .map(position -> ResponseEntity.ok(Map.<String, Object>of("chatId", chatId, "position", position)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/queue/{chatId}")
    public ResponseEntity<List<DownloadTask>> snapshot(@PathVariable long chatId) {
        return ResponseEntity.ok(queue.snapshotFor(chatId));
    }

    @GetMapping("/queue/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("depth", gauges.snapshot());
        body.put("engine", engineStats.snapshot());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(QueueRejectedException.class)
    public ResponseEntity<Map<String, Object>> onRejected(QueueRejectedException e) {
        HttpStatus status = e.getReason() == QueueRejectedException.Reason.DUPLICATE
                ? HttpStatus.CONFLICT
                : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(Map.of("error", e.getMessage(), "reason", e.getReason()));
    }
}
