package com.github.stormino.mediabot.controller;

import com.github.stormino.mediabot.service.progress.ProgressBroadcastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressBroadcastService progressBroadcastService;

    /**
     * Live progress of every task as server-sent events named {@code progress}.
     */
    @GetMapping("/stream")
    public SseEmitter streamProgress() {
        log.info("New SSE connection established");
        return progressBroadcastService.createEmitter();
    }
}
