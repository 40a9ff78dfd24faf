package com.github.stormino.mediabot.controller;

import com.github.stormino.mediabot.service.engine.EngineStats;
import com.github.stormino.mediabot.service.queue.PriorityTaskQueue;
import com.github.stormino.mediabot.service.queue.QueueGauges;
import com.github.stormino.mediabot.service.queue.TaskMirror;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("DownloadController")
class DownloadControllerTest {

    private PriorityTaskQueue queue;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        QueueGauges gauges = new QueueGauges();
        queue = new PriorityTaskQueue(2, TaskMirror.NOOP, gauges, Clock.systemUTC());
        mockMvc = MockMvcBuilders
                .standaloneSetup(new DownloadController(queue, gauges, new EngineStats()))
                .build();
    }

    @Nested
    @DisplayName("POST /api/downloads")
    class EnqueueTests {

        @Test
        @DisplayName("should accept and derive priority from the plan")
        void shouldAccept() throws Exception {
            mockMvc.perform(post("/api/downloads")
                            .param("url", "https://youtu.be/a")
                            .param("chatId", "1")
                            .param("plan", "vip"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.position").value(1))
                    .andExpect(jsonPath("$.priority").value("HIGH"));

            assertEquals(1, queue.size());
            assertFalse(queue.snapshotFor(1).get(0).isVideo());
        }

        @Test
        @DisplayName("video formats should be queued as video")
        void videoFormatShouldBeVideo() throws Exception {
            mockMvc.perform(post("/api/downloads")
                            .param("url", "https://youtu.be/a")
                            .param("chatId", "1")
                            .param("format", "mp4")
                            .param("quality", "1080"))
                    .andExpect(status().isAccepted());

            assertTrue(queue.snapshotFor(1).get(0).isVideo());
            assertEquals("1080", queue.snapshotFor(1).get(0).getVideoQuality());
        }

        @Test
        @DisplayName("should reject a half-open time range")
        void shouldRejectHalfOpenRange() throws Exception {
            mockMvc.perform(post("/api/downloads")
                            .param("url", "https://youtu.be/a")
                            .param("chatId", "1")
                            .param("start", "00:10"))
                    .andExpect(status().isBadRequest());

            assertTrue(queue.isEmpty());
        }

        @Test
        @DisplayName("should answer 409 for duplicates and 503 when full")
        void shouldMapRejections() throws Exception {
            mockMvc.perform(post("/api/downloads").param("url", "https://youtu.be/a").param("chatId", "1"))
                    .andExpect(status().isAccepted());
            mockMvc.perform(post("/api/downloads").param("url", "https://youtu.be/a").param("chatId", "1"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.reason").value("DUPLICATE"));
            mockMvc.perform(post("/api/downloads").param("url", "https://youtu.be/b").param("chatId", "2"))
                    .andExpect(status().isAccepted());
            mockMvc.perform(post("/api/downloads").param("url", "https://youtu.be/c").param("chatId", "3"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.reason").value("QUEUE_FULL"));
        }
    }

    @Test
    @DisplayName("position should be 404 for a chat with nothing queued")
    void positionShouldBeNotFoundWhenAbsent() throws Exception {
        mockMvc.perform(get("/api/queue/position/99"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("stats should expose depth per priority")
    void statsShouldExposeDepth() throws Exception {
        mockMvc.perform(post("/api/downloads").param("url", "https://youtu.be/a").param("chatId", "1")
                        .param("plan", "premium"))
                .andExpect(status().isAccepted());

        mockMvc.perform(get("/api/queue/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.depth.medium").value(1))
                .andExpect(jsonPath("$.depth.total").value(1));

        mockMvc.perform(get("/api/queue/position/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.position").value(1));
    }
}
