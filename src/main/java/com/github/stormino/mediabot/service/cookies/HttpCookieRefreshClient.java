package com.github.stormino.mediabot.service.cookies;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.mediabot.config.MediaBotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Posts {@code {"reason": ..., "url": ...}} to the cookie manager and reads {@code {"retry": true|false}}.
 * Completes with false when no endpoint is configured or the call fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpCookieRefreshClient implements CookieRefreshClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MediaBotProperties properties;

    @Override
    public CompletableFuture<Boolean> requestRefresh(String reason, String url) {
        if (!properties.getCookies().isRefreshConfigured()) {
            log.warn("Cookie refresh requested ({}) but no refresh endpoint is configured", reason);
            return CompletableFuture.completedFuture(false);
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("reason", reason, "url", url));
        } catch (JsonProcessingException e) {
            log.error("Failed to encode cookie refresh request: {}", e.getMessage());
            return CompletableFuture.completedFuture(false);
        }

        Request request = new Request.Builder()
                .url(properties.getCookies().getRefreshUrl())
                .post(RequestBody.create(body, JSON))
                .build();

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        Call call = httpClient.newCall(request);
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });

        log.info("Requesting cookie refresh ({}) for {}", reason, url);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(@NotNull Call call, @NotNull IOException e) {
                log.warn("Cookie refresh call failed: {}", e.getMessage());
                result.complete(false);
            }

            @Override
            public void onResponse(@NotNull Call call, @NotNull Response response) {
                try (response) {
                    result.complete(parseRetry(response));
                } catch (IOException e) {
                    log.warn("Unreadable cookie refresh response: {}", e.getMessage());
                    result.complete(false);
                }
            }
        });
        return result;
    }

    private boolean parseRetry(Response response) throws IOException {
        if (!response.isSuccessful()) {
            log.warn("Cookie refresh endpoint answered {}", response.code());
            return false;
        }
        ResponseBody responseBody = response.body();
        if (responseBody == null) {
            return false;
        }
        JsonNode json = objectMapper.readTree(responseBody.string());
        boolean retry = json.path("retry").asBoolean(false);
        log.info("Cookie refresh answered retry={}", retry);
        return retry;
    }
}
