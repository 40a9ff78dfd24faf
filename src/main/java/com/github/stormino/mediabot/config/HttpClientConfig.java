package com.github.stormino.mediabot.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final MediaBotProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        MediaBotProperties.Download download = properties.getDownload();
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(download.getHttpConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(download.getHttpReadTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(download.getHttpConnectTimeoutSeconds()))
                .addInterceptor(new UserAgentInterceptor(download.getUserAgent()))
                .addInterceptor(new RetryInterceptor(download.getMaxRetries(), download.getRetryDelayMs()))
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    /**
     * Sets the bot user agent unless the caller already chose one.
     */
    static class UserAgentInterceptor implements Interceptor {
        private final String userAgent;

        UserAgentInterceptor(String userAgent) {
            this.userAgent = userAgent;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request original = chain.request();
            if (original.header("User-Agent") != null) {
                return chain.proceed(original);
            }
            return chain.proceed(original.newBuilder()
                    .header("User-Agent", userAgent)
                    .build());
        }
    }

    /**
     * Retry interceptor with exponential backoff for 5xx responses and I/O failures.
     */
    static class RetryInterceptor implements Interceptor {
        private final int maxRetries;
        private final long baseDelayMs;

        RetryInterceptor(int maxRetries, long baseDelayMs) {
            this.maxRetries = maxRetries;
            this.baseDelayMs = baseDelayMs;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request request = chain.request();
            Response response = null;
            IOException lastException = null;

            for (int attempt = 0; attempt < maxRetries; attempt++) {
                try {
                    if (response != null) {
                        response.close();
                        response = null;
                    }

                    response = chain.proceed(request);

                    if (response.code() >= 500 && attempt < maxRetries - 1) {
                        log.debug("Server error {} on attempt {}/{} for {}",
                                response.code(), attempt + 1, maxRetries, request.url().redact());
                        sleep(attempt);
                        continue;
                    }

                    return response;

                } catch (IOException e) {
                    lastException = e;
                    log.warn("Network error on attempt {}/{} for {}: {}",
                            attempt + 1, maxRetries, request.url().redact(), e.getMessage());

                    if (attempt < maxRetries - 1) {
                        sleep(attempt);
                    }
                }
            }

            if (response != null) {
                return response;
            }

            throw lastException != null ? lastException : new IOException("Max retries exceeded");
        }

        private void sleep(int attempt) throws IOException {
            try {
                TimeUnit.MILLISECONDS.sleep(baseDelayMs * (1L << attempt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while backing off", e);
            }
        }
    }
}
