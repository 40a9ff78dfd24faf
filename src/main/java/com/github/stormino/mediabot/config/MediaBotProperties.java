package com.github.stormino.mediabot.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "mediabot")
public class MediaBotProperties {

    private Download download = new Download();
    private YtDlp ytdlp = new YtDlp();
    private Proxy proxy = new Proxy();
    private Queue queue = new Queue();
    private Cookies cookies = new Cookies();
    private Processing processing = new Processing();

    @Data
    public static class Download {
        @NotBlank
        private String downloadDir = "/downloads";

        @Min(1)
        private int parallelDownloads = 2;

        @Min(1)
        private long maxFileSizeBytes = 2L * 1024 * 1024 * 1024;

        @NotBlank
        private String defaultAudioBitrate = "320k";

        @NotBlank
        private String defaultVideoQuality = "720";

        @Min(1)
        private int subprocessTimeoutSeconds = 1800;

        @Min(10)
        private long workerPollIntervalMs = 500;

        @NotBlank
        private String userAgent = "Mozilla/5.0 (compatible; mediabot/0.2)";

        @Min(1)
        private int httpReadTimeoutSeconds = 600;

        @Min(1)
        private int httpConnectTimeoutSeconds = 30;

        @Min(100)
        private long retryDelayMs = 1000;

        @Min(1)
        private int maxRetries = 3;
    }

    @Data
    public static class YtDlp {
        @NotBlank
        private String binary = "yt-dlp";

        private String cookiesFile;

        private String cookiesFromBrowser;

        @NotBlank
        private String poTokenProviderUrl = "http://127.0.0.1:4416";

        @NotBlank
        private String jsRuntime = "deno";

        @Min(1)
        private int probeTimeoutSeconds = 30;

        /**
         * Comma-separated subtitle languages, in order of preference.
         */
        @NotBlank
        private String subtitleLanguages = "en,ru";

        public boolean hasCookiesFile() {
            return cookiesFile != null && !cookiesFile.isBlank();
        }

        public boolean hasCookiesFromBrowser() {
            return cookiesFromBrowser != null && !cookiesFromBrowser.isBlank();
        }
    }

    @Data
    public static class Proxy {
        /**
         * Ordered egress proxies tried before the direct connection.
         * Blank, "none" and "disabled" entries are ignored.
         */
        private List<String> urls = new ArrayList<>();
    }

    @Data
    public static class Queue {
        @Min(1)
        private int maxSize = 1000;

        @Min(1)
        private long maxAgeMinutes = 24 * 60;

        @Min(1000)
        private long evictionIntervalMs = 10 * 60 * 1000;

        private boolean recoverOnStartup = true;
    }

    @Data
    public static class Cookies {
        private String refreshUrl;

        @Min(1)
        private int refreshTimeoutSeconds = 20;

        @Min(0)
        private long postRefreshDelayMs = 3000;

        public boolean isRefreshConfigured() {
            return refreshUrl != null && !refreshUrl.isBlank();
        }
    }

    @Data
    public static class Processing {
        @Min(1)
        private int maxConcurrent = 3;

        @Min(1)
        private int acquireTimeoutSeconds = 600;
    }
}
