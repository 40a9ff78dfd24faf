package com.github.stormino.mediabot.service.backend;

import com.github.stormino.mediabot.config.MediaBotProperties;
import com.github.stormino.mediabot.exception.DownloadException;
import com.github.stormino.mediabot.exception.ExtractionException;
import com.github.stormino.mediabot.exception.FileTooLargeException;
import com.github.stormino.mediabot.model.DownloadOutput;
import com.github.stormino.mediabot.model.DownloadRequest;
import com.github.stormino.mediabot.model.ErrorKind;
import com.github.stormino.mediabot.model.MediaKind;
import com.github.stormino.mediabot.model.MediaMetadata;
import com.github.stormino.mediabot.service.classifier.ErrorClassifier;
import com.github.stormino.mediabot.service.command.TierConfig;
import com.github.stormino.mediabot.service.command.YtDlpCommandBuilder;
import com.github.stormino.mediabot.service.engine.AttemptResult;
import com.github.stormino.mediabot.service.engine.FallbackRetryEngine;
import com.github.stormino.mediabot.service.engine.ProxyChainProvider;
import com.github.stormino.mediabot.service.parser.YtDlpProgressParser;
import com.github.stormino.mediabot.service.process.ProcessResult;
import com.github.stormino.mediabot.service.process.ProcessRunner;
import com.github.stormino.mediabot.service.process.ProcessingSemaphore;
import com.github.stormino.mediabot.service.progress.ProgressSink;
import com.github.stormino.mediabot.service.progress.ProgressThrottle;
import com.github.stormino.mediabot.util.DownloadConstants;
import com.github.stormino.mediabot.util.PathUtils;
import com.github.stormino.mediabot.util.SubtitleFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Catch-all backend driving the yt-dlp CLI through the tiered fallback engine.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YtDlpSourceBackend implements SourceBackend {

    public static final String NAME = "yt-dlp";

    private static final Set<String> KNOWN_DOMAINS = Set.of(
            "youtube.com", "youtu.be", "music.youtube.com", "soundcloud.com", "vimeo.com",
            "tiktok.com", "instagram.com", "twitter.com", "x.com", "facebook.com",
            "twitch.tv", "clips.twitch.tv", "dailymotion.com", "bandcamp.com", "reddit.com",
            "bilibili.com", "nicovideo.jp", "rutube.ru", "ok.ru", "vk.com");

    private final MediaBotProperties properties;
    private final YtDlpCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;
    private final FallbackRetryEngine fallbackEngine;
    private final ProxyChainProvider proxyChainProvider;
    private final ErrorClassifier classifier;
    private final ProcessingSemaphore processingSemaphore;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(String url) {
        if (url == null) {
            return false;
        }
        Optional<String> host = PathUtils.urlHost(url);
        if (host.isPresent() && isKnownDomain(host.get())) {
            return true;
        }
        if (!PathUtils.isHttpUrl(url)) {
            return false;
        }
        return !DownloadConstants.NON_EXTRACTABLE_EXTENSIONS.contains(PathUtils.getUrlExtension(url));
    }

    private static boolean isKnownDomain(String host) {
        String bare = host.startsWith("www.") ? host.substring(4) : host;
        for (String domain : KNOWN_DOMAINS) {
            if (bare.equals(domain) || bare.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public MediaMetadata metadata(String url) {
        ProcessResult result = processRunner.run(
                commandBuilder.buildProbeCommand(url, "%(title)s", "%(uploader)s"), probeTimeout());
        if (!result.isSuccess()) {
            ErrorKind kind = classifier.classify(result.diagnostic());
            throw new ExtractionException("Failed to read metadata for " + url, kind, result.diagnostic());
        }
        List<String> lines = result.getStdoutTail().stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
        String title = !lines.isEmpty() ? lines.get(0) : PathUtils.getUrlTitle(url);
        String artist = lines.size() > 1 && !"NA".equals(lines.get(1)) ? lines.get(1) : "";
        return MediaMetadata.builder().title(title).artist(artist).build();
    }

    @Override
    public Optional<Long> estimateSize(String url) {
        try {
            ProcessResult result = processRunner.run(
                    commandBuilder.buildProbeCommand(url, "%(filesize_approx)s"), probeTimeout());
            if (!result.isSuccess()) {
                return Optional.empty();
            }
            String value = result.firstStdoutLine();
            if (value.isEmpty() || "NA".equals(value)) {
                return Optional.empty();
            }
            long approx = (long) Double.parseDouble(value);
            return Optional.of(Math.round(approx * DownloadConstants.SIZE_ESTIMATE_OVERHEAD));
        } catch (RuntimeException e) {
            log.debug("Size estimate for {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isLivestream(String url) {
        try {
            ProcessResult result = processRunner.run(
                    commandBuilder.buildProbeCommand(url, "%(is_live)s"), probeTimeout());
            if (!result.isSuccess()) {
                // yt-dlp refuses some upcoming/live streams outright
                return result.diagnostic().toLowerCase(Locale.ROOT).contains("live");
            }
            String value = result.firstStdoutLine().toLowerCase(Locale.ROOT);
            return value.equals("true") || value.equals("1");
        } catch (RuntimeException e) {
            log.debug("Livestream probe for {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    @Override
    public DownloadOutput download(DownloadRequest request, ProgressSink progressSink) {
        Path outputPath = request.getOutputPath();
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new DownloadException("Cannot create output directory for " + outputPath, e);
        }

        ProgressThrottle throttle = new ProgressThrottle(progressSink);
        Duration timeout = Duration.ofSeconds(properties.getDownload().getSubprocessTimeoutSeconds());

        AttemptResult success = fallbackEngine.execute(request.getUrl(), outputPath, proxyChainProvider.getChain(),
                (tier, proxy) -> {
                    throttle.reset();
                    List<String> command = commandBuilder.buildCommand(tier, request, proxy);
                    ProcessResult result = processRunner.run(command, timeout, new YtDlpProgressParser(), throttle);
                    return result.isSuccess()
                            ? AttemptResult.success(tier, proxy)
                            : AttemptResult.failure(tier, proxy, result.diagnostic());
                });

        boolean subtitles = request.getMediaKind() == MediaKind.SUBTITLE;
        Path actual = subtitles ? subtitleOutput(request) : PathUtils.findActualOutputFile(outputPath);
        if (!Files.exists(actual)) {
            throw new ExtractionException("yt-dlp reported success but wrote no file for " + request.getUrl(),
                    ErrorKind.UNKNOWN, "missing output " + outputPath);
        }

        long size;
        try {
            size = Files.size(actual);
        } catch (IOException e) {
            throw new DownloadException("Cannot stat " + actual, e);
        }
        if (request.getMaxFileSize() != null && size > request.getMaxFileSize()) {
            PathUtils.deletePartialOutputs(actual);
            throw new FileTooLargeException(request.getMaxFileSize(), size);
        }

        return DownloadOutput.builder()
                .filePath(actual)
                .fileSize(size)
                .durationSecs(subtitles ? null : probeDuration(actual))
                .mimeHint(mimeHint(request.getMediaKind(), actual))
                .postprocessingSkipped(success.getTier() == TierConfig.Tier.TIER_3)
                .build();
    }

    private Path subtitleOutput(DownloadRequest request) {
        Path outputPath = request.getOutputPath();
        List<String> languages = SubtitleFiles.languages(properties.getYtdlp().getSubtitleLanguages());
        Path track = SubtitleFiles.locate(outputPath, languages)
                .orElseThrow(() -> new ExtractionException("No subtitles available for " + request.getUrl(),
                        ErrorKind.UNKNOWN, "no subtitle track in " + languages + " for " + outputPath));
        try {
            return SubtitleFiles.finish(track, outputPath);
        } catch (IOException e) {
            throw new DownloadException("Cannot prepare subtitles from " + track, e);
        }
    }

    private static String mimeHint(MediaKind kind, Path file) {
        return switch (kind) {
            case AUDIO -> "audio/mpeg";
            case VIDEO -> "video/mp4";
            case SUBTITLE -> DownloadConstants.SUBTITLE_MIME_TYPES.getOrDefault(
                    PathUtils.getExtension(file.getFileName().toString()), DownloadConstants.DEFAULT_MIME_TYPE);
        };
    }

    /**
     * Duration via ffprobe; null when ffprobe is missing or the file is unreadable.
     */
    private Integer probeDuration(Path file) {
        ProcessResult result;
        try {
            result = processingSemaphore.withPermit(() -> processRunner.run(List.of(
                    "ffprobe", "-v", "error",
                    "-show_entries", "format=duration",
                    "-of", "default=noprint_wrappers=1:nokey=1",
                    file.toString()), probeTimeout()));
        } catch (DownloadException e) {
            log.debug("Duration probe skipped for {}: {}", file, e.getMessage());
            return null;
        }
        if (!result.isSuccess()) {
            return null;
        }
        try {
            return (int) Math.round(Double.parseDouble(result.firstStdoutLine()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Duration probeTimeout() {
        return Duration.ofSeconds(properties.getYtdlp().getProbeTimeoutSeconds());
    }
}
