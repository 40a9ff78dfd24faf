package com.github.stormino.mediabot.service.command;

import com.github.stormino.mediabot.config.MediaBotProperties;
import com.github.stormino.mediabot.model.DownloadRequest;
import com.github.stormino.mediabot.model.MediaKind;
import com.github.stormino.mediabot.model.ProxyConfig;
import com.github.stormino.mediabot.util.PathUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builder for yt-dlp command-line arguments, one {@link TierConfig} per escalation tier.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YtDlpCommandBuilder {

    private static final int[] FORMAT_HEIGHTS = {1080, 720, 480, 360, 240};
    private static final String DEFAULT_AUDIO_BITRATE = "320k";

    private final MediaBotProperties properties;

    /**
     * Build the argument set for a tier.
     *
     * @param tier    Escalation tier
     * @param request Download request
     * @param proxy   Egress path, may be direct
     * @return Tier configuration ready to render
     */
    public TierConfig buildTier(@NonNull TierConfig.Tier tier, @NonNull DownloadRequest request, ProxyConfig proxy) {
        boolean tierOne = tier == TierConfig.Tier.TIER_1;
        boolean skipPostprocessing = tier == TierConfig.Tier.TIER_3;

        MediaKind kind = request.getMediaKind();
        String outputTemplate = kind == MediaKind.SUBTITLE
                ? subtitleOutputTemplate(request.getOutputPath())
                : request.getOutputPath().toString();
        List<String> baseArgs = new ArrayList<>(tierOne
                ? fullBaseArgs(outputTemplate)
                : minimalBaseArgs(outputTemplate));
        baseArgs.addAll(switch (kind) {
            case AUDIO -> audioArgs(request.getAudioBitrate(), skipPostprocessing);
            case VIDEO -> videoArgs(request.getVideoQuality(), skipPostprocessing);
            case SUBTITLE -> subtitleArgs(skipPostprocessing);
        });

        MediaBotProperties.YtDlp ytdlp = properties.getYtdlp();
        List<String> extraFlags = new ArrayList<>();
        TierConfig.AuthMode authMode = TierConfig.AuthMode.NONE;
        String authValue = null;

        if (tierOne) {
            extraFlags.add("--extractor-args");
            extraFlags.add("youtube:player_client=default;formats=missing_pot");
        } else {
            extraFlags.add("--extractor-args");
            extraFlags.add("youtubepot-bgutilhttp:base_url=" + ytdlp.getPoTokenProviderUrl());
            extraFlags.add("--extractor-args");
            extraFlags.add("youtube:player_client=default");
            if (ytdlp.hasCookiesFile()) {
                authMode = TierConfig.AuthMode.COOKIES_FILE;
                authValue = ytdlp.getCookiesFile();
            } else if (ytdlp.hasCookiesFromBrowser()) {
                authMode = TierConfig.AuthMode.COOKIES_FROM_BROWSER;
                authValue = ytdlp.getCookiesFromBrowser();
            } else {
                log.warn("No cookies configured, {} runs without credentials", tier);
            }
        }
        extraFlags.add("--js-runtimes");
        extraFlags.add(ytdlp.getJsRuntime());
        extraFlags.add("--no-check-certificate");

        // subtitles are fetched whole
        if (request.hasTimeRange() && kind != MediaKind.SUBTITLE) {
            extraFlags.add("--download-sections");
            extraFlags.add(request.getTimeRange().toSection());
            extraFlags.add("--force-keyframes-at-cuts");
        }

        return TierConfig.builder()
                .tier(tier)
                .baseArgs(List.copyOf(baseArgs))
                .authMode(authMode)
                .authValue(authValue)
                .proxy(proxy)
                .extraFlags(List.copyOf(extraFlags))
                .build();
    }

    /**
     * Render the full command for a tier.
     */
    public List<String> buildCommand(@NonNull TierConfig.Tier tier, @NonNull DownloadRequest request, ProxyConfig proxy) {
        List<String> command = buildTier(tier, request, proxy)
                .toCommand(properties.getYtdlp().getBinary(), request.getUrl());
        log.debug("Built {} command: {}", tier, redactProxy(command));
        return command;
    }

    /**
     * Metadata probe that prints the given templates without downloading.
     */
    public List<String> buildProbeCommand(@NonNull String url, String... printTemplates) {
        List<String> command = new ArrayList<>();
        command.add(properties.getYtdlp().getBinary());
        for (String template : printTemplates) {
            command.add("--print");
            command.add(template);
        }
        command.add("--no-playlist");
        command.add("--skip-download");
        command.add("--no-check-certificate");
        command.add(url);
        return command;
    }

    /**
     * yt-dlp format selector preferring H.264/AAC at the requested height, then lower heights.
     *
     * @param requestedHeight Preferred height, e.g. "720" or "720p"; null for 720
     */
    public static String buildFormatSelector(String requestedHeight) {
        int preferred = parseHeight(requestedHeight);

        List<Integer> heights = new ArrayList<>();
        heights.add(preferred);
        for (int height : FORMAT_HEIGHTS) {
            if (height != preferred) {
                heights.add(height);
            }
        }

        List<String> selectors = new ArrayList<>();
        for (int height : heights) {
            selectors.add("bv*[height<=" + height + "][vcodec^=avc1]+ba[acodec^=mp4a]");
            selectors.add("bv*[height<=" + height + "][vcodec^=avc1][ext=mp4]+ba[ext=m4a]");
        }
        selectors.add("bestvideo[ext=mp4]+bestaudio[ext=m4a]");
        selectors.add("best[ext=mp4]");
        selectors.add("best");
        return String.join("/", selectors);
    }

    static List<String> fullBaseArgs(String outputPath) {
        List<String> args = new ArrayList<>(minimalBaseArgs(outputPath));
        args.addAll(List.of(
                "--sleep-requests", "2",
                "--sleep-interval", "3",
                "--max-sleep-interval", "10",
                "--limit-rate", "5M",
                "--retry-sleep", "http:exp=1:30",
                "--retry-sleep", "fragment:exp=1:30",
                "--retries", "15"));
        return args;
    }

    static List<String> minimalBaseArgs(String outputPath) {
        return List.of(
                "-o", outputPath,
                "--newline",
                "--force-overwrites",
                "--no-playlist",
                "--concurrent-fragments", "1",
                "--fragment-retries", "10",
                "--socket-timeout", "30",
                "--http-chunk-size", "2097152");
    }

    private List<String> audioArgs(String bitrate, boolean skipPostprocessing) {
        List<String> args = new ArrayList<>(List.of(
                "--extract-audio",
                "--audio-format", "mp3",
                "--audio-quality", "0",
                "--add-metadata"));
        if (skipPostprocessing) {
            args.add("--fixup");
            args.add("never");
        } else {
            String effectiveBitrate = bitrate != null && !bitrate.isBlank()
                    ? bitrate
                    : properties.getDownload().getDefaultAudioBitrate();
            args.add("--embed-thumbnail");
            args.add("--postprocessor-args");
            args.add("ffmpeg:-acodec libmp3lame -b:a " + (effectiveBitrate != null ? effectiveBitrate : DEFAULT_AUDIO_BITRATE));
        }
        return args;
    }

    private List<String> videoArgs(String quality, boolean skipPostprocessing) {
        String effectiveQuality = quality != null && !quality.isBlank()
                ? quality
                : properties.getDownload().getDefaultVideoQuality();
        List<String> args = new ArrayList<>(List.of(
                "--format", buildFormatSelector(effectiveQuality),
                "--merge-output-format", "mp4"));
        if (skipPostprocessing) {
            args.add("--fixup");
            args.add("never");
        } else {
            args.add("--postprocessor-args");
            args.add("Merger:-movflags +faststart");
        }
        return args;
    }

    /**
     * yt-dlp names subtitle files {@code <stem>.<lang>.<ext>}, so the template carries only the stem.
     */
    static String subtitleOutputTemplate(Path outputPath) {
        String stem = PathUtils.getStem(outputPath.getFileName().toString());
        return outputPath.resolveSibling(stem + ".%(ext)s").toString();
    }

    private List<String> subtitleArgs(boolean skipPostprocessing) {
        List<String> args = new ArrayList<>(List.of(
                "--skip-download",
                "--write-subs",
                "--write-auto-subs",
                "--sub-langs", properties.getYtdlp().getSubtitleLanguages(),
                "--sub-format", "srt/vtt/best"));
        if (skipPostprocessing) {
            args.add("--fixup");
            args.add("never");
        } else {
            args.add("--convert-subs");
            args.add("srt");
        }
        return args;
    }

    private static int parseHeight(String height) {
        if (height == null || height.isBlank()) {
            return 720;
        }
        String digits = height.trim().toLowerCase(Locale.ROOT).replace("p", "");
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 720;
        }
    }

    private static String redactProxy(List<String> command) {
        List<String> redacted = new ArrayList<>(command);
        for (int i = 0; i < redacted.size() - 1; i++) {
            if ("--proxy".equals(redacted.get(i))) {
                redacted.set(i + 1, ProxyConfig.maskPassword(redacted.get(i + 1)));
            }
        }
        return String.join(" ", redacted);
    }
}
