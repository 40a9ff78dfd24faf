package com.github.stormino.mediabot.service.classifier;

import com.github.stormino.mediabot.model.ErrorKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps raw extraction-tool diagnostics to an {@link ErrorKind}.
 * Stateless: every method is a pure function of its input.
 */
@Component
public class ErrorClassifier {

    private static final List<String> BOT_CHALLENGE_SIGNATURES = List.of(
            "sign in to confirm you're not a bot",
            "sign in to confirm you’re not a bot",
            "confirm you're not a bot",
            "confirm you’re not a bot");

    private static final List<String> INVALID_COOKIES_SIGNATURES = List.of(
            "cookies are no longer valid",
            "cookies have likely been rotated",
            "please sign in",
            "use --cookies-from-browser",
            "use --cookies for the authentication",
            "the provided youtube account cookies are no longer valid");

    private static final List<String> FRAGMENT_SIGNATURES = List.of(
            "http error 403",
            "retrying fragment",
            "fragment not found",
            "skipping fragment");

    private static final List<String> BOT_DETECTION_SIGNATURES = List.of(
            "bot detection",
            "http error 403",
            "unable to extract",
            "signature extraction failed");

    private static final List<String> UNAVAILABLE_SIGNATURES = List.of(
            "private video",
            "video unavailable",
            "this video is not available",
            "video is private",
            "video has been removed",
            "this video does not exist",
            "video is not available");

    private static final List<String> NETWORK_SIGNATURES = List.of(
            "timeout",
            "connection",
            "network",
            "socket",
            "dns",
            "failed to connect");

    private static final List<String> POSTPROCESSING_SIGNATURES = List.of(
            "postprocessing",
            "conversion failed",
            "fixupm3u8",
            "ffmpeg",
            "merger",
            "error fixing");

    private static final List<String> DISK_SPACE_SIGNATURES = List.of(
            "no space left",
            "disk quota",
            "not enough space",
            "insufficient disk space",
            "enospc",
            "no free space",
            "disk full");

    private static final List<String> PROXY_SIGNATURES = List.of(
            "proxy",
            "tunnel",
            "socks",
            "407",
            "forbidden",
            "403",
            "timed out",
            "timeout",
            "dns",
            "connection refused",
            "connection reset");

    private static final List<String> TOOL_OUTPUT_MARKERS = List.of(
            "error:",
            "[youtube]",
            "[download]",
            "yt-dlp",
            "youtube-dl",
            "http error",
            "--cookies");

    /**
     * Classify diagnostic text. Order matters: the first matching group wins.
     *
     * @param diagnostic raw stderr or error text, may be null
     * @return the kind, {@link ErrorKind#UNKNOWN} when nothing matches
     */
    public ErrorKind classify(String diagnostic) {
        if (diagnostic == null || diagnostic.isBlank()) {
            return ErrorKind.UNKNOWN;
        }
        String text = diagnostic.toLowerCase(Locale.ROOT);

        if (containsAny(text, BOT_CHALLENGE_SIGNATURES)) {
            return ErrorKind.BOT_DETECTION;
        }
        if (containsAny(text, INVALID_COOKIES_SIGNATURES)) {
            return ErrorKind.INVALID_COOKIES;
        }
        // must precede the generic 403 bot-detection rule
        if (text.contains("fragment") && containsAny(text, FRAGMENT_SIGNATURES)) {
            return ErrorKind.FRAGMENT_ERROR;
        }
        if (containsAny(text, BOT_DETECTION_SIGNATURES)) {
            return ErrorKind.BOT_DETECTION;
        }
        if (containsAny(text, UNAVAILABLE_SIGNATURES)) {
            return ErrorKind.VIDEO_UNAVAILABLE;
        }
        if (containsAny(text, NETWORK_SIGNATURES)) {
            return ErrorKind.NETWORK_ERROR;
        }
        if (containsAny(text, POSTPROCESSING_SIGNATURES)) {
            return ErrorKind.POSTPROCESSING_ERROR;
        }
        if (containsAny(text, DISK_SPACE_SIGNATURES)) {
            return ErrorKind.DISK_SPACE_ERROR;
        }
        return ErrorKind.UNKNOWN;
    }

    /**
     * Whether switching the egress path could plausibly fix this failure.
     * Cookie problems never are; bot detection and network errors always are.
     */
    public boolean isProxyRelated(String diagnostic) {
        ErrorKind kind = classify(diagnostic);
        if (kind == ErrorKind.INVALID_COOKIES) {
            return false;
        }
        if (kind == ErrorKind.BOT_DETECTION || kind == ErrorKind.NETWORK_ERROR) {
            return true;
        }
        if (diagnostic == null) {
            return false;
        }
        return containsAny(diagnostic.toLowerCase(Locale.ROOT), PROXY_SIGNATURES);
    }

    public String userMessage(ErrorKind kind) {
        return switch (kind) {
            case INVALID_COOKIES -> "The source requires authentication that is temporarily unavailable. Please try again later.";
            case BOT_DETECTION -> "The source blocked the request. Please try again later.";
            case VIDEO_UNAVAILABLE -> "This media is unavailable: it may be private, removed or region-locked.";
            case NETWORK_ERROR -> "Network problem. Try again in a minute.";
            case FRAGMENT_ERROR -> "Parts of the media could not be downloaded. Please try again.";
            case POSTPROCESSING_ERROR -> "The file was downloaded but could not be processed.";
            case DISK_SPACE_ERROR -> "The server is out of disk space. The administrator has been notified.";
            case UNKNOWN -> "Download failed. Please try again later.";
        };
    }

    /**
     * Kinds that need operator action rather than a user retry.
     */
    public boolean shouldNotifyAdmin(ErrorKind kind) {
        return kind == ErrorKind.INVALID_COOKIES
                || kind == ErrorKind.BOT_DETECTION
                || kind == ErrorKind.DISK_SPACE_ERROR
                || kind == ErrorKind.UNKNOWN;
    }

    public String recommendation(ErrorKind kind) {
        return switch (kind) {
            case INVALID_COOKIES -> "Refresh the cookies file or re-export cookies from the browser.";
            case BOT_DETECTION -> "Rotate the proxy and check that the PO token provider is running.";
            case VIDEO_UNAVAILABLE -> "No action needed: the media is not accessible.";
            case NETWORK_ERROR -> "Check the proxy chain and outbound connectivity.";
            case FRAGMENT_ERROR -> "Retry later; persistent fragment 403s usually mean a burned proxy.";
            case POSTPROCESSING_ERROR -> "Check the ffmpeg installation and version.";
            case DISK_SPACE_ERROR -> "Free disk space in the download directory.";
            case UNKNOWN -> "Inspect the raw diagnostic in the logs and update the extraction tool.";
        };
    }

    /**
     * Turn raw error text into something safe to show a user. Extraction-tool output is
     * replaced by the classified message; other text passes through unchanged.
     */
    public String sanitizeUserMessage(String raw) {
        if (raw == null || raw.isBlank()) {
            return userMessage(ErrorKind.UNKNOWN);
        }
        String text = raw.toLowerCase(Locale.ROOT);
        if (containsAny(text, TOOL_OUTPUT_MARKERS)) {
            return userMessage(classify(raw));
        }
        return raw;
    }

    private static boolean containsAny(String text, List<String> signatures) {
        for (String signature : signatures) {
            if (text.contains(signature)) {
                return true;
            }
        }
        return false;
    }
}
