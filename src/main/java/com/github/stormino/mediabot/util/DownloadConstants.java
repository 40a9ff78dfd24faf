package com.github.stormino.mediabot.util;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Constants used throughout the download system.
 */
public final class DownloadConstants {

    private DownloadConstants() {
        // Utility class, no instantiation
    }

    // ========== Subprocess ==========

    /**
     * Number of trailing stderr lines kept for classification.
     */
    public static final int STDERR_TAIL_LINES = 200;

    /**
     * Grace period for reaping a killed process.
     */
    public static final long KILL_REAP_TIMEOUT_SECONDS = 5;

    // ========== Progress Tracking ==========

    /**
     * Minimum percent advance before a new progress event is emitted.
     */
    public static final double PROGRESS_STEP_PERCENT = 5.0;

    /**
     * How long a finished subprocess waits for queued progress to reach its sink.
     */
    public static final long PROGRESS_FLUSH_TIMEOUT_MS = 1000;

    // ========== Size estimation ==========

    /**
     * Container/merge overhead added to the extractor's approximate size.
     */
    public static final double SIZE_ESTIMATE_OVERHEAD = 1.15;

    // ========== Partial output ==========

    /**
     * Suffixes the extraction tool leaves behind for unfinished transfers.
     */
    public static final List<String> PARTIAL_SUFFIXES = List.of(".part", ".ytdl", ".temp");

    /**
     * Marker for per-fragment leftovers, e.g. {@code video.mp4.part-Frag12}.
     */
    public static final String FRAGMENT_MARKER = ".part-Frag";

    // ========== Media types ==========

    /**
     * Direct media file extensions and their MIME types.
     */
    public static final Map<String, String> MEDIA_MIME_TYPES = Map.ofEntries(
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("wav", "audio/wav"),
            Map.entry("flac", "audio/flac"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("m4a", "audio/mp4"),
            Map.entry("webm", "video/webm"),
            Map.entry("avi", "video/x-msvideo"),
            Map.entry("mkv", "video/x-matroska"),
            Map.entry("aac", "audio/aac"),
            Map.entry("opus", "audio/opus")
    );

    /**
     * Subtitle outputs and their MIME types.
     */
    public static final Map<String, String> SUBTITLE_MIME_TYPES = Map.of(
            "srt", "application/x-subrip",
            "vtt", "text/vtt",
            "txt", "text/plain"
    );

    /**
     * Extensions the extraction tool never claims: direct media and archives.
     */
    public static final Set<String> NON_EXTRACTABLE_EXTENSIONS = Set.of(
            "mp3", "mp4", "wav", "flac", "ogg", "m4a", "webm", "avi", "mkv", "zip", "rar", "pdf");

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";
}
