package com.github.stormino.mediabot.service.backend;

import com.github.stormino.mediabot.model.DownloadOutput;
import com.github.stormino.mediabot.model.DownloadRequest;
import com.github.stormino.mediabot.model.MediaMetadata;
import com.github.stormino.mediabot.service.progress.ProgressSink;

import java.util.Optional;

/**
 * A pluggable unit that can download one class of URLs.
 */
public interface SourceBackend {

    /**
     * Stable backend name used in logs and results.
     */
    String name();

    /**
     * Whether this backend handles the URL. Must be cheap and must not perform I/O.
     */
    boolean supports(String url);

    /**
     * Title and artist of the media.
     *
     * @throws com.github.stormino.mediabot.exception.DownloadException when the source cannot be read
     */
    MediaMetadata metadata(String url);

    /**
     * Best-effort size estimate in bytes. Never throws; empty when unknown.
     */
    Optional<Long> estimateSize(String url);

    /**
     * Best-effort livestream check. Never throws; false when uncertain.
     */
    boolean isLivestream(String url);

    /**
     * Transfer the media, reporting progress to the sink.
     *
     * @throws com.github.stormino.mediabot.exception.DownloadException on failure
     */
    DownloadOutput download(DownloadRequest request, ProgressSink progressSink);
}
