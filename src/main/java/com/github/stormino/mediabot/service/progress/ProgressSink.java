package com.github.stormino.mediabot.service.progress;

import com.github.stormino.mediabot.model.SourceProgress;

/**
 * One-directional progress channel. Implementations must return quickly and never throw
 * back into the download.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NOOP = progress -> { };

    void accept(SourceProgress progress);
}
