package com.github.stormino.mediabot.service.progress;

import com.github.stormino.mediabot.model.SourceProgress;
import com.github.stormino.mediabot.util.DownloadConstants;
import lombok.extern.slf4j.Slf4j;

/**
 * Coalesces progress events: forwards one only when percent advanced by at least the
 * step since the last forwarded event, or reached 100. A drop in percent starts a new
 * attempt and is always forwarded.
 */
@Slf4j
public class ProgressThrottle implements ProgressSink {

    private final ProgressSink delegate;
    private final double stepPercent;
    private double lastPercent = -1;

    public ProgressThrottle(ProgressSink delegate) {
        this(delegate, DownloadConstants.PROGRESS_STEP_PERCENT);
    }

    public ProgressThrottle(ProgressSink delegate, double stepPercent) {
        this.delegate = delegate;
        this.stepPercent = stepPercent;
    }

    @Override
    public synchronized void accept(SourceProgress progress) {
        double percent = progress.getPercent();
        boolean restarted = lastPercent >= 0 && percent < lastPercent;
        boolean first = lastPercent < 0;
        boolean advanced = percent - lastPercent >= stepPercent;
        boolean finished = percent >= 100.0 && lastPercent < 100.0;

        if (!(first || restarted || advanced || finished)) {
            return;
        }
        lastPercent = percent;
        try {
            delegate.accept(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed: {}", e.getMessage());
        }
    }

    /**
     * Forget the last forwarded percent, e.g. before a new tier or proxy.
     */
    public synchronized void reset() {
        lastPercent = -1;
    }
}
