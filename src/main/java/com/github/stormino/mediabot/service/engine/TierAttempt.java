package com.github.stormino.mediabot.service.engine;

import com.github.stormino.mediabot.model.ProxyConfig;
import com.github.stormino.mediabot.service.command.TierConfig;

/**
 * Runs one tier through one proxy. Must not throw for ordinary tool failures;
 * those are reported as a failed {@link AttemptResult}.
 */
@FunctionalInterface
public interface TierAttempt {

    AttemptResult run(TierConfig.Tier tier, ProxyConfig proxy);
}
