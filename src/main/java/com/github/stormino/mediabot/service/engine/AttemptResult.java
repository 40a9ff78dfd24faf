package com.github.stormino.mediabot.service.engine;

import com.github.stormino.mediabot.model.ProxyConfig;
import com.github.stormino.mediabot.service.command.TierConfig;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one tier on one proxy.
 */
@Data
@Builder
public class AttemptResult {

    private final boolean success;
    private final TierConfig.Tier tier;
    private final ProxyConfig proxy;

    /**
     * Raw diagnostic text of a failed attempt.
     */
    private final String diagnostic;

    public static AttemptResult success(TierConfig.Tier tier, ProxyConfig proxy) {
        return AttemptResult.builder().success(true).tier(tier).proxy(proxy).build();
    }

    public static AttemptResult failure(TierConfig.Tier tier, ProxyConfig proxy, String diagnostic) {
        return AttemptResult.builder().success(false).tier(tier).proxy(proxy).diagnostic(diagnostic).build();
    }
}
