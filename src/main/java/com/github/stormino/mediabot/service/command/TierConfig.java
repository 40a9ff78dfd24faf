package com.github.stormino.mediabot.service.command;

import com.github.stormino.mediabot.model.ProxyConfig;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument set of one escalation tier, built once per task. Rendering is pure.
 */
@Data
@Builder
public class TierConfig {

    public enum Tier {
        TIER_1(1, "unauthenticated"),
        TIER_2(2, "authenticated"),
        TIER_3(3, "authenticated, no post-processing");

        private final int number;
        private final String description;

        Tier(int number, String description) {
            this.number = number;
            this.description = description;
        }

        public int getNumber() {
            return number;
        }

        public String getDescription() {
            return description;
        }
    }

    public enum AuthMode {
        NONE,
        COOKIES_FILE,
        COOKIES_FROM_BROWSER
    }

    private final Tier tier;

    /**
     * Output, tuning and media-kind flags.
     */
    private final List<String> baseArgs;

    private final AuthMode authMode;

    /**
     * Cookies file path or browser name, depending on {@link #authMode}.
     */
    private final String authValue;

    private final ProxyConfig proxy;

    /**
     * Client emulation, token provider and time-range flags.
     */
    private final List<String> extraFlags;

    public List<String> authArgs() {
        return switch (authMode) {
            case COOKIES_FILE -> List.of("--cookies", authValue);
            case COOKIES_FROM_BROWSER -> List.of("--cookies-from-browser", authValue);
            case NONE -> List.of();
        };
    }

    public List<String> proxyArgs() {
        if (proxy == null || proxy.isDirect()) {
            return List.of();
        }
        return List.of("--proxy", proxy.getUrl());
    }

    /**
     * Full argv; the URL is always the last element.
     */
    public List<String> toCommand(String binary, String url) {
        List<String> command = new ArrayList<>();
        command.add(binary);
        command.addAll(baseArgs);
        command.addAll(proxyArgs());
        command.addAll(authArgs());
        command.addAll(extraFlags);
        command.add(url);
        return command;
    }
}
