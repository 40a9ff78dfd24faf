package com.github.stormino.mediabot.service.engine;

import com.github.stormino.mediabot.config.MediaBotProperties;
import com.github.stormino.mediabot.exception.ConfigurationException;
import com.github.stormino.mediabot.model.ProxyConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resolves the ordered proxy chain from configuration. A direct connection is always last.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProxyChainProvider {

    private final MediaBotProperties properties;

    public List<ProxyConfig> getChain() {
        return buildChain(properties.getProxy().getUrls());
    }

    public static List<ProxyConfig> buildChain(List<String> urls) {
        List<ProxyConfig> chain = new ArrayList<>();
        if (urls != null) {
            for (String raw : urls) {
                if (raw == null) {
                    continue;
                }
                String url = raw.trim();
                String lower = url.toLowerCase(Locale.ROOT);
                if (url.isEmpty() || lower.equals("none") || lower.equals("disabled")) {
                    continue;
                }
                if (!url.contains("://")) {
                    throw new ConfigurationException("Proxy URL must include a scheme",
                            "mediabot.proxy.urls", ProxyConfig.maskPassword(url));
                }
                chain.add(ProxyConfig.builder().name(nameFor(lower)).url(url).build());
            }
        }
        chain.add(ProxyConfig.direct());
        return List.copyOf(chain);
    }

    static String nameFor(String lowerUrl) {
        if (lowerUrl.contains("geonode.com")) {
            return "Geonode Residential";
        }
        if (lowerUrl.contains("cloudflare")) {
            return "WARP (Cloudflare)";
        }
        return "Custom Proxy";
    }
}
