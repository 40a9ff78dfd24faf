package com.github.stormino.mediabot.model;

import lombok.Builder;
import lombok.Data;

/**
 * One egress path of the proxy chain. A null url means a direct connection.
 */
@Data
@Builder
public class ProxyConfig {

    private final String name;
    private final String url;

    public static ProxyConfig direct() {
        return ProxyConfig.builder().name("Direct (no proxy)").build();
    }

    public boolean isDirect() {
        return url == null;
    }

    /**
     * Proxy URL with the password replaced by {@code ***}, safe for logs.
     */
    public String maskedUrl() {
        return url == null ? "direct" : maskPassword(url);
    }

    public static String maskPassword(String proxyUrl) {
        int schemeEnd = proxyUrl.indexOf("://");
        int start = schemeEnd < 0 ? 0 : schemeEnd + 3;
        int at = proxyUrl.lastIndexOf('@');
        if (at < start) {
            return proxyUrl;
        }
        String credentials = proxyUrl.substring(start, at);
        int colon = credentials.indexOf(':');
        if (colon < 0) {
            return proxyUrl;
        }
        return proxyUrl.substring(0, start)
                + credentials.substring(0, colon) + ":***"
                + proxyUrl.substring(at);
    }

    @Override
    public String toString() {
        return name + " [" + maskedUrl() + "]";
    }
}
