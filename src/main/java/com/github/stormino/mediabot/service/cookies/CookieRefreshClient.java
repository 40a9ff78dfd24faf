package com.github.stormino.mediabot.service.cookies;

import java.util.concurrent.CompletableFuture;

/**
 * Asks the external cookie/session manager to refresh credentials.
 */
public interface CookieRefreshClient {

    /**
     * @param reason error tag, e.g. {@code InvalidCookies}
     * @param url    URL that failed
     * @return completes with true when the caller should retry now
     */
    CompletableFuture<Boolean> requestRefresh(String reason, String url);
}
