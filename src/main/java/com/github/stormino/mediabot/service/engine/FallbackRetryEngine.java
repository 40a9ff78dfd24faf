package com.github.stormino.mediabot.service.engine;

import com.github.stormino.mediabot.config.MediaBotProperties;
import com.github.stormino.mediabot.exception.ExtractionException;
import com.github.stormino.mediabot.model.ErrorKind;
import com.github.stormino.mediabot.model.ProxyConfig;
import com.github.stormino.mediabot.service.classifier.ErrorClassifier;
import com.github.stormino.mediabot.service.command.TierConfig.Tier;
import com.github.stormino.mediabot.service.cookies.CookieRefreshClient;
import com.github.stormino.mediabot.util.PathUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one download through the proxy chain, escalating through the three tiers on each
 * proxy according to the classified failure.
 *
 * <p>Per proxy: Tier 1 first. A purely network-related failure moves on to the next proxy
 * while one remains. Cookie, bot-detection and network failures get Tier 2 on the same
 * proxy; a Tier 2 cookie failure triggers one credential refresh and, if it succeeds, a
 * restart from Tier 1. A post-processing failure from Tier 1 or Tier 2 gets Tier 3. Partial
 * output is deleted before every attempt except the first.</p>
 */
@Slf4j
@Component
public class FallbackRetryEngine {

    private final ErrorClassifier classifier;
    private final CookieRefreshClient cookieRefreshClient;
    private final EngineStats stats;
    private final Duration refreshTimeout;
    private final Duration postRefreshDelay;

    @Autowired
    public FallbackRetryEngine(ErrorClassifier classifier, CookieRefreshClient cookieRefreshClient,
                               EngineStats stats, MediaBotProperties properties) {
        this(classifier, cookieRefreshClient, stats,
                Duration.ofSeconds(properties.getCookies().getRefreshTimeoutSeconds()),
                Duration.ofMillis(properties.getCookies().getPostRefreshDelayMs()));
    }

    public FallbackRetryEngine(ErrorClassifier classifier, CookieRefreshClient cookieRefreshClient,
                               EngineStats stats, Duration refreshTimeout, Duration postRefreshDelay) {
        this.classifier = classifier;
        this.cookieRefreshClient = cookieRefreshClient;
        this.stats = stats;
        this.refreshTimeout = refreshTimeout;
        this.postRefreshDelay = postRefreshDelay;
    }

    /**
     * @param url        source URL, passed to the credential refresh
     * @param outputPath requested output path, cleaned between attempts
     * @param proxies    ordered chain, never empty
     * @param attempt    runs one tier on one proxy
     * @return the successful attempt
     * @throws ExtractionException with the last classified error when every proxy is exhausted
     */
    public AttemptResult execute(@NonNull String url, @NonNull Path outputPath,
                                 @NonNull List<ProxyConfig> proxies, @NonNull TierAttempt attempt) {
        if (proxies.isEmpty()) {
            throw new IllegalArgumentException("Proxy chain must not be empty");
        }

        ErrorKind lastKind = ErrorKind.UNKNOWN;
        String lastDiagnostic = null;
        Tier lastTier = Tier.TIER_1;
        String lastProxyName = null;
        boolean firstAttempt = true;

        for (int index = 0; index < proxies.size(); index++) {
            ProxyConfig proxy = proxies.get(index);
            boolean moreProxies = index < proxies.size() - 1;
            boolean refreshUsed = false;
            lastProxyName = proxy.getName();

            log.info("Trying proxy {}/{}: {}", index + 1, proxies.size(), proxy);

            while (true) {
                // Tier 1
                if (!firstAttempt) {
                    PathUtils.deletePartialOutputs(outputPath);
                }
                firstAttempt = false;
                AttemptResult tier1 = attempt.run(Tier.TIER_1, proxy);
                if (tier1.isSuccess()) {
                    return succeeded(tier1);
                }
                ErrorKind tier1Kind = failed(tier1);
                lastKind = tier1Kind;
                lastDiagnostic = tier1.getDiagnostic();
                lastTier = Tier.TIER_1;

                boolean networkOnly = tier1Kind == ErrorKind.NETWORK_ERROR
                        || (classifier.isProxyRelated(tier1.getDiagnostic()) && tier1Kind != ErrorKind.BOT_DETECTION);
                if (networkOnly && moreProxies) {
                    log.warn("{} on {} looks network related, switching proxy", tier1Kind, proxy.getName());
                    break;
                }

                ErrorKind escalationKind = tier1Kind;

                // Tier 2
                if (tier1Kind == ErrorKind.INVALID_COOKIES
                        || tier1Kind == ErrorKind.BOT_DETECTION
                        || tier1Kind == ErrorKind.NETWORK_ERROR) {
                    PathUtils.deletePartialOutputs(outputPath);
                    AttemptResult tier2 = attempt.run(Tier.TIER_2, proxy);
                    if (tier2.isSuccess()) {
                        return succeeded(tier2);
                    }
                    ErrorKind tier2Kind = failed(tier2);
                    lastKind = tier2Kind;
                    lastDiagnostic = tier2.getDiagnostic();
                    lastTier = Tier.TIER_2;
                    escalationKind = tier2Kind;

                    if (tier2Kind == ErrorKind.INVALID_COOKIES && !refreshUsed) {
                        refreshUsed = true;
                        if (awaitCookieRefresh(url)) {
                            log.info("Cookies refreshed, restarting from Tier 1 on {}", proxy.getName());
                            pause(postRefreshDelay);
                            continue;
                        }
                        log.warn("Cookie refresh declined or timed out for {}", url);
                    } else if (tier2Kind == ErrorKind.BOT_DETECTION) {
                        stats.recordBurnedProxy(proxy.getName());
                        log.error("Bot detection with valid credentials on {}: proxy identity is likely burned",
                                proxy.getName());
                    }
                }

                // Tier 3
                if (tier1Kind == ErrorKind.POSTPROCESSING_ERROR || escalationKind == ErrorKind.POSTPROCESSING_ERROR) {
                    PathUtils.deletePartialOutputs(outputPath);
                    AttemptResult tier3 = attempt.run(Tier.TIER_3, proxy);
                    if (tier3.isSuccess()) {
                        log.warn("Download of {} succeeded only with post-processing disabled", url);
                        return succeeded(tier3);
                    }
                    lastKind = failed(tier3);
                    lastDiagnostic = tier3.getDiagnostic();
                    lastTier = Tier.TIER_3;
                }
                break;
            }

            if (moreProxies) {
                log.warn("All tiers failed on {} ({}), advancing to next proxy", proxy.getName(), lastKind);
            }
        }

        stats.recordExhausted();
        log.error("All {} proxies exhausted for {}: {} at {}", proxies.size(), url, lastKind, lastTier);
        throw new ExtractionException("Download failed: " + lastKind.getDisplayName(),
                lastKind, lastDiagnostic, lastTier.getNumber(), lastProxyName);
    }

    private AttemptResult succeeded(AttemptResult result) {
        stats.recordSuccess();
        log.info("{} succeeded on {}", result.getTier(), result.getProxy() != null ? result.getProxy().getName() : "direct");
        return result;
    }

    private ErrorKind failed(AttemptResult result) {
        ErrorKind kind = classifier.classify(result.getDiagnostic());
        stats.recordFailure(result.getTier(), kind);
        log.warn("{} failed on {} with {}: {}", result.getTier(),
                result.getProxy() != null ? result.getProxy().getName() : "direct",
                kind, abbreviate(result.getDiagnostic()));
        return kind;
    }

    /**
     * A refresh that does not answer within the timeout counts as refused.
     */
    private boolean awaitCookieRefresh(String url) {
        CompletableFuture<Boolean> refresh = cookieRefreshClient.requestRefresh("InvalidCookies", url);
        try {
            return Boolean.TRUE.equals(refresh.get(refreshTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            refresh.cancel(true);
            log.warn("Cookie refresh did not answer within {}s", refreshTimeout.toSeconds());
            return false;
        } catch (ExecutionException e) {
            log.warn("Cookie refresh failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String singleLine = text.replace('\n', ' ');
        return singleLine.length() > 300 ? singleLine.substring(singleLine.length() - 300) : singleLine;
    }
}
