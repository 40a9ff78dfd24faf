package com.github.stormino.mediabot.service.engine;

import com.github.stormino.mediabot.exception.ExtractionException;
import com.github.stormino.mediabot.model.ErrorKind;
import com.github.stormino.mediabot.model.ProxyConfig;
import com.github.stormino.mediabot.service.classifier.ErrorClassifier;
import com.github.stormino.mediabot.service.command.TierConfig.Tier;
import com.github.stormino.mediabot.service.cookies.CookieRefreshClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FallbackRetryEngine")
class FallbackRetryEngineTest {

    private static final String URL = "https://www.youtube.com/watch?v=abc";

    private static final String NETWORK = "ERROR: Connection refused";
    private static final String COOKIES = "ERROR: [youtube] abc: The provided YouTube account cookies are no longer valid";
    private static final String BOT = "ERROR: unable to download video data: HTTP Error 403: Forbidden";
    private static final String POSTPROCESSING = "ERROR: Postprocessing: Conversion failed!";
    private static final String UNAVAILABLE = "ERROR: [youtube] abc: Video unavailable";

    private static final ProxyConfig PROXY_1 = ProxyConfig.builder().name("Proxy 1").url("http://p1:8080").build();
    private static final ProxyConfig PROXY_2 = ProxyConfig.builder().name("Proxy 2").url("http://p2:8080").build();
    private static final ProxyConfig DIRECT = ProxyConfig.direct();

    @TempDir
    Path tempDir;

    private Path output;
    private EngineStats stats;
    private AtomicInteger refreshCalls;
    private CompletableFuture<Boolean> refreshAnswer;
    private FallbackRetryEngine engine;

    @BeforeEach
    void setUp() {
        output = tempDir.resolve("out.mp4");
        stats = new EngineStats();
        refreshCalls = new AtomicInteger();
        refreshAnswer = CompletableFuture.completedFuture(false);
        CookieRefreshClient cookieClient = (reason, url) -> {
            refreshCalls.incrementAndGet();
            return refreshAnswer;
        };
        engine = new FallbackRetryEngine(new ErrorClassifier(), cookieClient, stats,
                Duration.ofMillis(200), Duration.ZERO);
    }

    /**
     * Attempt double that records each call and answers from a script.
     */
    private static final class ScriptedAttempt implements TierAttempt {
        private final List<String> calls = new ArrayList<>();
        private final BiFunction<Integer, ProxyConfig, String> script;

        private ScriptedAttempt(BiFunction<Integer, ProxyConfig, String> script) {
            this.script = script;
        }

        /**
         * @param script call index and proxy to a diagnostic, null meaning success
         */
        static ScriptedAttempt of(BiFunction<Integer, ProxyConfig, String> script) {
            return new ScriptedAttempt(script);
        }

        @Override
        public AttemptResult run(Tier tier, ProxyConfig proxy) {
            int index = calls.size();
            calls.add(tier.name() + "@" + proxy.getName());
            String diagnostic = script.apply(index, proxy);
            return diagnostic == null
                    ? AttemptResult.success(tier, proxy)
                    : AttemptResult.failure(tier, proxy, diagnostic);
        }

        long count(Tier tier) {
            return calls.stream().filter(call -> call.startsWith(tier.name() + "@")).count();
        }
    }

    @Nested
    @DisplayName("escalation")
    class EscalationTests {

        @Test
        @DisplayName("invalid cookies on tier 1 should escalate to tier 2 on the same proxy")
        void invalidCookiesShouldEscalateToTierTwo() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> i == 0 ? COOKIES : null);

            AttemptResult result = engine.execute(URL, output, List.of(DIRECT), attempt);

            assertEquals(Tier.TIER_2, result.getTier());
            assertEquals(1, attempt.count(Tier.TIER_1));
            assertEquals(1, attempt.count(Tier.TIER_2));
            assertEquals(0, attempt.count(Tier.TIER_3));
            assertEquals(1, stats.getFailureCount(Tier.TIER_1, ErrorKind.INVALID_COOKIES));
        }

        @Test
        @DisplayName("post-processing failure on tier 1 should go straight to tier 3")
        void postprocessingShouldGoToTierThree() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> i == 0 ? POSTPROCESSING : null);

            AttemptResult result = engine.execute(URL, output, List.of(DIRECT), attempt);

            assertEquals(Tier.TIER_3, result.getTier());
            assertEquals(List.of("TIER_1@Direct (no proxy)", "TIER_3@Direct (no proxy)"), attempt.calls);
        }

        @Test
        @DisplayName("post-processing failure on tier 2 should go to tier 3")
        void tierTwoPostprocessingShouldGoToTierThree() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> switch (i) {
                case 0 -> BOT;
                case 1 -> POSTPROCESSING;
                default -> null;
            });

            AttemptResult result = engine.execute(URL, output, List.of(DIRECT), attempt);

            assertEquals(Tier.TIER_3, result.getTier());
            assertEquals(3, attempt.calls.size());
        }

        @Test
        @DisplayName("unavailable media should not escalate")
        void unavailableShouldNotEscalate() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> UNAVAILABLE);

            ExtractionException e = assertThrows(ExtractionException.class,
                    () -> engine.execute(URL, output, List.of(DIRECT), attempt));

            assertEquals(ErrorKind.VIDEO_UNAVAILABLE, e.getErrorKind());
            assertEquals(1, attempt.calls.size());
            assertEquals(1, e.getLastTier());
        }

        @Test
        @DisplayName("success on the first attempt should not touch other tiers")
        void firstSuccessShouldStop() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> null);

            AttemptResult result = engine.execute(URL, output, List.of(PROXY_1, DIRECT), attempt);

            assertTrue(result.isSuccess());
            assertEquals(PROXY_1, result.getProxy());
            assertEquals(1, attempt.calls.size());
        }
    }

    @Nested
    @DisplayName("proxy chain")
    class ProxyChainTests {

        @Test
        @DisplayName("network errors should walk the chain and end with tier 2 on the last proxy")
        void networkErrorsShouldExhaustChain() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> NETWORK);

            ExtractionException e = assertThrows(ExtractionException.class,
                    () -> engine.execute(URL, output, List.of(PROXY_1, PROXY_2, DIRECT), attempt));

            assertEquals(3, attempt.count(Tier.TIER_1));
            assertEquals(1, attempt.count(Tier.TIER_2));
            assertEquals(0, attempt.count(Tier.TIER_3));
            assertEquals(List.of("TIER_1@Proxy 1", "TIER_1@Proxy 2", "TIER_1@Direct (no proxy)",
                    "TIER_2@Direct (no proxy)"), attempt.calls);
            assertEquals(ErrorKind.NETWORK_ERROR, e.getErrorKind());
            assertEquals(2, e.getLastTier());
            assertEquals("Direct (no proxy)", e.getProxyName());
            assertEquals(NETWORK, e.getDiagnostic());
        }

        @Test
        @DisplayName("a network error should switch to the next proxy which may succeed")
        void networkErrorShouldSwitchProxy() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> proxy == PROXY_1 ? NETWORK : null);

            AttemptResult result = engine.execute(URL, output, List.of(PROXY_1, DIRECT), attempt);

            assertEquals(DIRECT, result.getProxy());
            assertEquals(Tier.TIER_1, result.getTier());
        }

        @Test
        @DisplayName("bot detection with credentials should mark the proxy burned and move on")
        void botDetectionShouldBurnProxy() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> proxy == PROXY_1 ? BOT : null);

            AttemptResult result = engine.execute(URL, output, List.of(PROXY_1, DIRECT), attempt);

            assertEquals(DIRECT, result.getProxy());
            assertEquals(List.of("TIER_1@Proxy 1", "TIER_2@Proxy 1", "TIER_1@Direct (no proxy)"), attempt.calls);
            assertEquals(1, stats.getBurnedCount("Proxy 1"));
            assertEquals(0, stats.getBurnedCount("Direct (no proxy)"));
        }

        @Test
        @DisplayName("an empty chain should be rejected")
        void emptyChainShouldBeRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> engine.execute(URL, output, List.of(), ScriptedAttempt.of((i, p) -> null)));
        }
    }

    @Nested
    @DisplayName("cookie refresh")
    class CookieRefreshTests {

        @Test
        @DisplayName("a successful refresh should restart from tier 1 on the same proxy")
        void refreshShouldRestartTierOne() {
            refreshAnswer = CompletableFuture.completedFuture(true);
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> i < 2 ? COOKIES : null);

            AttemptResult result = engine.execute(URL, output, List.of(DIRECT), attempt);

            assertEquals(Tier.TIER_1, result.getTier());
            assertEquals(List.of("TIER_1@Direct (no proxy)", "TIER_2@Direct (no proxy)", "TIER_1@Direct (no proxy)"),
                    attempt.calls);
            assertEquals(1, refreshCalls.get());
        }

        @Test
        @DisplayName("refresh should happen at most once per proxy")
        void refreshShouldHappenOncePerProxy() {
            refreshAnswer = CompletableFuture.completedFuture(true);
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> COOKIES);

            ExtractionException e = assertThrows(ExtractionException.class,
                    () -> engine.execute(URL, output, List.of(DIRECT), attempt));

            assertEquals(ErrorKind.INVALID_COOKIES, e.getErrorKind());
            assertEquals(1, refreshCalls.get());
            assertEquals(4, attempt.calls.size());
        }

        @Test
        @DisplayName("a declined refresh should not restart")
        void declinedRefreshShouldNotRestart() {
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> COOKIES);

            assertThrows(ExtractionException.class, () -> engine.execute(URL, output, List.of(DIRECT), attempt));

            assertEquals(1, refreshCalls.get());
            assertEquals(2, attempt.calls.size());
        }

        @Test
        @DisplayName("a refresh that never answers should count as declined and be cancelled")
        void silentRefreshShouldTimeOut() {
            refreshAnswer = new CompletableFuture<>();
            ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> COOKIES);

            long started = System.nanoTime();
            assertThrows(ExtractionException.class, () -> engine.execute(URL, output, List.of(DIRECT), attempt));
            long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

            assertEquals(2, attempt.calls.size());
            assertTrue(refreshAnswer.isCancelled());
            assertTrue(elapsedMillis < 5000, "took " + elapsedMillis + "ms");
        }
    }

    @Test
    @DisplayName("partial output should be removed before every retry")
    void partialOutputShouldBeRemovedBeforeRetry() throws IOException {
        Path partial = tempDir.resolve("out.mp4.part");
        Path fragment = tempDir.resolve("out.f137.mp4.part-Frag2");
        List<Boolean> partialSeen = new ArrayList<>();

        ScriptedAttempt attempt = ScriptedAttempt.of((i, proxy) -> {
            partialSeen.add(Files.exists(partial) || Files.exists(fragment));
            if (i == 0) {
                try {
                    Files.writeString(partial, "half a video");
                    Files.writeString(fragment, "frag");
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return NETWORK;
            }
            return null;
        });

        engine.execute(URL, output, List.of(DIRECT), attempt);

        assertEquals(List.of(false, false), partialSeen);
        assertFalse(Files.exists(partial));
    }

    @Test
    @DisplayName("the first attempt should keep existing output for resume")
    void firstAttemptShouldKeepExistingOutput() throws IOException {
        Path partial = Files.writeString(tempDir.resolve("out.mp4.part"), "resume me");

        engine.execute(URL, output, List.of(DIRECT), ScriptedAttempt.of((i, proxy) -> {
            assertTrue(Files.exists(partial));
            return null;
        }));
    }
}
