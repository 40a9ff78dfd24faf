package com.github.stormino.mediabot.service.engine;

import com.github.stormino.mediabot.model.ErrorKind;
import com.github.stormino.mediabot.service.command.TierConfig;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process failure counters of the fallback engine.
 */
@Component
public class EngineStats {

    private final ConcurrentHashMap<String, AtomicLong> tierFailures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> burnedProxies = new ConcurrentHashMap<>();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong exhausted = new AtomicLong();

    public void recordFailure(TierConfig.Tier tier, ErrorKind kind) {
        tierFailures.computeIfAbsent(tier.name() + "." + kind.name(), k -> new AtomicLong()).incrementAndGet();
    }

    /**
     * Bot detection despite valid credentials: the proxy identity is likely burned.
     */
    public void recordBurnedProxy(String proxyName) {
        burnedProxies.computeIfAbsent(proxyName, k -> new AtomicLong()).incrementAndGet();
    }

    public void recordSuccess() {
        successes.incrementAndGet();
    }

    public void recordExhausted() {
        exhausted.incrementAndGet();
    }

    public long getFailureCount(TierConfig.Tier tier, ErrorKind kind) {
        AtomicLong counter = tierFailures.get(tier.name() + "." + kind.name());
        return counter != null ? counter.get() : 0;
    }

    public long getBurnedCount(String proxyName) {
        AtomicLong counter = burnedProxies.get(proxyName);
        return counter != null ? counter.get() : 0;
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new TreeMap<>();
        tierFailures.forEach((key, value) -> snapshot.put("failures." + key, value.get()));
        burnedProxies.forEach((key, value) -> snapshot.put("burned." + key, value.get()));
        snapshot.put("successes", successes.get());
        snapshot.put("exhausted", exhausted.get());
        return snapshot;
    }
}
