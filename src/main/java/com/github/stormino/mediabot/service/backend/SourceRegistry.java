package com.github.stormino.mediabot.service.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered list of backends. Narrow backends must be registered before catch-all ones,
 * since the first backend that supports a URL wins.
 */
@Slf4j
public class SourceRegistry {

    private final List<SourceBackend> backends = new CopyOnWriteArrayList<>();

    public SourceRegistry() {
    }

    public SourceRegistry(List<SourceBackend> backends) {
        backends.forEach(this::register);
    }

    public void register(SourceBackend backend) {
        backends.add(backend);
        log.info("Registered source backend #{}: {}", backends.size(), backend.name());
    }

    /**
     * @return true when a backend with that name was removed
     */
    public boolean remove(String name) {
        return backends.removeIf(backend -> backend.name().equals(name));
    }

    public Optional<SourceBackend> resolve(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        for (SourceBackend backend : backends) {
            if (backend.supports(url)) {
                log.debug("Resolved {} to backend {}", url, backend.name());
                return Optional.of(backend);
            }
        }
        log.debug("No backend supports {}", url);
        return Optional.empty();
    }

    public List<SourceBackend> backends() {
        return Collections.unmodifiableList(backends);
    }
}
