package com.github.stormino.mediabot.service.backend;

import com.github.stormino.mediabot.model.DownloadOutput;
import com.github.stormino.mediabot.model.DownloadRequest;
import com.github.stormino.mediabot.model.MediaMetadata;
import com.github.stormino.mediabot.service.progress.ProgressSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceRegistry")
class SourceRegistryTest {

    private static SourceBackend backend(String name, Predicate<String> supports) {
        return new SourceBackend() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean supports(String url) {
                return supports.test(url);
            }

            @Override
            public MediaMetadata metadata(String url) {
                return MediaMetadata.builder().title(name).build();
            }

            @Override
            public Optional<Long> estimateSize(String url) {
                return Optional.empty();
            }

            @Override
            public boolean isLivestream(String url) {
                return false;
            }

            @Override
            public DownloadOutput download(DownloadRequest request, ProgressSink progressSink) {
                throw new UnsupportedOperationException();
            }
        };
    }

    private final SourceBackend instagram = backend("instagram", url -> url.contains("instagram.com"));
    private final SourceBackend catchAll = backend("catch-all", url -> url.startsWith("http"));

    @Test
    @DisplayName("first supporting backend should win")
    void firstSupportingBackendShouldWin() {
        SourceRegistry registry = new SourceRegistry(List.of(instagram, catchAll));

        assertEquals("instagram", registry.resolve("https://www.instagram.com/p/xyz").orElseThrow().name());
        assertEquals("catch-all", registry.resolve("https://example.com/video").orElseThrow().name());
    }

    @Test
    @DisplayName("registration order should decide precedence")
    void registrationOrderShouldDecide() {
        SourceRegistry registry = new SourceRegistry();
        registry.register(catchAll);
        registry.register(instagram);

        assertEquals("catch-all", registry.resolve("https://www.instagram.com/p/xyz").orElseThrow().name());
    }

    @Test
    @DisplayName("unsupported or blank urls should resolve to nothing")
    void unsupportedShouldResolveToNothing() {
        SourceRegistry registry = new SourceRegistry(List.of(instagram, catchAll));

        assertTrue(registry.resolve("ftp://example.com/a").isEmpty());
        assertTrue(registry.resolve("  ").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
    }

    @Test
    @DisplayName("remove should drop a backend by name")
    void removeShouldDropBackend() {
        SourceRegistry registry = new SourceRegistry(List.of(instagram, catchAll));

        assertTrue(registry.remove("instagram"));
        assertFalse(registry.remove("instagram"));
        assertEquals(1, registry.backends().size());
        assertEquals("catch-all", registry.resolve("https://www.instagram.com/p/xyz").orElseThrow().name());
        assertThrows(UnsupportedOperationException.class, () -> registry.backends().clear());
    }
}
