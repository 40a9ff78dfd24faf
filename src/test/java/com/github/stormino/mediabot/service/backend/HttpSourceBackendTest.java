package com.github.stormino.mediabot.service.backend;

import com.github.stormino.mediabot.exception.DownloadException;
import com.github.stormino.mediabot.exception.FileTooLargeException;
import com.github.stormino.mediabot.model.DownloadOutput;
import com.github.stormino.mediabot.model.DownloadRequest;
import com.github.stormino.mediabot.model.SourceProgress;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpSourceBackend")
class HttpSourceBackendTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private HttpSourceBackend backend;
    private final List<SourceProgress> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        backend = new HttpSourceBackend(new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static byte[] bytes(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) i;
        }
        return data;
    }

    private DownloadRequest request(String path, Long maxFileSize) {
        return DownloadRequest.builder()
                .url(server.url(path).toString())
                .outputPath(tempDir.resolve("out" + path.substring(path.lastIndexOf('.'))))
                .format("mp3")
                .maxFileSize(maxFileSize)
                .build();
    }

    @Nested
    @DisplayName("supports")
    class SupportsTests {

        @Test
        @DisplayName("should accept http media file urls")
        void shouldAcceptMediaFiles() {
            assertTrue(backend.supports("https://cdn.example.com/a/song.mp3"));
            assertTrue(backend.supports("http://cdn.example.com/clip.MP4?sig=1"));
        }

        @Test
        @DisplayName("should reject pages, other schemes and null")
        void shouldRejectOthers() {
            assertFalse(backend.supports("https://www.youtube.com/watch?v=abc"));
            assertFalse(backend.supports("https://example.com/index.html"));
            assertFalse(backend.supports("ftp://example.com/song.mp3"));
            assertFalse(backend.supports(null));
        }
    }

    @Test
    @DisplayName("metadata should come from the url")
    void metadataShouldComeFromUrl() {
        assertEquals("My Song", backend.metadata("https://cdn.example.com/My%20Song.mp3").getTitle());
        assertFalse(backend.isLivestream("https://cdn.example.com/My%20Song.mp3"));
    }

    @Nested
    @DisplayName("download")
    class DownloadTests {

        @Test
        @DisplayName("should stream the body to disk and report completion")
        void shouldStreamBody() throws Exception {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "audio/mpeg")
                    .setBody(new Buffer().write(bytes(1000))));

            DownloadOutput output = backend.download(request("/media/song.mp3", null), events::add);

            assertEquals(1000, output.getFileSize());
            assertEquals(1000, Files.size(output.getFilePath()));
            assertEquals("audio/mpeg", output.getMimeHint());
            assertFalse(events.isEmpty());
            assertEquals(100.0, events.get(events.size() - 1).getPercent(), 0.001);
        }

        @Test
        @DisplayName("should fall back to the extension mime type for octet streams")
        void shouldUseExtensionMime() {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "application/octet-stream")
                    .setBody("abc"));

            DownloadOutput output = backend.download(request("/media/clip.mp4", null), events::add);

            assertEquals("video/mp4", output.getMimeHint());
        }

        @Test
        @DisplayName("should resume a partial file with a range request")
        void shouldResumePartialFile() throws Exception {
            Path target = tempDir.resolve("out.mp3");
            Files.write(target, new byte[400]);
            server.enqueue(new MockResponse()
                    .setResponseCode(206)
                    .setHeader("Content-Range", "bytes 400-999/1000")
                    .setBody(new Buffer().write(new byte[600])));

            DownloadOutput output = backend.download(request("/media/song.mp3", null), events::add);

            RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
            assertNotNull(recorded);
            assertEquals("bytes=400-", recorded.getHeader("Range"));
            assertEquals(1000, output.getFileSize());
            assertEquals(1000, Files.size(target));
        }

        @Test
        @DisplayName("should treat 416 on an existing file as complete")
        void shouldTreat416AsComplete() throws Exception {
            Path target = tempDir.resolve("out.mp3");
            Files.write(target, new byte[700]);
            server.enqueue(new MockResponse().setResponseCode(416));

            DownloadOutput output = backend.download(request("/media/song.mp3", null), events::add);

            assertEquals(700, output.getFileSize());
        }

        @Test
        @DisplayName("should refuse a declared size above the cap")
        void shouldRefuseDeclaredOversize() {
            server.enqueue(new MockResponse().setBody(new Buffer().write(new byte[5000])));

            FileTooLargeException e = assertThrows(FileTooLargeException.class,
                    () -> backend.download(request("/media/song.mp3", 1000L), events::add));

            assertEquals(1000, e.getLimitBytes());
            assertEquals(5000, e.getActualBytes());
            assertFalse(Files.exists(tempDir.resolve("out.mp3")));
        }

        @Test
        @DisplayName("should abort a chunked transfer that grows past the cap")
        void shouldAbortStreamingOversize() {
            server.enqueue(new MockResponse().setChunkedBody(new Buffer().write(new byte[5000]), 512));

            assertThrows(FileTooLargeException.class,
                    () -> backend.download(request("/media/song.mp3", 1000L), events::add));
            assertFalse(Files.exists(tempDir.resolve("out.mp3")));
        }

        @Test
        @DisplayName("should fail on http errors")
        void shouldFailOnHttpErrors() {
            server.enqueue(new MockResponse().setResponseCode(404));

            DownloadException e = assertThrows(DownloadException.class,
                    () -> backend.download(request("/media/song.mp3", null), events::add));
            assertTrue(e.getMessage().contains("404"));
        }

        @Test
        @DisplayName("should delete the partial file when the connection drops mid-body")
        void shouldDeletePartialOnDisconnect() {
            server.enqueue(new MockResponse()
                    .setBody(new Buffer().write(bytes(200_000)))
                    .setSocketPolicy(SocketPolicy.DISCONNECT_DURING_RESPONSE_BODY));

            DownloadException e = assertThrows(DownloadException.class,
                    () -> backend.download(request("/media/song.mp3", null), events::add));

            assertTrue(e.getMessage().contains("connection error"));
            assertFalse(Files.exists(tempDir.resolve("out.mp3")));
        }

        @Test
        @DisplayName("should delete an earlier partial file when the resume request fails")
        void shouldDeletePartialOnHttpError() throws Exception {
            Path target = tempDir.resolve("out.mp3");
            Files.write(target, new byte[400]);
            Files.write(tempDir.resolve("out.mp3.part"), new byte[10]);
            server.enqueue(new MockResponse().setResponseCode(500));

            assertThrows(DownloadException.class,
                    () -> backend.download(request("/media/song.mp3", null), events::add));

            assertFalse(Files.exists(target));
            assertFalse(Files.exists(tempDir.resolve("out.mp3.part")));
        }
    }

    @Test
    @DisplayName("estimateSize should read Content-Length of a HEAD request")
    void estimateSizeShouldUseHead() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Length", "12345"));

        Optional<Long> size = backend.estimateSize(server.url("/media/song.mp3").toString());

        assertEquals(Optional.of(12345L), size);
        assertEquals("HEAD", server.takeRequest(5, TimeUnit.SECONDS).getMethod());
    }

    @Test
    @DisplayName("estimateSize should be empty on errors")
    void estimateSizeShouldBeEmptyOnErrors() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertTrue(backend.estimateSize(server.url("/media/song.mp3").toString()).isEmpty());
    }

    @Test
    @DisplayName("parseContentRangeTotal")
    void parseContentRangeTotal() {
        assertEquals(1000L, HttpSourceBackend.parseContentRangeTotal("bytes 400-999/1000"));
        assertNull(HttpSourceBackend.parseContentRangeTotal("bytes */1000"));
        assertNull(HttpSourceBackend.parseContentRangeTotal(null));
    }
}
