package com.github.stormino.mediabot.service.backend;

import com.github.stormino.mediabot.exception.DownloadException;
import com.github.stormino.mediabot.exception.FileTooLargeException;
import com.github.stormino.mediabot.model.DownloadOutput;
import com.github.stormino.mediabot.model.DownloadRequest;
import com.github.stormino.mediabot.model.MediaMetadata;
import com.github.stormino.mediabot.model.SourceProgress;
import com.github.stormino.mediabot.service.progress.ProgressSink;
import com.github.stormino.mediabot.service.progress.ProgressThrottle;
import com.github.stormino.mediabot.util.DownloadConstants;
import com.github.stormino.mediabot.util.PathUtils;
import com.github.stormino.mediabot.util.ProgressCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Direct download of bare media file URLs, with resume of partial files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpSourceBackend implements SourceBackend {

    public static final String NAME = "http";

    private static final Pattern CONTENT_RANGE_TOTAL = Pattern.compile("bytes\\s+\\d+-\\d+/(\\d+)");
    private static final int BUFFER_SIZE = 64 * 1024;

    private final OkHttpClient httpClient;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(String url) {
        if (url == null || !PathUtils.isHttpUrl(url)) {
            return false;
        }
        return DownloadConstants.MEDIA_MIME_TYPES.containsKey(PathUtils.getUrlExtension(url));
    }

    @Override
    public MediaMetadata metadata(String url) {
        return MediaMetadata.builder()
                .title(PathUtils.getUrlTitle(url))
                .artist("")
                .build();
    }

    @Override
    public Optional<Long> estimateSize(String url) {
        Request request = new Request.Builder().url(url).head().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return Optional.empty();
            }
            String length = response.header("Content-Length");
            return length != null ? Optional.of(Long.parseLong(length.trim())) : Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.debug("HEAD {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isLivestream(String url) {
        return false;
    }

    @Override
    public DownloadOutput download(DownloadRequest downloadRequest, ProgressSink progressSink) {
        Path output = downloadRequest.getOutputPath();
        String url = downloadRequest.getUrl();
        Long maxFileSize = downloadRequest.getMaxFileSize();
        ProgressThrottle throttle = new ProgressThrottle(progressSink);

        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            long existing = Files.exists(output) ? Files.size(output) : 0;
            Request.Builder requestBuilder = new Request.Builder().url(url).get();
            if (existing > 0) {
                requestBuilder.header("Range", "bytes=" + existing + "-");
                log.info("Resuming {} from byte {}", url, existing);
            }

            String contentType;
            long written;
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (response.code() == 416 && existing > 0) {
                    log.info("{} already complete on disk ({} bytes)", output, existing);
                    return finish(output, existing, null, url, throttle);
                }
                if (!response.isSuccessful()) {
                    throw new DownloadException("HTTP error " + response.code() + " for " + url);
                }
                ResponseBody body = response.body();
                if (body == null) {
                    throw new DownloadException("Empty response body for " + url);
                }

                boolean append = response.code() == 206 && existing > 0;
                long offset = append ? existing : 0;
                Long total = append
                        ? parseContentRangeTotal(response.header("Content-Range"))
                        : (body.contentLength() >= 0 ? body.contentLength() : null);

                if (maxFileSize != null && total != null && total > maxFileSize) {
                    Files.deleteIfExists(output);
                    throw new FileTooLargeException(maxFileSize, total);
                }

                contentType = body.contentType() != null
                        ? body.contentType().type() + "/" + body.contentType().subtype()
                        : null;
                written = transfer(body, output, append, offset, total, maxFileSize, throttle);
            }
            return finish(output, written, contentType, url, throttle);

        } catch (IOException e) {
            discardPartial(output);
            throw new DownloadException("connection error while downloading " + url + ": " + e.getMessage(), e);
        } catch (DownloadException e) {
            discardPartial(output);
            throw e;
        }
    }

    // a failed task is terminal, only a crash leaves bytes behind for a later resume
    private static void discardPartial(Path output) {
        int deleted = PathUtils.deletePartialOutputs(output);
        if (deleted > 0) {
            log.debug("Discarded {} partial file(s) for {}", deleted, output);
        }
    }

    private long transfer(ResponseBody body, Path output, boolean append, long offset, Long total,
                          Long maxFileSize, ProgressThrottle throttle) throws IOException {
        long downloaded = offset;
        long sessionBytes = 0;
        long startedAt = System.currentTimeMillis();
        boolean oversized = false;

        StandardOpenOption[] options = append
                ? new StandardOpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.APPEND}
                : new StandardOpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE};

        try (InputStream in = body.byteStream(); OutputStream out = Files.newOutputStream(output, options)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                downloaded += read;
                sessionBytes += read;
                if (maxFileSize != null && downloaded > maxFileSize) {
                    oversized = true;
                    break;
                }
                throttle.accept(ProgressCalculator.snapshot(downloaded, total, sessionBytes,
                        System.currentTimeMillis() - startedAt));
            }
        }

        if (oversized) {
            Files.deleteIfExists(output);
            throw new FileTooLargeException(maxFileSize, downloaded);
        }
        return downloaded;
    }

    private DownloadOutput finish(Path output, long size, String contentType, String url, ProgressThrottle throttle) {
        throttle.accept(SourceProgress.builder()
                .percent(100.0)
                .downloadedBytes(size)
                .totalBytes(size)
                .build());
        String mime = contentType != null && !contentType.equals("application/octet-stream")
                ? contentType
                : DownloadConstants.MEDIA_MIME_TYPES.getOrDefault(
                        PathUtils.getUrlExtension(url), DownloadConstants.DEFAULT_MIME_TYPE);
        log.info("Downloaded {} ({} bytes, {})", output, size, mime);
        return DownloadOutput.builder()
                .filePath(output)
                .fileSize(size)
                .mimeHint(mime)
                .build();
    }

    static Long parseContentRangeTotal(String contentRange) {
        if (contentRange == null) {
            return null;
        }
        Matcher matcher = CONTENT_RANGE_TOTAL.matcher(contentRange);
        return matcher.find() ? Long.parseLong(matcher.group(1)) : null;
    }
}
