package com.github.stormino.mediabot.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File and URL path helpers for download outputs.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    /**
     * Get file extension, lower-cased and without the dot.
     *
     * @param filename Filename to extract extension from
     * @return Extension, or empty string if there is none
     */
    public static String getExtension(String filename) {
        if (filename == null || filename.isBlank()) {
            return "";
        }

        int lastDot = filename.lastIndexOf('.');
        int lastSlash = filename.lastIndexOf('/');
        if (lastDot > 0 && lastDot > lastSlash + 1 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }

        return "";
    }

    /**
     * Get filename without extension.
     *
     * @param filename Full filename
     * @return Filename without extension
     */
    public static String getStem(String filename) {
        if (filename == null || filename.isBlank()) {
            return "";
        }

        int lastDot = filename.lastIndexOf('.');
        if (lastDot > 0) {
            return filename.substring(0, lastDot);
        }

        return filename;
    }

    /**
     * Extension of the URL's path component, ignoring query and fragment.
     *
     * @return Lower-cased extension, or empty when the URL has none or is malformed
     */
    public static String getUrlExtension(String url) {
        return urlPath(url).map(PathUtils::getExtension).orElse("");
    }

    /**
     * URL-decoded last path segment without its extension.
     */
    public static String getUrlTitle(String url) {
        String path = urlPath(url).orElse("");
        String segment = path.substring(path.lastIndexOf('/') + 1);
        String decoded = URLDecoder.decode(segment, StandardCharsets.UTF_8);
        String stem = getStem(decoded);
        return stem.isBlank() ? "download" : stem;
    }

    /**
     * Whether the URL has an http or https scheme.
     */
    public static boolean isHttpUrl(String url) {
        return urlScheme(url)
                .map(scheme -> scheme.equals("http") || scheme.equals("https"))
                .orElse(false);
    }

    /**
     * Lower-cased host of the URL.
     */
    public static Optional<String> urlHost(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            return Optional.ofNullable(host).map(h -> h.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> urlScheme(String url) {
        try {
            String scheme = URI.create(url.trim()).getScheme();
            return Optional.ofNullable(scheme).map(s -> s.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> urlPath(String url) {
        try {
            return Optional.ofNullable(URI.create(url.trim()).getRawPath());
        } catch (IllegalArgumentException | NullPointerException e) {
            return Optional.empty();
        }
    }

    /**
     * Locate the file the extraction tool actually wrote. The tool may append or change
     * an extension, so when the expected path is missing, the last sibling that shares the
     * stem and extension wins.
     *
     * @param expected Requested output path
     * @return Existing output file, or the expected path when nothing matches
     */
    public static Path findActualOutputFile(Path expected) {
        if (Files.exists(expected)) {
            return expected;
        }
        Path parent = expected.toAbsolutePath().getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            return expected;
        }

        String fileName = expected.getFileName().toString();
        String stem = getStem(fileName);
        String extension = getExtension(fileName);

        try (Stream<Path> files = Files.list(parent)) {
            List<Path> candidates = files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(stem)
                                && (extension.isEmpty() || name.toLowerCase(Locale.ROOT).endsWith("." + extension))
                                && !isPartialName(name);
                    })
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
            if (candidates.isEmpty()) {
                return expected;
            }
            Path actual = candidates.get(candidates.size() - 1);
            log.debug("Expected output {} missing, using {}", expected, actual);
            return actual;
        } catch (IOException e) {
            log.warn("Failed to scan {} for output file: {}", parent, e.getMessage());
            return expected;
        }
    }

    /**
     * Delete the target and every partial leftover of a previous attempt.
     *
     * @param target Requested output path
     * @return Number of files deleted
     */
    public static int deletePartialOutputs(Path target) {
        int deleted = 0;
        if (deleteQuietly(target)) {
            deleted++;
        }
        for (String suffix : DownloadConstants.PARTIAL_SUFFIXES) {
            if (deleteQuietly(target.resolveSibling(target.getFileName() + suffix))) {
                deleted++;
            }
        }

        Path parent = target.toAbsolutePath().getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            return deleted;
        }
        String stem = getStem(target.getFileName().toString());
        try (Stream<Path> files = Files.list(parent)) {
            List<Path> leftovers = files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(stem) && isPartialName(name);
                    })
                    .toList();
            for (Path leftover : leftovers) {
                if (deleteQuietly(leftover)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan {} for partial files: {}", parent, e.getMessage());
        }

        if (deleted > 0) {
            log.debug("Deleted {} partial output file(s) for {}", deleted, target);
        }
        return deleted;
    }

    private static boolean isPartialName(String name) {
        if (name.contains(DownloadConstants.FRAGMENT_MARKER)) {
            return true;
        }
        for (String suffix : DownloadConstants.PARTIAL_SUFFIXES) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", file, e.getMessage());
            return false;
        }
    }
}
