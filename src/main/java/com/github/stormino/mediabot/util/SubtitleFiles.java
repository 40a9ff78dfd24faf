package com.github.stormino.mediabot.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Helpers for the subtitle tracks the extraction tool writes as {@code <stem>.<lang>.<ext>}.
 */
@Slf4j
@UtilityClass
public class SubtitleFiles {

    private static final List<String> TRACK_EXTENSIONS = List.of("srt", "vtt");
    private static final Pattern CUE_INDEX = Pattern.compile("^\\d+$");
    private static final Pattern MARKUP = Pattern.compile("<[^>]*>|\\{\\\\[^}]*}");

    /**
     * Split a comma-separated language list, dropping blanks.
     */
    public static List<String> languages(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(lang -> !lang.isEmpty())
                .toList();
    }

    /**
     * Best subtitle track written next to the requested output: earliest preferred language
     * first, srt before vtt.
     *
     * @param outputPath Requested output path, e.g. {@code /downloads/t1.srt}
     * @param languages  Languages in order of preference
     */
    public static Optional<Path> locate(Path outputPath, List<String> languages) {
        List<Path> tracks = tracks(outputPath);
        String stem = PathUtils.getStem(outputPath.getFileName().toString());
        return tracks.stream()
                .min(Comparator.<Path>comparingInt(track -> languageRank(language(track, stem), languages))
                        .thenComparingInt(track -> TRACK_EXTENSIONS.indexOf(
                                PathUtils.getExtension(track.getFileName().toString())))
                        .thenComparing(track -> track.getFileName().toString()));
    }

    /**
     * Turn the chosen track into the requested output and delete the other tracks.
     * A txt request gets plain text; an srt request keeps the track as is, under its own
     * extension when the tool could not convert it.
     *
     * @return The file to deliver
     */
    public static Path finish(Path track, Path outputPath) throws IOException {
        String requested = PathUtils.getExtension(outputPath.getFileName().toString());
        String actual = PathUtils.getExtension(track.getFileName().toString());
        Path result;
        if (requested.equals("txt")) {
            String content = Files.readString(track, StandardCharsets.UTF_8);
            Files.writeString(outputPath, toPlainText(content), StandardCharsets.UTF_8);
            result = outputPath;
        } else {
            String stem = PathUtils.getStem(outputPath.getFileName().toString());
            result = actual.equals(requested) ? outputPath : outputPath.resolveSibling(stem + "." + actual);
            Files.move(track, result, StandardCopyOption.REPLACE_EXISTING);
        }
        for (Path leftover : tracks(outputPath)) {
            if (!leftover.equals(result)) {
                Files.deleteIfExists(leftover);
            }
        }
        return result;
    }

    /**
     * Spoken text of an srt or vtt document: no header, cue numbers, timings or markup,
     * and no consecutive repeats (auto-generated captions roll each line twice).
     */
    public static String toPlainText(String content) {
        List<String> lines = new ArrayList<>();
        boolean inNote = false;
        for (String raw : content.replace("\uFEFF", "").split("\\r?\\n")) {
            String line = raw.trim();
            if (line.isEmpty()) {
                inNote = false;
                continue;
            }
            if (inNote || line.startsWith("WEBVTT") || line.startsWith("Kind:") || line.startsWith("Language:")) {
                continue;
            }
            if (line.startsWith("NOTE") || line.startsWith("STYLE") || line.startsWith("REGION")) {
                inNote = true;
                continue;
            }
            if (CUE_INDEX.matcher(line).matches() || line.contains("-->")) {
                continue;
            }
            String text = MARKUP.matcher(line).replaceAll("").trim();
            if (text.isEmpty() || (!lines.isEmpty() && lines.get(lines.size() - 1).equals(text))) {
                continue;
            }
            lines.add(text);
        }
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }

    private static List<Path> tracks(Path outputPath) {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            return List.of();
        }
        String prefix = PathUtils.getStem(outputPath.getFileName().toString()) + ".";
        try (Stream<Path> files = Files.list(parent)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        String stem = PathUtils.getStem(name);
                        return name.startsWith(prefix)
                                && stem.length() > prefix.length()
                                && TRACK_EXTENSIONS.contains(PathUtils.getExtension(name));
                    })
                    .toList();
        } catch (IOException e) {
            log.warn("Failed to scan {} for subtitle tracks: {}", parent, e.getMessage());
            return List.of();
        }
    }

    private static String language(Path track, String stem) {
        String trackStem = PathUtils.getStem(track.getFileName().toString());
        return trackStem.substring(stem.length() + 1).toLowerCase(Locale.ROOT);
    }

    private static int languageRank(String language, List<String> languages) {
        for (int i = 0; i < languages.size(); i++) {
            String preferred = languages.get(i).toLowerCase(Locale.ROOT);
            if (language.equals(preferred) || language.startsWith(preferred + "-")) {
                return i;
            }
        }
        return languages.size();
    }
}
