package com.github.stormino.mediabot.service.parser;

import com.github.stormino.mediabot.model.SourceProgress;
import com.github.stormino.mediabot.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for yt-dlp {@code --newline} progress output, e.g.
 * {@code [download]  45.2% of 10.00MiB at 500.00KiB/s ETA 00:10}.
 */
@Slf4j
public class YtDlpProgressParser implements ProgressParser {

    private static final String DOWNLOAD_MARKER = "[download]";
    private static final Pattern PERCENT_PATTERN = Pattern.compile("(\\d+(?:\\.\\d+)?)%");

    private Long totalSize = null;

    @Override
    public SourceProgress parseLine(String line) {
        if (line == null || !line.contains(DOWNLOAD_MARKER) || !line.contains("%")) {
            return null;
        }

        Matcher percentMatcher = PERCENT_PATTERN.matcher(line);
        if (!percentMatcher.find()) {
            return null;
        }
        double percent;
        try {
            percent = Double.parseDouble(percentMatcher.group(1));
        } catch (NumberFormatException e) {
            log.debug("Unparseable percent in line: {}", line);
            return null;
        }
        percent = Math.max(0.0, Math.min(100.0, percent));

        Long total = null;
        Long speed = null;
        Long eta = null;

        String[] tokens = line.trim().split("\\s+");
        for (int i = 0; i < tokens.length - 1; i++) {
            String next = tokens[i + 1];
            if (next.equals("~") && i + 2 < tokens.length) {
                next = tokens[i + 2];
            }
            switch (tokens[i]) {
                case "of" -> total = FormatUtils.parseSize(next);
                case "at" -> speed = FormatUtils.parseSize(next);
                case "ETA" -> eta = FormatUtils.parseClock(next);
                default -> {
                    // not a keyword
                }
            }
        }

        if (total != null) {
            totalSize = total;
        }

        return SourceProgress.builder()
                .percent(percent)
                .speedBytesPerSec(speed)
                .etaSeconds(eta)
                .downloadedBytes(total != null ? (long) (total * percent / 100.0) : null)
                .totalBytes(total)
                .build();
    }

    @Override
    public void reset() {
        totalSize = null;
    }

    @Override
    public Long getTotalSize() {
        return totalSize;
    }
}
