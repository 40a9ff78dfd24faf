package com.github.stormino.mediabot.service.process;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one subprocess invocation.
 */
@Data
@Builder
public class ProcessResult {

    /**
     * Exit code, or null when the process timed out or never started.
     */
    private final Integer exitCode;

    private final boolean timedOut;

    private final boolean spawnFailed;

    @Builder.Default
    private final List<String> stdoutTail = List.of();

    @Builder.Default
    private final List<String> stderrTail = List.of();

    /**
     * Set when the failure did not come from the process itself (timeout, spawn error).
     */
    private final String failureMessage;

    public boolean isSuccess() {
        return exitCode != null && exitCode == 0;
    }

    /**
     * Text to classify when the invocation failed.
     */
    public String diagnostic() {
        if (failureMessage != null) {
            return failureMessage;
        }
        return String.join("\n", stderrTail);
    }

    /**
     * First non-blank stdout line, used by {@code --print} probes.
     */
    public String firstStdoutLine() {
        return stdoutTail.stream()
                .filter(line -> !line.isBlank())
                .findFirst()
                .map(String::trim)
                .orElse("");
    }

    public static ProcessResult spawnFailure(String message) {
        return ProcessResult.builder()
                .spawnFailed(true)
                .failureMessage(message)
                .build();
    }
}
