package com.github.stormino.mediabot.service.parser;

import com.github.stormino.mediabot.model.SourceProgress;

/**
 * Interface for parsing progress information from command output.
 * One instance per attempt; implementations may keep state between lines.
 */
public interface ProgressParser {

    /**
     * Parse a single line of output and extract progress information.
     *
     * @param line Output line to parse
     * @return SourceProgress if progress information was found, null otherwise
     */
    SourceProgress parseLine(String line);

    /**
     * Reset the parser state for a new attempt.
     */
    void reset();

    /**
     * Get the total size reported by the most recent progress line.
     *
     * @return Total size in bytes, or null if unknown
     */
    Long getTotalSize();
}
