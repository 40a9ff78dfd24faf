package com.github.stormino.mediabot.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormatUtils")
class FormatUtilsTest {

    @Nested
    @DisplayName("formatSize")
    class FormatSizeTests {

        @ParameterizedTest
        @CsvSource({
                "0, 0 B",
                "789, 789 B",
                "1024, 1.00 KiB",
                "1536, 1.50 KiB",
                "10485760, 10.00 MiB",
                "1610612736, 1.50 GiB"
        })
        @DisplayName("should use binary units")
        void shouldUseBinaryUnits(long bytes, String expected) {
            assertEquals(expected, FormatUtils.formatSize(bytes));
        }

        @Test
        @DisplayName("formatSpeed should append per-second suffix")
        void formatSpeedShouldAppendSuffix() {
            assertEquals("512 B/s", FormatUtils.formatSpeed(512));
            assertEquals("10.00 MiB/s", FormatUtils.formatSpeed(10L * 1024 * 1024));
        }
    }

    @Nested
    @DisplayName("parseSize")
    class ParseSizeTests {

        @ParameterizedTest
        @CsvSource({
                "10.00MiB, 10485760",
                "~1.5GiB, 1610612736",
                "500KB, 512000",
                "500.00KiB/s, 512000",
                "2kB, 2048",
                "12B, 12",
                "1MB, 1048576"
        })
        @DisplayName("should parse tool size tokens")
        void shouldParseSizeTokens(String token, long expected) {
            assertEquals(expected, FormatUtils.parseSize(token));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"abc", "xMiB", "Unknown", "12"})
        @DisplayName("should return null for tokens that are not sizes")
        void shouldReturnNullForInvalidTokens(String token) {
            assertNull(FormatUtils.parseSize(token));
        }
    }

    @Nested
    @DisplayName("parseClock")
    class ParseClockTests {

        @Test
        @DisplayName("should parse mm:ss and hh:mm:ss")
        void shouldParseClockValues() {
            assertEquals(10L, FormatUtils.parseClock("00:10"));
            assertEquals(3723L, FormatUtils.parseClock("1:02:03"));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"10", "a:b", "1:2:3:4", "Unknown"})
        @DisplayName("should return null for non-clock values")
        void shouldReturnNullForNonClockValues(String value) {
            assertNull(FormatUtils.parseClock(value));
        }
    }

    @Nested
    @DisplayName("formatDurationCompact")
    class FormatDurationCompactTests {

        @ParameterizedTest
        @CsvSource({
                "8130, 02:15:30",
                "2712, 45:12",
                "0, 00:00",
                "-5, 00:00"
        })
        @DisplayName("should format seconds as clock")
        void shouldFormatSeconds(long seconds, String expected) {
            assertEquals(expected, FormatUtils.formatDurationCompact(seconds));
        }
    }
}
