package com.github.stormino.mediabot.exception;

import com.github.stormino.mediabot.model.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception hierarchy")
class ExceptionHierarchyTest {

    @Test
    @DisplayName("all exceptions should extend DownloadException")
    void allExceptionsShouldExtendDownloadException() {
        assertInstanceOf(DownloadException.class, new ExtractionException("m", ErrorKind.UNKNOWN, "d"));
        assertInstanceOf(DownloadException.class, new UnsupportedSourceException("ftp://x"));
        assertInstanceOf(DownloadException.class, new FileTooLargeException(1, 2));
        assertInstanceOf(DownloadException.class,
                new QueueRejectedException("full", QueueRejectedException.Reason.QUEUE_FULL));
        assertInstanceOf(DownloadException.class, new ConfigurationException("bad", "key"));
        assertInstanceOf(RuntimeException.class, new DownloadException("x"));
    }

    @Nested
    @DisplayName("ExtractionException")
    class ExtractionExceptionTests {

        @Test
        @DisplayName("should carry tier and proxy of the final attempt")
        void shouldCarryTierAndProxy() {
            ExtractionException e = new ExtractionException("Download failed: Network error",
                    ErrorKind.NETWORK_ERROR, "ERROR: timed out", 2, "Proxy 1");

            assertEquals(ErrorKind.NETWORK_ERROR, e.getErrorKind());
            assertEquals("ERROR: timed out", e.getDiagnostic());
            assertEquals(2, e.getLastTier());
            assertEquals("Proxy 1", e.getProxyName());
        }

        @Test
        @DisplayName("cause constructor should use cause message as diagnostic")
        void causeConstructorShouldUseCauseMessage() {
            IOException cause = new IOException("socket closed");
            ExtractionException e = new ExtractionException("failed", ErrorKind.NETWORK_ERROR, cause);

            assertSame(cause, e.getCause());
            assertEquals("socket closed", e.getDiagnostic());
            assertNull(e.getLastTier());
        }
    }

    @Test
    @DisplayName("FileTooLargeException should report both sizes")
    void fileTooLargeShouldReportSizes() {
        FileTooLargeException e = new FileTooLargeException(100, 250);

        assertEquals(100, e.getLimitBytes());
        assertEquals(250, e.getActualBytes());
        assertTrue(e.getMessage().contains("250"));
        assertTrue(e.getMessage().contains("100"));
    }

    @Test
    @DisplayName("UnsupportedSourceException should keep the url")
    void unsupportedShouldKeepUrl() {
        UnsupportedSourceException e = new UnsupportedSourceException("ftp://x");

        assertEquals("ftp://x", e.getUrl());
        assertTrue(e.getMessage().contains("ftp://x"));
    }

    @Test
    @DisplayName("ConfigurationException should keep key and value")
    void configurationShouldKeepKeyAndValue() {
        ConfigurationException e = new ConfigurationException("Invalid proxy", "mediabot.proxy.urls", "host:1");

        assertEquals("mediabot.proxy.urls", e.getConfigKey());
        assertEquals("host:1", e.getConfigValue());
    }
}
