package com.github.stormino.mediabot.exception;

import com.github.stormino.mediabot.model.ErrorKind;

/**
 * Final, classified failure of the extraction tool after the proxy chain was exhausted.
 */
public class ExtractionException extends DownloadException {

    private final ErrorKind errorKind;
    private final String diagnostic;
    private final Integer lastTier;
    private final String proxyName;

    public ExtractionException(String message, ErrorKind errorKind, String diagnostic) {
        super(message);
        this.errorKind = errorKind;
        this.diagnostic = diagnostic;
        this.lastTier = null;
        this.proxyName = null;
    }

    public ExtractionException(String message, ErrorKind errorKind, String diagnostic,
                               Integer lastTier, String proxyName) {
        super(message);
        this.errorKind = errorKind;
        this.diagnostic = diagnostic;
        this.lastTier = lastTier;
        this.proxyName = proxyName;
    }

    public ExtractionException(String message, ErrorKind errorKind, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
        this.diagnostic = cause != null ? cause.getMessage() : null;
        this.lastTier = null;
        this.proxyName = null;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getDiagnostic() {
        return diagnostic;
    }

    public Integer getLastTier() {
        return lastTier;
    }

    public String getProxyName() {
        return proxyName;
    }
}
