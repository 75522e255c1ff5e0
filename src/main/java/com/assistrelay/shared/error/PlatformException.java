package com.assistrelay.shared.error;

/**
 * Slack Web API failure. Slack answers most errors with HTTP 200 and {@code "ok": false},
 * so the error code is kept separately from the HTTP status.
 */
public class PlatformException extends TransportException {

    private final String errorCode;

    public PlatformException(String method, String errorCode, int statusCode) {
        super(method + " failed: " + errorCode, statusCode, errorCode);
        this.errorCode = errorCode;
    }

    public PlatformException(String method, Throwable cause) {
        super(method + " failed: " + cause.getMessage(), cause);
        this.errorCode = cause.getClass().getSimpleName();
    }

    public String errorCode() { return errorCode; }
}
