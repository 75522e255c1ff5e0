package com.assistrelay.shared.error;

public class TransportException extends RelayException {

    private final int statusCode;
    private final String body;

    public TransportException(String message, int statusCode, String body) {
        super(message);
        this.statusCode = statusCode;
        this.body = body;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.body = null;
    }

    /** HTTP status of the failed call, or 0 when no response was received. */
    public int statusCode() { return statusCode; }

    public String body() { return body; }
}
