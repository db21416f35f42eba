package com.apod.pipeline.etl.http;

public class FatalUpstreamException extends RuntimeException {
    private final int statusCode;
    private final String reason;

    public FatalUpstreamException(String reason, int statusCode, String message) {
        super(message);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReason() {
        return reason;
    }
}
