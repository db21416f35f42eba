package com.apod.pipeline.etl.service;

public class SinkWriteException extends RuntimeException {
    private final String sink;

    public SinkWriteException(String sink, String message, Throwable cause) {
        super(message, cause);
        this.sink = sink;
    }

    public String getSink() {
        return sink;
    }
}
