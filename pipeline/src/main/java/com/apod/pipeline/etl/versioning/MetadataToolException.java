package com.apod.pipeline.etl.versioning;

public class MetadataToolException extends RuntimeException {
    public MetadataToolException(String message) {
        super(message);
    }

    public MetadataToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
