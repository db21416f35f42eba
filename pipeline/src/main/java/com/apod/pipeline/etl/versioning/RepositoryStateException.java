package com.apod.pipeline.etl.versioning;

public class RepositoryStateException extends RuntimeException {
    public RepositoryStateException(String message) {
        super(message);
    }
}
