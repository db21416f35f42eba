package com.apod.pipeline.etl.model;

public enum FetchClassification {
    SUCCESS,
    RETRYABLE,
    FATAL
}
