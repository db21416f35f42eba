package com.apod.pipeline.etl.model;

public record PipelineStatusResponse(
    boolean dbConnectivity,
    long recordCount,
    boolean csvExists,
    int csvRowCount,
    boolean metadataToolUsable,
    boolean pipelineRunning) {}
