package com.apod.pipeline.etl.model;

public enum MetadataSource {
    REAL,
    SIMULATED
}
