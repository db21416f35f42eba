package com.apod.pipeline.etl.model;

public record VersioningState(
    String csvChecksum,
    boolean metadataPresent,
    MetadataSource metadataSource,
    boolean repoDirty) {}
