package com.apod.pipeline.etl.model;

import java.nio.file.Path;

public record MetadataResult(
    Path dataPath,
    Path documentPath,
    String checksum,
    long sizeBytes,
    MetadataSource source) {}
