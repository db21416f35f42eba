package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.etl.model.MetadataResult;

import java.nio.file.Path;

public interface MetadataProducer {

    MetadataResult produceMetadata(Path dataFile);
}
