package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.etl.model.MetadataResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Produces the metadata document for the data file, through the real tool when a fresh probe
 * says it is usable and through the simulated producer otherwise.
 */
@Service
public class MetadataVersioner {
    private static final Logger log = LoggerFactory.getLogger(MetadataVersioner.class);

    private final ToolAvailabilityProbe probe;
    private final DvcMetadataProducer realProducer;
    private final SimulatedMetadataProducer simulatedProducer;

    public MetadataVersioner(
        ToolAvailabilityProbe probe,
        DvcMetadataProducer realProducer,
        SimulatedMetadataProducer simulatedProducer
    ) {
        this.probe = probe;
        this.realProducer = realProducer;
        this.simulatedProducer = simulatedProducer;
    }

    public MetadataResult version(Path dataFile) {
        if (!Files.isRegularFile(dataFile)) {
            throw new IllegalStateException("Data file does not exist: " + dataFile);
        }
        if (probe.probe()) {
            try {
                return realProducer.produceMetadata(dataFile);
            } catch (RuntimeException e) {
                log.warn("Metadata tool failed for {}, using simulated metadata: {}", dataFile.getFileName(), e.getMessage());
            }
        } else {
            log.warn("Metadata tool unavailable, using simulated metadata for {}", dataFile.getFileName());
        }
        return simulatedProducer.produceMetadata(dataFile);
    }
}
