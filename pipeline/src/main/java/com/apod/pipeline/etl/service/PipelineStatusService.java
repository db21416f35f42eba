package com.apod.pipeline.etl.service;

import com.apod.pipeline.etl.model.PipelineStatusResponse;
import com.apod.pipeline.etl.persistence.ApodCsvStore;
import com.apod.pipeline.etl.persistence.ApodJdbcRepository;
import com.apod.pipeline.etl.versioning.ToolAvailabilityProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class PipelineStatusService {
    private static final Logger log = LoggerFactory.getLogger(PipelineStatusService.class);

    private final ApodJdbcRepository repository;
    private final ApodCsvStore csvStore;
    private final ToolAvailabilityProbe probe;
    private final PipelineRunService runService;

    public PipelineStatusService(
        ApodJdbcRepository repository,
        ApodCsvStore csvStore,
        ToolAvailabilityProbe probe,
        PipelineRunService runService
    ) {
        this.repository = repository;
        this.csvStore = csvStore;
        this.probe = probe;
        this.runService = runService;
    }

    public PipelineStatusResponse getStatus() {
        boolean dbConnectivity = false;
        long recordCount = 0;
        try {
            dbConnectivity = repository.isDbReachable();
            recordCount = repository.countAll();
        } catch (DataAccessException e) {
            log.warn("Database check failed: {}", e.getMessage());
        }
        boolean csvExists = csvStore.exists();
        int csvRows = 0;
        if (csvExists) {
            try {
                csvRows = csvStore.rowCount();
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", csvStore.csvPath(), e.getMessage());
            }
        }
        return new PipelineStatusResponse(
            dbConnectivity,
            recordCount,
            csvExists,
            csvRows,
            probe.probe(),
            runService.isRunning()
        );
    }
}
