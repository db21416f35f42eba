package com.apod.pipeline.etl.service;

import com.apod.pipeline.etl.model.ApodRecord;
import com.apod.pipeline.etl.persistence.ApodCsvStore;
import com.apod.pipeline.etl.persistence.ApodJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class ApodSinkWriter implements DualSinkWriter {
    private static final Logger log = LoggerFactory.getLogger(ApodSinkWriter.class);

    public static final String POSTGRES_SINK = "postgres";
    public static final String CSV_SINK = "csv";

    private final ApodJdbcRepository repository;
    private final ApodCsvStore csvStore;

    public ApodSinkWriter(ApodJdbcRepository repository, ApodCsvStore csvStore) {
        this.repository = repository;
        this.csvStore = csvStore;
    }

    @Override
    public void upsert(ApodRecord record) {
        try {
            repository.upsert(record);
            log.info("Upserted APOD {} into apod_data", record.date());
        } catch (DataAccessException e) {
            log.error("Failed to upsert APOD {}: {}", record.date(), e.getMessage());
            throw new SinkWriteException(POSTGRES_SINK, "Failed to upsert APOD " + record.date(), e);
        }
    }

    @Override
    public int appendAndDedupe(ApodRecord record) {
        try {
            return csvStore.appendAndDedupe(record);
        } catch (IOException e) {
            log.error("Failed to write APOD {} to {}: {}", record.date(), csvStore.csvPath(), e.getMessage());
            throw new SinkWriteException(CSV_SINK, "Failed to write APOD " + record.date() + " to CSV", e);
        }
    }
}
