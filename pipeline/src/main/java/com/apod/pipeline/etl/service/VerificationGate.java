package com.apod.pipeline.etl.service;

import com.apod.pipeline.etl.model.VerificationReport;
import com.apod.pipeline.etl.persistence.ApodCsvStore;
import com.apod.pipeline.etl.persistence.ApodJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;

/**
 * Read-only cross-check of both sinks. Never retries and never writes.
 */
@Service
public class VerificationGate {
    private static final Logger log = LoggerFactory.getLogger(VerificationGate.class);

    private final ApodJdbcRepository repository;
    private final ApodCsvStore csvStore;

    public VerificationGate(ApodJdbcRepository repository, ApodCsvStore csvStore) {
        this.repository = repository;
        this.csvStore = csvStore;
    }

    public VerificationReport verify(LocalDate expectedDate) {
        int postgresCount = repository.countByDate(expectedDate);
        boolean csvExists = csvStore.exists();
        int csvRows = 0;
        if (csvExists) {
            try {
                csvRows = csvStore.rowCount();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + csvStore.csvPath() + " during verification", e);
            }
        }
        boolean passed = postgresCount > 0 && csvExists;
        VerificationReport report = new VerificationReport(expectedDate, postgresCount, csvExists, csvRows, passed);

        log.info(
            "Verification for {}: postgresRecords={} csvExists={} csvRows={}",
            expectedDate,
            postgresCount,
            csvExists,
            csvRows
        );
        if (passed) {
            log.info("All verifications passed for {}", expectedDate);
        } else {
            log.error("Verification failed for {}", expectedDate);
        }
        return report;
    }
}
