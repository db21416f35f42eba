package com.apod.pipeline.etl.service;

import com.apod.pipeline.etl.model.VerificationReport;

public class VerificationFailedException extends RuntimeException {
    private final VerificationReport report;

    public VerificationFailedException(VerificationReport report) {
        super("Dual-sink verification failed for " + report.date()
            + ": postgresCount=" + report.postgresCount()
            + ", csvExists=" + report.csvExists());
        this.report = report;
    }

    public VerificationReport getReport() {
        return report;
    }
}
