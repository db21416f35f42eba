package com.apod.pipeline.etl.model;

import java.time.LocalDate;

public record VerificationReport(
    LocalDate date,
    int postgresCount,
    boolean csvExists,
    int csvRowCount,
    boolean passed) {}
