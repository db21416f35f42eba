package com.apod.pipeline.etl.model;

public record ExtractionOutcome(
    RawApod raw,
    Provenance provenance,
    int attempts,
    ExtractionState state) {}
