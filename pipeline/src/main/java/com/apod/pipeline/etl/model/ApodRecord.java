package com.apod.pipeline.etl.model;

import java.time.Instant;
import java.time.LocalDate;

public record ApodRecord(
    LocalDate date,
    String title,
    String mediaUrl,
    String highDefUrl,
    MediaType mediaType,
    String explanation,
    String attribution,
    Instant retrievedAt,
    Provenance provenance
) {
    public ApodRecord {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
    }
}
