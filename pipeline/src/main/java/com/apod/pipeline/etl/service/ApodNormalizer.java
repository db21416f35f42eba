package com.apod.pipeline.etl.service;

import com.apod.pipeline.etl.model.ApodRecord;
import com.apod.pipeline.etl.model.ExtractionOutcome;
import com.apod.pipeline.etl.model.MediaType;
import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.model.RawApod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

@Service
public class ApodNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ApodNormalizer.class);

    public static final int EXPLANATION_MAX_LENGTH = 1000;
    public static final int ATTRIBUTION_MAX_LENGTH = 255;
    static final String DEFAULT_TITLE = "No Title";
    static final String DEFAULT_ATTRIBUTION = "NASA";

    private final Clock clock;

    public ApodNormalizer(Clock clock) {
        this.clock = clock;
    }

    public ApodRecord normalize(ExtractionOutcome outcome) {
        return normalize(outcome.raw(), outcome.provenance());
    }

    public ApodRecord normalize(RawApod raw, Provenance provenance) {
        if (raw == null) {
            throw new ValidationException("date", "No APOD data received from extraction");
        }
        LocalDate date = parseDate(raw.date());
        String title = defaultIfBlank(raw.title(), DEFAULT_TITLE);
        String mediaUrl = defaultIfBlank(raw.url(), "");
        String highDefUrl = defaultIfBlank(raw.hdurl(), null);
        MediaType mediaType = MediaType.fromWireValue(raw.mediaType());
        if (mediaType == null) {
            if (raw.mediaType() != null && !raw.mediaType().isBlank()) {
                log.warn("Unrecognized media_type '{}' for {}; storing as image", raw.mediaType(), date);
            }
            mediaType = MediaType.IMAGE;
        }
        String explanation = truncate("explanation", defaultIfBlank(raw.explanation(), ""), EXPLANATION_MAX_LENGTH);
        String attribution = truncate("copyright", defaultIfBlank(raw.copyright(), DEFAULT_ATTRIBUTION), ATTRIBUTION_MAX_LENGTH);
        Instant retrievedAt = parseInstant(raw.retrievedAt());

        return new ApodRecord(
            date,
            title,
            mediaUrl,
            highDefUrl,
            mediaType,
            explanation,
            attribution,
            retrievedAt == null ? Instant.now(clock) : retrievedAt,
            resolveProvenance(raw, provenance)
        );
    }

    /**
     * A re-served cached row keeps the provenance it was stored with. Rows without a stored
     * provenance read as {@code cached}.
     */
    private Provenance resolveProvenance(RawApod raw, Provenance provenance) {
        if (provenance == null) {
            return Provenance.LIVE;
        }
        if (provenance == Provenance.CACHED) {
            Provenance stored = Provenance.fromWireValue(raw.provenance());
            return stored == null ? Provenance.CACHED : stored;
        }
        return provenance;
    }

    private LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("date", "Date field is missing from APOD data");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("date", "Date field is not an ISO date: " + value);
        }
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable retrieved_at '{}'", value);
            return null;
        }
    }

    private String truncate(String field, String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        log.debug("Truncating {} from {} to {} characters", field, value.length(), maxLength);
        return value.substring(0, maxLength);
    }

    private static String defaultIfBlank(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }
}
