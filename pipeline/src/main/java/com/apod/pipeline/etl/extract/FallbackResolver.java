package com.apod.pipeline.etl.extract;

import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.model.RawApod;

import java.time.LocalDate;
import java.util.Optional;

/**
 * One step of the degraded-extraction chain, consulted in order once live retries are spent.
 */
public interface FallbackResolver {

    /**
     * @param requestedDate the day a backfill asked for, or {@code null} for the current APOD
     */
    Optional<RawApod> resolve(LocalDate requestedDate);

    Provenance provenance();
}
