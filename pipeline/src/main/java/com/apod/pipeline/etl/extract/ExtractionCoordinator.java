package com.apod.pipeline.etl.extract;

import com.apod.pipeline.etl.http.ApodApiClient;
import com.apod.pipeline.etl.http.RetryPolicy;
import com.apod.pipeline.etl.model.ExtractionOutcome;
import com.apod.pipeline.etl.model.ExtractionState;
import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.model.RawApod;
import com.apod.pipeline.etl.model.RetryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Drives extraction from {@code ATTEMPTING} to one of the terminal states. Only a fatal
 * upstream classification escapes as an exception; every other path ends with a record.
 */
@Service
public class ExtractionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ExtractionCoordinator.class);

    private final ApodApiClient apiClient;
    private final RetryPolicy retryPolicy;
    private final List<FallbackResolver> fallbacks;

    public ExtractionCoordinator(ApodApiClient apiClient, RetryPolicy retryPolicy, List<FallbackResolver> fallbacks) {
        this.apiClient = apiClient;
        this.retryPolicy = retryPolicy;
        this.fallbacks = List.copyOf(fallbacks);
    }

    public ExtractionOutcome extract() {
        return extract(null);
    }

    public ExtractionOutcome extract(LocalDate date) {
        log.info("Extraction state {} (date={})", ExtractionState.ATTEMPTING, date == null ? "today" : date);
        RetryOutcome retry = retryPolicy.execute(() -> apiClient.fetch(date));
        if (!retry.exhausted()) {
            RawApod raw = retry.lastResponse().body();
            log.info("Extraction state {} after {} attempt(s): {} - {}", ExtractionState.SUCCESS, retry.attempts(), raw.date(), raw.title());
            return new ExtractionOutcome(raw, Provenance.LIVE, retry.attempts(), ExtractionState.SUCCESS);
        }

        log.warn(
            "Extraction state {} after {} attempt(s), last failure {}",
            ExtractionState.EXHAUSTED_RETRIES,
            retry.attempts(),
            retry.lastResponse() == null ? "unknown" : retry.lastResponse().reason()
        );
        for (FallbackResolver fallback : fallbacks) {
            Optional<RawApod> resolved = fallback.resolve(date);
            if (resolved.isPresent()) {
                ExtractionState state = ExtractionState.forProvenance(fallback.provenance());
                log.warn("Extraction state {}: serving {} record for {}", state, fallback.provenance().wireValue(), resolved.get().date());
                return new ExtractionOutcome(resolved.get(), fallback.provenance(), retry.attempts(), state);
            }
        }
        throw new IllegalStateException("No fallback resolver produced an APOD record");
    }
}
