package com.apod.pipeline.etl.extract;

import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.model.RawApod;
import com.apod.pipeline.etl.persistence.ApodCsvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Optional;

@Component
@Order(1)
public class CachedRecordResolver implements FallbackResolver {
    private static final Logger log = LoggerFactory.getLogger(CachedRecordResolver.class);

    private final ApodCsvStore csvStore;

    public CachedRecordResolver(ApodCsvStore csvStore) {
        this.csvStore = csvStore;
    }

    @Override
    public Optional<RawApod> resolve(LocalDate requestedDate) {
        try {
            Optional<RawApod> cached = requestedDate == null
                ? csvStore.latestServable()
                : csvStore.findServable(requestedDate);
            if (cached.isEmpty()) {
                log.info("No cached APOD row for {} in {}", requestedDate == null ? "latest" : requestedDate, csvStore.csvPath());
            }
            return cached;
        } catch (IOException e) {
            log.warn("Cached APOD store {} could not be read: {}", csvStore.csvPath(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Provenance provenance() {
        return Provenance.CACHED;
    }
}
