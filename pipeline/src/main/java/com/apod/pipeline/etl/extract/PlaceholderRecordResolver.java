package com.apod.pipeline.etl.extract;

import com.apod.pipeline.etl.model.MediaType;
import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.model.RawApod;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

@Component
@Order(2)
public class PlaceholderRecordResolver implements FallbackResolver {
    static final String PLACEHOLDER_TITLE = "APOD Unavailable";
    static final String PLACEHOLDER_EXPLANATION =
        "The APOD service could not be reached for this date. This placeholder record was generated by the pipeline.";
    static final String PLACEHOLDER_ATTRIBUTION = "NASA";

    private final Clock clock;

    public PlaceholderRecordResolver(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<RawApod> resolve(LocalDate requestedDate) {
        LocalDate date = requestedDate == null ? LocalDate.now(clock) : requestedDate;
        return Optional.of(new RawApod(
            date.toString(),
            PLACEHOLDER_TITLE,
            "",
            null,
            MediaType.IMAGE.wireValue(),
            PLACEHOLDER_EXPLANATION,
            PLACEHOLDER_ATTRIBUTION,
            null,
            Provenance.PLACEHOLDER.wireValue()
        ));
    }

    @Override
    public Provenance provenance() {
        return Provenance.PLACEHOLDER;
    }
}
