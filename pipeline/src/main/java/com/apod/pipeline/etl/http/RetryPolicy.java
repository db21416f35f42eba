package com.apod.pipeline.etl.http;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.FetchClassification;
import com.apod.pipeline.etl.model.FetchResponse;
import com.apod.pipeline.etl.model.RetryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Bounded exponential backoff: attempt {@code n} that comes back retryable waits
 * {@code base * 2^(n-1)} before attempt {@code n+1}, up to {@code maxRetries} attempts in total.
 */
@Component
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final PipelineProperties properties;
    private final BackoffSleeper sleeper;

    public RetryPolicy(PipelineProperties properties, BackoffSleeper sleeper) {
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public RetryOutcome execute(Supplier<FetchResponse> call) {
        int maxAttempts = properties.getApi().getMaxRetries();
        FetchResponse last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            last = call.get();
            FetchClassification classification = last.classification();
            if (classification == FetchClassification.SUCCESS) {
                return new RetryOutcome(last, attempt, false);
            }
            if (classification == FetchClassification.FATAL) {
                throw new FatalUpstreamException(
                    last.reason(),
                    last.statusCode(),
                    "APOD API returned a non-retryable response (" + last.reason() + ") on attempt " + attempt
                );
            }
            if (attempt >= maxAttempts) {
                return new RetryOutcome(last, attempt, true);
            }
            long delay = backoffMillis(attempt);
            log.warn(
                "APOD attempt {}/{} failed with {}; retrying in {} ms",
                attempt,
                maxAttempts,
                last.reason(),
                delay
            );
            if (!sleepBackoff(delay)) {
                log.warn("Backoff interrupted after attempt {}; giving up on live fetch", attempt);
                return new RetryOutcome(last, attempt, true);
            }
        }
        return new RetryOutcome(last, maxAttempts, true);
    }

    public long backoffMillis(int attempt) {
        long baseDelayMs = properties.getApi().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return 0;
        }
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = baseDelayMs * (1L << shift);
        long maxDelayMs = properties.getApi().getRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    private boolean sleepBackoff(long delay) {
        if (delay <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
