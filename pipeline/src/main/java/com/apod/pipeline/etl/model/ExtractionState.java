package com.apod.pipeline.etl.model;

public enum ExtractionState {
    ATTEMPTING,
    SUCCESS,
    EXHAUSTED_RETRIES,
    FALLBACK_CACHED,
    FALLBACK_PLACEHOLDER;

    public static ExtractionState forProvenance(Provenance provenance) {
        return switch (provenance) {
            case LIVE -> SUCCESS;
            case CACHED -> FALLBACK_CACHED;
            case PLACEHOLDER -> FALLBACK_PLACEHOLDER;
        };
    }
}
