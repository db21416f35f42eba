package com.apod.pipeline.etl.model;

public record FetchResponse(
    HttpFetchResult result,
    FetchClassification classification,
    RawApod body,
    String reason
) {
    public int statusCode() {
        return result == null ? 0 : result.statusCode();
    }
}
