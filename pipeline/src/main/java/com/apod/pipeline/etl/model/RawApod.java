package com.apod.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RawApod(
    @JsonProperty("date") String date,
    @JsonProperty("title") String title,
    @JsonProperty("url") String url,
    @JsonProperty("hdurl") String hdurl,
    @JsonProperty("media_type") String mediaType,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("copyright") String copyright,
    @JsonProperty("retrieved_at") String retrievedAt,
    @JsonProperty("provenance") String provenance
) {}
