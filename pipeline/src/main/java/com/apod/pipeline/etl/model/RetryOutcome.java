package com.apod.pipeline.etl.model;

public record RetryOutcome(FetchResponse lastResponse, int attempts, boolean exhausted) {}
