package com.apod.pipeline.etl.model;

public record PublishResult(boolean ok, String reason, String branch) {}
