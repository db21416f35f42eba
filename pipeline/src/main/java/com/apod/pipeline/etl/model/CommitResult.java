package com.apod.pipeline.etl.model;

public record CommitResult(String hash, boolean madeNewCommit) {}
