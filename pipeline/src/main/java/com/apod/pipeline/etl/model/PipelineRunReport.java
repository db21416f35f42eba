package com.apod.pipeline.etl.model;

import java.time.Instant;

public record PipelineRunReport(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    ApodRecord record,
    int attempts,
    ExtractionState extractionState,
    VerificationReport verification,
    MetadataResult metadata,
    VersioningState versioningState,
    CommitResult commit,
    PublishResult publish) {}
