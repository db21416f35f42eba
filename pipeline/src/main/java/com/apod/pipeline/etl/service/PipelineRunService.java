package com.apod.pipeline.etl.service;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.extract.ExtractionCoordinator;
import com.apod.pipeline.etl.model.ApodRecord;
import com.apod.pipeline.etl.model.CommitResult;
import com.apod.pipeline.etl.model.ExtractionOutcome;
import com.apod.pipeline.etl.model.MetadataResult;
import com.apod.pipeline.etl.model.PipelineRunReport;
import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.model.PublishResult;
import com.apod.pipeline.etl.model.VerificationReport;
import com.apod.pipeline.etl.model.VersioningState;
import com.apod.pipeline.etl.versioning.MetadataVersioner;
import com.apod.pipeline.etl.versioning.PublishAttempt;
import com.apod.pipeline.etl.versioning.RepositoryReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class PipelineRunService {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunService.class);

    public static final String STATUS_SUCCEEDED = "SUCCEEDED";
    public static final String STATUS_COMPLETED_WITH_WARNINGS = "COMPLETED_WITH_WARNINGS";

    private final PipelineProperties properties;
    private final ExtractionCoordinator extractionCoordinator;
    private final ApodNormalizer normalizer;
    private final DualSinkWriter sinkWriter;
    private final VerificationGate verificationGate;
    private final MetadataVersioner metadataVersioner;
    private final RepositoryReconciler repositoryReconciler;
    private final PublishAttempt publishAttempt;
    private final ExecutorService sinkExecutor;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PipelineRunService(
        PipelineProperties properties,
        ExtractionCoordinator extractionCoordinator,
        ApodNormalizer normalizer,
        DualSinkWriter sinkWriter,
        VerificationGate verificationGate,
        MetadataVersioner metadataVersioner,
        RepositoryReconciler repositoryReconciler,
        PublishAttempt publishAttempt,
        @Qualifier("sinkExecutor") ExecutorService sinkExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.extractionCoordinator = extractionCoordinator;
        this.normalizer = normalizer;
        this.sinkWriter = sinkWriter;
        this.verificationGate = verificationGate;
        this.metadataVersioner = metadataVersioner;
        this.repositoryReconciler = repositoryReconciler;
        this.publishAttempt = publishAttempt;
        this.sinkExecutor = sinkExecutor;
        this.clock = clock;
    }

    public boolean isRunning() {
        return running.get();
    }

    public PipelineRunReport run() {
        return run(null);
    }

    public PipelineRunReport run(LocalDate date) {
        if (!running.compareAndSet(false, true)) {
            throw new ActivePipelineRunException("A pipeline run is already in progress");
        }
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now(clock);
        try {
            log.info("Pipeline run {} started", runId);
            PipelineRunReport report = execute(runId, startedAt, date);
            log.info("Pipeline run {} finished with status {}", runId, report.status());
            return report;
        } catch (RuntimeException e) {
            log.error("Pipeline run {} failed: {}", runId, e.getMessage());
            throw e;
        } finally {
            running.set(false);
        }
    }

    private PipelineRunReport execute(String runId, Instant startedAt, LocalDate date) {
        ExtractionOutcome outcome = extractionCoordinator.extract(date);
        ApodRecord record = normalizer.normalize(outcome);
        log.info("Normalized APOD {} ({}, {})", record.date(), record.mediaType().wireValue(), record.provenance().wireValue());

        writeSinks(record);

        VerificationReport verification = verificationGate.verify(record.date());
        if (!verification.passed() && properties.getVerification().isFailRunOnFailure()) {
            throw new VerificationFailedException(verification);
        }

        MetadataResult metadata = null;
        VersioningState versioningState = null;
        CommitResult commit = null;
        PublishResult publish = null;
        if (properties.getVersioning().isEnabled()) {
            repositoryReconciler.ensureInitialized();
            metadata = metadataVersioner.version(properties.getData().csvPath());
            versioningState = repositoryReconciler.inspect(metadata);
            commit = repositoryReconciler.reconcile(record.date().toString());
            publish = publishAttempt.publish(properties.getVersioning().getBranch());
            if (!publish.ok()) {
                log.warn("Publish did not complete: {}", publish.reason());
            }
        } else {
            log.info("Versioning disabled, skipping metadata and commit");
        }

        boolean warnings = !verification.passed() || outcome.provenance() != Provenance.LIVE;
        return new PipelineRunReport(
            runId,
            startedAt,
            Instant.now(clock),
            warnings ? STATUS_COMPLETED_WITH_WARNINGS : STATUS_SUCCEEDED,
            record,
            outcome.attempts(),
            outcome.state(),
            verification,
            metadata,
            versioningState,
            commit,
            publish
        );
    }

    private void writeSinks(ApodRecord record) {
        CompletableFuture<Void> database = CompletableFuture.runAsync(() -> sinkWriter.upsert(record), sinkExecutor);
        CompletableFuture<Integer> csv = CompletableFuture.supplyAsync(() -> sinkWriter.appendAndDedupe(record), sinkExecutor);
        try {
            CompletableFuture.allOf(database, csv).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof SinkWriteException sinkFailure) {
                throw sinkFailure;
            }
            throw new SinkWriteException("unknown", "Sink write failed for " + record.date(), cause);
        }
        log.info("Both sinks written for {} (csvRows={})", record.date(), csv.join());
    }
}
