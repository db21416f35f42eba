package com.apod.pipeline.etl.service;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.PipelineRunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class PipelineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);

    private final PipelineProperties properties;
    private final PipelineRunService runService;
    private final ConfigurableApplicationContext applicationContext;

    public PipelineCliRunner(
        PipelineProperties properties,
        PipelineRunService runService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.runService = runService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int status = 0;
        try {
            PipelineRunReport report = runService.run();
            log.info(
                "Run {} completed with status {}: date={} provenance={} attempts={} commit={} publish={}",
                report.runId(),
                report.status(),
                report.record().date(),
                report.record().provenance().wireValue(),
                report.attempts(),
                report.commit() == null ? "skipped" : report.commit().hash(),
                report.publish() == null ? "skipped" : report.publish().reason()
            );
        } catch (RuntimeException e) {
            log.error("Pipeline run failed", e);
            status = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalStatus = status;
            int exitCode = SpringApplication.exit(applicationContext, () -> finalStatus);
            System.exit(exitCode);
        }
    }
}
