package com.apod.pipeline.etl.service;

import com.apod.pipeline.etl.model.PipelineRunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "apod.schedule", name = "enabled", havingValue = "true")
public class PipelineScheduler {
    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineRunService runService;

    public PipelineScheduler(PipelineRunService runService) {
        this.runService = runService;
    }

    @Scheduled(cron = "${apod.schedule.cron:0 0 0 * * *}", zone = "${apod.schedule.zone:UTC}")
    public void runDaily() {
        try {
            PipelineRunReport report = runService.run();
            log.info("Scheduled run {} finished with status {}", report.runId(), report.status());
        } catch (ActivePipelineRunException e) {
            log.warn("Skipping scheduled run: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled run failed", e);
        }
    }
}
