package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.PassTrigger;
import com.delta.jobingest.ingest.model.PipelinePassSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cron triggers for pipeline passes and the daily liveness audit. The expressions are read from
 * {@code ingest.scheduler.pipeline-cron}, {@code ingest.scheduler.audit-cron} and
 * {@code ingest.scheduler.zone}, and only fire when scheduling is enabled.
 */
@Component
public class IngestScheduler {
    private static final Logger log = LoggerFactory.getLogger(IngestScheduler.class);

    private final IngestProperties properties;
    private final PipelinePassService pipelinePassService;
    private final LivenessAuditService livenessAuditService;

    public IngestScheduler(
        IngestProperties properties,
        PipelinePassService pipelinePassService,
        LivenessAuditService livenessAuditService
    ) {
        this.properties = properties;
        this.pipelinePassService = pipelinePassService;
        this.livenessAuditService = livenessAuditService;
    }

    @Scheduled(cron = "${ingest.scheduler.pipeline-cron:0 0 7-17 * * *}", zone = "${ingest.scheduler.zone:UTC}")
    public void scheduledPass() {
        try {
            PipelinePassSummary summary = pipelinePassService.runPass(PassTrigger.SCHEDULED);
            log.info("Scheduled pipeline pass {} finished with status {}", summary.passId(), summary.status());
        } catch (ActivePipelinePassException e) {
            log.info("Skipping scheduled pipeline pass: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${ingest.scheduler.audit-cron:0 0 18 * * *}", zone = "${ingest.scheduler.zone:UTC}")
    public void scheduledAudit() {
        livenessAuditService.audit();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void runOnStartup() {
        if (!properties.getScheduler().isEnabled() || !properties.getScheduler().isRunOnStartup()) {
            return;
        }
        if (properties.getCli().isRun()) {
            log.info("Skipping startup pipeline pass because a CLI run is configured");
            return;
        }
        try {
            long passId = pipelinePassService.startAsync(PassTrigger.STARTUP);
            log.info("Startup pipeline pass {} queued", passId);
        } catch (ActivePipelinePassException e) {
            log.info("Skipping startup pipeline pass: {}", e.getMessage());
        }
    }
}
