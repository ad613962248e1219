package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.PassTrigger;
import com.delta.jobingest.ingest.model.PipelinePassSummary;
import com.delta.jobingest.ingest.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class IngestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestCliRunner.class);

    private final IngestProperties properties;
    private final PipelinePassService pipelinePassService;
    private final ConfigurableApplicationContext applicationContext;

    public IngestCliRunner(
        IngestProperties properties,
        PipelinePassService pipelinePassService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelinePassService = pipelinePassService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> sources = Arrays.stream(properties.getCli().getSources().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        PipelinePassSummary summary = pipelinePassService.runPass(PassTrigger.CLI, sources);
        log.info("Pipeline pass {} completed with status {}", summary.passId(), summary.status());
        for (RunRecord run : summary.runs()) {
            log.info(
                "Source {}: status={}, added={}, updated={}, expired={}, duplicates={}, failed={}, error={}",
                run.sourceName(),
                run.status(),
                run.postingsAdded(),
                run.postingsUpdated(),
                run.postingsExpired(),
                run.duplicatesSkipped(),
                run.postingsFailed(),
                run.errorMessage()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
