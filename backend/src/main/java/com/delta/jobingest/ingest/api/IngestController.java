package com.delta.jobingest.ingest.api;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.PassTrigger;
import com.delta.jobingest.ingest.model.PipelinePassRecord;
import com.delta.jobingest.ingest.model.PipelinePassSummary;
import com.delta.jobingest.ingest.model.RoleStats;
import com.delta.jobingest.ingest.model.RunRecord;
import com.delta.jobingest.ingest.model.StatusResponse;
import com.delta.jobingest.ingest.service.IngestStatusService;
import com.delta.jobingest.ingest.service.PipelinePassService;
import com.delta.jobingest.ingest.service.RoleClassifierService;
import com.delta.jobingest.ingest.service.RunLedgerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class IngestController {
    private static final int MAX_LIMIT = 500;

    private final IngestProperties properties;
    private final PipelinePassService pipelinePassService;
    private final RunLedgerService runLedgerService;
    private final RoleClassifierService roleClassifierService;
    private final IngestStatusService statusService;

    public IngestController(
        IngestProperties properties,
        PipelinePassService pipelinePassService,
        RunLedgerService runLedgerService,
        RoleClassifierService roleClassifierService,
        IngestStatusService statusService
    ) {
        this.properties = properties;
        this.pipelinePassService = pipelinePassService;
        this.runLedgerService = runLedgerService;
        this.roleClassifierService = roleClassifierService;
        this.statusService = statusService;
    }

    @PostMapping("/pipeline/run")
    public Map<String, Long> runPipeline() {
        long passId = pipelinePassService.startAsync(PassTrigger.MANUAL);
        return Map.of("passId", passId);
    }

    @PostMapping("/sources/{name}/run")
    public RunRecord runSource(@PathVariable("name") String name) {
        IngestProperties.Source source = properties.findSource(name);
        if (source == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown source: " + name);
        }
        return pipelinePassService.runSingleSource(source);
    }

    @GetMapping("/pipeline/passes")
    public List<PipelinePassRecord> recentPasses(
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        return runLedgerService.recentPasses(clampLimit(limit));
    }

    @GetMapping("/pipeline/passes/{passId}")
    public PipelinePassSummary pass(@PathVariable("passId") long passId) {
        PipelinePassSummary summary = runLedgerService.passSummary(passId);
        if (summary == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown pipeline pass: " + passId);
        }
        return summary;
    }

    @GetMapping("/pipeline/runs")
    public List<RunRecord> recentRuns(
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return runLedgerService.recentRuns(source, clampLimit(limit));
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/roles")
    public List<RoleStats> roles() {
        return roleClassifierService.roleStats();
    }

    private int clampLimit(int limit) {
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }
}
