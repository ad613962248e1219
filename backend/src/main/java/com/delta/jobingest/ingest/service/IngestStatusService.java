package com.delta.jobingest.ingest.service;

import com.delta.jobingest.ingest.model.LivenessAudit;
import com.delta.jobingest.ingest.model.PipelinePassRecord;
import com.delta.jobingest.ingest.model.StatusResponse;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class IngestStatusService {
    private static final Logger log = LoggerFactory.getLogger(IngestStatusService.class);

    private final PostingJdbcRepository repository;
    private final LivenessAuditService livenessAuditService;
    private final RunLedgerService runLedgerService;

    public IngestStatusService(
        PostingJdbcRepository repository,
        LivenessAuditService livenessAuditService,
        RunLedgerService runLedgerService
    ) {
        this.repository = repository;
        this.livenessAuditService = livenessAuditService;
        this.runLedgerService = runLedgerService;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database unreachable while building status: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, null, null);
        }
        LivenessAudit liveness = livenessAuditService.audit();
        PipelinePassRecord latestPass = runLedgerService.latestPass();
        return new StatusResponse(true, liveness, latestPass);
    }
}
