package com.delta.jobingest.ingest.model;

import java.time.Instant;
import java.util.Map;

public record LivenessAudit(
    long activePostings,
    long inactivePostings,
    Map<String, Long> activeByCompany,
    Instant auditedAt
) {}
