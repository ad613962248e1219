package com.delta.jobingest.ingest.model;

public record StatusResponse(boolean dbConnected, LivenessAudit liveness, PipelinePassRecord latestPass) {}
