package com.delta.jobingest.ingest.model;

public enum PassTrigger {
    SCHEDULED,
    STARTUP,
    MANUAL,
    CLI
}
