package com.delta.jobingest.ingest.model;

public record RoleStats(String role, long postingCount) {}
