package com.delta.jobingest.ingest.model;

public record DatabaseStatistics(long activePostings, long totalPostings, long companies, long roles) {}
