package com.delta.jobingest.ingest.model;

public record SourceRunCounts(int added, int updated, int expired, int duplicatesSkipped, int failed) {

    public static SourceRunCounts empty() {
        return new SourceRunCounts(0, 0, 0, 0, 0);
    }
}
