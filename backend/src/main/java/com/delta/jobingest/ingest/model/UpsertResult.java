package com.delta.jobingest.ingest.model;

public record UpsertResult(UpsertOutcome outcome, PostingRecord posting, UpsertFailureReason failureReason) {

    public static UpsertResult created(PostingRecord posting) {
        return new UpsertResult(UpsertOutcome.CREATED, posting, null);
    }

    public static UpsertResult updated(PostingRecord posting) {
        return new UpsertResult(UpsertOutcome.UPDATED, posting, null);
    }

    public static UpsertResult duplicateSkipped(PostingRecord existing) {
        return new UpsertResult(UpsertOutcome.DUPLICATE_SKIPPED, existing, null);
    }

    public static UpsertResult failed(UpsertFailureReason reason) {
        return new UpsertResult(UpsertOutcome.FAILED, null, reason);
    }

    public boolean isFailed() {
        return outcome == UpsertOutcome.FAILED;
    }
}
