package com.delta.jobingest.ingest.model;

import java.time.Instant;
import java.time.LocalDate;

public record PostingRecord(
    long id,
    String externalId,
    String company,
    String title,
    String location,
    String url,
    LocalDate datePosted,
    String employmentType,
    String description,
    Instant firstSeen,
    Instant lastUpdated,
    boolean isActive
) {}
