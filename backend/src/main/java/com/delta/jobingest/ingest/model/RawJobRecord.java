package com.delta.jobingest.ingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One job as returned by a source adapter, before identity resolution.
 */
public record RawJobRecord(
    String externalId,
    String title,
    String location,
    String url,
    String datePosted,
    String employmentType,
    String description,
    Map<String, Object> attributes
) {
    public RawJobRecord {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public RawJobRecord(
        String externalId,
        String title,
        String location,
        String url,
        String datePosted,
        String employmentType,
        String description
    ) {
        this(externalId, title, location, url, datePosted, employmentType, description, Map.of());
    }

    public boolean hasIdentity() {
        return externalId != null && !externalId.isBlank();
    }

    public RawJobRecord withDescription(String newDescription) {
        return new RawJobRecord(externalId, title, location, url, datePosted, employmentType, newDescription, attributes);
    }
}
