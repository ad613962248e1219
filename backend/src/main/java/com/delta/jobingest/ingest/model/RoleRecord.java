package com.delta.jobingest.ingest.model;

public record RoleRecord(long id, String name) {}
