package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted metadata of a workflow. The workflow's status is never stored;
 * it is derived from its tasks (see {@link WorkflowSummary}).
 */
public record WorkflowRecord(
    String id,
    String description,
    @JsonProperty("created_at") Instant createdAt
) {
    public WorkflowRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Workflow id cannot be empty");
        }
        Objects.requireNonNull(createdAt, "createdAt");
        description = description == null ? "" : description;
    }
}
