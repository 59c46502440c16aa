package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate status of a workflow, derived from the statuses of its tasks.
 */
public enum OverallStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    PARTIALLY_COMPLETED("partially_completed"),
    FAILED("failed");

    private final String tag;

    OverallStatus(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Derive the aggregate from task counts.
     * Failure outranks completion, completion outranks activity.
     */
    public static OverallStatus derive(int total, int completed, int failed, int inProgress) {
        if (failed > 0) {
            return completed > 0 ? PARTIALLY_COMPLETED : FAILED;
        }
        if (completed == total) {
            return COMPLETED;
        }
        if (inProgress > 0) {
            return IN_PROGRESS;
        }
        return PENDING;
    }
}
