package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states for a task within a workflow.
 * Statuses only move forward; see {@link #canTransitionTo(TaskStatus)}.
 */
public enum TaskStatus {
    /**
     * Task has no unmet dependencies and is waiting to be picked up.
     * Transitions: -> IN_PROGRESS
     */
    PENDING("pending"),

    /**
     * Task is waiting for at least one dependency to complete.
     * Transitions: -> PENDING (once every dependency is COMPLETED)
     */
    BLOCKED("blocked"),

    /**
     * Task has been dispatched to a handler.
     * Transitions: -> COMPLETED, FAILED
     */
    IN_PROGRESS("in_progress"),

    /**
     * Handler reported success. Terminal state.
     */
    COMPLETED("completed"),

    /**
     * Handler reported failure. Terminal state.
     */
    FAILED("failed");

    private final String tag;

    TaskStatus(String tag) {
        this.tag = tag;
    }

    /**
     * Wire representation used in persisted task records.
     */
    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static TaskStatus fromTag(String tag) {
        for (TaskStatus status : values()) {
            if (status.tag.equalsIgnoreCase(tag) || status.name().equalsIgnoreCase(tag)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + tag);
    }

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if the task has not been dispatched yet.
     */
    public boolean isWaiting() {
        return this == PENDING || this == BLOCKED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case BLOCKED -> target == PENDING;
            case PENDING -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
