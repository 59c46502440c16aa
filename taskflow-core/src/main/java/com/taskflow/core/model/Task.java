package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One schedulable unit of work within a workflow.
 * Immutable; state changes produce copies through the {@code with*} methods.
 *
 * Invariants:
 * - id is non-empty and unique within its workflow
 * - dependencies is ordered and free of duplicates
 * - startedAt and completedAt are each set at most once, and
 *   createdAt <= startedAt <= completedAt
 * - result is set once execution finishes (success or failure)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
    String id,
    String description,
    @JsonProperty("task_type") TaskType taskType,
    TaskStatus status,
    List<String> dependencies,
    TaskResult result,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    Map<String, String> metadata
) {
    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be empty");
        }
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        description = description == null ? "" : description;
        taskType = taskType == null ? TaskType.GENERAL_TASK : taskType;
        dependencies = dependencies == null
            ? List.of()
            : List.copyOf(new LinkedHashSet<>(dependencies));
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Create a new task. Tasks without dependencies start PENDING, all others BLOCKED.
     */
    public static Task create(
            String id,
            String description,
            TaskType taskType,
            List<String> dependencies,
            Map<String, String> metadata,
            Instant createdAt) {

        boolean hasDependencies = dependencies != null && !dependencies.isEmpty();
        return new Task(
            id,
            description,
            taskType,
            hasDependencies ? TaskStatus.BLOCKED : TaskStatus.PENDING,
            dependencies,
            null,
            createdAt,
            null,
            null,
            metadata
        );
    }

    /**
     * Check whether this task waits on the given task.
     */
    public boolean dependsOn(String taskId) {
        return dependencies.contains(taskId);
    }

    /**
     * Create a copy with a new status. The first IN_PROGRESS sets startedAt,
     * the first terminal status sets completedAt.
     */
    public Task withStatus(TaskStatus newStatus, Instant now) {
        Instant started = startedAt;
        Instant completed = completedAt;
        if (newStatus == TaskStatus.IN_PROGRESS && started == null) {
            started = latest(now, createdAt);
        }
        if (newStatus.isTerminal() && completed == null) {
            completed = latest(now, started != null ? started : createdAt);
        }
        return new Task(id, description, taskType, newStatus, dependencies, result,
            createdAt, started, completed, metadata);
    }

    /**
     * Create a copy carrying the execution result.
     */
    public Task withResult(TaskResult newResult) {
        return new Task(id, description, taskType, status, dependencies, newResult,
            createdAt, startedAt, completedAt, metadata);
    }

    /**
     * Create a copy with a replaced dependency list. Status is left untouched.
     */
    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, description, taskType, status, newDependencies, result,
            createdAt, startedAt, completedAt, metadata);
    }

    /**
     * Create a copy reclassified to another type.
     */
    public Task withTaskType(TaskType newType) {
        return new Task(id, description, newType, status, dependencies, result,
            createdAt, startedAt, completedAt, metadata);
    }

    private static Instant latest(Instant candidate, Instant floor) {
        return candidate.isBefore(floor) ? floor : candidate;
    }
}
