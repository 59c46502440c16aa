package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one execution attempt of a task.
 *
 * Invariants:
 * - error is set iff success == false
 * - artifacts is never null; keys are the names downstream tasks consume
 *   (e.g. filename, headlines, url)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
    boolean success,
    JsonNode result,
    String error,
    Map<String, JsonNode> artifacts
) {
    public TaskResult {
        if (result != null && result.isNull()) {
            result = null;
        }
        if (success && error != null) {
            throw new IllegalArgumentException("A successful result cannot carry an error");
        }
        if (!success && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("A failed result must carry an error message");
        }
        artifacts = artifacts == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    /**
     * Create a successful result.
     */
    public static TaskResult success(JsonNode result, Map<String, JsonNode> artifacts) {
        return new TaskResult(true, result, null, artifacts);
    }

    /**
     * Create a failed result.
     */
    public static TaskResult failure(String error, JsonNode result, Map<String, JsonNode> artifacts) {
        return new TaskResult(false, result, error, artifacts);
    }

    /**
     * Create a failed result with no payload.
     */
    public static TaskResult failure(String error) {
        return failure(error, null, Map.of());
    }
}
