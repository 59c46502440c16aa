package com.taskflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw outcome of a handler invocation, before artifacts are derived.
 * error and errorCode are only set on failure.
 */
public record HandlerOutcome(
    boolean success,
    JsonNode result,
    String error,
    String errorCode
) {
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    public static final String HANDLER_FAILURE = "HANDLER_FAILURE";

    public HandlerOutcome {
        if (!success && (error == null || error.isBlank())) {
            error = "Task failed without an error message";
        }
        if (success) {
            error = null;
            errorCode = null;
        } else if (errorCode == null) {
            errorCode = HANDLER_FAILURE;
        }
    }

    public static HandlerOutcome success(JsonNode result) {
        return new HandlerOutcome(true, result, null, null);
    }

    public static HandlerOutcome failure(String error) {
        return new HandlerOutcome(false, null, error, HANDLER_FAILURE);
    }

    public static HandlerOutcome failure(String errorCode, String error, JsonNode result) {
        return new HandlerOutcome(false, result, error, errorCode);
    }
}
