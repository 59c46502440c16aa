package com.taskflow.core.exception;

/**
 * Thrown when the completion service could not produce a plan.
 */
public class CompletionFailedException extends TaskflowException {

    public static final String ERROR_CODE = "COMPLETION_FAILED";

    public CompletionFailedException(String message) {
        super(ERROR_CODE, message);
    }
}
