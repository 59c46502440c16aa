package com.taskflow.core.exception;

/**
 * Thrown when the completion text contains no usable JSON plan.
 */
public class PlanParseException extends TaskflowException {

    public static final String ERROR_CODE = "PLAN_PARSE_ERROR";

    public PlanParseException(String message) {
        super(ERROR_CODE, message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
