package com.taskflow.core.exception;

import java.util.List;

/**
 * Thrown when a parsed plan cannot be turned into a workflow:
 * empty, duplicate ids, unresolved or self dependencies, cycles.
 */
public class InvalidPlanException extends TaskflowException {

    public static final String ERROR_CODE = "INVALID_PLAN";

    private final List<String> violations;

    public InvalidPlanException(List<String> violations) {
        super(ERROR_CODE, "Invalid plan: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
