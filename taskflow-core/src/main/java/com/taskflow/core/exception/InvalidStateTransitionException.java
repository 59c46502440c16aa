package com.taskflow.core.exception;

import com.taskflow.core.model.TaskStatus;

/**
 * Thrown when a task status change violates the forward-only transition rules.
 */
public class InvalidStateTransitionException extends TaskflowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String taskId, TaskStatus current, TaskStatus target) {
        super(ERROR_CODE, String.format(
            "Cannot transition task %s from %s to %s",
            taskId, current.tag(), target.tag()
        ));
    }

    public InvalidStateTransitionException(String taskId, String message) {
        super(ERROR_CODE, String.format("Task %s: %s", taskId, message));
    }
}
