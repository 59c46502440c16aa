package com.taskflow.core.exception;

/**
 * Thrown when a store cannot read or write workflow state.
 */
public class TaskStoreException extends TaskflowException {

    public static final String ERROR_CODE = "STORE_FAILURE";

    public TaskStoreException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
