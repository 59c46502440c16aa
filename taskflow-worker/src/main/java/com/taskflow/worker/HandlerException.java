package com.taskflow.worker;

/**
 * Exception thrown by task handlers on failure.
 * The message becomes the task's error text.
 */
public class HandlerException extends Exception {

    private final String errorCode;

    public HandlerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public HandlerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
