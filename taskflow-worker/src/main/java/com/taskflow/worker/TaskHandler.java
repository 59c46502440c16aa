package com.taskflow.worker;

/**
 * Interface for type-specific task implementations.
 * Each {@link com.taskflow.core.model.TaskType} is served by at most one handler.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Execute the task.
     *
     * @param context Execution context providing the task and upstream data
     * @return The outcome; a handler reports expected failures through
     *         {@link HandlerOutcome#failure(String)} or by throwing
     * @throws HandlerException if the task fails
     */
    HandlerOutcome handle(HandlerContext context) throws HandlerException;
}
