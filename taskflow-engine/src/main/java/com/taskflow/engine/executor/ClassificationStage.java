package com.taskflow.engine.executor;

/**
 * Point in a task's execution at which its type is reconsidered.
 */
public enum ClassificationStage {
    /**
     * Before the first handler call, from the description alone.
     */
    PRE_DISPATCH,

    /**
     * After the handler failed, with the error text available.
     */
    POST_FAILURE
}
