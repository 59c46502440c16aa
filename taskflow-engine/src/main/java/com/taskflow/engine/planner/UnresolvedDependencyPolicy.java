package com.taskflow.engine.planner;

/**
 * What to do with a plan dependency that names no subtask of the plan.
 */
public enum UnresolvedDependencyPolicy {
    /**
     * Reject the whole plan.
     */
    FAIL,

    /**
     * Drop the edge and log a warning.
     */
    DROP
}
