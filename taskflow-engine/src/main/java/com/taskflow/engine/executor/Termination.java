package com.taskflow.engine.executor;

/**
 * Why a workflow run stopped.
 */
public enum Termination {
    /**
     * No task is left waiting or running.
     */
    DRAINED,

    /**
     * Tasks are waiting on each other (or on tasks that do not exist) and none can run.
     */
    DEADLOCKED,

    /**
     * Every task still waiting depends, directly or transitively, on a failed task.
     */
    UPSTREAM_FAILED,

    /**
     * Tasks are marked in progress but no execution is running them, e.g. after a
     * crash with orphan recovery turned off.
     */
    ORPHANED,

    /**
     * The run was cancelled before the workflow drained.
     */
    CANCELLED
}
