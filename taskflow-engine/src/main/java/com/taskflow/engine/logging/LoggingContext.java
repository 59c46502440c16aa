package com.taskflow.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Puts workflow and task ids on every log line written inside the block.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(workflowId, taskId, taskType)) {
 *     log.info("Dispatching task"); // includes workflowId, taskId, taskType
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String TASK_ID = "taskId";
    public static final String TASK_TYPE = "taskType";
    public static final String TRACE_ID = "traceId";

    private final boolean ownsTrace;
    private final boolean ownsWorkflow;

    private LoggingContext(boolean ownsTrace, boolean ownsWorkflow) {
        this.ownsTrace = ownsTrace;
        this.ownsWorkflow = ownsWorkflow;
    }

    /**
     * Create a logging context for a workflow run.
     */
    public static LoggingContext forWorkflow(String workflowId) {
        if (workflowId != null) {
            MDC.put(WORKFLOW_ID, workflowId);
        }
        return new LoggingContext(ensureTraceId(), true);
    }

    /**
     * Create a logging context for one task dispatch. Closing it restores
     * the enclosing workflow context, or clears the workflow id when there
     * is none on this thread (pooled dispatch).
     */
    public static LoggingContext forTask(String workflowId, String taskId, String taskType) {
        boolean ownsWorkflow = MDC.get(WORKFLOW_ID) == null;
        if (workflowId != null) {
            MDC.put(WORKFLOW_ID, workflowId);
        }
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        }
        if (taskType != null) {
            MDC.put(TASK_TYPE, taskType);
        }
        return new LoggingContext(ensureTraceId(), ownsWorkflow);
    }

    /**
     * Update the task type after a reclassification.
     */
    public static void setTaskType(String taskType) {
        if (taskType != null) {
            MDC.put(TASK_TYPE, taskType);
        }
    }

    public static String getWorkflowId() {
        return MDC.get(WORKFLOW_ID);
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static boolean ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
            return true;
        }
        return false;
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(TASK_TYPE);
        if (ownsWorkflow) {
            MDC.remove(WORKFLOW_ID);
        }
        if (ownsTrace) {
            MDC.remove(TRACE_ID);
        }
    }
}
