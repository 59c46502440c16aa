package com.taskflow.engine.executor;

import com.taskflow.core.model.WorkflowSummary;

import java.util.List;

/**
 * Outcome of one workflow run.
 *
 * @param stuckTaskIds Tasks left waiting when the run ended DEADLOCKED or UPSTREAM_FAILED
 */
public record ExecutionReport(
    String workflowId,
    Termination termination,
    WorkflowSummary summary,
    List<String> stuckTaskIds
) {
    public ExecutionReport {
        stuckTaskIds = stuckTaskIds == null ? List.of() : List.copyOf(stuckTaskIds);
    }
}
