package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Point-in-time aggregate of a workflow's task statuses.
 *
 * Invariants:
 * - pendingTasks + blockedTasks + inProgressTasks + completedTasks + failedTasks == totalTasks
 * - progressPercentage is 0 for an empty workflow
 */
public record WorkflowSummary(
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("total_tasks") int totalTasks,
    @JsonProperty("pending_tasks") int pendingTasks,
    @JsonProperty("blocked_tasks") int blockedTasks,
    @JsonProperty("in_progress_tasks") int inProgressTasks,
    @JsonProperty("completed_tasks") int completedTasks,
    @JsonProperty("failed_tasks") int failedTasks,
    @JsonProperty("overall_status") OverallStatus overallStatus,
    @JsonProperty("progress_percentage") double progressPercentage
) {
    /**
     * Derive the summary from a snapshot of tasks.
     */
    public static WorkflowSummary of(String workflowId, Collection<Task> tasks) {
        int pending = 0;
        int blocked = 0;
        int inProgress = 0;
        int completed = 0;
        int failed = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case PENDING -> pending++;
                case BLOCKED -> blocked++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        int total = tasks.size();
        double progress = total == 0 ? 0.0 : (double) completed / total * 100.0;
        return new WorkflowSummary(
            workflowId,
            total,
            pending,
            blocked,
            inProgress,
            completed,
            failed,
            OverallStatus.derive(total, completed, failed, inProgress),
            progress
        );
    }

    /**
     * Tasks that have not started yet, blocked ones included.
     */
    public int waitingTasks() {
        return pendingTasks + blockedTasks;
    }
}
