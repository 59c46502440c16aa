package com.taskflow.engine.service;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskType;
import com.taskflow.core.model.WorkflowRecord;
import com.taskflow.core.model.WorkflowSummary;
import com.taskflow.engine.executor.ExecutionReport;

import java.util.List;
import java.util.Map;

/**
 * Entry point for creating, planning and running workflows.
 * Every operation is addressed by workflow id; workflows do not share state.
 */
public interface WorkflowService {

    /**
     * Create an empty workflow.
     *
     * @return The workflow id
     */
    String createWorkflow(String description);

    /**
     * Add a task to a workflow.
     *
     * @param dependencies Ids of tasks already in the workflow
     * @return The task id
     */
    String addTask(String workflowId, String description, TaskType taskType,
                   List<String> dependencies, Map<String, String> metadata);

    /**
     * Plan a request into a new workflow.
     *
     * @return The workflow id
     */
    String planTask(String taskDescription);

    /**
     * Run a workflow until it drains, stalls or is cancelled.
     */
    ExecutionReport executeWorkflow(String workflowId);

    /**
     * Ask a running execution to stop dispatching.
     *
     * @return true if a run was in progress
     */
    boolean cancelWorkflow(String workflowId);

    List<Task> getAllTasks(String workflowId);

    WorkflowSummary getWorkflowStatus(String workflowId);

    List<WorkflowRecord> listWorkflows();
}
