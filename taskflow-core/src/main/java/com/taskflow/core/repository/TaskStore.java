package com.taskflow.core.repository;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.WorkflowRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of workflows and their tasks.
 * Tasks are addressed by workflow id and task id; each save stands alone.
 */
public interface TaskStore {

    /**
     * Save or replace workflow metadata.
     *
     * @param workflow The workflow record
     */
    void saveWorkflow(WorkflowRecord workflow);

    /**
     * Find workflow metadata.
     *
     * @param workflowId The workflow ID
     * @return The record if the workflow is known
     */
    Optional<WorkflowRecord> findWorkflow(String workflowId);

    /**
     * Insert or replace one task of a workflow.
     *
     * @param workflowId The owning workflow
     * @param task The task, including any result
     */
    void saveTask(String workflowId, Task task);

    /**
     * Load every task of a workflow. No ordering is guaranteed.
     *
     * @param workflowId The workflow ID
     * @return The tasks, or empty if the workflow is unknown
     */
    Optional<List<Task>> loadTasks(String workflowId);

    /**
     * List all known workflows.
     */
    List<WorkflowRecord> listWorkflows();
}
