package com.taskflow.engine.persistence;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.WorkflowRecord;
import com.taskflow.core.repository.TaskStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TaskStore.
 * For testing and single-run usage. Not persistent across restarts.
 */
public class InMemoryTaskStore implements TaskStore {

    private final Map<String, WorkflowRecord> workflows = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Task>> tasksByWorkflow = new ConcurrentHashMap<>();

    @Override
    public void saveWorkflow(WorkflowRecord workflow) {
        workflows.put(workflow.id(), workflow);
        tasksByWorkflow.computeIfAbsent(workflow.id(), k -> new ConcurrentHashMap<>());
    }

    @Override
    public Optional<WorkflowRecord> findWorkflow(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public void saveTask(String workflowId, Task task) {
        tasksByWorkflow.computeIfAbsent(workflowId, k -> new ConcurrentHashMap<>())
            .put(task.id(), task);
    }

    @Override
    public Optional<List<Task>> loadTasks(String workflowId) {
        if (!workflows.containsKey(workflowId)) {
            return Optional.empty();
        }
        Map<String, Task> tasks = tasksByWorkflow.getOrDefault(workflowId, Map.of());
        return Optional.of(new ArrayList<>(tasks.values()));
    }

    @Override
    public List<WorkflowRecord> listWorkflows() {
        return workflows.values().stream()
            .sorted(Comparator.comparing(WorkflowRecord::createdAt))
            .toList();
    }

    /**
     * Clear all data (for testing).
     */
    public void clear() {
        workflows.clear();
        tasksByWorkflow.clear();
    }
}
