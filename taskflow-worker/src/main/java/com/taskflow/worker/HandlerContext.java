package com.taskflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context provided to task handlers during execution.
 */
public class HandlerContext {

    private final String workflowId;
    private final Task task;
    private final TaskType dispatchType;
    private final String description;
    private final Map<String, JsonNode> upstreamArtifacts;
    private final ObjectMapper objectMapper;

    public HandlerContext(
            String workflowId,
            Task task,
            TaskType dispatchType,
            String description,
            Map<String, JsonNode> upstreamArtifacts,
            ObjectMapper objectMapper) {
        this.workflowId = workflowId;
        this.task = task;
        this.dispatchType = dispatchType;
        this.description = description;
        this.upstreamArtifacts = upstreamArtifacts == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(upstreamArtifacts));
        this.objectMapper = objectMapper;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getTaskId() {
        return task.id();
    }

    /**
     * Get the task as it was claimed.
     */
    public Task getTask() {
        return task;
    }

    /**
     * Get the type the task is being dispatched as. Differs from the task's
     * stored type while a reclassified retry is running.
     */
    public TaskType getDispatchType() {
        return dispatchType;
    }

    /**
     * Get the description to act on, including information carried over
     * from completed dependencies.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Get the merged artifacts of all dependencies.
     */
    public Map<String, JsonNode> getUpstreamArtifacts() {
        return upstreamArtifacts;
    }

    /**
     * Create a copy dispatched under another type.
     */
    public HandlerContext withDispatchType(TaskType type) {
        return new HandlerContext(workflowId, task, type, description, upstreamArtifacts, objectMapper);
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}
