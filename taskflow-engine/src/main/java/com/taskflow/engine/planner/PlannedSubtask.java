package com.taskflow.engine.planner;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One subtask as drafted by the planner. Ids are local to the plan.
 */
public record PlannedSubtask(
    String id,
    String description,
    @JsonProperty("task_type") String taskType,
    List<String> dependencies
) {
    public PlannedSubtask {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
