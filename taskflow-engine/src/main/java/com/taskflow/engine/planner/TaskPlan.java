package com.taskflow.engine.planner;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed plan: the overall task and its subtasks in plan order.
 */
public record TaskPlan(
    @JsonProperty("main_task") String mainTask,
    List<PlannedSubtask> subtasks
) {
    public TaskPlan {
        // Null entries are kept so validation can report them.
        subtasks = subtasks == null ? List.of() : new ArrayList<>(subtasks);
    }
}
