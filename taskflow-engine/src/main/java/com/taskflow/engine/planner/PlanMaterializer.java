package com.taskflow.engine.planner;

import com.taskflow.core.exception.InvalidPlanException;
import com.taskflow.core.model.TaskType;
import com.taskflow.engine.manager.TaskManager;
import com.taskflow.engine.manager.WorkflowContext;
import com.taskflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a validated plan into a persisted workflow.
 *
 * The whole edge list is checked before anything is written: ids must be
 * unique, descriptions present, dependencies resolvable and the graph acyclic.
 * Tasks are then added in topological order (plan order among ready tasks),
 * so every dependency exists by the time its dependent is added.
 */
public class PlanMaterializer {

    private static final Logger log = LoggerFactory.getLogger(PlanMaterializer.class);

    public static final String PLAN_ID = "plan_id";
    public static final String REQUESTED_TASK_TYPE = "requested_task_type";

    private final TaskManager taskManager;
    private final UnresolvedDependencyPolicy unresolvedPolicy;
    private final WorkflowMetrics metrics;

    public PlanMaterializer(TaskManager taskManager, UnresolvedDependencyPolicy unresolvedPolicy,
                            WorkflowMetrics metrics) {
        this.taskManager = taskManager;
        this.unresolvedPolicy = unresolvedPolicy;
        this.metrics = metrics;
    }

    /**
     * Validate the plan and create its workflow.
     *
     * @param workflowDescription Description stored on the workflow
     * @throws InvalidPlanException if the plan is empty, malformed or cyclic; nothing is persisted
     */
    public WorkflowContext materialize(TaskPlan plan, String workflowDescription) {
        Map<String, PlannedSubtask> subtasks = new LinkedHashMap<>();
        Map<String, List<String>> edges = new LinkedHashMap<>();
        List<String> violations = validate(plan, subtasks, edges);
        if (!violations.isEmpty()) {
            throw new InvalidPlanException(violations);
        }

        List<String> order = topologicalOrder(edges);

        WorkflowContext context = taskManager.createWorkflow(workflowDescription);
        Map<String, String> idMapping = new HashMap<>();
        for (String planId : order) {
            PlannedSubtask subtask = subtasks.get(planId);
            List<String> dependencies = new ArrayList<>();
            for (String dependency : edges.get(planId)) {
                dependencies.add(idMapping.get(dependency));
            }

            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put(PLAN_ID, planId);
            String requestedType = subtask.taskType();
            if (requestedType != null && !requestedType.isBlank() && !TaskType.isKnownTag(requestedType)) {
                metadata.put(REQUESTED_TASK_TYPE, requestedType);
            }

            String taskId = taskManager.addTask(context, subtask.description(),
                TaskType.fromTag(requestedType), dependencies, metadata);
            idMapping.put(planId, taskId);
        }

        metrics.planMaterialized(order.size());
        log.info("Created workflow {} with {} subtasks", context.workflowId(), order.size());
        return context;
    }

    private List<String> validate(TaskPlan plan, Map<String, PlannedSubtask> subtasks,
                                  Map<String, List<String>> edges) {
        List<String> violations = new ArrayList<>();
        if (plan.subtasks().isEmpty()) {
            violations.add("plan has no subtasks");
            return violations;
        }

        int position = 0;
        for (PlannedSubtask subtask : plan.subtasks()) {
            position++;
            if (subtask == null) {
                violations.add("subtask #" + position + " is empty");
                continue;
            }
            if (subtask.id() == null || subtask.id().isBlank()) {
                violations.add("subtask #" + position + " has no id");
                continue;
            }
            if (subtasks.containsKey(subtask.id())) {
                violations.add("duplicate subtask id " + subtask.id());
                continue;
            }
            if (subtask.description() == null || subtask.description().isBlank()) {
                violations.add("subtask " + subtask.id() + " has no description");
            }
            subtasks.put(subtask.id(), subtask);
        }

        for (PlannedSubtask subtask : subtasks.values()) {
            Set<String> resolved = new LinkedHashSet<>();
            for (String dependency : subtask.dependencies()) {
                if (subtask.id().equals(dependency)) {
                    violations.add("subtask " + subtask.id() + " depends on itself");
                } else if (subtasks.containsKey(dependency)) {
                    resolved.add(dependency);
                } else if (unresolvedPolicy == UnresolvedDependencyPolicy.DROP) {
                    log.warn("Dropping unresolved dependency {} of subtask {}", dependency, subtask.id());
                } else {
                    violations.add("subtask " + subtask.id() + " depends on unknown subtask " + dependency);
                }
            }
            edges.put(subtask.id(), new ArrayList<>(resolved));
        }

        if (violations.isEmpty()) {
            List<String> order = topologicalOrder(edges);
            if (order.size() < edges.size()) {
                Set<String> cyclic = new LinkedHashSet<>(edges.keySet());
                order.forEach(cyclic::remove);
                violations.add("dependency cycle among subtasks " + cyclic);
            }
        }
        return violations;
    }

    /**
     * Topological sort that always takes the first ready subtask in plan order.
     * Returns fewer ids than the graph has when a cycle exists.
     */
    private static List<String> topologicalOrder(Map<String, List<String>> edges) {
        List<String> order = new ArrayList<>();
        Set<String> emitted = new HashSet<>();
        boolean progressed = true;
        while (progressed && order.size() < edges.size()) {
            progressed = false;
            for (Map.Entry<String, List<String>> entry : edges.entrySet()) {
                if (!emitted.contains(entry.getKey()) && emitted.containsAll(entry.getValue())) {
                    emitted.add(entry.getKey());
                    order.add(entry.getKey());
                    progressed = true;
                    break;
                }
            }
        }
        return order;
    }
}
