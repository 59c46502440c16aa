package com.taskflow.engine.metrics;

import com.taskflow.core.model.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for workflow planning and execution.
 *
 * Metrics exposed:
 * - Workflows created, running and finished by termination
 * - Task starts, completions and failures by type
 * - Reclassifications between types
 * - Task duration
 */
public class WorkflowMetrics {

    public static final String WORKFLOWS_CREATED = "taskflow.workflows.created";
    public static final String WORKFLOWS_RUNNING = "taskflow.workflows.running";
    public static final String WORKFLOWS_FINISHED = "taskflow.workflows.finished";

    public static final String TASKS_STARTED = "taskflow.tasks.started";
    public static final String TASKS_COMPLETED = "taskflow.tasks.completed";
    public static final String TASKS_FAILED = "taskflow.tasks.failed";
    public static final String TASKS_RECLASSIFIED = "taskflow.tasks.reclassified";
    public static final String TASK_DURATION = "taskflow.task.duration";

    public static final String PLANS_MATERIALIZED = "taskflow.plans.materialized";

    private final MeterRegistry registry;
    private final AtomicInteger runningWorkflows = new AtomicInteger(0);

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(WORKFLOWS_RUNNING, runningWorkflows, AtomicInteger::get)
            .description("Workflows currently being executed")
            .register(registry);
    }

    /**
     * Metrics backed by a private registry, for callers that do not export metrics.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    // ========== Workflow Metrics ==========

    public void workflowCreated() {
        Counter.builder(WORKFLOWS_CREATED)
            .description("Total workflows created")
            .register(registry)
            .increment();
    }

    public void workflowStarted() {
        runningWorkflows.incrementAndGet();
    }

    public void workflowFinished(String termination) {
        Counter.builder(WORKFLOWS_FINISHED)
            .tag("termination", termination)
            .description("Total workflow runs finished")
            .register(registry)
            .increment();
        runningWorkflows.decrementAndGet();
    }

    public void planMaterialized(int taskCount) {
        Counter.builder(PLANS_MATERIALIZED)
            .description("Total plans turned into workflows")
            .register(registry)
            .increment();
        registry.summary("taskflow.plans.tasks").record(taskCount);
    }

    // ========== Task Metrics ==========

    public void taskStarted(TaskType type) {
        Counter.builder(TASKS_STARTED)
            .tag("task_type", type.tag())
            .description("Total tasks dispatched")
            .register(registry)
            .increment();
    }

    public void taskCompleted(TaskType type, Duration duration) {
        Counter.builder(TASKS_COMPLETED)
            .tag("task_type", type.tag())
            .description("Total tasks completed successfully")
            .register(registry)
            .increment();
        recordDuration(type, "success", duration);
    }

    public void taskFailed(TaskType type, Duration duration) {
        Counter.builder(TASKS_FAILED)
            .tag("task_type", type.tag())
            .description("Total tasks failed")
            .register(registry)
            .increment();
        recordDuration(type, "failure", duration);
    }

    public void taskReclassified(TaskType from, TaskType to) {
        Counter.builder(TASKS_RECLASSIFIED)
            .tag("from", from.tag())
            .tag("to", to.tag())
            .description("Total task type reassignments")
            .register(registry)
            .increment();
    }

    private void recordDuration(TaskType type, String outcome, Duration duration) {
        if (duration == null) {
            return;
        }
        Timer.builder(TASK_DURATION)
            .tag("task_type", type.tag())
            .tag("outcome", outcome)
            .description("Task execution duration")
            .register(registry)
            .record(duration);
    }
}
