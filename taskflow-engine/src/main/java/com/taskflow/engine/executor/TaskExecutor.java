package com.taskflow.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.model.RetryPolicy;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskResult;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.TaskType;
import com.taskflow.core.model.WorkflowSummary;
import com.taskflow.engine.logging.LoggingContext;
import com.taskflow.engine.manager.TaskManager;
import com.taskflow.engine.manager.WorkflowContext;
import com.taskflow.engine.metrics.WorkflowMetrics;
import com.taskflow.engine.persistence.TaskJson;
import com.taskflow.worker.HandlerContext;
import com.taskflow.worker.HandlerOutcome;
import com.taskflow.worker.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a workflow to completion.
 *
 * Each round claims the executable frontier, dispatches it through the
 * {@link DispatchStrategy} and waits for the batch. The run ends when
 * nothing is left waiting, when waiting tasks can never become executable
 * (deadlock or failed upstream), when in-progress tasks belong to no active
 * run, or when the run is cancelled.
 *
 * Handler failures never escape: they become FAILED tasks. A failed task may be
 * reclassified and retried under the {@link RetryPolicy}; the retry's result is final.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    static final String ORPHAN_REASON = "Task was interrupted before it finished";

    private final TaskManager taskManager;
    private final HandlerRegistry handlers;
    private final DispatchStrategy strategy;
    private final ClassifierChain classifiers;
    private final ArtifactExtractors extractors;
    private final RetryPolicy retryPolicy;
    private final Duration idlePollInterval;
    private final boolean recoverOrphans;
    private final WorkflowMetrics metrics;
    private final ObjectMapper objectMapper;

    private TaskExecutor(Builder builder) {
        this.taskManager = builder.taskManager;
        this.handlers = builder.handlers;
        this.strategy = builder.strategy;
        this.classifiers = builder.classifiers;
        this.extractors = builder.extractors;
        this.retryPolicy = builder.retryPolicy;
        this.idlePollInterval = builder.idlePollInterval;
        this.recoverOrphans = builder.recoverOrphans;
        this.metrics = builder.metrics;
        this.objectMapper = builder.objectMapper;
    }

    public TaskManager getTaskManager() {
        return taskManager;
    }

    /**
     * Load a workflow from the store and execute it.
     *
     * @throws NotFoundException if the workflow is unknown
     */
    public ExecutionReport executeWorkflow(String workflowId, CancellationToken token) {
        WorkflowContext context = taskManager.loadWorkflow(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        return execute(context, token);
    }

    /**
     * Execute a workflow until it drains, stalls or is cancelled.
     */
    public ExecutionReport execute(WorkflowContext context, CancellationToken token) {
        try (LoggingContext ignored = LoggingContext.forWorkflow(context.workflowId())) {
            log.info("Executing workflow {} ({} tasks)", context.workflowId(), context.size());
            metrics.workflowStarted();
            Termination termination = null;
            List<String> stuck = List.of();
            context.beginRun();
            try {
                if (recoverOrphans) {
                    taskManager.recoverOrphanedTasks(context, ORPHAN_REASON);
                }

                while (termination == null) {
                    if (token.isCancelled()) {
                        termination = Termination.CANCELLED;
                        break;
                    }

                    List<Task> batch = taskManager.claimExecutableTasks(context, strategy.maxBatchSize());
                    if (!batch.isEmpty()) {
                        strategy.dispatch(batch, task -> runTask(context, task));
                        continue;
                    }

                    WorkflowSummary summary = taskManager.getWorkflowStatus(context);
                    if (summary.waitingTasks() == 0 && summary.inProgressTasks() == 0) {
                        termination = Termination.DRAINED;
                    } else if (summary.inProgressTasks() == 0) {
                        stuck = waitingTaskIds(context);
                        termination = stalledTermination(context);
                        log.warn("No executable tasks but {} waiting: {} {}",
                            stuck.size(), termination, stuck);
                    } else if (context.activeRuns() <= 1) {
                        // Batches are awaited, so these were not claimed by this run.
                        stuck = unfinishedTaskIds(context);
                        termination = Termination.ORPHANED;
                        log.warn("{} tasks in progress with no run executing them: {}",
                            summary.inProgressTasks(), stuck);
                    } else if (!idle()) {
                        termination = Termination.CANCELLED;
                    }
                }
            } finally {
                context.endRun();
                metrics.workflowFinished(termination != null ? termination.name().toLowerCase() : "error");
            }

            WorkflowSummary summary = taskManager.getWorkflowStatus(context);
            log.info("Workflow {} finished: {} ({} completed, {} failed of {})",
                context.workflowId(), termination,
                summary.completedTasks(), summary.failedTasks(), summary.totalTasks());
            return new ExecutionReport(context.workflowId(), termination, summary, stuck);
        }
    }

    /**
     * Execute one claimed task and record its outcome.
     */
    void runTask(WorkflowContext context, Task claimed) {
        try (LoggingContext ignored = LoggingContext.forTask(
                context.workflowId(), claimed.id(), claimed.taskType().tag())) {

            Map<String, JsonNode> upstream = mergeDependencyArtifacts(context, claimed);
            String description = ArtifactRenderer.render(claimed.description(), upstream);

            Task task = claimed;
            Optional<Classification> preDispatch =
                classifiers.classify(task, ClassificationStage.PRE_DISPATCH, null);
            if (preDispatch.isPresent() && retryPolicy.acceptsPreDispatch(preDispatch.get().confidence())) {
                task = reclassify(context, task, preDispatch.get());
            }

            log.info("Executing task {}: {}", task.id(), task.description());
            metrics.taskStarted(task.taskType());
            HandlerOutcome outcome = handlers.invoke(handlerContext(context, task, description, upstream));

            int reclassifications = 0;
            while (!outcome.success()
                    && retryPolicy.shouldRetry(task.taskType())
                    && retryPolicy.hasMoreAttempts(reclassifications)) {
                Optional<Classification> retry =
                    classifiers.classify(task, ClassificationStage.POST_FAILURE, outcome.error());
                if (retry.isEmpty() || !retryPolicy.acceptsRetry(retry.get().confidence())) {
                    break;
                }
                task = reclassify(context, task, retry.get());
                reclassifications++;
                log.info("Retrying task {} as {}", task.id(), task.taskType().tag());
                outcome = handlers.invoke(handlerContext(context, task, description, upstream));
            }

            Map<String, JsonNode> artifacts = extractors.extract(task.taskType(), outcome);
            TaskResult result = outcome.success()
                ? TaskResult.success(outcome.result(), artifacts)
                : TaskResult.failure(outcome.error(), outcome.result(), artifacts);
            TaskStatus status = outcome.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
            Task finished = taskManager.updateTaskStatus(context, task.id(), status, result);

            Duration duration = finished.startedAt() != null && finished.completedAt() != null
                ? Duration.between(finished.startedAt(), finished.completedAt())
                : null;
            if (outcome.success()) {
                metrics.taskCompleted(task.taskType(), duration);
            } else {
                metrics.taskFailed(task.taskType(), duration);
                log.warn("Task {} failed: {}", task.id(), outcome.error());
            }
        }
    }

    private Task reclassify(WorkflowContext context, Task task, Classification classification) {
        TaskType from = task.taskType();
        log.warn("Reclassifying task {} from {} to {}: {}",
            task.id(), from.tag(), classification.type().tag(), classification.reason());
        Task updated = taskManager.reassignTaskType(context, task.id(), classification.type());
        metrics.taskReclassified(from, classification.type());
        LoggingContext.setTaskType(classification.type().tag());
        return updated;
    }

    private HandlerContext handlerContext(WorkflowContext context, Task task, String description,
                                          Map<String, JsonNode> upstream) {
        return new HandlerContext(context.workflowId(), task, task.taskType(), description, upstream, objectMapper);
    }

    /**
     * Artifacts of all dependencies, in dependency order; later keys win.
     */
    private Map<String, JsonNode> mergeDependencyArtifacts(WorkflowContext context, Task task) {
        Map<String, JsonNode> merged = new LinkedHashMap<>();
        for (String dependency : task.dependencies()) {
            merged.putAll(taskManager.getTaskArtifacts(context, dependency));
        }
        return merged;
    }

    private static List<String> waitingTaskIds(WorkflowContext context) {
        List<String> waiting = new ArrayList<>();
        for (Task task : context.tasks()) {
            if (task.status().isWaiting()) {
                waiting.add(task.id());
            }
        }
        return waiting;
    }

    private static List<String> unfinishedTaskIds(WorkflowContext context) {
        List<String> unfinished = new ArrayList<>();
        for (Task task : context.tasks()) {
            if (task.status().isWaiting() || task.status() == TaskStatus.IN_PROGRESS) {
                unfinished.add(task.id());
            }
        }
        return unfinished;
    }

    /**
     * UPSTREAM_FAILED when every waiting task reaches a failed task through its
     * dependencies, DEADLOCKED otherwise.
     */
    static Termination stalledTermination(WorkflowContext context) {
        Map<String, Task> tasks = new HashMap<>();
        for (Task task : context.tasks()) {
            tasks.put(task.id(), task);
        }
        Map<String, Boolean> memo = new HashMap<>();
        for (Task task : tasks.values()) {
            if (task.status().isWaiting() && !reachesFailure(task.id(), tasks, memo)) {
                return Termination.DEADLOCKED;
            }
        }
        return Termination.UPSTREAM_FAILED;
    }

    private static boolean reachesFailure(String taskId, Map<String, Task> tasks, Map<String, Boolean> memo) {
        Boolean known = memo.get(taskId);
        if (known != null) {
            return known;
        }
        // Provisional answer for cycles.
        memo.put(taskId, false);
        boolean reaches = false;
        Task task = tasks.get(taskId);
        if (task != null) {
            for (String dependency : task.dependencies()) {
                Task upstream = tasks.get(dependency);
                if (upstream != null && upstream.status() == TaskStatus.FAILED) {
                    reaches = true;
                    break;
                }
                if (reachesFailure(dependency, tasks, memo)) {
                    reaches = true;
                    break;
                }
            }
        }
        memo.put(taskId, reaches);
        return reaches;
    }

    /**
     * Wait for tasks claimed by another run of the same context to finish.
     *
     * @return false if the thread was interrupted
     */
    private boolean idle() {
        log.debug("Waiting {} for in-progress tasks", idlePollInterval);
        try {
            Thread.sleep(idlePollInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static Builder builder(TaskManager taskManager, HandlerRegistry handlers) {
        return new Builder(taskManager, handlers);
    }

    public static class Builder {
        private final TaskManager taskManager;
        private final HandlerRegistry handlers;
        private DispatchStrategy strategy = new SerialDispatchStrategy();
        private ClassifierChain classifiers = ClassifierChain.defaults();
        private ArtifactExtractors extractors = ArtifactExtractors.defaults();
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private Duration idlePollInterval = Duration.ofMillis(200);
        private boolean recoverOrphans = true;
        private WorkflowMetrics metrics = WorkflowMetrics.noop();
        private ObjectMapper objectMapper = TaskJson.createObjectMapper();

        private Builder(TaskManager taskManager, HandlerRegistry handlers) {
            this.taskManager = taskManager;
            this.handlers = handlers;
        }

        public Builder strategy(DispatchStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder classifiers(ClassifierChain classifiers) {
            this.classifiers = classifiers;
            return this;
        }

        public Builder extractors(ArtifactExtractors extractors) {
            this.extractors = extractors;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder idlePollInterval(Duration idlePollInterval) {
            this.idlePollInterval = idlePollInterval;
            return this;
        }

        public Builder recoverOrphans(boolean recoverOrphans) {
            this.recoverOrphans = recoverOrphans;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public TaskExecutor build() {
            return new TaskExecutor(this);
        }
    }
}
