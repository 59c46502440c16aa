package com.taskflow.engine.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskflow.core.exception.DependencyNotFoundException;
import com.taskflow.core.exception.InvalidStateTransitionException;
import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskResult;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.TaskType;
import com.taskflow.core.model.WorkflowRecord;
import com.taskflow.core.model.WorkflowSummary;
import com.taskflow.core.repository.TaskStore;
import com.taskflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the task graph rules: creation, dependency gating, status transitions
 * and unblocking. Holds no workflow state itself; every operation works on a
 * {@link WorkflowContext} and persists each changed task through the store.
 *
 * All mutations of a context run under its lock, so claiming a task and the
 * unblocking that follows a completion are atomic with respect to other
 * threads driving the same workflow.
 */
public class TaskManager {

    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    private final TaskStore store;
    private final Clock clock;
    private final WorkflowMetrics metrics;

    public TaskManager(TaskStore store) {
        this(store, Clock.systemUTC(), WorkflowMetrics.noop());
    }

    public TaskManager(TaskStore store, Clock clock, WorkflowMetrics metrics) {
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
    }

    public TaskStore getStore() {
        return store;
    }

    // ========== Workflow Lifecycle ==========

    /**
     * Create and persist a new, empty workflow.
     */
    public WorkflowContext createWorkflow(String description) {
        WorkflowRecord workflow = new WorkflowRecord(UUID.randomUUID().toString(), description, clock.instant());
        store.saveWorkflow(workflow);
        metrics.workflowCreated();
        log.info("Created workflow {}: {}", workflow.id(), workflow.description());
        return new WorkflowContext(workflow);
    }

    /**
     * Rehydrate a workflow from the store. Tasks are ordered by creation time
     * and the reverse dependency index is rebuilt.
     *
     * A process can stop between persisting a completion and persisting the
     * release of its dependents, so BLOCKED tasks whose dependencies are all
     * COMPLETED are released here.
     *
     * @return The context, or empty if the store does not know the workflow
     */
    public Optional<WorkflowContext> loadWorkflow(String workflowId) {
        Optional<WorkflowRecord> workflow = store.findWorkflow(workflowId);
        if (workflow.isEmpty()) {
            return Optional.empty();
        }
        List<Task> tasks = new ArrayList<>(store.loadTasks(workflowId).orElse(List.of()));
        tasks.sort(Comparator.comparing(Task::createdAt).thenComparing(Task::id));

        WorkflowContext context = new WorkflowContext(workflow.get());
        context.lock().lock();
        try {
            tasks.forEach(context::put);
            Instant now = clock.instant();
            for (Task task : tasks) {
                if (task.status() == TaskStatus.BLOCKED && context.allDependenciesCompleted(task)) {
                    release(context, task, now);
                }
            }
        } finally {
            context.lock().unlock();
        }
        log.debug("Loaded workflow {} with {} tasks", workflowId, tasks.size());
        return Optional.of(context);
    }

    // ========== Task Creation ==========

    /**
     * Add a task to the workflow. Every dependency must already exist.
     *
     * @return The new task's id
     * @throws DependencyNotFoundException if a dependency is unknown; the workflow is unchanged
     */
    public String addTask(
            WorkflowContext context,
            String description,
            TaskType taskType,
            List<String> dependencies,
            Map<String, String> metadata) {

        List<String> deps = dependencies == null ? List.of() : dependencies;
        context.lock().lock();
        try {
            for (String dependency : deps) {
                if (!context.contains(dependency)) {
                    throw new DependencyNotFoundException(context.workflowId(), dependency);
                }
            }

            Instant createdAt = context.nextCreatedAt(clock.instant());
            Task task = Task.create(UUID.randomUUID().toString(), description, taskType, deps, metadata, createdAt);
            store.saveTask(context.workflowId(), task);
            context.put(task);

            log.info("Added task {} ({}) to workflow {} as {}",
                task.id(), task.taskType().tag(), context.workflowId(), task.status().tag());

            // Dependencies that finished before this task existed never trigger unblocking.
            if (task.status() == TaskStatus.BLOCKED && context.allDependenciesCompleted(task)) {
                release(context, task, createdAt);
            }
            return task.id();
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Replace a task's dependencies without existence checks. Only tasks that
     * have not started can be rewired; their status is re-derived as PENDING
     * when every new dependency is completed, BLOCKED otherwise.
     */
    public Task rewireDependencies(WorkflowContext context, String taskId, List<String> dependencies) {
        context.lock().lock();
        try {
            Task task = require(context, taskId);
            if (!task.status().isWaiting()) {
                throw new InvalidStateTransitionException(taskId,
                    "cannot rewire a task that is " + task.status().tag());
            }
            Task rewired = task.withDependencies(dependencies);
            TaskStatus derived = context.allDependenciesCompleted(rewired) ? TaskStatus.PENDING : TaskStatus.BLOCKED;
            rewired = new Task(rewired.id(), rewired.description(), rewired.taskType(), derived,
                rewired.dependencies(), rewired.result(), rewired.createdAt(),
                rewired.startedAt(), rewired.completedAt(), rewired.metadata());

            store.saveTask(context.workflowId(), rewired);
            context.put(rewired);
            log.info("Rewired task {} to depend on {} ({})", taskId, rewired.dependencies(), derived.tag());
            return rewired;
        } finally {
            context.lock().unlock();
        }
    }

    // ========== Scheduling ==========

    /**
     * Tasks that are PENDING and whose dependencies are all COMPLETED,
     * in creation order.
     */
    public List<Task> getExecutableTasks(WorkflowContext context) {
        context.lock().lock();
        try {
            List<Task> executable = new ArrayList<>();
            for (Task task : context.taskMap().values()) {
                if (isExecutable(context, task)) {
                    executable.add(task);
                }
            }
            return executable;
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Move up to {@code max} executable tasks to IN_PROGRESS in one step.
     * A task returned here is never returned by another claim.
     */
    public List<Task> claimExecutableTasks(WorkflowContext context, int max) {
        context.lock().lock();
        try {
            List<Task> claimed = new ArrayList<>();
            for (Task task : getExecutableTasks(context)) {
                if (claimed.size() >= max) {
                    break;
                }
                claimed.add(updateTaskStatus(context, task.id(), TaskStatus.IN_PROGRESS, null));
            }
            if (!claimed.isEmpty()) {
                log.debug("Claimed {} tasks in workflow {}", claimed.size(), context.workflowId());
            }
            return claimed;
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Apply a status change. Sets timestamps, persists, and on COMPLETED
     * releases every BLOCKED dependent whose dependencies are now all COMPLETED.
     *
     * @param result Attached to the task when not null
     * @return The updated task
     * @throws NotFoundException if the task is unknown
     * @throws InvalidStateTransitionException if the transition is not allowed
     */
    public Task updateTaskStatus(WorkflowContext context, String taskId, TaskStatus status, TaskResult result) {
        context.lock().lock();
        try {
            Task task = require(context, taskId);
            if (task.status() == TaskStatus.BLOCKED && status == TaskStatus.PENDING) {
                throw new InvalidStateTransitionException(taskId,
                    "blocked tasks are released only when their dependencies complete");
            }
            if (!task.status().canTransitionTo(status)) {
                throw new InvalidStateTransitionException(taskId, task.status(), status);
            }

            Instant now = clock.instant();
            Task updated = task.withStatus(status, now);
            if (result != null) {
                updated = updated.withResult(result);
            }
            store.saveTask(context.workflowId(), updated);
            context.put(updated);

            log.info("Task {} {} -> {}", taskId, task.status().tag(), status.tag());

            if (status == TaskStatus.COMPLETED) {
                unblockDependents(context, taskId, now);
            }
            return updated;
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Change a task's type, e.g. after it turned out to be misclassified.
     */
    public Task reassignTaskType(WorkflowContext context, String taskId, TaskType taskType) {
        context.lock().lock();
        try {
            Task task = require(context, taskId);
            if (task.taskType() == taskType) {
                return task;
            }
            Task updated = task.withTaskType(taskType);
            store.saveTask(context.workflowId(), updated);
            context.put(updated);
            log.info("Reassigned task {} from {} to {}", taskId, task.taskType().tag(), taskType.tag());
            return updated;
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Fail every task left IN_PROGRESS, e.g. by a process that died mid-run.
     *
     * @return Ids of the tasks that were failed
     */
    public List<String> recoverOrphanedTasks(WorkflowContext context, String reason) {
        context.lock().lock();
        try {
            List<String> recovered = new ArrayList<>();
            for (Task task : new ArrayList<>(context.taskMap().values())) {
                if (task.status() == TaskStatus.IN_PROGRESS) {
                    updateTaskStatus(context, task.id(), TaskStatus.FAILED, TaskResult.failure(reason));
                    recovered.add(task.id());
                }
            }
            if (!recovered.isEmpty()) {
                log.warn("Recovered {} orphaned tasks in workflow {}: {}",
                    recovered.size(), context.workflowId(), recovered);
            }
            return recovered;
        } finally {
            context.lock().unlock();
        }
    }

    // ========== Queries ==========

    public WorkflowSummary getWorkflowStatus(WorkflowContext context) {
        return WorkflowSummary.of(context.workflowId(), context.tasks());
    }

    public Optional<Task> getTask(WorkflowContext context, String taskId) {
        return context.task(taskId);
    }

    public List<Task> getAllTasks(WorkflowContext context) {
        return context.tasks();
    }

    /**
     * Artifacts produced by a task; empty when the task is unknown or has no result.
     */
    public Map<String, JsonNode> getTaskArtifacts(WorkflowContext context, String taskId) {
        return context.task(taskId)
            .map(Task::result)
            .map(TaskResult::artifacts)
            .orElse(Map.of());
    }

    // ========== Internals ==========

    private static boolean isExecutable(WorkflowContext context, Task task) {
        return task.status() == TaskStatus.PENDING && context.allDependenciesCompleted(task);
    }

    private void unblockDependents(WorkflowContext context, String completedTaskId, Instant now) {
        for (String dependentId : context.dependentsOf(completedTaskId)) {
            Task dependent = context.get(dependentId);
            if (dependent != null
                    && dependent.status() == TaskStatus.BLOCKED
                    && context.allDependenciesCompleted(dependent)) {
                release(context, dependent, now);
            }
        }
    }

    private void release(WorkflowContext context, Task task, Instant now) {
        Task released = task.withStatus(TaskStatus.PENDING, now);
        store.saveTask(context.workflowId(), released);
        context.put(released);
        log.info("Unblocked task {}", task.id());
    }

    private static Task require(WorkflowContext context, String taskId) {
        Task task = context.get(taskId);
        if (task == null) {
            throw new NotFoundException("Task", taskId);
        }
        return task;
    }
}
