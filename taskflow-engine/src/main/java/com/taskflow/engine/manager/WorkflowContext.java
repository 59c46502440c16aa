package com.taskflow.engine.manager;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.WorkflowRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live state of one workflow: its tasks in creation order, the reverse
 * dependency index and the lock that serializes every mutation.
 * Mutations go through {@link TaskManager}; reads here return snapshots.
 */
public final class WorkflowContext {

    private final WorkflowRecord workflow;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicInteger activeRuns = new AtomicInteger();
    private Instant lastCreatedAt;

    WorkflowContext(WorkflowRecord workflow) {
        this.workflow = workflow;
    }

    public String workflowId() {
        return workflow.id();
    }

    public String description() {
        return workflow.description();
    }

    public WorkflowRecord workflow() {
        return workflow;
    }

    /**
     * Snapshot of all tasks in creation order.
     */
    public List<Task> tasks() {
        lock.lock();
        try {
            return new ArrayList<>(tasks.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Task> task(String taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids of the tasks that list the given task as a dependency.
     */
    public Set<String> dependentsOf(String taskId) {
        lock.lock();
        try {
            return Set.copyOf(dependents.getOrDefault(taskId, Set.of()));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Register an execution driving this context.
     *
     * @return The number of executions now active, this one included
     */
    public int beginRun() {
        return activeRuns.incrementAndGet();
    }

    public void endRun() {
        activeRuns.decrementAndGet();
    }

    public int activeRuns() {
        return activeRuns.get();
    }

    // Package-private mutators, called by TaskManager with the lock held.

    ReentrantLock lock() {
        return lock;
    }

    boolean contains(String taskId) {
        return tasks.containsKey(taskId);
    }

    Task get(String taskId) {
        return tasks.get(taskId);
    }

    Map<String, Task> taskMap() {
        return tasks;
    }

    void put(Task task) {
        Task previous = tasks.put(task.id(), task);
        if (previous != null) {
            for (String dependency : previous.dependencies()) {
                Set<String> reverse = dependents.get(dependency);
                if (reverse != null) {
                    reverse.remove(task.id());
                }
            }
        }
        for (String dependency : task.dependencies()) {
            dependents.computeIfAbsent(dependency, k -> new LinkedHashSet<>()).add(task.id());
        }
        if (lastCreatedAt == null || task.createdAt().isAfter(lastCreatedAt)) {
            lastCreatedAt = task.createdAt();
        }
    }

    boolean allDependenciesCompleted(Task task) {
        for (String dependency : task.dependencies()) {
            Task upstream = tasks.get(dependency);
            if (upstream == null || upstream.status() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    /**
     * Next creation timestamp: the clock reading, bumped past the previous
     * task so creation order survives a reload.
     */
    Instant nextCreatedAt(Instant now) {
        if (lastCreatedAt != null && !now.isAfter(lastCreatedAt)) {
            return lastCreatedAt.plusNanos(1);
        }
        return now;
    }
}
