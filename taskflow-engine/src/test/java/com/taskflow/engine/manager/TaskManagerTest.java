package com.taskflow.engine.manager;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskflow.core.exception.DependencyNotFoundException;
import com.taskflow.core.exception.InvalidStateTransitionException;
import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.model.OverallStatus;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskResult;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.TaskType;
import com.taskflow.core.model.WorkflowSummary;
import com.taskflow.engine.metrics.WorkflowMetrics;
import com.taskflow.engine.persistence.InMemoryTaskStore;
import com.taskflow.engine.test.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TaskManagerTest {

    private InMemoryTaskStore store;
    private TestClock clock;
    private TaskManager manager;
    private WorkflowContext workflow;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore();
        clock = TestClock.frozen();
        manager = new TaskManager(store, clock, WorkflowMetrics.noop());
        workflow = manager.createWorkflow("Research and summarize");
    }

    @Test
    @DisplayName("Tasks without dependencies start pending, others blocked")
    void addTask_shouldDeriveInitialStatus() {
        String a = manager.addTask(workflow, "Search news", TaskType.WEB_BROWSING, List.of(), null);
        String b = manager.addTask(workflow, "Write summary", TaskType.FILE_CREATION, List.of(a), Map.of("plan_id", "2"));

        assertThat(status(a)).isEqualTo(TaskStatus.PENDING);
        assertThat(status(b)).isEqualTo(TaskStatus.BLOCKED);
        assertThat(workflow.dependentsOf(a)).containsExactly(b);
        assertThat(manager.getTask(workflow, b).orElseThrow().metadata()).containsEntry("plan_id", "2");
        assertThat(store.loadTasks(workflow.workflowId()).orElseThrow()).hasSize(2);
    }

    @Test
    @DisplayName("Missing dependency is rejected and the workflow is unchanged")
    void addTask_withMissingDependency_shouldFail() {
        manager.addTask(workflow, "Search news", TaskType.WEB_BROWSING, List.of(), null);

        assertThatThrownBy(() -> manager.addTask(workflow, "Orphan", TaskType.GENERAL_TASK, List.of("nope"), null))
            .isInstanceOf(DependencyNotFoundException.class)
            .hasMessageContaining("nope");

        assertThat(manager.getAllTasks(workflow)).hasSize(1);
        assertThat(store.loadTasks(workflow.workflowId()).orElseThrow()).hasSize(1);
    }

    @Test
    @DisplayName("Only pending tasks with completed dependencies are executable")
    void getExecutableTasks_shouldGateOnDependencies() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(a), null);
        String c = manager.addTask(workflow, "C", TaskType.GENERAL_TASK, List.of(), null);

        assertThat(manager.getExecutableTasks(workflow)).extracting(Task::id).containsExactly(a, c);

        complete(a);

        assertThat(status(b)).isEqualTo(TaskStatus.PENDING);
        assertThat(manager.getExecutableTasks(workflow)).extracting(Task::id).containsExactly(b, c);
    }

    @Test
    @DisplayName("A dependent is released only when its whole dependency set completes")
    void updateTaskStatus_shouldUnblockOnlyWhenAllDependenciesComplete() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(), null);
        String c = manager.addTask(workflow, "C", TaskType.GENERAL_TASK, List.of(a, b), null);

        complete(a);
        assertThat(status(c)).isEqualTo(TaskStatus.BLOCKED);

        manager.updateTaskStatus(workflow, b, TaskStatus.IN_PROGRESS, null);
        manager.updateTaskStatus(workflow, b, TaskStatus.FAILED, TaskResult.failure("boom"));
        assertThat(status(c)).isEqualTo(TaskStatus.BLOCKED);
    }

    @Test
    @DisplayName("Status changes only move forward")
    void updateTaskStatus_shouldRejectInvalidTransitions() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(a), null);

        assertThatThrownBy(() -> manager.updateTaskStatus(workflow, a, TaskStatus.COMPLETED, null))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> manager.updateTaskStatus(workflow, b, TaskStatus.PENDING, null))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> manager.updateTaskStatus(workflow, "missing", TaskStatus.IN_PROGRESS, null))
            .isInstanceOf(NotFoundException.class);

        complete(a);
        assertThatThrownBy(() -> manager.updateTaskStatus(workflow, a, TaskStatus.IN_PROGRESS, null))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Timestamps are set once and stay ordered")
    void updateTaskStatus_shouldStampTimes() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        clock.advanceSeconds(5);
        manager.updateTaskStatus(workflow, a, TaskStatus.IN_PROGRESS, null);
        clock.advanceSeconds(3);
        Task done = manager.updateTaskStatus(workflow, a, TaskStatus.COMPLETED,
            TaskResult.success(JsonNodeFactory.instance.textNode("ok"), Map.of()));

        assertThat(done.startedAt()).isEqualTo(done.createdAt().plusSeconds(5));
        assertThat(done.completedAt()).isEqualTo(done.startedAt().plusSeconds(3));
        assertThat(done.result().result().asText()).isEqualTo("ok");
    }

    @Test
    @DisplayName("Claiming moves tasks to in progress exactly once")
    void claimExecutableTasks_shouldNotReturnTheSameTaskTwice() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(), null);
        manager.addTask(workflow, "C", TaskType.GENERAL_TASK, List.of(), null);

        List<Task> first = manager.claimExecutableTasks(workflow, 2);
        List<Task> second = manager.claimExecutableTasks(workflow, 5);

        assertThat(first).extracting(Task::id).containsExactly(a, b);
        assertThat(first).allMatch(t -> t.status() == TaskStatus.IN_PROGRESS);
        assertThat(second).hasSize(1);
        assertThat(manager.claimExecutableTasks(workflow, 5)).isEmpty();
    }

    @Test
    @DisplayName("A task added after its dependencies completed is executable")
    void addTask_afterDependenciesCompleted_shouldBePending() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        complete(a);

        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(a), null);

        assertThat(status(b)).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    @DisplayName("Rewiring re-derives the waiting status")
    void rewireDependencies_shouldRederiveStatus() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(a), null);

        Task rewired = manager.rewireDependencies(workflow, a, List.of(b));

        assertThat(rewired.status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(workflow.dependentsOf(b)).containsExactly(a);
        assertThat(manager.getExecutableTasks(workflow)).isEmpty();

        manager.rewireDependencies(workflow, a, List.of());
        assertThat(status(a)).isEqualTo(TaskStatus.PENDING);
        assertThat(workflow.dependentsOf(b)).isEmpty();
    }

    @Test
    @DisplayName("Counts always add up to the total")
    void getWorkflowStatus_shouldConserveCounts() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(a), null);
        manager.addTask(workflow, "C", TaskType.GENERAL_TASK, List.of(b), null);
        String d = manager.addTask(workflow, "D", TaskType.GENERAL_TASK, List.of(), null);

        complete(a);
        manager.updateTaskStatus(workflow, d, TaskStatus.IN_PROGRESS, null);
        manager.updateTaskStatus(workflow, d, TaskStatus.FAILED, TaskResult.failure("nope"));

        WorkflowSummary summary = manager.getWorkflowStatus(workflow);

        assertThat(summary.totalTasks()).isEqualTo(4);
        assertThat(summary.completedTasks()).isEqualTo(1);
        assertThat(summary.failedTasks()).isEqualTo(1);
        assertThat(summary.pendingTasks()).isEqualTo(1);
        assertThat(summary.blockedTasks()).isEqualTo(1);
        assertThat(summary.overallStatus()).isEqualTo(OverallStatus.PARTIALLY_COMPLETED);
        assertThat(summary.progressPercentage()).isEqualTo(25.0);
    }

    @Test
    @DisplayName("Reloading restores creation order and the reverse index")
    void loadWorkflow_shouldRebuildContext() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(a), null);
        String c = manager.addTask(workflow, "C", TaskType.GENERAL_TASK, List.of(a, b), null);

        WorkflowContext reloaded = manager.loadWorkflow(workflow.workflowId()).orElseThrow();

        assertThat(reloaded.tasks()).extracting(Task::id).containsExactly(a, b, c);
        assertThat(reloaded.dependentsOf(a)).containsExactlyInAnyOrder(b, c);

        manager.updateTaskStatus(reloaded, a, TaskStatus.IN_PROGRESS, null);
        manager.updateTaskStatus(reloaded, a, TaskStatus.COMPLETED, null);
        assertThat(reloaded.task(b).orElseThrow().status()).isEqualTo(TaskStatus.PENDING);
        assertThat(manager.loadWorkflow("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Reloading releases tasks whose dependencies completed before a crash")
    void loadWorkflow_withCompletedDependencyStillBlocked_shouldRelease() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        String b = manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(a), null);
        String c = manager.addTask(workflow, "C", TaskType.GENERAL_TASK, List.of(a, b), null);
        // A's completion was saved, the release of B was not.
        Task stored = workflow.task(a).orElseThrow();
        store.saveTask(workflow.workflowId(), stored
            .withStatus(TaskStatus.IN_PROGRESS, clock.instant())
            .withStatus(TaskStatus.COMPLETED, clock.instant()));

        WorkflowContext reloaded = manager.loadWorkflow(workflow.workflowId()).orElseThrow();

        assertThat(reloaded.task(b).orElseThrow().status()).isEqualTo(TaskStatus.PENDING);
        assertThat(reloaded.task(c).orElseThrow().status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(manager.getExecutableTasks(reloaded)).extracting(Task::id).containsExactly(b);
        assertThat(store.loadTasks(workflow.workflowId()).orElseThrow())
            .filteredOn(t -> t.id().equals(b))
            .extracting(Task::status)
            .containsExactly(TaskStatus.PENDING);
    }

    @Test
    @DisplayName("Orphaned in-progress tasks are failed")
    void recoverOrphanedTasks_shouldFailInProgressTasks() {
        String a = manager.addTask(workflow, "A", TaskType.GENERAL_TASK, List.of(), null);
        manager.addTask(workflow, "B", TaskType.GENERAL_TASK, List.of(), null);
        manager.updateTaskStatus(workflow, a, TaskStatus.IN_PROGRESS, null);

        List<String> recovered = manager.recoverOrphanedTasks(workflow, "process died");

        assertThat(recovered).containsExactly(a);
        Task failed = manager.getTask(workflow, a).orElseThrow();
        assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.result().error()).isEqualTo("process died");
    }

    @Test
    @DisplayName("Artifacts are empty until a result is recorded")
    void getTaskArtifacts_shouldReturnResultArtifacts() {
        String a = manager.addTask(workflow, "A", TaskType.WEB_BROWSING, List.of(), null);
        assertThat(manager.getTaskArtifacts(workflow, a)).isEmpty();
        assertThat(manager.getTaskArtifacts(workflow, "missing")).isEmpty();

        manager.updateTaskStatus(workflow, a, TaskStatus.IN_PROGRESS, null);
        manager.updateTaskStatus(workflow, a, TaskStatus.COMPLETED, TaskResult.success(null,
            Map.of("url", JsonNodeFactory.instance.textNode("https://example.com"))));

        assertThat(manager.getTaskArtifacts(workflow, a)).containsOnlyKeys("url");
    }

    @Test
    @DisplayName("Reassigning a type is persisted")
    void reassignTaskType_shouldPersist() {
        String a = manager.addTask(workflow, "Write a story", TaskType.WEB_BROWSING, List.of(), null);

        manager.reassignTaskType(workflow, a, TaskType.FILE_CREATION);

        Task stored = store.loadTasks(workflow.workflowId()).orElseThrow().get(0);
        assertThat(stored.taskType()).isEqualTo(TaskType.FILE_CREATION);
    }

    private TaskStatus status(String taskId) {
        return manager.getTask(workflow, taskId).orElseThrow().status();
    }

    private void complete(String taskId) {
        manager.updateTaskStatus(workflow, taskId, TaskStatus.IN_PROGRESS, null);
        manager.updateTaskStatus(workflow, taskId, TaskStatus.COMPLETED, TaskResult.success(null, Map.of()));
    }
}
