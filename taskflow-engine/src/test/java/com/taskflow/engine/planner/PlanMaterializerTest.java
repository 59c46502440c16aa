package com.taskflow.engine.planner;

import com.taskflow.core.exception.InvalidPlanException;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.TaskType;
import com.taskflow.engine.manager.TaskManager;
import com.taskflow.engine.manager.WorkflowContext;
import com.taskflow.engine.metrics.WorkflowMetrics;
import com.taskflow.engine.persistence.InMemoryTaskStore;
import com.taskflow.engine.test.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class PlanMaterializerTest {

    private InMemoryTaskStore store;
    private TaskManager taskManager;
    private PlanMaterializer materializer;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore();
        taskManager = new TaskManager(store, TestClock.frozen(), WorkflowMetrics.noop());
        materializer = new PlanMaterializer(taskManager, UnresolvedDependencyPolicy.FAIL, WorkflowMetrics.noop());
    }

    @Test
    @DisplayName("Plan ids are mapped to task ids and dependencies follow")
    void materialize_shouldMapIdsAndDependencies() {
        TaskPlan plan = plan(
            subtask("1", "Search the news", "web_browsing"),
            subtask("2", "Summarize the news", "general_task", "1"),
            subtask("3", "Save the summary", "file_creation", "2"));

        WorkflowContext context = materializer.materialize(plan, "News digest");

        Map<String, Task> byPlanId = byPlanId(context);
        assertThat(context.description()).isEqualTo("News digest");
        assertThat(byPlanId.get("1").status()).isEqualTo(TaskStatus.PENDING);
        assertThat(byPlanId.get("1").taskType()).isEqualTo(TaskType.WEB_BROWSING);
        assertThat(byPlanId.get("2").status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(byPlanId.get("2").dependencies()).containsExactly(byPlanId.get("1").id());
        assertThat(byPlanId.get("3").dependencies()).containsExactly(byPlanId.get("2").id());
        assertThat(store.loadTasks(context.workflowId()).orElseThrow()).hasSize(3);
    }

    @Test
    @DisplayName("Subtasks listed before their dependencies are still created")
    void materialize_withForwardReference_shouldSucceed() {
        TaskPlan plan = plan(
            subtask("report", "Write the report", "file_creation", "research"),
            subtask("research", "Research the topic", "web_browsing"));

        WorkflowContext context = materializer.materialize(plan, "Report");

        Map<String, Task> byPlanId = byPlanId(context);
        assertThat(byPlanId.get("report").dependencies()).containsExactly(byPlanId.get("research").id());
        assertThat(context.tasks()).extracting(t -> t.metadata().get(PlanMaterializer.PLAN_ID))
            .containsExactly("research", "report");
    }

    @Test
    @DisplayName("Unknown task types become general tasks and keep the requested tag")
    void materialize_withUnknownType_shouldFallBack() {
        WorkflowContext context = materializer.materialize(
            plan(subtask("1", "Compose a poem", "poetry")), "Poem");

        Task task = context.tasks().get(0);
        assertThat(task.taskType()).isEqualTo(TaskType.GENERAL_TASK);
        assertThat(task.metadata()).containsEntry(PlanMaterializer.REQUESTED_TASK_TYPE, "poetry");
    }

    @Test
    @DisplayName("Cycles are rejected and nothing is persisted")
    void materialize_withCycle_shouldFail() {
        TaskPlan plan = plan(
            subtask("a", "First", "general_task", "c"),
            subtask("b", "Second", "general_task", "a"),
            subtask("c", "Third", "general_task", "b"),
            subtask("d", "Independent", "general_task"));

        assertThatThrownBy(() -> materializer.materialize(plan, "Cyclic"))
            .isInstanceOf(InvalidPlanException.class)
            .satisfies(e -> assertThat(((InvalidPlanException) e).getViolations())
                .containsExactly("dependency cycle among subtasks [a, b, c]"));
        assertThat(store.listWorkflows()).isEmpty();
    }

    @Test
    @DisplayName("Every structural problem is reported at once")
    void materialize_withManyProblems_shouldListAll() {
        TaskPlan plan = new TaskPlan("Broken", Arrays.asList(
            subtask("1", "Fine", "general_task"),
            null,
            subtask("1", "Duplicate", "general_task"),
            subtask(" ", "No id", "general_task"),
            subtask("2", " ", "general_task", "2", "missing")));

        assertThatThrownBy(() -> materializer.materialize(plan, "Broken"))
            .isInstanceOf(InvalidPlanException.class)
            .satisfies(e -> assertThat(((InvalidPlanException) e).getViolations()).containsExactly(
                "subtask #2 is empty",
                "duplicate subtask id 1",
                "subtask #4 has no id",
                "subtask 2 has no description",
                "subtask 2 depends on itself",
                "subtask 2 depends on unknown subtask missing"));
        assertThat(store.listWorkflows()).isEmpty();
    }

    @Test
    @DisplayName("An empty plan is rejected")
    void materialize_withNoSubtasks_shouldFail() {
        assertThatThrownBy(() -> materializer.materialize(new TaskPlan("Nothing", null), "Nothing"))
            .isInstanceOf(InvalidPlanException.class)
            .hasMessageContaining("plan has no subtasks");
    }

    @Test
    @DisplayName("Unresolved dependencies can be dropped instead of failing")
    void materialize_withDropPolicy_shouldIgnoreUnknownDependencies() {
        PlanMaterializer lenient = new PlanMaterializer(taskManager, UnresolvedDependencyPolicy.DROP,
            WorkflowMetrics.noop());

        WorkflowContext context = lenient.materialize(
            plan(subtask("1", "Stand alone", "general_task", "ghost")), "Lenient");

        Task task = context.tasks().get(0);
        assertThat(task.dependencies()).isEmpty();
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
    }

    private static Map<String, Task> byPlanId(WorkflowContext context) {
        return context.tasks().stream()
            .collect(Collectors.toMap(t -> t.metadata().get(PlanMaterializer.PLAN_ID), Function.identity()));
    }

    private static TaskPlan plan(PlannedSubtask... subtasks) {
        return new TaskPlan("Main", List.of(subtasks));
    }

    private static PlannedSubtask subtask(String id, String description, String type, String... deps) {
        return new PlannedSubtask(id, description, type, List.of(deps));
    }
}
