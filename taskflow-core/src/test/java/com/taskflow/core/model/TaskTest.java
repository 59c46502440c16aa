package com.taskflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void create_withoutDependencies_shouldBePending() {
        Task task = Task.create("a", "Search news", TaskType.WEB_BROWSING, List.of(), null, T0);

        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.metadata()).isEmpty();
        assertThat(task.result()).isNull();
    }

    @Test
    void create_withDependencies_shouldBeBlockedAndDeduplicated() {
        Task task = Task.create("c", "Write summary", TaskType.FILE_CREATION,
            List.of("a", "b", "a"), Map.of("plan_id", "3"), T0);

        assertThat(task.status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(task.dependencies()).containsExactly("a", "b");
        assertThat(task.dependsOn("b")).isTrue();
        assertThat(task.dependsOn("c")).isFalse();
    }

    @Test
    void create_withBlankId_shouldFail() {
        assertThatThrownBy(() -> Task.create(" ", "x", TaskType.GENERAL_TASK, List.of(), null, T0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withStatus_shouldSetTimestampsOnce() {
        Task task = Task.create("a", "x", null, List.of(), null, T0);
        Instant started = T0.plusSeconds(5);
        Instant done = T0.plusSeconds(9);

        Task running = task.withStatus(TaskStatus.IN_PROGRESS, started);
        Task finished = running.withStatus(TaskStatus.COMPLETED, done);
        Task again = finished.withStatus(TaskStatus.COMPLETED, done.plusSeconds(60));

        assertThat(task.taskType()).isEqualTo(TaskType.GENERAL_TASK);
        assertThat(running.startedAt()).isEqualTo(started);
        assertThat(running.completedAt()).isNull();
        assertThat(finished.startedAt()).isEqualTo(started);
        assertThat(finished.completedAt()).isEqualTo(done);
        assertThat(again.completedAt()).isEqualTo(done);
    }

    @Test
    void withStatus_shouldKeepTimestampsOrdered() {
        Task task = Task.create("a", "x", TaskType.GENERAL_TASK, List.of(), null, T0);

        Task running = task.withStatus(TaskStatus.IN_PROGRESS, T0.minusSeconds(30));

        assertThat(running.startedAt()).isEqualTo(T0);
    }

    @Test
    void copies_shouldLeaveOriginalUntouched() {
        Task task = Task.create("a", "x", TaskType.WEB_BROWSING, List.of("z"), null, T0);

        Task retyped = task.withTaskType(TaskType.FILE_CREATION);
        Task rewired = task.withDependencies(List.of());
        Task withResult = task.withResult(TaskResult.failure("boom"));

        assertThat(task.taskType()).isEqualTo(TaskType.WEB_BROWSING);
        assertThat(retyped.taskType()).isEqualTo(TaskType.FILE_CREATION);
        assertThat(rewired.dependencies()).isEmpty();
        assertThat(rewired.status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(withResult.result().error()).isEqualTo("boom");
        assertThat(task.result()).isNull();
    }
}
