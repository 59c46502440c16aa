package com.taskflow.engine.executor;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ClassifierChainTest {

    private final ClassifierChain chain = ClassifierChain.defaults();

    @Test
    @DisplayName("Web tasks naming a file are switched to file creation before dispatch")
    void classify_preDispatch_shouldDetectFileCreation() {
        Task task = task("Save the summary as notes.md", TaskType.WEB_BROWSING);

        Optional<Classification> proposal = chain.classify(task, ClassificationStage.PRE_DISPATCH, null);

        assertThat(proposal).isPresent();
        assertThat(proposal.get().type()).isEqualTo(TaskType.FILE_CREATION);
        assertThat(proposal.get().confidence()).isEqualTo(0.9);
        assertThat(proposal.get().reason()).isEqualTo("description mentions '.md'");
    }

    @Test
    @DisplayName("Matching ignores case")
    void classify_shouldIgnoreCase() {
        Task task = task("WRITE A STORY about dragons", TaskType.WEB_BROWSING);

        assertThat(chain.classify(task, ClassificationStage.PRE_DISPATCH, null)).isPresent();
    }

    @Test
    @DisplayName("Genuine web tasks are left alone before dispatch")
    void classify_preDispatch_shouldIgnorePlainWebTasks() {
        Task task = task("Find the weather forecast for Oslo", TaskType.WEB_BROWSING);

        assertThat(chain.classify(task, ClassificationStage.PRE_DISPATCH, null)).isEmpty();
    }

    @Test
    @DisplayName("A web failure needs both a file-like description and a web error")
    void classify_postFailure_shouldRequireMatchingError() {
        Task task = task("Collect story ideas", TaskType.WEB_BROWSING);

        assertThat(chain.classify(task, ClassificationStage.POST_FAILURE, "Web browsing failed: timeout"))
            .map(Classification::type).hasValue(TaskType.FILE_CREATION);
        assertThat(chain.classify(task, ClassificationStage.POST_FAILURE, "rate limited")).isEmpty();
        assertThat(chain.classify(task, ClassificationStage.POST_FAILURE, null)).isEmpty();
    }

    @Test
    @DisplayName("A file failure mentioning web access is retried as web browsing")
    void classify_postFailure_shouldDetectWebTasks() {
        Task task = task("Look up recent articles online", TaskType.FILE_CREATION);

        Optional<Classification> proposal =
            chain.classify(task, ClassificationStage.POST_FAILURE, "HTTP 403 while fetching");

        assertThat(proposal).isPresent();
        assertThat(proposal.get().type()).isEqualTo(TaskType.WEB_BROWSING);
        assertThat(proposal.get().confidence()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Other task types are never reclassified by the defaults")
    void classify_shouldIgnoreOtherTypes() {
        Task task = task("Write a report and search online", TaskType.GENERAL_TASK);

        assertThat(chain.classify(task, ClassificationStage.PRE_DISPATCH, null)).isEmpty();
        assertThat(chain.classify(task, ClassificationStage.POST_FAILURE, "web browsing failed")).isEmpty();
    }

    @Test
    @DisplayName("The most confident proposal wins and no-op proposals are dropped")
    void classify_shouldPickMostConfident() {
        Task task = task("anything", TaskType.GENERAL_TASK);
        ClassifierChain custom = new ClassifierChain(List.of(
            (t, stage, error) -> Optional.of(new Classification(TaskType.IMAGE_SEARCH, 0.6, "low")),
            (t, stage, error) -> Optional.of(new Classification(TaskType.GENERAL_TASK, 0.99, "same type")),
            (t, stage, error) -> Optional.of(new Classification(TaskType.FILE_ORGANIZATION, 0.8, "high"))
        ));

        assertThat(custom.classify(task, ClassificationStage.POST_FAILURE, "x"))
            .map(Classification::reason).hasValue("high");
        assertThat(ClassifierChain.none().classify(task, ClassificationStage.POST_FAILURE, "x")).isEmpty();
    }

    private static Task task(String description, TaskType type) {
        return Task.create("t1", description, type, List.of(), Map.of(), Instant.parse("2024-05-01T10:00:00Z"));
    }
}
