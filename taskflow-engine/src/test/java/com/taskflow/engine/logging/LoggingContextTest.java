package com.taskflow.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class LoggingContextTest {

    @BeforeEach
    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Closing a task context restores the enclosing workflow context")
    void forTask_insideWorkflow_shouldKeepWorkflowId() {
        try (LoggingContext workflow = LoggingContext.forWorkflow("wf-1")) {
            String trace = LoggingContext.getTraceId();
            try (LoggingContext task = LoggingContext.forTask("wf-1", "task-1", "general_task")) {
                assertThat(LoggingContext.getTaskId()).isEqualTo("task-1");
                assertThat(LoggingContext.getTraceId()).isEqualTo(trace);
            }
            assertThat(LoggingContext.getWorkflowId()).isEqualTo("wf-1");
            assertThat(LoggingContext.getTaskId()).isNull();
            assertThat(MDC.get(LoggingContext.TASK_TYPE)).isNull();
            assertThat(LoggingContext.getTraceId()).isEqualTo(trace);
        }
        assertThat(LoggingContext.getWorkflowId()).isNull();
        assertThat(LoggingContext.getTraceId()).isNull();
    }

    @Test
    @DisplayName("A task context on a bare thread leaves nothing behind")
    void forTask_onBareThread_shouldClearEverything() {
        try (LoggingContext task = LoggingContext.forTask("wf-2", "task-2", "web_browsing")) {
            LoggingContext.setTaskType("file_creation");
            assertThat(LoggingContext.getWorkflowId()).isEqualTo("wf-2");
            assertThat(MDC.get(LoggingContext.TASK_TYPE)).isEqualTo("file_creation");
        }

        assertThat(LoggingContext.getWorkflowId()).isNull();
        assertThat(LoggingContext.getTaskId()).isNull();
        assertThat(LoggingContext.getTraceId()).isNull();
    }
}
