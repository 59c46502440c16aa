package com.taskflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskflow.core.exception.TaskStoreException;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.WorkflowRecord;
import com.taskflow.core.repository.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Relational implementation of TaskStore (PostgreSQL in production, H2 in tests).
 * Tables are created from {@code db/taskflow-schema.sql}.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcTaskStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void saveWorkflow(WorkflowRecord workflow) {
        String json = toJson(workflow);
        try {
            int rows = jdbcTemplate.update("""
                UPDATE taskflow_workflows
                SET description = ?, created_at = ?, workflow_json = ?
                WHERE workflow_id = ?
                """,
                workflow.description(), Timestamp.from(workflow.createdAt()), json, workflow.id());
            if (rows == 0) {
                jdbcTemplate.update("""
                    INSERT INTO taskflow_workflows (workflow_id, description, created_at, workflow_json)
                    VALUES (?, ?, ?, ?)
                    """,
                    workflow.id(), workflow.description(), Timestamp.from(workflow.createdAt()), json);
            }
        } catch (DataAccessException e) {
            throw new TaskStoreException("Failed to save workflow " + workflow.id(), e);
        }
    }

    @Override
    public Optional<WorkflowRecord> findWorkflow(String workflowId) {
        try {
            List<WorkflowRecord> found = jdbcTemplate.query(
                "SELECT workflow_json FROM taskflow_workflows WHERE workflow_id = ?",
                (rs, rowNum) -> fromJson(rs.getString("workflow_json"), WorkflowRecord.class),
                workflowId);
            return found.stream().findFirst();
        } catch (DataAccessException e) {
            throw new TaskStoreException("Failed to find workflow " + workflowId, e);
        }
    }

    @Override
    @Transactional
    public void saveTask(String workflowId, Task task) {
        String json = toJson(task);
        Timestamp now = Timestamp.from(Instant.now());
        try {
            int rows = jdbcTemplate.update("""
                UPDATE taskflow_tasks
                SET status = ?, task_type = ?, task_json = ?, updated_at = ?
                WHERE workflow_id = ? AND task_id = ?
                """,
                task.status().tag(), task.taskType().tag(), json, now, workflowId, task.id());
            if (rows == 0) {
                jdbcTemplate.update("""
                    INSERT INTO taskflow_tasks (workflow_id, task_id, status, task_type, task_json, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """,
                    workflowId, task.id(), task.status().tag(), task.taskType().tag(), json, now);
            }
            log.debug("Saved task {} of workflow {} as {}", task.id(), workflowId, task.status().tag());
        } catch (DataAccessException e) {
            throw new TaskStoreException("Failed to save task " + task.id(), e);
        }
    }

    @Override
    public Optional<List<Task>> loadTasks(String workflowId) {
        if (findWorkflow(workflowId).isEmpty()) {
            return Optional.empty();
        }
        try {
            List<Task> tasks = jdbcTemplate.query(
                "SELECT task_json FROM taskflow_tasks WHERE workflow_id = ?",
                (rs, rowNum) -> fromJson(rs.getString("task_json"), Task.class),
                workflowId);
            return Optional.of(tasks);
        } catch (DataAccessException e) {
            throw new TaskStoreException("Failed to load tasks of workflow " + workflowId, e);
        }
    }

    @Override
    public List<WorkflowRecord> listWorkflows() {
        try {
            return jdbcTemplate.query(
                "SELECT workflow_json FROM taskflow_workflows ORDER BY created_at",
                (rs, rowNum) -> fromJson(rs.getString("workflow_json"), WorkflowRecord.class));
        } catch (DataAccessException e) {
            throw new TaskStoreException("Failed to list workflows", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
