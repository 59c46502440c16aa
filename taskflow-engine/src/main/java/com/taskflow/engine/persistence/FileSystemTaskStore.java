package com.taskflow.engine.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.taskflow.core.exception.TaskStoreException;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.WorkflowRecord;
import com.taskflow.core.repository.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stores each workflow as a directory of JSON documents:
 * <pre>
 * {root}/{workflowId}/workflow.json
 * {root}/{workflowId}/tasks/{taskId}.json
 * </pre>
 * Files are written to a temporary sibling and moved into place, so a reader
 * never sees a half-written task.
 */
public class FileSystemTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemTaskStore.class);

    private static final String WORKFLOW_FILE = "workflow.json";
    private static final String TASKS_DIR = "tasks";
    private static final String JSON_SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper objectMapper;

    public FileSystemTaskStore(Path root) {
        this(root, TaskJson.createObjectMapper());
    }

    public FileSystemTaskStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public void saveWorkflow(WorkflowRecord workflow) {
        Path dir = workflowDir(workflow.id());
        write(dir.resolve(WORKFLOW_FILE), workflow);
        log.debug("Saved workflow {} to {}", workflow.id(), dir);
    }

    @Override
    public Optional<WorkflowRecord> findWorkflow(String workflowId) {
        Path file = workflowDir(workflowId).resolve(WORKFLOW_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file, WorkflowRecord.class));
    }

    @Override
    public void saveTask(String workflowId, Task task) {
        Path file = workflowDir(workflowId).resolve(TASKS_DIR).resolve(fileName(task.id()));
        write(file, task);
    }

    @Override
    public Optional<List<Task>> loadTasks(String workflowId) {
        Path dir = workflowDir(workflowId);
        if (!Files.isRegularFile(dir.resolve(WORKFLOW_FILE))) {
            return Optional.empty();
        }
        Path tasksDir = dir.resolve(TASKS_DIR);
        List<Task> tasks = new ArrayList<>();
        if (!Files.isDirectory(tasksDir)) {
            return Optional.of(tasks);
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(tasksDir, "*" + JSON_SUFFIX)) {
            for (Path file : files) {
                tasks.add(read(file, Task.class));
            }
        } catch (IOException e) {
            throw new TaskStoreException("Failed to list tasks of workflow " + workflowId, e);
        }
        return Optional.of(tasks);
    }

    @Override
    public List<WorkflowRecord> listWorkflows() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<WorkflowRecord> workflows = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                Path file = dir.resolve(WORKFLOW_FILE);
                if (Files.isRegularFile(file)) {
                    workflows.add(read(file, WorkflowRecord.class));
                }
            }
        } catch (IOException e) {
            throw new TaskStoreException("Failed to list workflows under " + root, e);
        }
        workflows.sort(Comparator.comparing(WorkflowRecord::createdAt));
        return workflows;
    }

    private Path workflowDir(String workflowId) {
        return root.resolve(checkSegment(workflowId));
    }

    private static String fileName(String taskId) {
        return checkSegment(taskId) + JSON_SUFFIX;
    }

    private static String checkSegment(String id) {
        if (id == null || id.isBlank() || id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new IllegalArgumentException("Id cannot be used as a file name: " + id);
        }
        return id;
    }

    private void write(Path target, Object value) {
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), value);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new TaskStoreException("Failed to write " + target, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new TaskStoreException("Failed to read " + file, e);
        }
    }
}
