package com.taskflow.engine.coordinator;

import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.exception.WorkflowBusyException;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskType;
import com.taskflow.core.model.WorkflowRecord;
import com.taskflow.core.model.WorkflowSummary;
import com.taskflow.engine.executor.CancellationToken;
import com.taskflow.engine.executor.ExecutionReport;
import com.taskflow.engine.executor.TaskExecutor;
import com.taskflow.engine.manager.TaskManager;
import com.taskflow.engine.manager.WorkflowContext;
import com.taskflow.engine.planner.TaskPlanner;
import com.taskflow.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow facade over the manager, planner and executor.
 *
 * The store is the source of truth: a workflow's context is loaded on each
 * call and held in memory only while an execution runs, so calls made during
 * a run see the executor's live state. At most one execution per workflow
 * runs at a time.
 */
public class WorkflowCoordinator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private final TaskManager taskManager;
    private final TaskPlanner planner;
    private final TaskExecutor executor;
    private final Map<String, ActiveRun> running = new ConcurrentHashMap<>();

    public WorkflowCoordinator(TaskManager taskManager, TaskPlanner planner, TaskExecutor executor) {
        this.taskManager = taskManager;
        this.planner = planner;
        this.executor = executor;
    }

    @Override
    public String createWorkflow(String description) {
        return taskManager.createWorkflow(description).workflowId();
    }

    @Override
    public String addTask(String workflowId, String description, TaskType taskType,
                          List<String> dependencies, Map<String, String> metadata) {
        return taskManager.addTask(context(workflowId), description, taskType, dependencies, metadata);
    }

    @Override
    public String planTask(String taskDescription) {
        return planner.planTask(taskDescription).workflowId();
    }

    @Override
    public ExecutionReport executeWorkflow(String workflowId) {
        if (running.containsKey(workflowId)) {
            throw new WorkflowBusyException(workflowId);
        }
        ActiveRun run = new ActiveRun(load(workflowId), new CancellationToken());
        if (running.putIfAbsent(workflowId, run) != null) {
            throw new WorkflowBusyException(workflowId);
        }
        try {
            return executor.execute(run.context(), run.token());
        } finally {
            running.remove(workflowId);
        }
    }

    @Override
    public boolean cancelWorkflow(String workflowId) {
        ActiveRun run = running.get(workflowId);
        if (run == null) {
            if (taskManager.getStore().findWorkflow(workflowId).isEmpty()) {
                throw new NotFoundException("Workflow", workflowId);
            }
            return false;
        }
        log.info("Cancelling workflow {}", workflowId);
        run.token().cancel();
        return true;
    }

    @Override
    public List<Task> getAllTasks(String workflowId) {
        return taskManager.getAllTasks(context(workflowId));
    }

    @Override
    public WorkflowSummary getWorkflowStatus(String workflowId) {
        return taskManager.getWorkflowStatus(context(workflowId));
    }

    @Override
    public List<WorkflowRecord> listWorkflows() {
        return taskManager.getStore().listWorkflows();
    }

    int activeRunCount() {
        return running.size();
    }

    /**
     * The running execution's context, else a fresh load from the store.
     *
     * @throws NotFoundException if the workflow is unknown
     */
    private WorkflowContext context(String workflowId) {
        ActiveRun run = running.get(workflowId);
        return run != null ? run.context() : load(workflowId);
    }

    private WorkflowContext load(String workflowId) {
        return taskManager.loadWorkflow(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    private record ActiveRun(WorkflowContext context, CancellationToken token) {
    }
}
