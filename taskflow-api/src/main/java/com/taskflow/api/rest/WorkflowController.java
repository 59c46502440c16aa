package com.taskflow.api.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskType;
import com.taskflow.core.model.WorkflowRecord;
import com.taskflow.core.model.WorkflowSummary;
import com.taskflow.engine.executor.ExecutionReport;
import com.taskflow.engine.service.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for building, planning and running workflows.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Create an empty workflow.
     */
    @PostMapping
    public ResponseEntity<WorkflowCreatedResponse> createWorkflow(
            @RequestBody CreateWorkflowRequest request) {

        String workflowId = workflowService.createWorkflow(requireText(request.description(), "description"));
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new WorkflowCreatedResponse(workflowId));
    }

    /**
     * Plan a natural-language request into a new workflow.
     */
    @PostMapping("/plan")
    public ResponseEntity<WorkflowStatusResponse> planWorkflow(
            @RequestBody PlanRequest request) {

        String workflowId = workflowService.planTask(requireText(request.request(), "request"));
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(WorkflowStatusResponse.from(workflowService.getWorkflowStatus(workflowId),
                workflowService.getAllTasks(workflowId)));
    }

    /**
     * List workflows, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowResponse>> listWorkflows() {
        List<WorkflowResponse> responses = workflowService.listWorkflows().stream()
            .map(WorkflowResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * Add a task to a workflow.
     */
    @PostMapping("/{workflowId}/tasks")
    public ResponseEntity<TaskCreatedResponse> addTask(
            @PathVariable String workflowId,
            @RequestBody AddTaskRequest request) {

        TaskType type = TaskType.fromTag(request.taskType());
        String taskId = workflowService.addTask(
            workflowId,
            requireText(request.description(), "description"),
            type,
            request.dependencies() == null ? List.of() : request.dependencies(),
            request.metadata() == null ? Map.of() : request.metadata()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new TaskCreatedResponse(workflowId, taskId));
    }

    @GetMapping("/{workflowId}/tasks")
    public ResponseEntity<List<Task>> getTasks(@PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.getAllTasks(workflowId));
    }

    @GetMapping("/{workflowId}/status")
    public ResponseEntity<WorkflowSummary> getStatus(@PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.getWorkflowStatus(workflowId));
    }

    /**
     * Run a workflow until it drains, stalls or is cancelled. Blocks until the run ends.
     */
    @PostMapping("/{workflowId}/execute")
    public ResponseEntity<ExecutionResponse> executeWorkflow(@PathVariable String workflowId) {
        ExecutionReport report = workflowService.executeWorkflow(workflowId);
        return ResponseEntity.ok(ExecutionResponse.from(report));
    }

    /**
     * Stop a running workflow from dispatching further tasks.
     */
    @PostMapping("/{workflowId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelWorkflow(@PathVariable String workflowId) {
        boolean cancelled = workflowService.cancelWorkflow(workflowId);
        return ResponseEntity.ok(Map.of(
            "workflow_id", workflowId,
            "cancelled", cancelled
        ));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
        return value;
    }

    // ========== DTOs ==========

    public record CreateWorkflowRequest(String description) {}

    public record PlanRequest(String request) {}

    public record AddTaskRequest(
        String description,
        @JsonProperty("task_type") String taskType,
        List<String> dependencies,
        Map<String, String> metadata
    ) {}

    public record WorkflowCreatedResponse(@JsonProperty("workflow_id") String workflowId) {}

    public record TaskCreatedResponse(
        @JsonProperty("workflow_id") String workflowId,
        @JsonProperty("task_id") String taskId
    ) {}

    public record WorkflowResponse(
        @JsonProperty("workflow_id") String workflowId,
        String description,
        @JsonProperty("created_at") Instant createdAt
    ) {
        public static WorkflowResponse from(WorkflowRecord workflow) {
            return new WorkflowResponse(workflow.id(), workflow.description(), workflow.createdAt());
        }
    }

    public record WorkflowStatusResponse(
        @JsonProperty("workflow_id") String workflowId,
        WorkflowSummary summary,
        List<Task> tasks
    ) {
        public static WorkflowStatusResponse from(WorkflowSummary summary, List<Task> tasks) {
            return new WorkflowStatusResponse(summary.workflowId(), summary, tasks);
        }
    }

    public record ExecutionResponse(
        @JsonProperty("workflow_id") String workflowId,
        String termination,
        WorkflowSummary summary,
        @JsonProperty("stuck_task_ids") List<String> stuckTaskIds
    ) {
        public static ExecutionResponse from(ExecutionReport report) {
            return new ExecutionResponse(
                report.workflowId(),
                report.termination().name().toLowerCase(),
                report.summary(),
                report.stuckTaskIds()
            );
        }
    }
}
