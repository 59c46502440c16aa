package com.taskflow.core.exception;

/**
 * Thrown when a workflow is executed while another run of it is still going.
 */
public class WorkflowBusyException extends TaskflowException {

    public static final String ERROR_CODE = "WORKFLOW_BUSY";

    public WorkflowBusyException(String workflowId) {
        super(ERROR_CODE, String.format("Workflow %s is already being executed", workflowId));
    }
}
