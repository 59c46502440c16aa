package com.taskflow.core.exception;

/**
 * Thrown when a task is added with a dependency that does not exist in its workflow.
 * The workflow is left unchanged.
 */
public class DependencyNotFoundException extends TaskflowException {

    public static final String ERROR_CODE = "DEPENDENCY_NOT_FOUND";

    private final String dependencyId;

    public DependencyNotFoundException(String workflowId, String dependencyId) {
        super(ERROR_CODE, String.format(
            "Dependency task %s not found in workflow %s",
            dependencyId, workflowId
        ));
        this.dependencyId = dependencyId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
