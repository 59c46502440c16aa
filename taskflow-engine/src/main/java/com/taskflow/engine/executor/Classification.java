package com.taskflow.engine.executor;

import com.taskflow.core.model.TaskType;

/**
 * A proposed task type with the classifier's confidence in [0, 1].
 */
public record Classification(TaskType type, double confidence, String reason) {

    public Classification {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]");
        }
    }
}
