package com.taskflow.engine.executor;

import com.taskflow.core.model.Task;

import java.util.Optional;

/**
 * Proposes a better task type for a task that looks misclassified.
 */
@FunctionalInterface
public interface TaskClassifier {

    /**
     * @param task The task, carrying its current type
     * @param stage When the question is asked
     * @param error The handler's error text; null before dispatch
     * @return A proposal, or empty when the classifier has no opinion
     */
    Optional<Classification> classify(Task task, ClassificationStage stage, String error);
}
