package com.taskflow.core.model;

import java.util.Set;

/**
 * Configuration for misclassification retries.
 * Immutable and shared across workflow runs.
 *
 * Invariants:
 * - maxReclassifications >= 0
 * - minConfidence and preDispatchConfidence in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxReclassifications,
    double minConfidence,
    double preDispatchConfidence,
    Set<TaskType> retryableTypes
) {
    public RetryPolicy {
        if (maxReclassifications < 0) {
            throw new IllegalArgumentException("maxReclassifications must be >= 0");
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be in [0, 1]");
        }
        if (preDispatchConfidence < 0.0 || preDispatchConfidence > 1.0) {
            throw new IllegalArgumentException("preDispatchConfidence must be in [0, 1]");
        }
        retryableTypes = retryableTypes == null ? Set.of() : Set.copyOf(retryableTypes);
    }

    /**
     * Default policy: one reclassification per task.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1, 0.5, 0.9, Set.of());
    }

    /**
     * Never reclassify.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, 1.0, 1.0, Set.of());
    }

    /**
     * Check if another reclassification is allowed.
     *
     * @param used reclassifications already performed for the task
     */
    public boolean hasMoreAttempts(int used) {
        return used < maxReclassifications;
    }

    /**
     * Check if failures of the given type may be reclassified.
     * An empty retryable set admits every type.
     */
    public boolean shouldRetry(TaskType type) {
        return retryableTypes.isEmpty() || retryableTypes.contains(type);
    }

    public boolean acceptsRetry(double confidence) {
        return maxReclassifications > 0 && confidence >= minConfidence;
    }

    public boolean acceptsPreDispatch(double confidence) {
        return maxReclassifications > 0 && confidence >= preDispatchConfidence;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxReclassifications = 1;
        private double minConfidence = 0.5;
        private double preDispatchConfidence = 0.9;
        private Set<TaskType> retryableTypes = Set.of();

        public Builder maxReclassifications(int maxReclassifications) {
            this.maxReclassifications = maxReclassifications;
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder preDispatchConfidence(double preDispatchConfidence) {
            this.preDispatchConfidence = preDispatchConfidence;
            return this;
        }

        public Builder retryableTypes(Set<TaskType> retryableTypes) {
            this.retryableTypes = retryableTypes;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maxReclassifications, minConfidence,
                preDispatchConfidence, retryableTypes
            );
        }
    }
}
