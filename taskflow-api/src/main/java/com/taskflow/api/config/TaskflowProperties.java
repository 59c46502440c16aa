package com.taskflow.api.config;

import com.taskflow.core.model.TaskType;
import com.taskflow.engine.planner.UnresolvedDependencyPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Set;

/**
 * Settings under the {@code taskflow} prefix.
 */
@ConfigurationProperties(prefix = "taskflow")
public record TaskflowProperties(
    @DefaultValue Store store,
    @DefaultValue Executor executor,
    @DefaultValue Planner planner,
    @DefaultValue Retry retry,
    @DefaultValue Completion completion
) {

    public enum StoreType {
        FILESYSTEM,
        JDBC,
        MEMORY
    }

    public enum DispatchMode {
        SERIAL,
        POOLED
    }

    /**
     * @param root Directory of the file store; defaults to ~/.taskflow/workflows
     */
    public record Store(
        @DefaultValue("filesystem") StoreType type,
        String root
    ) {}

    public record Executor(
        @DefaultValue("serial") DispatchMode strategy,
        @DefaultValue("4") int poolSize,
        @DefaultValue("200ms") Duration idlePollInterval,
        @DefaultValue("true") boolean recoverOrphans
    ) {}

    public record Planner(
        @DefaultValue("fail") UnresolvedDependencyPolicy unresolvedDependencyPolicy
    ) {}

    /**
     * Misclassification retry. An empty retryable-types set allows every type.
     */
    public record Retry(
        @DefaultValue("1") int maxReclassifications,
        @DefaultValue("0.5") double minConfidence,
        @DefaultValue("0.9") double preDispatchConfidence,
        Set<TaskType> retryableTypes
    ) {}

    public record Completion(
        @DefaultValue("http://localhost:11434") String baseUrl,
        @DefaultValue("llama3") String model,
        @DefaultValue("120s") Duration timeout,
        @DefaultValue("0.7") double temperature,
        @DefaultValue("4096") int maxTokens
    ) {}
}
