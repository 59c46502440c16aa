package com.taskflow.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskflow.core.model.RetryPolicy;
import com.taskflow.core.model.TaskType;
import com.taskflow.core.repository.TaskStore;
import com.taskflow.engine.coordinator.WorkflowCoordinator;
import com.taskflow.engine.executor.ClassifierChain;
import com.taskflow.engine.executor.DispatchStrategy;
import com.taskflow.engine.executor.PooledDispatchStrategy;
import com.taskflow.engine.executor.SerialDispatchStrategy;
import com.taskflow.engine.executor.TaskExecutor;
import com.taskflow.engine.handler.CompletionTaskHandler;
import com.taskflow.engine.manager.TaskManager;
import com.taskflow.engine.metrics.WorkflowMetrics;
import com.taskflow.engine.persistence.FileSystemTaskStore;
import com.taskflow.engine.persistence.InMemoryTaskStore;
import com.taskflow.engine.persistence.TaskJson;
import com.taskflow.engine.persistence.jdbc.JdbcTaskStore;
import com.taskflow.engine.planner.CompletionService;
import com.taskflow.engine.planner.OllamaCompletionService;
import com.taskflow.engine.planner.PlanMaterializer;
import com.taskflow.engine.planner.TaskPlanner;
import com.taskflow.engine.service.WorkflowService;
import com.taskflow.worker.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;

/**
 * Wires the engine from {@link TaskflowProperties}. Engine classes carry no
 * Spring annotations; every collaborator is built here.
 */
@Configuration
public class TaskflowConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaskflowConfiguration.class);

    @Bean
    public ObjectMapper taskflowObjectMapper() {
        return TaskJson.createObjectMapper();
    }

    @Bean
    public TaskStore taskStore(TaskflowProperties properties, ObjectMapper taskflowObjectMapper,
                               ObjectProvider<JdbcTemplate> jdbcTemplate) {
        TaskflowProperties.Store store = properties.store();
        TaskStore taskStore = switch (store.type()) {
            case JDBC -> new JdbcTaskStore(jdbcTemplate.getObject(), taskflowObjectMapper);
            case MEMORY -> new InMemoryTaskStore();
            case FILESYSTEM -> new FileSystemTaskStore(fileStoreRoot(store), taskflowObjectMapper);
        };
        log.info("Using {} task store", store.type().name().toLowerCase());
        return taskStore;
    }

    @Bean
    public TaskManager taskManager(TaskStore taskStore, WorkflowMetrics workflowMetrics) {
        return new TaskManager(taskStore, Clock.systemUTC(), workflowMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public CompletionService completionService(TaskflowProperties properties) {
        TaskflowProperties.Completion completion = properties.completion();
        log.info("Using completion model {} at {}", completion.model(), completion.baseUrl());
        return new OllamaCompletionService(completion.baseUrl(), completion.model(),
            completion.timeout(), completion.temperature(), completion.maxTokens());
    }

    @Bean
    public TaskPlanner taskPlanner(CompletionService completionService, TaskManager taskManager,
                                   TaskflowProperties properties, WorkflowMetrics workflowMetrics) {
        PlanMaterializer materializer = new PlanMaterializer(taskManager,
            properties.planner().unresolvedDependencyPolicy(), workflowMetrics);
        return new TaskPlanner(completionService, materializer);
    }

    /**
     * Handlers by task type. Without dedicated handlers every type is answered
     * by the completion service; applications replace this bean to add their own.
     */
    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry(CompletionService completionService) {
        CompletionTaskHandler general = new CompletionTaskHandler(completionService);
        return HandlerRegistry.builder()
            .register(TaskType.GENERAL_TASK, general)
            .defaultHandler(general)
            .build();
    }

    @Bean(destroyMethod = "close")
    public DispatchStrategy dispatchStrategy(TaskflowProperties properties) {
        TaskflowProperties.Executor executor = properties.executor();
        if (executor.strategy() == TaskflowProperties.DispatchMode.POOLED) {
            log.info("Dispatching tasks on a pool of {} threads", executor.poolSize());
            return new PooledDispatchStrategy(executor.poolSize());
        }
        return new SerialDispatchStrategy();
    }

    @Bean
    public RetryPolicy retryPolicy(TaskflowProperties properties) {
        TaskflowProperties.Retry retry = properties.retry();
        return RetryPolicy.builder()
            .maxReclassifications(retry.maxReclassifications())
            .minConfidence(retry.minConfidence())
            .preDispatchConfidence(retry.preDispatchConfidence())
            .retryableTypes(retry.retryableTypes() == null ? Set.of() : retry.retryableTypes())
            .build();
    }

    @Bean
    public TaskExecutor taskExecutor(TaskManager taskManager,
                                     HandlerRegistry handlerRegistry,
                                     DispatchStrategy dispatchStrategy,
                                     RetryPolicy retryPolicy,
                                     TaskflowProperties properties,
                                     WorkflowMetrics workflowMetrics,
                                     ObjectMapper taskflowObjectMapper) {
        return TaskExecutor.builder(taskManager, handlerRegistry)
            .strategy(dispatchStrategy)
            .classifiers(ClassifierChain.defaults())
            .retryPolicy(retryPolicy)
            .idlePollInterval(properties.executor().idlePollInterval())
            .recoverOrphans(properties.executor().recoverOrphans())
            .metrics(workflowMetrics)
            .objectMapper(taskflowObjectMapper)
            .build();
    }

    @Bean
    public WorkflowService workflowService(TaskManager taskManager, TaskPlanner taskPlanner,
                                           TaskExecutor taskExecutor) {
        return new WorkflowCoordinator(taskManager, taskPlanner, taskExecutor);
    }

    static Path fileStoreRoot(TaskflowProperties.Store store) {
        if (store.root() == null || store.root().isBlank()) {
            return Path.of(System.getProperty("user.home"), ".taskflow", "workflows");
        }
        return Path.of(store.root());
    }
}
