package com.taskflow.engine.planner;

import com.taskflow.core.exception.CompletionFailedException;
import com.taskflow.core.exception.InvalidPlanException;
import com.taskflow.core.exception.PlanParseException;
import com.taskflow.engine.manager.WorkflowContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Decomposes a natural-language request into a workflow of subtasks
 * by asking the completion service for a JSON plan.
 */
public class TaskPlanner {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanner.class);

    public static final String SYSTEM_PROMPT_RESOURCE = "prompts/task-planner-system.txt";

    private final CompletionService completionService;
    private final PlanParser parser;
    private final PlanMaterializer materializer;
    private final String systemPrompt;

    public TaskPlanner(CompletionService completionService, PlanMaterializer materializer) {
        this(completionService, new PlanParser(), materializer, loadSystemPrompt());
    }

    public TaskPlanner(CompletionService completionService, PlanParser parser,
                       PlanMaterializer materializer, String systemPrompt) {
        this.completionService = completionService;
        this.parser = parser;
        this.materializer = materializer;
        this.systemPrompt = systemPrompt;
    }

    /**
     * Plan a request and persist the resulting workflow.
     *
     * @throws CompletionFailedException if the completion service fails
     * @throws PlanParseException if the completion holds no usable JSON
     * @throws InvalidPlanException if the plan cannot form a valid task graph
     */
    public WorkflowContext planTask(String taskDescription) {
        log.info("Planning task: {}", taskDescription);

        Completion completion = completionService.complete(buildPrompt(taskDescription), systemPrompt);
        if (!completion.success()) {
            throw new CompletionFailedException("Failed to generate task plan: "
                + (completion.error() != null ? completion.error() : "Unknown error"));
        }

        TaskPlan plan = parser.parse(completion.text());
        String mainTask = plan.mainTask() != null && !plan.mainTask().isBlank()
            ? plan.mainTask()
            : taskDescription;
        return materializer.materialize(plan, mainTask);
    }

    static String buildPrompt(String taskDescription) {
        return "I need to break down this task into subtasks: " + taskDescription
            + "\n\nProvide a detailed plan with clear dependencies between subtasks.";
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    /**
     * Load the planner instructions from the classpath.
     */
    public static String loadSystemPrompt() {
        try (InputStream in = TaskPlanner.class.getClassLoader().getResourceAsStream(SYSTEM_PROMPT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SYSTEM_PROMPT_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SYSTEM_PROMPT_RESOURCE, e);
        }
    }
}
