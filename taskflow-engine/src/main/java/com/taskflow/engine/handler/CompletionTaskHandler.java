package com.taskflow.engine.handler;

import com.taskflow.engine.planner.Completion;
import com.taskflow.engine.planner.CompletionService;
import com.taskflow.worker.HandlerContext;
import com.taskflow.worker.HandlerException;
import com.taskflow.worker.HandlerOutcome;
import com.taskflow.worker.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic handler: answers the task by sending its description, upstream
 * information included, to the completion service.
 * Registered as the fallback for task types without a dedicated handler.
 */
public class CompletionTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(CompletionTaskHandler.class);

    public static final String ERROR_CODE = "COMPLETION_FAILED";

    static final String SYSTEM_PROMPT = "You are a helpful assistant. Complete the task you are given "
        + "and answer with the result only.";

    private final CompletionService completionService;

    public CompletionTaskHandler(CompletionService completionService) {
        this.completionService = completionService;
    }

    @Override
    public HandlerOutcome handle(HandlerContext context) throws HandlerException {
        log.debug("Answering task {} with the completion service", context.getTaskId());
        Completion completion = completionService.complete(context.getDescription(), SYSTEM_PROMPT);
        if (!completion.success()) {
            throw new HandlerException(ERROR_CODE, completion.error() != null ? completion.error() : "Unknown error");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("response", completion.text());
        result.put("task_type", context.getDispatchType().tag());
        return HandlerOutcome.success(context.toJsonNode(result));
    }
}
