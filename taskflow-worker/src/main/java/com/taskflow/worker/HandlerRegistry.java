package com.taskflow.worker;

import com.taskflow.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps task types to handlers and invokes them.
 * Types without a registered handler fall through to the default handler.
 */
public class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<TaskType, TaskHandler> handlers;
    private final TaskHandler defaultHandler;

    private HandlerRegistry(Map<TaskType, TaskHandler> handlers, TaskHandler defaultHandler) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
        this.defaultHandler = defaultHandler;
    }

    /**
     * Resolve the handler for a type.
     */
    public TaskHandler resolve(TaskType type) {
        return handlers.getOrDefault(type, defaultHandler);
    }

    public boolean isRegistered(TaskType type) {
        return handlers.containsKey(type);
    }

    public Set<TaskType> registeredTypes() {
        return handlers.keySet();
    }

    /**
     * Invoke the handler for the context's dispatch type.
     * Never throws: handler exceptions are turned into failed outcomes.
     */
    public HandlerOutcome invoke(HandlerContext context) {
        TaskType type = context.getDispatchType();
        TaskHandler handler = resolve(type);
        try {
            HandlerOutcome outcome = handler.handle(context);
            if (outcome == null) {
                return HandlerOutcome.failure(HandlerOutcome.INTERNAL_ERROR,
                    "Handler for " + type.tag() + " returned no outcome", null);
            }
            return outcome;

        } catch (HandlerException e) {
            log.warn("Task {} failed: {} - {}", context.getTaskId(), e.getErrorCode(), e.getMessage());
            return HandlerOutcome.failure(e.getErrorCode(), e.getMessage(), null);

        } catch (Exception e) {
            log.error("Task {} failed with unexpected error", context.getTaskId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return HandlerOutcome.failure(HandlerOutcome.INTERNAL_ERROR, message, null);
        }
    }

    /**
     * Registry whose every type fails with "no handler".
     */
    public static HandlerRegistry empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
        private TaskHandler defaultHandler = context -> HandlerOutcome.failure(
            "NO_HANDLER",
            "No handler registered for task type " + context.getDispatchType().tag(),
            null
        );

        public Builder register(TaskType type, TaskHandler handler) {
            handlers.put(type, handler);
            log.info("Registered task handler: {}", type.tag());
            return this;
        }

        /**
         * Handler used for types without a dedicated handler.
         */
        public Builder defaultHandler(TaskHandler handler) {
            this.defaultHandler = handler;
            return this;
        }

        public HandlerRegistry build() {
            return new HandlerRegistry(handlers, defaultHandler);
        }
    }
}
