package com.taskflow.engine.planner;

/**
 * Text generation backend used to draft task plans.
 * Implementations report failures through {@link Completion#failure(String)}
 * rather than by throwing.
 */
@FunctionalInterface
public interface CompletionService {

    /**
     * Generate a completion.
     *
     * @param prompt The user prompt
     * @param systemPrompt Instructions for the model; may be null
     */
    Completion complete(String prompt, String systemPrompt);
}
