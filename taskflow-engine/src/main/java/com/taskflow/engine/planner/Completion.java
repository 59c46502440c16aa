package com.taskflow.engine.planner;

/**
 * Result of one completion request: the generated text on success,
 * an error message otherwise.
 */
public record Completion(boolean success, String text, String error) {

    public static Completion success(String text) {
        return new Completion(true, text, null);
    }

    public static Completion failure(String error) {
        return new Completion(false, null, error);
    }
}
