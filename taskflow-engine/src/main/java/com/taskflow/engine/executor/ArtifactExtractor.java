package com.taskflow.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskflow.worker.HandlerOutcome;

import java.util.Map;

/**
 * Derives the named values a task exposes to its dependents.
 */
@FunctionalInterface
public interface ArtifactExtractor {

    Map<String, JsonNode> extract(HandlerOutcome outcome);
}
