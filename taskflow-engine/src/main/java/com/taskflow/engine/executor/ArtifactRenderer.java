package com.taskflow.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Appends upstream artifacts to a task description so the handler can use them.
 */
public final class ArtifactRenderer {

    static final String HEADER = "\n\nUse the following information from previous tasks:\n";
    static final int MAX_VALUE_LENGTH = 100;

    private ArtifactRenderer() {
    }

    /**
     * Text values are included as is; anything else is rendered as JSON,
     * cut to 100 characters and followed by "...".
     */
    public static String render(String description, Map<String, JsonNode> artifacts) {
        if (artifacts == null || artifacts.isEmpty()) {
            return description;
        }
        StringBuilder enhanced = new StringBuilder(description).append(HEADER);
        for (Map.Entry<String, JsonNode> artifact : artifacts.entrySet()) {
            enhanced.append("- ").append(artifact.getKey()).append(": ")
                .append(renderValue(artifact.getValue()))
                .append('\n');
        }
        return enhanced.toString();
    }

    static String renderValue(JsonNode value) {
        if (value != null && value.isTextual()) {
            return value.asText();
        }
        String json = value == null ? "null" : value.toString();
        return truncate(json) + "...";
    }

    private static String truncate(String text) {
        return text.length() > MAX_VALUE_LENGTH ? text.substring(0, MAX_VALUE_LENGTH) : text;
    }
}
