package com.taskflow.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskflow.core.model.TaskType;
import com.taskflow.worker.HandlerOutcome;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Artifact extraction per task type. Types without an extractor produce no artifacts.
 */
public class ArtifactExtractors {

    static final String DEFAULT_FILENAME = "document.txt";
    static final String DEFAULT_PREVIEW = "Content generated successfully.";

    private final Map<TaskType, ArtifactExtractor> extractors;

    public ArtifactExtractors(Map<TaskType, ArtifactExtractor> extractors) {
        this.extractors = extractors.isEmpty()
            ? new EnumMap<>(TaskType.class)
            : new EnumMap<>(extractors);
    }

    public static ArtifactExtractors defaults() {
        Map<TaskType, ArtifactExtractor> extractors = new EnumMap<>(TaskType.class);
        extractors.put(TaskType.FILE_CREATION, ArtifactExtractors::fileCreation);
        extractors.put(TaskType.WEB_BROWSING, ArtifactExtractors::webBrowsing);
        extractors.put(TaskType.IMAGE_ANALYSIS, ArtifactExtractors::imageAnalysis);
        return new ArtifactExtractors(extractors);
    }

    public Map<String, JsonNode> extract(TaskType type, HandlerOutcome outcome) {
        ArtifactExtractor extractor = extractors.get(type);
        return extractor == null ? Map.of() : extractor.extract(outcome);
    }

    /**
     * filename, file_type and content_preview. A successful result missing
     * them gets a default filename, the filename's extension and a stock preview.
     */
    static Map<String, JsonNode> fileCreation(HandlerOutcome outcome) {
        Map<String, JsonNode> artifacts = new LinkedHashMap<>();
        JsonNode result = outcome.result();
        if (result == null || !result.isObject()) {
            if (!outcome.success()) {
                return artifacts;
            }
            result = JsonNodeFactory.instance.objectNode();
        }
        String filename = text(result, "filename");
        if (filename == null && outcome.success()) {
            filename = DEFAULT_FILENAME;
        }
        String fileType = text(result, "file_type");
        if (fileType == null && filename != null) {
            int dot = filename.lastIndexOf('.');
            fileType = dot >= 0 && dot < filename.length() - 1 ? filename.substring(dot + 1) : "txt";
        }
        String preview = text(result, "content_preview");
        if (preview == null && outcome.success()) {
            preview = DEFAULT_PREVIEW;
        }
        putText(artifacts, "filename", filename);
        putText(artifacts, "file_type", fileType);
        putText(artifacts, "content_preview", preview);
        return artifacts;
    }

    /**
     * filename, headlines, information and url. Headlines and information
     * default to empty lists.
     */
    static Map<String, JsonNode> webBrowsing(HandlerOutcome outcome) {
        Map<String, JsonNode> artifacts = new LinkedHashMap<>();
        JsonNode result = outcome.result() != null && outcome.result().isObject()
            ? outcome.result()
            : JsonNodeFactory.instance.objectNode();
        putText(artifacts, "filename", text(result, "filename"));
        artifacts.put("headlines", listOrEmpty(result, "headlines"));
        artifacts.put("information", listOrEmpty(result, "information"));
        putText(artifacts, "url", text(result, "url"));
        return artifacts;
    }

    /**
     * analysis and image_path.
     */
    static Map<String, JsonNode> imageAnalysis(HandlerOutcome outcome) {
        Map<String, JsonNode> artifacts = new LinkedHashMap<>();
        JsonNode result = outcome.result();
        if (result == null || !result.isObject()) {
            return artifacts;
        }
        if (result.hasNonNull("analysis")) {
            artifacts.put("analysis", result.get("analysis"));
        }
        putText(artifacts, "image_path", text(result, "image_path"));
        return artifacts;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static void putText(Map<String, JsonNode> artifacts, String key, String value) {
        if (value != null) {
            artifacts.put(key, JsonNodeFactory.instance.textNode(value));
        }
    }

    private static JsonNode listOrEmpty(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isArray() ? value : JsonNodeFactory.instance.arrayNode();
    }
}
