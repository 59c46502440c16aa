package com.taskflow.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskflow.core.model.TaskType;
import com.taskflow.worker.HandlerOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ArtifactHandlingTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ArtifactExtractors extractors = ArtifactExtractors.defaults();

    @Test
    @DisplayName("File creation results get defaults for missing fields")
    void fileCreation_withBareSuccess_shouldApplyDefaults() {
        Map<String, JsonNode> artifacts = extractors.extract(TaskType.FILE_CREATION, HandlerOutcome.success(null));

        assertThat(artifacts.get("filename").asText()).isEqualTo("document.txt");
        assertThat(artifacts.get("file_type").asText()).isEqualTo("txt");
        assertThat(artifacts.get("content_preview").asText()).isEqualTo("Content generated successfully.");
    }

    @Test
    @DisplayName("File type follows the filename's extension")
    void fileCreation_shouldDeriveFileType() {
        ObjectNode result = objectMapper.createObjectNode()
            .put("filename", "build.gradle.kts")
            .put("content_preview", "plugins {");

        Map<String, JsonNode> artifacts = extractors.extract(TaskType.FILE_CREATION, HandlerOutcome.success(result));

        assertThat(artifacts.get("file_type").asText()).isEqualTo("kts");
        assertThat(artifacts.get("content_preview").asText()).isEqualTo("plugins {");
    }

    @Test
    @DisplayName("Failed file creation keeps only what the handler reported")
    void fileCreation_withFailure_shouldNotInventDefaults() {
        ObjectNode result = objectMapper.createObjectNode().put("filename", "half.txt");

        Map<String, JsonNode> artifacts = extractors.extract(TaskType.FILE_CREATION,
            HandlerOutcome.failure("IO_ERROR", "disk full", result));

        assertThat(artifacts).containsOnlyKeys("filename", "file_type");
        assertThat(extractors.extract(TaskType.FILE_CREATION, HandlerOutcome.failure("boom"))).isEmpty();
    }

    @Test
    @DisplayName("Web results always expose headline and information lists")
    void webBrowsing_shouldDefaultLists() {
        ObjectNode result = objectMapper.createObjectNode().put("url", "https://example.org");

        Map<String, JsonNode> artifacts = extractors.extract(TaskType.WEB_BROWSING, HandlerOutcome.success(result));

        assertThat(artifacts).containsOnlyKeys("headlines", "information", "url");
        assertThat(artifacts.get("headlines").isArray()).isTrue();
        assertThat(artifacts.get("headlines").size()).isZero();
    }

    @Test
    @DisplayName("Image analysis keeps the analysis and the image path")
    void imageAnalysis_shouldKeepAnalysis() {
        ObjectNode result = objectMapper.createObjectNode().put("image_path", "cat.png");
        result.putObject("analysis").put("label", "cat");

        Map<String, JsonNode> artifacts = extractors.extract(TaskType.IMAGE_ANALYSIS, HandlerOutcome.success(result));

        assertThat(artifacts.get("analysis").get("label").asText()).isEqualTo("cat");
        assertThat(artifacts.get("image_path").asText()).isEqualTo("cat.png");
        assertThat(extractors.extract(TaskType.GENERAL_TASK, HandlerOutcome.success(result))).isEmpty();
    }

    @Test
    @DisplayName("Rendering keeps text and truncates structured values")
    void render_shouldFormatValues() {
        Map<String, JsonNode> artifacts = new LinkedHashMap<>();
        artifacts.put("filename", JsonNodeFactory.instance.textNode("notes.txt"));
        artifacts.put("headlines", objectMapper.createArrayNode().add("a").add("b"));
        artifacts.put("long", JsonNodeFactory.instance.textNode("x".repeat(150)));
        artifacts.put("blob", objectMapper.createArrayNode().add("y".repeat(150)));

        String rendered = ArtifactRenderer.render("Summarize", artifacts);

        String blob = "[\"" + "y".repeat(98) + "...";
        assertThat(rendered).isEqualTo("Summarize"
            + "\n\nUse the following information from previous tasks:\n"
            + "- filename: notes.txt\n"
            + "- headlines: [\"a\",\"b\"]...\n"
            + "- long: " + "x".repeat(150) + "\n"
            + "- blob: " + blob + "\n");
    }

    @Test
    @DisplayName("No artifacts leaves the description unchanged")
    void render_withoutArtifacts_shouldReturnDescription() {
        assertThat(ArtifactRenderer.render("Plain", Map.of())).isEqualTo("Plain");
        assertThat(ArtifactRenderer.render("Plain", null)).isEqualTo("Plain");
    }
}
