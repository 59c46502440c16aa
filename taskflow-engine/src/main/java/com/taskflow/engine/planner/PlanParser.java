package com.taskflow.engine.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.taskflow.core.exception.PlanParseException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link TaskPlan} from free-form model output.
 *
 * The JSON is taken from the first fenced code block when there is one,
 * otherwise from the first '{' to the last '}'. Comments, trailing commas
 * and single quotes are tolerated since models emit them despite instructions.
 */
public class PlanParser {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public PlanParser() {
        this.objectMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    public TaskPlan parse(String text) {
        String json = extractJson(text);
        try {
            TaskPlan plan = objectMapper.readValue(json, TaskPlan.class);
            if (plan == null) {
                throw new PlanParseException("Plan JSON is empty");
            }
            return plan;
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Failed to parse plan JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Locate the JSON object in the text.
     *
     * @throws PlanParseException if the text holds no JSON object
     */
    static String extractJson(String text) {
        if (text == null || text.isBlank()) {
            throw new PlanParseException("Completion text is empty");
        }
        Matcher fenced = FENCED.matcher(text);
        if (fenced.find() && fenced.group(1).contains("{")) {
            return fenced.group(1);
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new PlanParseException("No JSON object found in completion text");
        }
        return text.substring(start, end + 1);
    }
}
