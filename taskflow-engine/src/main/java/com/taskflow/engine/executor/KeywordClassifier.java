package com.taskflow.engine.executor;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskType;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Proposes {@code to} for tasks of type {@code from} whose description
 * contains one of the description keywords and, when error keywords are
 * given, whose error contains one of those. Matching is case-insensitive.
 */
public class KeywordClassifier implements TaskClassifier {

    private final TaskType from;
    private final TaskType to;
    private final ClassificationStage stage;
    private final double confidence;
    private final List<String> descriptionKeywords;
    private final List<String> errorKeywords;

    public KeywordClassifier(TaskType from, TaskType to, ClassificationStage stage, double confidence,
                             List<String> descriptionKeywords, List<String> errorKeywords) {
        this.from = from;
        this.to = to;
        this.stage = stage;
        this.confidence = confidence;
        this.descriptionKeywords = lower(descriptionKeywords);
        this.errorKeywords = lower(errorKeywords);
    }

    @Override
    public Optional<Classification> classify(Task task, ClassificationStage stage, String error) {
        if (stage != this.stage || task.taskType() != from) {
            return Optional.empty();
        }
        String description = task.description().toLowerCase(Locale.ROOT);
        Optional<String> hit = firstMatch(description, descriptionKeywords);
        if (hit.isEmpty()) {
            return Optional.empty();
        }
        if (!errorKeywords.isEmpty()) {
            String errorText = error == null ? "" : error.toLowerCase(Locale.ROOT);
            if (firstMatch(errorText, errorKeywords).isEmpty()) {
                return Optional.empty();
            }
        }
        return Optional.of(new Classification(to, confidence,
            "description mentions '" + hit.get() + "'"));
    }

    private static Optional<String> firstMatch(String text, List<String> keywords) {
        return keywords.stream().filter(text::contains).findFirst();
    }

    private static List<String> lower(List<String> keywords) {
        return keywords == null
            ? List.of()
            : keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }
}
