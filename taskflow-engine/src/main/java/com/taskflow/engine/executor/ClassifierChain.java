package com.taskflow.engine.executor;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskType;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Asks every classifier and keeps the most confident proposal that
 * actually changes the task's type.
 */
public class ClassifierChain {

    static final List<String> FILE_CREATION_PHRASES = List.of(
        "create a file", "write a file", "save to file", "save a file",
        "write to file", "save as file", "create new file", "make a file",
        "create a story", "write a story", "save story", "write story",
        "create a poem", "write a poem", "save poem", "write poem",
        "create an essay", "write an essay", "save essay", "write essay",
        "create a document", "write a document", "save document", "write document",
        "create a text", "write a text", "save text", "write text",
        "create a report", "write a report", "save report", "write report",
        "create a letter", "write a letter", "save letter", "write letter",
        "create a script", "write a script", "save script", "write script",
        "write about", "create content", "write content", "save content",
        "write something", "create something", "save something",
        ".txt", ".md", ".doc", ".docx", ".rtf", ".py", ".js", ".html", ".css",
        "save it as", "save this as", "save as", "save to", "save in"
    );

    static final List<String> FILE_CREATION_WORDS = List.of(
        "create", "write", "save", "story", "document", "file"
    );

    static final List<String> WEB_BROWSING_WORDS = List.of(
        "search", "news", "online", "website", "browse", "look up", "internet"
    );

    private final List<TaskClassifier> classifiers;

    public ClassifierChain(List<TaskClassifier> classifiers) {
        this.classifiers = List.copyOf(classifiers);
    }

    /**
     * The built-in rules:
     * web_browsing tasks that read like file creation are switched before dispatch,
     * a web_browsing failure on such a task is retried as file_creation, and a
     * file_creation failure caused by web access on a search-like task is retried
     * as web_browsing.
     */
    public static ClassifierChain defaults() {
        return new ClassifierChain(List.of(
            new KeywordClassifier(TaskType.WEB_BROWSING, TaskType.FILE_CREATION,
                ClassificationStage.PRE_DISPATCH, 0.9, FILE_CREATION_PHRASES, List.of()),
            new KeywordClassifier(TaskType.WEB_BROWSING, TaskType.FILE_CREATION,
                ClassificationStage.POST_FAILURE, 0.7, FILE_CREATION_WORDS, List.of("web browsing failed")),
            new KeywordClassifier(TaskType.FILE_CREATION, TaskType.WEB_BROWSING,
                ClassificationStage.POST_FAILURE, 0.7, WEB_BROWSING_WORDS,
                List.of("web browsing", "url", "http", "website"))
        ));
    }

    public static ClassifierChain none() {
        return new ClassifierChain(List.of());
    }

    public Optional<Classification> classify(Task task, ClassificationStage stage, String error) {
        return classifiers.stream()
            .map(classifier -> classifier.classify(task, stage, error))
            .flatMap(Optional::stream)
            .filter(proposal -> proposal.type() != task.taskType())
            .max(Comparator.comparingDouble(Classification::confidence));
    }
}
