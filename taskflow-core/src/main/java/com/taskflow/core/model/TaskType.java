package com.taskflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of work a task can describe. The type selects the handler that executes the task
 * and may be reassigned at runtime when a task turns out to be misclassified.
 */
public enum TaskType {
    /**
     * Creating or modifying a local file: stories, documents, reports, notes.
     */
    FILE_CREATION("file_creation"),

    /**
     * Gathering information from websites.
     */
    WEB_BROWSING("web_browsing"),

    /**
     * Analyzing an image.
     */
    IMAGE_ANALYSIS("image_analysis"),

    /**
     * Searching for and downloading images.
     */
    IMAGE_SEARCH("image_search"),

    /**
     * Sorting files into categories.
     */
    FILE_ORGANIZATION("file_organization"),

    /**
     * Deleting files.
     */
    FILE_DELETION("file_deletion"),

    /**
     * Anything else. Also the default for tags that are not recognized.
     */
    GENERAL_TASK("general_task");

    private final String tag;

    TaskType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Resolve a tag to a type. Unknown or blank tags resolve to {@link #GENERAL_TASK}.
     */
    @JsonCreator
    public static TaskType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return GENERAL_TASK;
        }
        String normalized = tag.trim();
        for (TaskType type : values()) {
            if (type.tag.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return GENERAL_TASK;
    }

    /**
     * Check whether a tag names one of the known types.
     */
    public static boolean isKnownTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return false;
        }
        String normalized = tag.trim();
        for (TaskType type : values()) {
            if (type.tag.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return true;
            }
        }
        return false;
    }
}
