package com.taskrelay.orchestrator.model;

/**
 * The request payload a task is created from.
 *
 * Language defaults match what the translator agent has always assumed when a
 * caller sends bare text.
 */
public record TaskInput(String text, String sourceLanguage, String targetLanguage) {

    public static final String DEFAULT_SOURCE_LANGUAGE = "Spanish";
    public static final String DEFAULT_TARGET_LANGUAGE = "English";

    public TaskInput {
        if (text == null) text = "";
        if (sourceLanguage == null || sourceLanguage.isBlank()) sourceLanguage = DEFAULT_SOURCE_LANGUAGE;
        if (targetLanguage == null || targetLanguage.isBlank()) targetLanguage = DEFAULT_TARGET_LANGUAGE;
    }

    public static TaskInput of(String text) {
        return new TaskInput(text, null, null);
    }
}
