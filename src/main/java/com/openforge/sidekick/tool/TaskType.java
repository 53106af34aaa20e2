package com.openforge.sidekick.tool;

import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Menial task kinds accepted by {@code automate_menial_task}.  Each carries a
 * system prompt template; {@code %s} is replaced by the requested output format.
 */
public enum TaskType {

    FORMAT("You are a formatting assistant. Format the following data as clean %s. Be precise and consistent."),
    EXTRACT("You are a data extraction assistant. Extract relevant information and present it as %s."),
    TRANSFORM("You are a data transformation assistant. Transform the input according to common patterns and output as %s."),
    VALIDATE("You are a validation assistant. Check the data for errors, inconsistencies, or issues. Report findings clearly."),
    GENERATE("You are a content generation assistant. Generate appropriate content based on the input, formatted as %s.");

    private final String promptTemplate;

    TaskType(String promptTemplate) {
        this.promptTemplate = promptTemplate;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** System prompt for this task, with the format hint of {@code outputFormat} appended. */
    public String systemPrompt(String outputFormat) {
        String base = promptTemplate.contains("%s") ? promptTemplate.formatted(outputFormat) : promptTemplate;
        return base + OutputFormat.hintFor(outputFormat);
    }

    /** @throws SidekickException UNKNOWN_TASK_TYPE */
    public static TaskType parse(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName().equals(value))
                .findFirst()
                .orElseThrow(() -> new SidekickException(ErrorKind.UNKNOWN_TASK_TYPE,
                        "Unknown task type: %s. Available types: %s".formatted(value, available())));
    }

    static String available() {
        return Arrays.stream(values()).map(TaskType::wireName).collect(Collectors.joining(", "));
    }
}
