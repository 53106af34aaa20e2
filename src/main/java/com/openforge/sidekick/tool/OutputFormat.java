package com.openforge.sidekick.tool;

import java.util.Arrays;
import java.util.Locale;

/** Output formats with the hint appended to a task's system prompt. */
public enum OutputFormat {

    TEXT("Output plain text."),
    JSON("Output valid JSON only."),
    MARKDOWN("Use proper Markdown formatting."),
    CODE("Output clean, properly formatted code.");

    private final String hint;

    OutputFormat(String hint) {
        this.hint = hint;
    }

    /**
     * "\n\n" + hint for a known format, empty for anything else; an unknown
     * format is still passed through to the prompt text, just without a hint.
     */
    static String hintFor(String format) {
        return Arrays.stream(values())
                .filter(f -> f.name().toLowerCase(Locale.ROOT).equals(format))
                .findFirst()
                .map(f -> "\n\n" + f.hint)
                .orElse("");
    }
}
