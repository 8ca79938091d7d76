package com.frosted.tracer.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Supported snippet languages. Chosen once per source text; decides the grammar and rule set.
 */
public enum Language {
    PYTHON_LIKE("python", "Python"),
    JAVASCRIPT_LIKE("javascript", "JavaScript"),
    JAVA_LIKE("java", "Java");

    private final String id;
    private final String displayName;

    Language(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    @JsonValue
    public String getId() { return id; }

    public String getDisplayName() { return displayName; }

    public boolean usesIndentation() {
        return this == PYTHON_LIKE;
    }

    /**
     * Resolves a wire id or enum name, returning {@code null} for anything unknown.
     */
    public static Language fromId(String value) {
        if (value == null || value.isBlank()) return null;
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.id.equals(key) || language.name().toLowerCase(Locale.ROOT).equals(key)) {
                return language;
            }
        }
        return null;
    }
}
