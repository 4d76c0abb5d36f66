package com.piscanner.evaluation;

import java.util.Locale;

import com.piscanner.runtime.ConfigException;

public enum JudgeBackendType {
    OPENAI("openai"),
    OLLAMA("ollama");

    private final String id;

    JudgeBackendType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static JudgeBackendType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Missing required configuration field: evaluator.judges.*.backend");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JudgeBackendType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new ConfigException("Unsupported judge backend: " + value + " (expected openai or ollama)");
    }
}
