package com.piscanner.agent;

import java.util.Locale;

public enum AgentType {
    API("api"),
    OLLAMA("ollama"),
    OPENAI("openai");

    private final String id;

    AgentType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static AgentType fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (AgentType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported agent type: " + id);
    }
}
