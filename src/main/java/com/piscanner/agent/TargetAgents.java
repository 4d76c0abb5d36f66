package com.piscanner.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piscanner.runtime.AppConfig;
import com.piscanner.signing.CanonicalSigner;

public final class TargetAgents {
    private TargetAgents() {
    }

    public static TargetAgent create(AgentType type, AppConfig.AgentsConfig agents, ObjectMapper mapper) {
        return switch (type) {
            case API -> new ApiTargetAgent(
                    agents.getApi(),
                    CanonicalSigner.fromConfig(agents.getApi()),
                    new StreamExtractor(mapper),
                    mapper);
            case OLLAMA -> new OllamaTargetAgent(agents.getOllama(), mapper);
            case OPENAI -> new OpenAiTargetAgent(agents.getOpenai(), mapper);
        };
    }

    public static boolean isEnabled(AgentType type, AppConfig.AgentsConfig agents) {
        return switch (type) {
            case API -> agents.getApi().isEnabled();
            case OLLAMA -> agents.getOllama().isEnabled();
            case OPENAI -> agents.getOpenai().isEnabled();
        };
    }
}
