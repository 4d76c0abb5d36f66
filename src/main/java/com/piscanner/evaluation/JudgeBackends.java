package com.piscanner.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piscanner.runtime.AppConfig;

public final class JudgeBackends {
    private JudgeBackends() {
    }

    public static JudgeBackend create(AppConfig.JudgeConfig config, ObjectMapper mapper) {
        return switch (JudgeBackendType.fromConfig(config.getBackend())) {
            case OPENAI -> new OpenAiJudgeBackend(config, mapper);
            case OLLAMA -> new OllamaJudgeBackend(config, mapper);
        };
    }
}
