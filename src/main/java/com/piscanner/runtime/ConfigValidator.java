package com.piscanner.runtime;

import com.piscanner.agent.AgentType;
import com.piscanner.evaluation.JudgeBackendType;

/**
 * Startup checks. Every failure is a {@link ConfigException}.
 */
public final class ConfigValidator {
    private ConfigValidator() {
    }

    public static void validateAgent(AppConfig config, AgentType type) {
        AppConfig.AgentsConfig agents = config.getAgents();
        switch (type) {
            case API -> {
                AppConfig.ApiAgentConfig api = agents.getApi();
                require(api.getUrl(), "agents.api.url");
                if (api.isSign() && api.getRsaPrivateKey().isBlank()) {
                    throw new ConfigException("agents.api.rsaPrivateKey is required when agents.api.sign is true");
                }
            }
            case OLLAMA -> {
                require(agents.getOllama().getBaseUrl(), "agents.ollama.baseUrl");
                require(agents.getOllama().getModelName(), "agents.ollama.modelName");
            }
            case OPENAI -> {
                require(agents.getOpenai().getUrl(), "agents.openai.url");
                require(agents.getOpenai().getModel(), "agents.openai.model");
            }
        }
        validateScan(config.getScan());
    }

    /**
     * Returns the first enabled judge in declaration order after checking its required fields.
     */
    public static AppConfig.JudgeConfig enabledJudge(AppConfig.EvaluatorConfig evaluator) {
        AppConfig.JudgeConfig judge = evaluator.getJudges().values().stream()
                .filter(AppConfig.JudgeConfig::isEnabled)
                .findFirst()
                .orElseThrow(() -> new ConfigException("No enabled evaluator configuration found"));
        JudgeBackendType backend = JudgeBackendType.fromConfig(judge.getBackend());
        require(judge.getUrl(), "evaluator.judges.*.url");
        require(judge.getModel(), "evaluator.judges.*.model");
        if (backend == JudgeBackendType.OPENAI && judge.getApiKey().isBlank()) {
            throw new ConfigException("evaluator.judges.*.apiKey is required for the openai backend");
        }
        if (evaluator.getTimeoutMs() <= 0) {
            throw new ConfigException("evaluator.timeoutMs must be positive");
        }
        if (evaluator.getCompliance().getCap() < 1) {
            throw new ConfigException("evaluator.compliance.cap must be at least 1");
        }
        return judge;
    }

    static void validateScan(AppConfig.ScanConfig scan) {
        require(scan.getPromptsPath(), "scan.promptsPath");
        require(scan.getOutputDir(), "scan.outputDir");
        if (scan.getDelayMs() < 0) {
            throw new ConfigException("scan.delayMs must not be negative");
        }
        if (scan.getRequestTimeoutMs() <= 0) {
            throw new ConfigException("scan.requestTimeoutMs must be positive");
        }
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Missing required configuration field: " + field);
        }
    }
}
