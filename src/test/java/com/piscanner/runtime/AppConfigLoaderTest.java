package com.piscanner.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadYamlConfig() throws Exception {
        Path file = tempDir.resolve("application.yml");
        Files.writeString(file, """
                agents:
                  api:
                    enabled: "true"
                    url: https://agent.example/chat
                    headers:
                      Authorization: Bearer abc
                    bodyContent:
                      query: "{user_input}"
                      sign: "{sign_input}"
                    stream: true
                  ollama:
                    modelName: llama3
                evaluator:
                  timeoutMs: 5000
                  judges:
                    local-judge:
                      enabled: true
                      description: Local judge
                      backend: ollama
                      url: http://localhost:11434
                      model: qwen
                  compliance:
                    keywords: [cannot, sorry]
                    cap: 3
                scan:
                  delayMs: 0
                  unknownSetting: ignored
                """);

        AppConfig config = new AppConfigLoader().load(file);

        AppConfig.ApiAgentConfig api = config.getAgents().getApi();
        assertTrue(api.isEnabled());
        assertTrue(api.isStream());
        assertEquals("Bearer abc", api.getHeaders().get("Authorization"));
        assertEquals("{user_input}", api.getBodyContent().get("query").asText());
        assertEquals("llama3", config.getAgents().getOllama().getModelName());
        assertEquals("http://localhost:11434", config.getAgents().getOllama().getBaseUrl());
        assertEquals(5000, config.getEvaluator().getTimeoutMs());
        assertEquals(3, config.getEvaluator().getCompliance().getCap());
        assertEquals("qwen", ConfigValidator.enabledJudge(config.getEvaluator()).getModel());
        assertEquals(0, config.getScan().getDelayMs());
        assertEquals(60000, config.getScan().getRequestTimeoutMs());
    }

    @Test
    void shouldLoadJsonConfig() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"agents\":{\"openai\":{\"enabled\":true,\"apiKey\":\"sk\",\"model\":\"gpt-4o\"}}}");

        AppConfig config = new AppConfigLoader().load(file);

        assertTrue(config.getAgents().getOpenai().isEnabled());
        assertEquals("https://api.openai.com/v1", config.getAgents().getOpenai().getUrl());
        assertFalse(config.getAgents().getApi().isEnabled());
    }

    @Test
    void shouldUseDefaultsWhenFileIsMissing() throws Exception {
        AppConfig config = new AppConfigLoader().load(tempDir.resolve("missing.yml"));

        assertEquals(5, config.getEvaluator().getCompliance().getCap());
        assertEquals(10000, config.getEvaluator().getTimeoutMs());
        assertEquals(List.of("success", "successful", "yes"), config.getEvaluator().getAffirmativeTokens());
        assertEquals(1000, config.getScan().getDelayMs());
    }

    @Test
    void shouldRejectMalformedConfig() throws Exception {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "agents: [unclosed");

        assertThrows(ConfigException.class, () -> new AppConfigLoader().load(file));
    }
}
