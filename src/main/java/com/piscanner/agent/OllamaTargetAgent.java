package com.piscanner.agent;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.piscanner.llm.ChatMessage;
import com.piscanner.llm.ChatPayloads;
import com.piscanner.runtime.AppConfig;

import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OllamaTargetAgent implements TargetAgent {
    private final AppConfig.OllamaAgentConfig config;
    private final ObjectMapper mapper;

    public OllamaTargetAgent(AppConfig.OllamaAgentConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
    }

    @Override
    public AgentType type() {
        return AgentType.OLLAMA;
    }

    @Override
    public Request buildRequest(String prompt) {
        String payload;
        try {
            payload = mapper.writeValueAsString(
                    ChatPayloads.chatBody(mapper, config.getModelName(), List.of(ChatMessage.user(prompt))));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize request body", e);
        }
        return new Request.Builder()
                .url(ChatPayloads.stripTrailingSlash(config.getBaseUrl()) + config.getEndpoint())
                .header("Accept", "application/json")
                .post(RequestBody.create(payload, ChatPayloads.JSON))
                .build();
    }

    @Override
    public String parseReply(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new IOException("Ollama returned an empty body");
        }
        return ChatPayloads.ollamaContent(mapper.readTree(body.string()));
    }
}
