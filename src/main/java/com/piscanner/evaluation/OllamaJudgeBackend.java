package com.piscanner.evaluation;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.piscanner.llm.ChatMessage;
import com.piscanner.llm.ChatPayloads;
import com.piscanner.runtime.AppConfig;

import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Judge hosted on a local Ollama server, called through {@code /api/chat} without streaming.
 */
public class OllamaJudgeBackend implements JudgeBackend {
    static final String CHAT_PATH = "/api/chat";

    private final AppConfig.JudgeConfig config;
    private final ObjectMapper mapper;

    public OllamaJudgeBackend(AppConfig.JudgeConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
    }

    @Override
    public JudgeBackendType type() {
        return JudgeBackendType.OLLAMA;
    }

    @Override
    public Request buildRequest(List<ChatMessage> transcript) {
        String payload;
        try {
            payload = mapper.writeValueAsString(ChatPayloads.chatBody(mapper, config.getModel(), transcript));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize judge request", e);
        }
        return new Request.Builder()
                .url(ChatPayloads.stripTrailingSlash(config.getUrl()) + CHAT_PATH)
                .post(RequestBody.create(payload, ChatPayloads.JSON))
                .build();
    }

    @Override
    public String parseReply(String body) throws IOException {
        return ChatPayloads.ollamaContent(mapper.readTree(body));
    }
}
