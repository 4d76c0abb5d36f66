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

public class OpenAiJudgeBackend implements JudgeBackend {
    private final AppConfig.JudgeConfig config;
    private final ObjectMapper mapper;

    public OpenAiJudgeBackend(AppConfig.JudgeConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
    }

    @Override
    public JudgeBackendType type() {
        return JudgeBackendType.OPENAI;
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
                .url(ChatPayloads.chatCompletionsUrl(config.getUrl()))
                .header("Authorization", "Bearer " + config.getApiKey())
                .post(RequestBody.create(payload, ChatPayloads.JSON))
                .build();
    }

    @Override
    public String parseReply(String body) throws IOException {
        return ChatPayloads.openAiContent(mapper.readTree(body));
    }
}
