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

public class OpenAiTargetAgent implements TargetAgent {
    private final AppConfig.OpenAiAgentConfig config;
    private final ObjectMapper mapper;

    public OpenAiTargetAgent(AppConfig.OpenAiAgentConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
    }

    @Override
    public AgentType type() {
        return AgentType.OPENAI;
    }

    @Override
    public Request buildRequest(String prompt) {
        if (config.getApiKey().isBlank()) {
            throw new IllegalStateException("OpenAI API key error");
        }
        String payload;
        try {
            payload = mapper.writeValueAsString(
                    ChatPayloads.chatBody(mapper, config.getModel(), List.of(ChatMessage.user(prompt))));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize request body", e);
        }
        return new Request.Builder()
                .url(ChatPayloads.chatCompletionsUrl(config.getUrl()))
                .header("Authorization", "Bearer " + config.getApiKey())
                .post(RequestBody.create(payload, ChatPayloads.JSON))
                .build();
    }

    @Override
    public String parseReply(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new IOException("OpenAI API returned empty response");
        }
        String content = ChatPayloads.openAiContent(mapper.readTree(body.string()));
        if (content.isEmpty()) {
            throw new IOException("OpenAI API returned empty response");
        }
        return content;
    }
}
