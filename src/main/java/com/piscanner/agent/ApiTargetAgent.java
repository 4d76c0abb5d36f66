package com.piscanner.agent;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.piscanner.llm.ChatPayloads;
import com.piscanner.payload.PlaceholderSubstitutor;
import com.piscanner.runtime.AppConfig;
import com.piscanner.signing.CanonicalSigner;

import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Generic HTTP agent driven by a body template with {@code {user_input}} and, when signing is on,
 * {@code {sign_input}} placeholders.
 */
public class ApiTargetAgent implements TargetAgent {
    private static final String AUTHORIZATION = "Authorization";

    private final AppConfig.ApiAgentConfig config;
    private final CanonicalSigner signer;
    private final StreamExtractor streamExtractor;
    private final ObjectMapper mapper;

    public ApiTargetAgent(AppConfig.ApiAgentConfig config, CanonicalSigner signer, StreamExtractor streamExtractor, ObjectMapper mapper) {
        this.config = config;
        this.signer = signer;
        this.streamExtractor = streamExtractor;
        this.mapper = mapper;
    }

    @Override
    public AgentType type() {
        return AgentType.API;
    }

    @Override
    public Request buildRequest(String prompt) {
        ObjectNode body = buildBody(prompt);
        Request.Builder builder = new Request.Builder().url(config.getUrl());
        for (Map.Entry<String, String> header : config.getHeaders().entrySet()) {
            String value = header.getValue();
            if (AUTHORIZATION.equalsIgnoreCase(header.getKey()) && (value == null || value.isBlank())) {
                continue;
            }
            builder.header(header.getKey(), value == null ? "" : value);
        }
        try {
            return builder.post(RequestBody.create(mapper.writeValueAsString(body), ChatPayloads.JSON)).build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize request body", e);
        }
    }

    ObjectNode buildBody(String prompt) {
        if (signer.isEnabled()) {
            return signer.buildSignedRequest(config.getBodyContent(), prompt);
        }
        ObjectNode body = config.getBodyContent().deepCopy();
        PlaceholderSubstitutor.substitute(body, PlaceholderSubstitutor.USER_INPUT, prompt);
        return body;
    }

    @Override
    public String parseReply(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        if (config.isStream()) {
            try (BufferedReader reader = new BufferedReader(body.charStream())) {
                return streamExtractor.extract(reader);
            }
        }
        return body.string();
    }
}
