package com.piscanner.llm;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;

/**
 * Request bodies and reply envelopes for the two chat wire shapes: OpenAI-style chat completions and the
 * Ollama {@code /api/chat} endpoint.
 */
public final class ChatPayloads {
    public static final MediaType JSON = MediaType.parse("application/json");

    private ChatPayloads() {
    }

    /**
     * Non-streaming chat body; both wire shapes accept the same {@code model}/{@code messages}/{@code stream} fields.
     */
    public static ObjectNode chatBody(ObjectMapper mapper, String model, List<ChatMessage> messages) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.set("messages", messagesNode(mapper, messages));
        body.put("stream", false);
        return body;
    }

    public static String openAiContent(JsonNode root) throws IOException {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new IOException("Reply has no choices[0].message.content");
        }
        return content.textValue();
    }

    public static String ollamaContent(JsonNode root) throws IOException {
        JsonNode content = root.path("message").path("content");
        if (!content.isTextual()) {
            throw new IOException("Reply has no message.content");
        }
        return content.textValue();
    }

    public static String chatCompletionsUrl(String baseUrl) {
        return stripTrailingSlash(baseUrl) + "/chat/completions";
    }

    public static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static ArrayNode messagesNode(ObjectMapper mapper, List<ChatMessage> messages) {
        ArrayNode array = mapper.createArrayNode();
        for (ChatMessage message : messages) {
            array.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        return array;
    }
}
