package com.piscanner.evaluation;

import java.io.IOException;
import java.util.List;

import com.piscanner.llm.ChatMessage;

import okhttp3.Request;

public interface JudgeBackend {
    JudgeBackendType type();

    Request buildRequest(List<ChatMessage> transcript);

    /**
     * Pulls the judge's reply text out of a successful response body.
     */
    String parseReply(String body) throws IOException;
}
