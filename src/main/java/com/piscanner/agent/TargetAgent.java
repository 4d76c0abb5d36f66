package com.piscanner.agent;

import java.io.IOException;

import okhttp3.Request;
import okhttp3.Response;

/**
 * One target-agent wire shape. Implementations are chosen once per run by {@link TargetAgents}.
 */
public interface TargetAgent {
    AgentType type();

    /**
     * @throws IllegalStateException when the prompt cannot be turned into a request, for example because a
     *         credential is missing
     */
    Request buildRequest(String prompt);

    /**
     * Extracts the answer from a successful reply.
     */
    String parseReply(Response response) throws IOException;
}
