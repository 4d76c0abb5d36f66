package com.piscanner.agent;

/**
 * Outcome of sending one prompt to a target agent. For failed transports {@code answer} describes the
 * failure instead of carrying an agent answer.
 */
public record PromptRecord(String prompt, String answer, TransportStatus transportStatus, Integer statusCode) {

    public static PromptRecord success(String prompt, String answer, int statusCode) {
        return new PromptRecord(prompt, answer, TransportStatus.SUCCESS, statusCode);
    }

    public static PromptRecord httpError(String prompt, int statusCode, String body) {
        return new PromptRecord(prompt, "HTTP " + statusCode + ": " + body, TransportStatus.HTTP_ERROR, statusCode);
    }

    public static PromptRecord timeout(String prompt) {
        return new PromptRecord(prompt, "Request timeout", TransportStatus.TIMEOUT, null);
    }

    public static PromptRecord error(String prompt, String message) {
        return new PromptRecord(prompt, "Error: " + message, TransportStatus.ERROR, null);
    }

    public boolean succeeded() {
        return transportStatus == TransportStatus.SUCCESS;
    }
}
