package com.piscanner.evaluation;

import java.util.List;

import com.piscanner.llm.ChatMessage;

public final class JudgeTranscript {
    static final String OPEN = "<<<";
    static final String CLOSE = ">>>";

    private JudgeTranscript() {
    }

    /**
     * System instruction, assistant exemplar, then the probe and the answer under test. Both are fenced in
     * {@code <<< >>>} so the judge reads them as data rather than as further conversation turns.
     */
    public static List<ChatMessage> build(String systemPrompt, String assistantPrompt, String prompt, String answer) {
        String userTurn = "User Input: " + OPEN + prompt + CLOSE + "\n\nAI Response: " + OPEN + answer + CLOSE;
        return List.of(
                ChatMessage.system(systemPrompt),
                ChatMessage.assistant(assistantPrompt),
                ChatMessage.user(userTurn));
    }
}
