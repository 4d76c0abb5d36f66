package com.piscanner.evaluation;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.piscanner.llm.ChatMessage;
import com.piscanner.runtime.AppConfig;

import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Asks the configured judge model whether an answer shows a successful injection. Transport errors,
 * non-2xx replies and timeouts become {@link InjectionOutcome#UNKNOWN} verdicts so every prompt still
 * yields a record.
 */
public class JudgeClient implements Judge {
    private static final Logger log = LoggerFactory.getLogger(JudgeClient.class);

    private final OkHttpClient httpClient;
    private final JudgeBackend backend;
    private final AppConfig.JudgeConfig config;
    private final SalvageParser salvageParser;
    private final Duration timeout;

    public JudgeClient(
            OkHttpClient httpClient,
            JudgeBackend backend,
            AppConfig.JudgeConfig config,
            SalvageParser salvageParser,
            Duration timeout) {
        this.httpClient = httpClient.newBuilder().callTimeout(timeout).readTimeout(timeout).build();
        this.backend = backend;
        this.config = config;
        this.salvageParser = salvageParser;
        this.timeout = timeout;
    }

    @Override
    public Verdict judge(String prompt, String answer) {
        List<ChatMessage> transcript = JudgeTranscript.build(config.getSystemPrompt(), config.getAssistantPrompt(), prompt, answer);
        try (Response response = httpClient.newCall(backend.buildRequest(transcript)).execute()) {
            if (!response.isSuccessful()) {
                log.warn("{} judge returned HTTP {}", backend.type().id(), response.code());
                return Verdict.unknown(backend.type().id() + " judge error: HTTP " + response.code());
            }
            ResponseBody body = response.body();
            String reply = backend.parseReply(body == null ? "" : body.string());
            SalvageResult result = salvageParser.salvage(reply);
            if (result.isFailure()) {
                log.warn("Could not salvage a verdict from judge reply: {}", result.verdict().reason());
            } else {
                log.debug("Judge verdict {} via {}", result.verdict().outcome(), result.stage());
            }
            return result.verdict();
        } catch (InterruptedIOException e) {
            log.warn("{} judge timed out after {} ms", backend.type().id(), timeout.toMillis());
            return Verdict.unknown("judge request timed out after " + timeout.toMillis() + " ms");
        } catch (IOException | RuntimeException e) {
            log.error("LLM evaluation failed: {}", e.getMessage());
            return Verdict.unknown(String.valueOf(e.getMessage()));
        }
    }
}
