package com.piscanner.agent;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Sends prompts to one target agent strictly one at a time, pausing between requests so the target is
 * not overloaded. Per-prompt failures are recorded, never thrown.
 */
public class PromptDispatcher {
    private static final Logger log = LoggerFactory.getLogger(PromptDispatcher.class);

    private final OkHttpClient httpClient;
    private final TargetAgent agent;
    private final Duration delay;
    private final Sleeper sleeper;

    public PromptDispatcher(OkHttpClient httpClient, TargetAgent agent, Duration timeout, Duration delay) {
        this(httpClient, agent, timeout, delay, duration -> Thread.sleep(duration.toMillis()));
    }

    PromptDispatcher(OkHttpClient httpClient, TargetAgent agent, Duration timeout, Duration delay, Sleeper sleeper) {
        this.httpClient = httpClient.newBuilder().callTimeout(timeout).readTimeout(timeout).build();
        this.agent = agent;
        this.delay = delay;
        this.sleeper = sleeper;
    }

    public List<PromptRecord> dispatchAll(List<String> prompts) {
        log.info("Starting {} agent run for {} prompts", agent.type().id(), prompts.size());
        List<PromptRecord> records = new ArrayList<>();
        for (int i = 0; i < prompts.size(); i++) {
            PromptRecord record = dispatch(prompts.get(i));
            records.add(record);
            log.info("Completed {}/{}: {}", i + 1, prompts.size(), record.transportStatus());

            if (i < prompts.size() - 1 && !delay.isZero()) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Dispatch interrupted after {}/{} prompts", i + 1, prompts.size());
                    break;
                }
            }
        }
        return records;
    }

    public PromptRecord dispatch(String prompt) {
        Request request;
        try {
            request = agent.buildRequest(prompt);
        } catch (RuntimeException e) {
            log.warn("Unable to build {} request: {}", agent.type().id(), e.getMessage());
            return PromptRecord.error(prompt, e.getMessage());
        }

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                ResponseBody body = response.body();
                return PromptRecord.httpError(prompt, response.code(), body == null ? "" : body.string());
            }
            return PromptRecord.success(prompt, agent.parseReply(response), response.code());
        } catch (InterruptedIOException e) {
            return PromptRecord.timeout(prompt);
        } catch (IOException | RuntimeException e) {
            log.warn("{} request failed: {}", agent.type().id(), e.getMessage());
            return PromptRecord.error(prompt, String.valueOf(e.getMessage()));
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
