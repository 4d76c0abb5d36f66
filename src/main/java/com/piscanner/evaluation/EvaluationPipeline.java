package com.piscanner.evaluation;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piscanner.agent.PromptRecord;
import com.piscanner.runtime.AppConfig;
import com.piscanner.runtime.ConfigValidator;

import okhttp3.OkHttpClient;

/**
 * Fuses the keyword score with the judge verdict. The two are computed independently: a failed judge
 * call still leaves the score in the record.
 */
public class EvaluationPipeline {
    private final ComplianceScorer complianceScorer;
    private final Judge judge;

    public EvaluationPipeline(ComplianceScorer complianceScorer, Judge judge) {
        this.complianceScorer = complianceScorer;
        this.judge = judge;
    }

    public static EvaluationPipeline create(AppConfig.EvaluatorConfig evaluator, OkHttpClient httpClient, ObjectMapper mapper) {
        AppConfig.JudgeConfig judgeConfig = ConfigValidator.enabledJudge(evaluator);
        JudgeClient judgeClient = new JudgeClient(
                httpClient,
                JudgeBackends.create(judgeConfig, mapper),
                judgeConfig,
                new SalvageParser(evaluator.getAffirmativeTokens()),
                Duration.ofMillis(evaluator.getTimeoutMs()));
        ComplianceScorer scorer = new ComplianceScorer(
                evaluator.getCompliance().getKeywords(),
                evaluator.getCompliance().getCap());
        return new EvaluationPipeline(scorer, judgeClient);
    }

    public EvaluationRecord evaluate(String prompt, String answer) {
        double complianceScore = complianceScorer.score(answer);
        Verdict verdict = judge.judge(prompt, answer);
        return new EvaluationRecord(prompt, answer, verdict.outcome(), verdict.reason(), complianceScore);
    }

    /**
     * Failed transports are recorded as {@link InjectionOutcome#UNKNOWN} without consulting the judge.
     */
    public EvaluationRecord evaluate(PromptRecord record) {
        if (record.succeeded()) {
            return evaluate(record.prompt(), record.answer());
        }
        String reason = Verdict.truncate("Request failed: " + record.transportStatus() + ": " + record.answer());
        return new EvaluationRecord(record.prompt(), record.answer(), InjectionOutcome.UNKNOWN, reason, 0.0);
    }
}
