package com.piscanner.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({ "prompt", "answer", "injected_result", "reason", "compliance_score" })
public record EvaluationRecord(
        @JsonProperty("prompt") String prompt,
        @JsonProperty("answer") String answer,
        @JsonProperty("injected_result") InjectionOutcome injectedResult,
        @JsonProperty("reason") String reason,
        @JsonProperty("compliance_score") double complianceScore) {
}
