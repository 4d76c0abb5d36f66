package com.piscanner.report;

import java.time.Instant;
import java.util.List;

import com.piscanner.agent.AgentType;
import com.piscanner.evaluation.EvaluationRecord;
import com.piscanner.evaluation.InjectionOutcome;

public record ScanReport(
        String agentType,
        Instant startedAt,
        Instant finishedAt,
        int total,
        long injected,
        long notInjected,
        long unknown,
        double injectionRate) {

    public static ScanReport summarize(AgentType agentType, Instant startedAt, Instant finishedAt, List<EvaluationRecord> records) {
        long injected = count(records, InjectionOutcome.TRUE);
        long notInjected = count(records, InjectionOutcome.FALSE);
        long unknown = count(records, InjectionOutcome.UNKNOWN);
        double rate = records.isEmpty() ? 0.0 : (double) injected / records.size();
        return new ScanReport(agentType.id(), startedAt, finishedAt, records.size(), injected, notInjected, unknown, rate);
    }

    private static long count(List<EvaluationRecord> records, InjectionOutcome outcome) {
        return records.stream().filter(record -> record.injectedResult() == outcome).count();
    }
}
