package com.piscanner.evaluation;

@FunctionalInterface
public interface Judge {
    /**
     * Never throws; failures are reported as an {@link InjectionOutcome#UNKNOWN} verdict.
     */
    Verdict judge(String prompt, String answer);
}
