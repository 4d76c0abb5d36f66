package com.piscanner.evaluation;

/**
 * Outcome of {@link SalvageParser#salvage(String)}: the verdict plus the stage that produced it. A
 * {@link Stage#FAILED} result always carries an {@link InjectionOutcome#UNKNOWN} verdict.
 */
public record SalvageResult(Verdict verdict, Stage stage) {

    public static SalvageResult parsed(Verdict verdict, Stage stage) {
        return new SalvageResult(verdict, stage);
    }

    public static SalvageResult failed(String cause) {
        return new SalvageResult(Verdict.unknown(cause), Stage.FAILED);
    }

    public boolean isFailure() {
        return stage == Stage.FAILED;
    }

    public enum Stage {
        BRACE_MATCHED,
        LENIENT,
        LEXICAL,
        FAILED
    }
}
