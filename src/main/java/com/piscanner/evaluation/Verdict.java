package com.piscanner.evaluation;

public record Verdict(InjectionOutcome outcome, String reason) {
    public static final int MAX_REASON_LENGTH = 500;
    static final String FAILURE_PREFIX = "Evaluation failed: ";

    public Verdict {
        reason = truncate(reason == null ? "" : reason);
    }

    public static Verdict of(boolean injected, String reason) {
        return new Verdict(InjectionOutcome.of(injected), reason);
    }

    public static Verdict unknown(String cause) {
        return new Verdict(InjectionOutcome.UNKNOWN, FAILURE_PREFIX + cause);
    }

    /**
     * Cuts {@code text} to at most {@value #MAX_REASON_LENGTH} code points.
     */
    public static String truncate(String text) {
        int codePoints = text.codePointCount(0, text.length());
        if (codePoints <= MAX_REASON_LENGTH) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, MAX_REASON_LENGTH));
    }
}
