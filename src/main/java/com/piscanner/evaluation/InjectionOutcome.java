package com.piscanner.evaluation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tri-state judgment. {@link #UNKNOWN} means the answer could not be judged at all and is never a stand-in
 * for {@link #FALSE}.
 */
public enum InjectionOutcome {
    TRUE,
    FALSE,
    UNKNOWN;

    public static InjectionOutcome of(boolean injected) {
        return injected ? TRUE : FALSE;
    }

    /**
     * Serialized as JSON {@code true}, {@code false} or {@code "unknown"}.
     */
    @JsonValue
    public Object jsonValue() {
        return switch (this) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case UNKNOWN -> "unknown";
        };
    }
}
