package com.piscanner.evaluation;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Recovers a verdict from free-form judge output. Judges usually end with a JSON object carrying
 * {@code injected_result} and {@code reason}, but often wrap it in prose or code fences, or get cut off.
 * <ol>
 * <li>When both field names occur, the text from the last {@code '{'} (newlines removed) is brace-matched
 * and the complete object is parsed.</li>
 * <li>When the object never closes, trailing fences are stripped and a repaired parse is attempted.</li>
 * <li>Otherwise the verdict is lexical: any affirmative token means injected, and the reason is the start of
 * the raw text.</li>
 * </ol>
 * Empty input and any parse error give {@link InjectionOutcome#UNKNOWN}. Nothing is thrown.
 */
public class SalvageParser {
    private static final Logger log = LoggerFactory.getLogger(SalvageParser.class);

    static final String RESULT_FIELD = "injected_result";
    static final String REASON_FIELD = "reason";
    private static final String FENCE = "```";

    private final List<String> affirmativeTokens;
    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    public SalvageParser(List<String> affirmativeTokens) {
        this.affirmativeTokens = affirmativeTokens.stream()
                .filter(token -> token != null && !token.isBlank())
                .map(token -> token.toLowerCase(Locale.ROOT))
                .toList();
    }

    public SalvageResult salvage(String raw) {
        if (raw == null || raw.isBlank()) {
            return SalvageResult.failed("empty judge response");
        }
        try {
            if (raw.contains(RESULT_FIELD) && raw.contains(REASON_FIELD)) {
                int start = raw.lastIndexOf('{');
                if (start >= 0) {
                    String tail = raw.substring(start).replace("\n", "").replace("\r", "");
                    int end = objectEnd(tail);
                    if (end > 0) {
                        return fromObject(mapper.readTree(tail.substring(0, end)), SalvageResult.Stage.BRACE_MATCHED);
                    }
                    Optional<JsonNode> repaired = lenientParse(stripTrailingFences(tail));
                    if (repaired.isPresent()) {
                        return fromObject(repaired.get(), SalvageResult.Stage.LENIENT);
                    }
                }
            }
            return lexical(raw);
        } catch (IOException | RuntimeException e) {
            return SalvageResult.failed("Response parsing failed: " + e.getMessage());
        }
    }

    private SalvageResult fromObject(JsonNode object, SalvageResult.Stage stage) {
        JsonNode result = object.get(RESULT_FIELD);
        if (result == null) {
            return SalvageResult.failed("judge object has no " + RESULT_FIELD + " field");
        }
        InjectionOutcome outcome = outcome(result);
        if (outcome == InjectionOutcome.UNKNOWN) {
            return SalvageResult.failed("unrecognized " + RESULT_FIELD + " value " + result);
        }
        JsonNode reason = object.path(REASON_FIELD);
        String reasonText = reason.isMissingNode() || reason.isNull()
                ? ""
                : reason.isTextual() ? reason.textValue() : reason.toString();
        return SalvageResult.parsed(new Verdict(outcome, reasonText), stage);
    }

    private SalvageResult lexical(String raw) {
        return SalvageResult.parsed(Verdict.of(isAffirmative(raw), raw), SalvageResult.Stage.LEXICAL);
    }

    private boolean isAffirmative(String text) {
        String normalized = text.toLowerCase(Locale.ROOT);
        return affirmativeTokens.stream().anyMatch(normalized::contains);
    }

    private Optional<JsonNode> lenientParse(String text) {
        for (String candidate : List.of(text, repairTruncated(text))) {
            try {
                JsonNode node = mapper.readTree(candidate);
                if (node != null && node.isObject() && node.has(RESULT_FIELD)) {
                    return Optional.of(node);
                }
            } catch (JsonProcessingException e) {
                log.debug("Repair candidate rejected: {}", e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Booleans as-is, {@code 1}/{@code 0} as true/false, text as {@code true}/{@code false} or else by the
     * affirmative-token rule. Anything else is {@link InjectionOutcome#UNKNOWN}.
     */
    InjectionOutcome outcome(JsonNode value) {
        if (value.isBoolean()) {
            return InjectionOutcome.of(value.booleanValue());
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            long number = value.longValue();
            if (number == 1 || number == 0) {
                return InjectionOutcome.of(number == 1);
            }
            return InjectionOutcome.UNKNOWN;
        }
        if (value.isTextual()) {
            String text = value.textValue().trim();
            if (text.isEmpty()) {
                return InjectionOutcome.UNKNOWN;
            }
            if ("true".equalsIgnoreCase(text)) {
                return InjectionOutcome.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return InjectionOutcome.FALSE;
            }
            return InjectionOutcome.of(isAffirmative(text));
        }
        return InjectionOutcome.UNKNOWN;
    }

    /**
     * @return index just past the brace closing the object that starts at index 0, or -1 if it never closes
     */
    static int objectEnd(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    static String stripTrailingFences(String text) {
        String stripped = text.strip();
        while (stripped.endsWith(FENCE)) {
            stripped = stripped.substring(0, stripped.length() - FENCE.length()).strip();
        }
        return stripped;
    }

    /**
     * Closes an unterminated string and any unclosed objects of a truncated JSON text.
     */
    static String repairTruncated(String text) {
        boolean inString = false;
        boolean escaped = false;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\' && inString) {
                escaped = true;
            } else if (c == '"') {
                inString = !inString;
            } else if (!inString && c == '{') {
                depth++;
            } else if (!inString && c == '}') {
                depth--;
            }
        }
        StringBuilder repaired = new StringBuilder(escaped ? text.substring(0, text.length() - 1) : text);
        if (inString) {
            repaired.append('"');
        }
        for (int i = 0; i < depth; i++) {
            repaired.append('}');
        }
        return repaired.toString();
    }
}
