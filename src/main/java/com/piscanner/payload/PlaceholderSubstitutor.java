package com.piscanner.payload;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

public final class PlaceholderSubstitutor {
    public static final String USER_INPUT = "{user_input}";
    public static final String SIGN_INPUT = "{sign_input}";

    private PlaceholderSubstitutor() {
    }

    public static void substitute(JsonNode tree, String placeholder, String replacement) {
        substitute(tree, Map.of(placeholder, replacement));
    }

    /**
     * Replaces every placeholder inside every string leaf of {@code tree}. Replacement is literal, and
     * leaves without a placeholder are left as they are. Object keys are never rewritten.
     */
    public static void substitute(JsonNode tree, Map<String, String> replacements) {
        TreeWalker.walk(tree, new NodeVisitor() {
            @Override
            public boolean visitText(TextSlot slot) {
                String rewritten = slot.value();
                for (Map.Entry<String, String> entry : replacements.entrySet()) {
                    if (rewritten.contains(entry.getKey())) {
                        rewritten = rewritten.replace(entry.getKey(), entry.getValue());
                    }
                }
                if (!rewritten.equals(slot.value())) {
                    slot.replace(rewritten);
                }
                return false;
            }
        });
    }

    /**
     * Collects the string leaves that currently hold {@code placeholder}, in walk order.
     */
    public static List<TextSlot> slotsContaining(JsonNode tree, String placeholder) {
        List<TextSlot> slots = new ArrayList<>();
        TreeWalker.walk(tree, new NodeVisitor() {
            @Override
            public boolean visitText(TextSlot slot) {
                if (slot.value().contains(placeholder)) {
                    slots.add(slot);
                }
                return false;
            }
        });
        return slots;
    }
}
