package com.piscanner.payload;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlaceholderSubstitutorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldReplacePlaceholdersAtAnyDepth() throws Exception {
        JsonNode tree = mapper.readTree("""
                {
                  "query": "{user_input}",
                  "meta": {"history": [{"role": "user", "content": "say {user_input}"}], "flag": true},
                  "list": ["{user_input}", 3, null]
                }
                """);

        PlaceholderSubstitutor.substitute(tree, PlaceholderSubstitutor.USER_INPUT, "hello");

        assertEquals("hello", tree.get("query").textValue());
        assertEquals("say hello", tree.at("/meta/history/0/content").textValue());
        assertEquals("hello", tree.at("/list/0").textValue());
        assertEquals(3, tree.at("/list/1").intValue());
        assertTrue(tree.at("/list/2").isNull());
        assertTrue(tree.at("/meta/flag").booleanValue());
    }

    @Test
    void shouldReplaceEveryPlaceholderInTheSameLeaf() throws Exception {
        JsonNode tree = mapper.readTree("{\"text\": \"{user_input}|{sign_input}|{user_input}\"}");
        Map<String, String> replacements = new LinkedHashMap<>();
        replacements.put(PlaceholderSubstitutor.USER_INPUT, "u");
        replacements.put(PlaceholderSubstitutor.SIGN_INPUT, "s");

        PlaceholderSubstitutor.substitute(tree, replacements);

        assertEquals("u|s|u", tree.get("text").textValue());
    }

    @Test
    void shouldTreatReplacementLiterally() throws Exception {
        JsonNode tree = mapper.readTree("{\"text\": \"value: {user_input}\"}");

        PlaceholderSubstitutor.substitute(tree, PlaceholderSubstitutor.USER_INPUT, "$1 \\d+ .*");

        assertEquals("value: $1 \\d+ .*", tree.get("text").textValue());
    }

    @Test
    void shouldLeaveLeavesWithoutPlaceholderUntouched() throws Exception {
        ObjectNode tree = (ObjectNode) mapper.readTree("{\"keep\": \"plain\", \"key{user_input}\": \"x\"}");
        JsonNode before = tree.get("keep");

        PlaceholderSubstitutor.substitute(tree, PlaceholderSubstitutor.USER_INPUT, "injected");

        assertSame(before, tree.get("keep"));
        assertEquals("x", tree.get("key{user_input}").textValue());
    }

    @Test
    void shouldCollectSlotsHoldingPlaceholder() throws Exception {
        JsonNode tree = mapper.readTree("{\"a\": \"x{sign_input}\", \"b\": [\"plain\", \"{sign_input}\"]}");

        List<TextSlot> slots = PlaceholderSubstitutor.slotsContaining(tree, PlaceholderSubstitutor.SIGN_INPUT);

        assertEquals(2, slots.size());
        assertEquals("a", slots.get(0).fieldName());
        assertEquals(1, slots.get(1).index());
        slots.get(1).replace("SIG");
        assertEquals("SIG", tree.get("b").get(1).textValue());
    }
}
