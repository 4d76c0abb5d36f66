package com.piscanner.agent;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.piscanner.payload.TreeWalker;

/**
 * Reassembles a server-push reply ({@code data:<json>} lines) into one answer. Backends either stream
 * {@code content} deltas or emit {@code result} values; when both appear the {@code result} text wins so
 * the answer is not duplicated.
 */
public class StreamExtractor {
    static final String DATA_PREFIX = "data:";
    static final String RESULT_FIELD = "result";
    static final String CONTENT_FIELD = "content";

    private final ObjectMapper mapper;

    public StreamExtractor() {
        this(new ObjectMapper());
    }

    public StreamExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reads until the transport closes the stream.
     */
    public String extract(BufferedReader reader) throws IOException {
        Reassembly reassembly = new Reassembly();
        String line;
        while ((line = reader.readLine()) != null) {
            decode(line).ifPresent(reassembly::add);
        }
        return reassembly.answer();
    }

    public String extract(Iterable<String> lines) {
        Reassembly reassembly = new Reassembly();
        for (String line : lines) {
            decode(line).ifPresent(reassembly::add);
        }
        return reassembly.answer();
    }

    Optional<StreamFragment> decode(String rawLine) {
        if (rawLine == null) {
            return Optional.empty();
        }
        String line = rawLine.trim();
        if (line.isEmpty() || !line.startsWith(DATA_PREFIX)) {
            return Optional.empty();
        }
        JsonNode value;
        try {
            value = mapper.readTree(line.substring(DATA_PREFIX.length()).trim());
        } catch (JsonProcessingException e) {
            // partial chunks and sentinels such as [DONE]
            return Optional.empty();
        }
        Optional<String> result = findText(value, RESULT_FIELD);
        if (result.isPresent()) {
            return Optional.of(new StreamFragment(StreamFragment.Tier.RESULT, result.get()));
        }
        return findText(value, CONTENT_FIELD)
                .map(text -> new StreamFragment(StreamFragment.Tier.CONTENT, text));
    }

    private static Optional<String> findText(JsonNode value, String field) {
        return TreeWalker.findField(value, field, node -> !asText(node).isEmpty())
                .map(StreamExtractor::asText);
    }

    private static String asText(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isTextual() ? node.textValue() : node.toString();
    }

    private static final class Reassembly {
        private final StringBuilder primary = new StringBuilder();
        private final StringBuilder secondary = new StringBuilder();

        void add(StreamFragment fragment) {
            if (fragment.tier() == StreamFragment.Tier.RESULT) {
                primary.append(fragment.text());
            } else {
                secondary.append(fragment.text());
            }
        }

        String answer() {
            return primary.length() > 0 ? primary.toString() : secondary.toString();
        }
    }
}
