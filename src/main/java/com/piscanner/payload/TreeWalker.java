package com.piscanner.payload;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Depth-first, pre-order walk over a Jackson tree. Objects are reported before their children and
 * string leaves are reported as {@link TextSlot}s; other scalars are skipped.
 */
public final class TreeWalker {
    private TreeWalker() {
    }

    /**
     * @return {@code true} if the visitor stopped the walk
     */
    public static boolean walk(JsonNode node, NodeVisitor visitor) {
        if (node == null) {
            return false;
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            if (visitor.visitObject(object)) {
                return true;
            }
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode child = object.get(name);
                if (child.isTextual()) {
                    if (visitor.visitText(TextSlot.ofField(object, name, child.textValue()))) {
                        return true;
                    }
                } else if (walk(child, visitor)) {
                    return true;
                }
            }
        } else if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                JsonNode child = array.get(i);
                if (child.isTextual()) {
                    if (visitor.visitText(TextSlot.ofElement(array, i, child.textValue()))) {
                        return true;
                    }
                } else if (walk(child, visitor)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Finds the first field named {@code fieldName} whose value passes {@code accept}. An object's own
     * fields are checked before descending into its children.
     */
    public static Optional<JsonNode> findField(JsonNode root, String fieldName, Predicate<JsonNode> accept) {
        JsonNode[] found = new JsonNode[1];
        walk(root, new NodeVisitor() {
            @Override
            public boolean visitObject(ObjectNode node) {
                JsonNode value = node.get(fieldName);
                if (value != null && accept.test(value)) {
                    found[0] = value;
                    return true;
                }
                return false;
            }
        });
        return Optional.ofNullable(found[0]);
    }
}
