package com.piscanner.payload;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ContainerNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A string leaf together with the container position it occupies, so a visitor can rewrite it in place.
 */
public record TextSlot(ContainerNode<?> parent, String fieldName, int index, String value) {

    static TextSlot ofField(ObjectNode parent, String fieldName, String value) {
        return new TextSlot(parent, fieldName, -1, value);
    }

    static TextSlot ofElement(ArrayNode parent, int index, String value) {
        return new TextSlot(parent, null, index, value);
    }

    public void replace(String replacement) {
        if (parent.isObject()) {
            ((ObjectNode) parent).put(fieldName, replacement);
        } else {
            ((ArrayNode) parent).set(index, parent.textNode(replacement));
        }
    }
}
