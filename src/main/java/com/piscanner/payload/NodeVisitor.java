package com.piscanner.payload;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Callback for {@link TreeWalker}. Each method returns {@code true} to stop the walk.
 */
public interface NodeVisitor {
    default boolean visitObject(ObjectNode node) {
        return false;
    }

    default boolean visitText(TextSlot slot) {
        return false;
    }
}
