package com.example.workflowgraph.graph;

import java.util.Map;

/**
 * Node as held by the visual editor. {@code data} carries the display {@code label} and the
 * node parameters in one bag.
 */
public record EditorNode(String id, String type, EditorPosition position, Map<String, Object> data) {

    public static final String LABEL = "label";

    /**
     * Returns the display label when it is a non-empty string, else {@code null}.
     */
    public String label() {
        if (data == null) {
            return null;
        }
        Object label = data.get(LABEL);
        if (label instanceof String text && !text.isEmpty()) {
            return text;
        }
        return null;
    }
}
