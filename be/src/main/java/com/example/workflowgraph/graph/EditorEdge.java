package com.example.workflowgraph.graph;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Editor edge between two node ids. The source port is taken from {@code sourceHandle},
 * falling back to {@code type}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EditorEdge(
        String id,
        String source,
        String target,
        String sourceHandle,
        String targetHandle,
        String type,
        String label
) {

    public EditorEdge(String id, String source, String target) {
        this(id, source, target, null, null, null, null);
    }

    public EditorEdge(String id, String source, String target, String sourceHandle) {
        this(id, source, target, sourceHandle, null, null, null);
    }
}
