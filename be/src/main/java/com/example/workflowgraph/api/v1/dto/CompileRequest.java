package com.example.workflowgraph.api.v1.dto;

import com.example.workflowgraph.graph.EditorEdge;
import com.example.workflowgraph.graph.EditorGraph;
import com.example.workflowgraph.graph.EditorNode;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request body for POST /api/v1/graphs/compile: workflow name plus the editor graph.
 */
public record CompileRequest(
        String name,
        @NotNull List<EditorNode> nodes,
        @NotNull List<EditorEdge> edges
) {

    public EditorGraph graph() {
        return new EditorGraph(nodes, edges);
    }
}
