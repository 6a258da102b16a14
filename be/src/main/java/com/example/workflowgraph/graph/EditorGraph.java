package com.example.workflowgraph.graph;

import java.util.List;
import java.util.Objects;

/**
 * Spatial node/edge graph authored in the visual editor.
 */
public record EditorGraph(List<EditorNode> nodes, List<EditorEdge> edges) {

    public EditorGraph {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
    }
}
