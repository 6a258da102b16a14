package com.example.workflowgraph.graph;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Name-addressed graph consumed by the runner: nodes plus connections keyed by source node name.
 */
public record ExecutionGraph(List<WorkflowNode> nodes, Map<String, NodeConnections> connections) {

    public ExecutionGraph {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(connections, "connections");
    }
}
