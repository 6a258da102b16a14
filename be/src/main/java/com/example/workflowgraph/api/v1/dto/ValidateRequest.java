package com.example.workflowgraph.api.v1.dto;

import com.example.workflowgraph.graph.ExecutionGraph;
import com.example.workflowgraph.graph.NodeConnections;
import com.example.workflowgraph.graph.WorkflowNode;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/graphs/validate. The name is checked by the validator itself,
 * so a blank name yields a validation error rather than a 400.
 */
public record ValidateRequest(
        String name,
        @NotNull List<WorkflowNode> nodes,
        @NotNull Map<String, NodeConnections> connections
) {

    public ExecutionGraph graph() {
        return new ExecutionGraph(nodes, connections);
    }
}
