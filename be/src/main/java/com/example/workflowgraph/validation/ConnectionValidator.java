package com.example.workflowgraph.validation;

import com.example.workflowgraph.conversion.WorkflowGraphConverter;
import com.example.workflowgraph.graph.Connection;
import com.example.workflowgraph.graph.NodeConnections;
import com.example.workflowgraph.graph.WorkflowNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Referential integrity of the connections map: every source and target must name an existing
 * node, and no node may connect to itself.
 */
public final class ConnectionValidator {

    private ConnectionValidator() {
    }

    public static ValidationResult validate(List<WorkflowNode> nodes, Map<String, NodeConnections> connections) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(connections, "connections");
        IssueReport report = new IssueReport();
        Map<String, String> nameToId = WorkflowGraphConverter.buildNodeNameMap(nodes);

        for (Map.Entry<String, NodeConnections> entry : connections.entrySet()) {
            String sourceName = entry.getKey();
            if (!nameToId.containsKey(sourceName)) {
                report.add(ValidationIssue.error(null, "connections",
                        "Connection source node \"" + sourceName + "\" does not exist"));
                continue;
            }
            if (entry.getValue() == null) {
                continue;
            }
            String sourceId = nameToId.get(sourceName);
            for (Connection connection : entry.getValue().stream().toList()) {
                if (!nameToId.containsKey(connection.node())) {
                    report.add(ValidationIssue.error(sourceId, "connections",
                            "Connection target node \"" + connection.node() + "\" does not exist"));
                } else if (Objects.equals(connection.node(), sourceName)) {
                    report.add(ValidationIssue.error(sourceId, "connections",
                            "Node \"" + sourceName + "\" has a self-referencing connection"));
                }
            }
        }
        return report.toResult();
    }
}
