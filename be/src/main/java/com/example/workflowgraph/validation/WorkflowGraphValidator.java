package com.example.workflowgraph.validation;

import com.example.workflowgraph.graph.ExecutionGraph;
import com.example.workflowgraph.graph.NodeConnections;
import com.example.workflowgraph.graph.NodeType;
import com.example.workflowgraph.graph.WorkflowNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validates an execution graph before it may run.
 * <p>
 * All checks always run and their findings are partitioned into blocking errors and advisory
 * warnings: workflow name, non-empty graph, trigger presence, per-node checks, connection
 * integrity, unreachable nodes (warnings) and cycles (warnings). Graph content problems never
 * throw; only {@code null} arguments do.
 * </p>
 */
public final class WorkflowGraphValidator {

    private WorkflowGraphValidator() {
    }

    public static ValidationResult validate(String name, List<WorkflowNode> nodes, Map<String, NodeConnections> connections) {
        return validate(name, nodes, connections, false);
    }

    public static ValidationResult validate(String name, ExecutionGraph graph) {
        Objects.requireNonNull(graph, "graph");
        return validate(name, graph.nodes(), graph.connections(), false);
    }

    /**
     * @param deduplicateCycles report each distinct loop once instead of once per DFS entry
     */
    public static ValidationResult validate(String name, List<WorkflowNode> nodes,
                                            Map<String, NodeConnections> connections, boolean deduplicateCycles) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(connections, "connections");
        IssueReport report = new IssueReport();

        if (NodeValidator.isBlank(name)) {
            report.add(ValidationIssue.error(null, "name", "Workflow name is required"));
        }
        if (nodes.isEmpty()) {
            report.add(ValidationIssue.error(null, "nodes", "Workflow must have at least one node"));
        } else if (nodes.stream().noneMatch(node -> NodeType.isTriggerTag(node.type()))) {
            report.add(ValidationIssue.error(null, "nodes", "Workflow must have at least one trigger node"));
        }

        ValidationResult nodeChecks = NodeValidator.validate(nodes);
        report.addAll(nodeChecks.errors());
        report.addAll(nodeChecks.warnings());

        ValidationResult connectionChecks = ConnectionValidator.validate(nodes, connections);
        report.addAll(connectionChecks.errors());
        report.addAll(connectionChecks.warnings());

        for (String nodeId : ReachabilityAnalyzer.findUnreachableNodes(nodes, connections)) {
            report.add(ValidationIssue.warning(nodeId, "Node is unreachable from any trigger"));
        }

        List<List<String>> cycles = CycleDetector.detectCycles(nodes, connections);
        if (deduplicateCycles) {
            cycles = CycleDetector.deduplicate(cycles);
        }
        for (List<String> cycle : cycles) {
            report.add(ValidationIssue.warning("Cycle detected: " + String.join(" -> ", cycle)));
        }

        return report.toResult();
    }
}
