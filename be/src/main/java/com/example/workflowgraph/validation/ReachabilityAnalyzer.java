package com.example.workflowgraph.validation;

import com.example.workflowgraph.conversion.WorkflowGraphConverter;
import com.example.workflowgraph.graph.Connection;
import com.example.workflowgraph.graph.NodeConnections;
import com.example.workflowgraph.graph.NodeType;
import com.example.workflowgraph.graph.WorkflowNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Forward reachability from the trigger nodes. The walk uses an explicit stack, so chain length
 * is bounded by heap rather than thread stack. Disabled flags are ignored.
 */
public final class ReachabilityAnalyzer {

    private ReachabilityAnalyzer() {
    }

    /**
     * Ids of nodes not reachable from any trigger, in node-list order. Without a trigger every
     * node is unreachable.
     */
    public static List<String> findUnreachableNodes(List<WorkflowNode> nodes, Map<String, NodeConnections> connections) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(connections, "connections");
        if (nodes.isEmpty()) {
            return List.of();
        }

        List<WorkflowNode> triggers = nodes.stream()
                .filter(node -> NodeType.isTriggerTag(node.type()))
                .toList();
        if (triggers.isEmpty()) {
            return nodes.stream().map(WorkflowNode::id).toList();
        }

        Map<String, String> nameToId = WorkflowGraphConverter.buildNodeNameMap(nodes);
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (WorkflowNode trigger : triggers) {
            visited.add(trigger.id());
        }
        for (WorkflowNode trigger : triggers) {
            if (trigger.name() != null) {
                stack.push(trigger.name());
            }
            while (!stack.isEmpty()) {
                NodeConnections outgoing = connections.get(stack.pop());
                if (outgoing == null) {
                    continue;
                }
                for (Connection connection : outgoing.stream().toList()) {
                    String targetId = nameToId.get(connection.node());
                    if (targetId != null && connection.node() != null && visited.add(targetId)) {
                        stack.push(connection.node());
                    }
                }
            }
        }

        return nodes.stream()
                .map(WorkflowNode::id)
                .filter(id -> !visited.contains(id))
                .toList();
    }
}
