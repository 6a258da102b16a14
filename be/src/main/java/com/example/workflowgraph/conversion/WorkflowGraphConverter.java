package com.example.workflowgraph.conversion;

import com.example.workflowgraph.graph.Connection;
import com.example.workflowgraph.graph.EditorEdge;
import com.example.workflowgraph.graph.EditorGraph;
import com.example.workflowgraph.graph.EditorNode;
import com.example.workflowgraph.graph.EditorPosition;
import com.example.workflowgraph.graph.ExecutionGraph;
import com.example.workflowgraph.graph.NodeConnections;
import com.example.workflowgraph.graph.WorkflowNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts between the editor graph (positioned nodes, flat edge list keyed by node id) and the
 * execution graph (nodes addressed by name, outgoing connections grouped by port).
 * <p>
 * Edges whose endpoints cannot be resolved are dropped without error in both directions: the
 * editor may hold dangling edges while the user is still wiring nodes.
 * </p>
 */
public final class WorkflowGraphConverter {

    /** Port used when an edge carries no handle. */
    public static final String DEFAULT_PORT = "main";

    private WorkflowGraphConverter() {
    }

    /**
     * Editor graph to execution graph. Node name is the editor label, or the node id when the
     * label is missing or empty.
     */
    public static ExecutionGraph toExecutionGraph(List<EditorNode> editorNodes, List<EditorEdge> editorEdges) {
        Objects.requireNonNull(editorNodes, "editorNodes");
        Objects.requireNonNull(editorEdges, "editorEdges");

        List<WorkflowNode> nodes = new ArrayList<>(editorNodes.size());
        for (EditorNode editorNode : editorNodes) {
            nodes.add(toWorkflowNode(editorNode));
        }

        Map<String, String> idToName = new HashMap<>();
        for (WorkflowNode node : nodes) {
            idToName.put(node.id(), node.name());
        }

        Map<String, List<List<Connection>>> groupsBySource = new LinkedHashMap<>();
        for (EditorEdge edge : editorEdges) {
            String sourceName = idToName.get(edge.source());
            String targetName = idToName.get(edge.target());
            if (sourceName == null || targetName == null) {
                continue;
            }
            String port = portOf(edge);
            List<List<Connection>> groups = groupsBySource.computeIfAbsent(sourceName, k -> new ArrayList<>());
            List<Connection> group = findGroup(groups, port);
            if (group == null) {
                group = new ArrayList<>();
                groups.add(group);
            }
            group.add(new Connection(targetName, port, group.size(), edge.label()));
        }

        Map<String, NodeConnections> connections = new LinkedHashMap<>();
        groupsBySource.forEach((source, groups) -> connections.put(source, new NodeConnections(groups)));
        return new ExecutionGraph(nodes, connections);
    }

    public static ExecutionGraph toExecutionGraph(EditorGraph graph) {
        Objects.requireNonNull(graph, "graph");
        return toExecutionGraph(graph.nodes(), graph.edges());
    }

    /**
     * Execution graph to editor graph. Edges are emitted walking sources in node-list order so the
     * output does not depend on the iteration order of the connections map. Edge ids are
     * {@code e-<sourceId>-<targetId>-<seq>} with a sequence local to this call. Each connections
     * entry is emitted once even when several nodes share its name; the source id then follows
     * {@link #buildNodeNameMap}.
     */
    public static EditorGraph toEditorGraph(List<WorkflowNode> nodes, Map<String, NodeConnections> connections) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(connections, "connections");

        Map<String, String> nameToId = buildNodeNameMap(nodes);

        List<EditorNode> editorNodes = new ArrayList<>(nodes.size());
        for (WorkflowNode node : nodes) {
            editorNodes.add(toEditorNode(node));
        }

        List<EditorEdge> edges = new ArrayList<>();
        Set<String> walkedSources = new HashSet<>();
        int sequence = 0;
        for (WorkflowNode source : nodes) {
            NodeConnections nodeConnections = connections.get(source.name());
            if (nodeConnections == null || !walkedSources.add(source.name())) {
                continue;
            }
            String sourceId = nameToId.get(source.name());
            for (Connection connection : nodeConnections.stream().toList()) {
                String targetId = nameToId.get(connection.node());
                if (targetId == null) {
                    continue;
                }
                String port = connection.type();
                String handle = port != null && !port.isEmpty() && !DEFAULT_PORT.equals(port) ? port : null;
                String edgeId = "e-" + sourceId + "-" + targetId + "-" + sequence++;
                edges.add(new EditorEdge(edgeId, sourceId, targetId, handle, null, null, connection.label()));
            }
        }
        return new EditorGraph(editorNodes, edges);
    }

    public static EditorGraph toEditorGraph(ExecutionGraph graph) {
        Objects.requireNonNull(graph, "graph");
        return toEditorGraph(graph.nodes(), graph.connections());
    }

    /**
     * Node name to node id. When two nodes share a name the later one wins.
     */
    public static Map<String, String> buildNodeNameMap(List<WorkflowNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        Map<String, String> nameToId = new HashMap<>();
        for (WorkflowNode node : nodes) {
            nameToId.put(node.name(), node.id());
        }
        return nameToId;
    }

    private static WorkflowNode toWorkflowNode(EditorNode editorNode) {
        String label = editorNode.label();
        String name = label != null ? label : editorNode.id();
        EditorPosition position = editorNode.position();
        List<Double> coordinates = position != null
                ? List.of(position.x(), position.y())
                : List.of(0.0, 0.0);
        Map<String, Object> parameters = editorNode.data() != null
                ? new LinkedHashMap<>(editorNode.data())
                : new LinkedHashMap<>();
        return new WorkflowNode(editorNode.id(), name, editorNode.type(), coordinates, parameters);
    }

    private static EditorNode toEditorNode(WorkflowNode node) {
        Map<String, Object> data = node.parameters() != null
                ? new LinkedHashMap<>(node.parameters())
                : new LinkedHashMap<>();
        data.put(EditorNode.LABEL, node.name());
        return new EditorNode(node.id(), node.type(), new EditorPosition(node.x(), node.y()), data);
    }

    private static String portOf(EditorEdge edge) {
        if (edge.sourceHandle() != null && !edge.sourceHandle().isEmpty()) {
            return edge.sourceHandle();
        }
        if (edge.type() != null && !edge.type().isEmpty()) {
            return edge.type();
        }
        return DEFAULT_PORT;
    }

    private static List<Connection> findGroup(List<List<Connection>> groups, String port) {
        for (List<Connection> group : groups) {
            if (!group.isEmpty() && port.equals(group.get(0).type())) {
                return group;
            }
        }
        return null;
    }
}
