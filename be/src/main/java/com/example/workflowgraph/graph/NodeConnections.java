package com.example.workflowgraph.graph;

import java.util.List;
import java.util.stream.Stream;

/**
 * Outgoing connections of one source node: the {@code main} channel holds port groups in
 * insertion order, each group sharing one port identifier.
 */
public record NodeConnections(List<List<Connection>> main) {

    public static NodeConnections empty() {
        return new NodeConnections(List.of());
    }

    /**
     * All connections across every port group, in group order.
     */
    public Stream<Connection> stream() {
        if (main == null) {
            return Stream.empty();
        }
        return main.stream()
                .filter(group -> group != null)
                .flatMap(List::stream)
                .filter(connection -> connection != null);
    }
}
