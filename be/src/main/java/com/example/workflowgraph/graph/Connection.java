package com.example.workflowgraph.graph;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Directed edge to the node named {@code node}, leaving the source through port {@code type}.
 * {@code index} is the position within the port group and is recomputed on conversion; a
 * missing index reads as 0.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Connection(String node, String type, Integer index, String label) {

    public Connection {
        index = index != null ? index : 0;
    }

    public Connection(String node, String type, int index) {
        this(node, type, index, null);
    }
}
