package com.example.workflowgraph.graph;

/**
 * Canvas coordinates of an editor node.
 */
public record EditorPosition(double x, double y) {
}
