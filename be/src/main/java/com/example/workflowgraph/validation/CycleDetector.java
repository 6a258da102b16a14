package com.example.workflowgraph.validation;

import com.example.workflowgraph.graph.Connection;
import com.example.workflowgraph.graph.NodeConnections;
import com.example.workflowgraph.graph.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Depth-first cycle detection over node names.
 * <p>
 * Roots are taken in node-list order. Each back edge to a node still on the DFS branch yields one
 * cycle: the branch from that node to the current one, closed by repeating the first name. A node
 * finished once is never re-entered. The same loop can be reported more than once when it is
 * entered from different roots; {@link #deduplicate(List)} collapses rotations of one loop.
 * </p>
 */
public final class CycleDetector {

    private CycleDetector() {
    }

    public static List<List<String>> detectCycles(List<WorkflowNode> nodes, Map<String, NodeConnections> connections) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(connections, "connections");
        List<List<String>> cycles = new ArrayList<>();
        if (nodes.isEmpty()) {
            return cycles;
        }

        Set<String> names = new HashSet<>();
        for (WorkflowNode node : nodes) {
            names.add(node.name());
        }

        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (WorkflowNode root : nodes) {
            if (root.name() == null || visited.contains(root.name())) {
                continue;
            }
            enter(root.name(), connections, visited, onStack, path, stack);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.targets().hasNext()) {
                    stack.pop();
                    path.remove(path.size() - 1);
                    onStack.remove(frame.name());
                    continue;
                }
                String target = frame.targets().next().node();
                if (target == null || !names.contains(target)) {
                    continue;
                }
                if (!visited.contains(target)) {
                    enter(target, connections, visited, onStack, path, stack);
                } else if (onStack.contains(target)) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                    cycle.add(target);
                    cycles.add(cycle);
                }
            }
        }
        return cycles;
    }

    /**
     * Keeps the first occurrence of each distinct loop, treating rotations of a closed path as equal.
     */
    public static List<List<String>> deduplicate(List<List<String>> cycles) {
        Set<List<String>> seen = new LinkedHashSet<>();
        List<List<String>> distinct = new ArrayList<>();
        for (List<String> cycle : cycles) {
            if (seen.add(canonicalRotation(cycle))) {
                distinct.add(cycle);
            }
        }
        return distinct;
    }

    static List<String> canonicalRotation(List<String> cycle) {
        List<String> open = cycle.subList(0, Math.max(cycle.size() - 1, 0));
        List<String> best = open;
        for (int shift = 1; shift < open.size(); shift++) {
            List<String> rotated = new ArrayList<>(open.subList(shift, open.size()));
            rotated.addAll(open.subList(0, shift));
            if (compare(rotated, best) < 0) {
                best = rotated;
            }
        }
        return List.copyOf(best);
    }

    private static int compare(List<String> left, List<String> right) {
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int c = left.get(i).compareTo(right.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static void enter(String name, Map<String, NodeConnections> connections, Set<String> visited,
                              Set<String> onStack, List<String> path, Deque<Frame> stack) {
        visited.add(name);
        onStack.add(name);
        path.add(name);
        NodeConnections outgoing = connections.get(name);
        Iterator<Connection> targets = outgoing != null ? outgoing.stream().iterator() : List.<Connection>of().iterator();
        stack.push(new Frame(name, targets));
    }

    private record Frame(String name, Iterator<Connection> targets) {
    }
}
