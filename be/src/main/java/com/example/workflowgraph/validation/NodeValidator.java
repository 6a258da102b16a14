package com.example.workflowgraph.validation;

import com.example.workflowgraph.graph.WorkflowNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-node checks: id and name present and unique, disabled nodes flagged.
 * <p>
 * Ids and names are tracked independently. A repeated id is reported on every occurrence after
 * the first; a repeated name is reported on every node carrying it, so each offending node gets
 * an error tagged with its own id.
 * </p>
 */
public final class NodeValidator {

    private NodeValidator() {
    }

    public static ValidationResult validate(List<WorkflowNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        IssueReport report = new IssueReport();

        Map<String, Integer> nameCounts = new HashMap<>();
        for (WorkflowNode node : nodes) {
            if (!isBlank(node.name())) {
                nameCounts.merge(node.name(), 1, Integer::sum);
            }
        }

        Set<String> seenIds = new HashSet<>();
        for (WorkflowNode node : nodes) {
            if (isBlank(node.id())) {
                report.add(ValidationIssue.error(node.id(), "id", "Node ID is required"));
            } else if (!seenIds.add(node.id())) {
                report.add(ValidationIssue.error(node.id(), "id", "Duplicate node ID: " + node.id()));
            }

            if (isBlank(node.name())) {
                report.add(ValidationIssue.error(node.id(), "name", "Node name is required"));
            } else if (nameCounts.get(node.name()) > 1) {
                report.add(ValidationIssue.error(node.id(), "name", "Duplicate node name: " + node.name()));
            }

            if (Boolean.TRUE.equals(node.disabled())) {
                report.add(ValidationIssue.warning(node.id(), "Node \"" + node.name() + "\" is disabled and will not execute"));
            }
        }
        return report.toResult();
    }

    /**
     * Blank means empty after trimming whitespace and Unicode space separators, so a no-break
     * space alone does not count as a name.
     */
    static boolean isBlank(String value) {
        return value == null || value.codePoints().allMatch(NodeValidator::isSpace);
    }

    private static boolean isSpace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == '\uFEFF';
    }
}
