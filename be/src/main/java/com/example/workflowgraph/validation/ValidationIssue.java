package com.example.workflowgraph.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A single finding of graph validation, optionally tied to a node and a field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(String nodeId, String field, String message, Severity severity) {

    public ValidationIssue {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
    }

    public static ValidationIssue error(String message) {
        return new ValidationIssue(null, null, message, Severity.ERROR);
    }

    public static ValidationIssue error(String nodeId, String message) {
        return new ValidationIssue(nodeId, null, message, Severity.ERROR);
    }

    public static ValidationIssue error(String nodeId, String field, String message) {
        return new ValidationIssue(nodeId, field, message, Severity.ERROR);
    }

    public static ValidationIssue warning(String message) {
        return new ValidationIssue(null, null, message, Severity.WARNING);
    }

    public static ValidationIssue warning(String nodeId, String message) {
        return new ValidationIssue(nodeId, null, message, Severity.WARNING);
    }
}
