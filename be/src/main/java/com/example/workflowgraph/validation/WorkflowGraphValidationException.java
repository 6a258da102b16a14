package com.example.workflowgraph.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a graph submitted for compilation has blocking validation errors.
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by {@link com.example.workflowgraph.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowGraphValidationException extends RuntimeException {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public WorkflowGraphValidationException(ValidationResult result) {
        super("Workflow graph validation failed: " + (result != null ? result.errors().size() + " error(s)" : ""));
        this.errors = result != null ? result.errors() : List.of();
        this.warnings = result != null ? result.warnings() : List.of();
    }
}
