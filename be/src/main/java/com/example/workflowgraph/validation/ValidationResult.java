package com.example.workflowgraph.validation;

import java.util.List;

/**
 * Outcome of {@link WorkflowGraphValidator#validate}. {@code valid} is derived from the errors
 * list and is true exactly when it is empty, whatever the caller passes.
 */
public record ValidationResult(boolean valid, List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        valid = errors.isEmpty();
    }

    public static ValidationResult of(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }
}
