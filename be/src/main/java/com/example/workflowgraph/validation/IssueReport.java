package com.example.workflowgraph.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable collector shared by the validation passes.
 */
final class IssueReport {

    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();

    void add(ValidationIssue issue) {
        if (issue.severity() == Severity.ERROR) {
            errors.add(issue);
        } else {
            warnings.add(issue);
        }
    }

    void addAll(List<ValidationIssue> issues) {
        issues.forEach(this::add);
    }

    List<ValidationIssue> errors() {
        return errors;
    }

    List<ValidationIssue> warnings() {
        return warnings;
    }

    ValidationResult toResult() {
        return ValidationResult.of(errors, warnings);
    }
}
