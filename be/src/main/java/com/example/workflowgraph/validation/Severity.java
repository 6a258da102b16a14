package com.example.workflowgraph.validation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Errors block execution; warnings are advisory.
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
