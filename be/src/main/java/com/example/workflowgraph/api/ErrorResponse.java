package com.example.workflowgraph.api;

import com.example.workflowgraph.validation.ValidationIssue;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Standard error response body (4xx/5xx): message and optional validation errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<ValidationIssue> errors) {

    public ErrorResponse(String message) {
        this(message, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationIssue> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null);
    }
}
