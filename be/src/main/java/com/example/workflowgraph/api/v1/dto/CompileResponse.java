package com.example.workflowgraph.api.v1.dto;

import com.example.workflowgraph.graph.ExecutionGraph;
import com.example.workflowgraph.validation.ValidationResult;

/**
 * Compiled execution graph with its (warning-only) validation result.
 */
public record CompileResponse(ExecutionGraph graph, ValidationResult validation) {}
