package com.example.workflowgraph.graph;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * One step of an execution graph. Addressed by {@code name} in connections; {@code id} is the
 * editor's stable identifier.
 * <p>
 * Uniqueness of id and name is not enforced here; {@link com.example.workflowgraph.validation.WorkflowGraphValidator}
 * reports violations.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowNode(
        String id,
        String name,
        String type,
        List<Double> position,
        Map<String, Object> parameters,
        Boolean disabled,
        Boolean retryOnFail,
        Integer maxRetries,
        Long retryDelayMs,
        Long timeoutMs,
        String notes
) {

    public WorkflowNode(String id, String name, String type, List<Double> position, Map<String, Object> parameters) {
        this(id, name, type, position, parameters, null, null, null, null, null, null);
    }

    public double x() {
        return coordinate(0);
    }

    public double y() {
        return coordinate(1);
    }

    private double coordinate(int index) {
        if (position == null || position.size() <= index || position.get(index) == null) {
            return 0.0;
        }
        return position.get(index);
    }
}
