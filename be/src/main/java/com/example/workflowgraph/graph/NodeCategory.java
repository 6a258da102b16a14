package com.example.workflowgraph.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Palette grouping of node types.
 */
public enum NodeCategory {
    TRIGGER,
    AI,
    LOGIC,
    ACTION,
    HUMAN,
    CODE,
    INTEGRATION;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
