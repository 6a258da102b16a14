package com.example.workflowgraph.api.v1.dto;

import com.example.workflowgraph.graph.NodeCategory;

/**
 * API response for one node type of the palette.
 */
public record NodeTypeDto(String type, NodeCategory category, boolean trigger) {}
