package com.example.workflowgraph.api.v1.dto;

/**
 * Body of GET /api/v1/health.
 */
public record HealthResponse(String status, String service, int nodeTypes, int triggerTypes, boolean deduplicateCycles) {}
