package com.example.workflowgraph.api.v1;

import com.example.workflowgraph.api.v1.dto.HealthResponse;
import com.example.workflowgraph.graph.NodeType;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/health reports liveness along with the size of the node-type catalogue and the
 * active cycle reporting mode, so a client can tell which validator build it is talking to.
 */
@RestController
@Slf4j
public class HealthController {

    private final boolean deduplicateCycles;

    public HealthController(@Value("${workflow.validation.deduplicate-cycles:false}") boolean deduplicateCycles) {
        this.deduplicateCycles = deduplicateCycles;
    }

    @GetMapping("/api/v1/health")
    public HealthResponse health() {
        log.trace("Health check");
        return new HealthResponse("UP", "workflow-graph-be", NodeType.values().length,
                NodeType.TRIGGER_TAGS.size(), deduplicateCycles);
    }
}
