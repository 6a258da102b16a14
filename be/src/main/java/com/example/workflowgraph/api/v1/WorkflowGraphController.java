package com.example.workflowgraph.api.v1;

import com.example.workflowgraph.api.v1.dto.CompileRequest;
import com.example.workflowgraph.api.v1.dto.CompileResponse;
import com.example.workflowgraph.api.v1.dto.NodeTypeDto;
import com.example.workflowgraph.api.v1.dto.ValidateRequest;
import com.example.workflowgraph.graph.EditorGraph;
import com.example.workflowgraph.graph.ExecutionGraph;
import com.example.workflowgraph.graph.NodeType;
import com.example.workflowgraph.service.WorkflowGraphService;
import com.example.workflowgraph.validation.ValidationResult;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

/**
 * REST controller for graph conversion and validation.
 * <p>
 * Exposes {@code /api/v1/graphs} for editor-to-execution and execution-to-editor conversion,
 * validation of an execution graph, and compile (convert, validate, reject on errors). Nothing
 * is stored.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/graphs")
@RequiredArgsConstructor
@Slf4j
public class WorkflowGraphController {

    private final WorkflowGraphService service;

    @PostMapping("/to-execution")
    public ResponseEntity<ExecutionGraph> toExecution(@RequestBody EditorGraph request) {
        log.info("Converting editor graph nodeCount={} edgeCount={}", request.nodes().size(), request.edges().size());
        return ResponseEntity.ok(service.toExecution(request));
    }

    @PostMapping("/to-editor")
    public ResponseEntity<EditorGraph> toEditor(@RequestBody ExecutionGraph request) {
        log.info("Converting execution graph nodeCount={}", request.nodes().size());
        return ResponseEntity.ok(service.toEditor(request));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@Valid @RequestBody ValidateRequest request) {
        log.info("Validating workflow name={} nodeCount={}", request.name(), request.nodes().size());
        return ResponseEntity.ok(service.validate(request.name(), request.graph()));
    }

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        log.info("Compiling workflow name={} nodeCount={} edgeCount={}", request.name(), request.nodes().size(), request.edges().size());
        return ResponseEntity.ok(service.compile(request.name(), request.graph()));
    }

    @GetMapping("/node-types")
    public List<NodeTypeDto> nodeTypes() {
        log.debug("Listing node types");
        return Arrays.stream(NodeType.values())
                .map(type -> new NodeTypeDto(type.tag(), type.category(), type.isTrigger()))
                .toList();
    }
}
