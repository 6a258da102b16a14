package com.example.workflowgraph.service;

import com.example.workflowgraph.api.v1.dto.CompileResponse;
import com.example.workflowgraph.conversion.WorkflowGraphConverter;
import com.example.workflowgraph.graph.EditorGraph;
import com.example.workflowgraph.graph.ExecutionGraph;
import com.example.workflowgraph.validation.ValidationResult;
import com.example.workflowgraph.validation.WorkflowGraphValidationException;
import com.example.workflowgraph.validation.WorkflowGraphValidator;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Application service composing graph conversion and validation.
 * <p>
 * Stateless: every call works on the graph it is given. {@link #compile} is the save/run gate,
 * rejecting graphs with blocking errors via {@link WorkflowGraphValidationException}.
 * </p>
 */
@Service
@Slf4j
public class WorkflowGraphService {

    private final boolean deduplicateCycles;

    public WorkflowGraphService(@Value("${workflow.validation.deduplicate-cycles:false}") boolean deduplicateCycles) {
        this.deduplicateCycles = deduplicateCycles;
    }

    public ExecutionGraph toExecution(EditorGraph editorGraph) {
        log.debug("Converting editor graph nodes={} edges={}", editorGraph.nodes().size(), editorGraph.edges().size());
        ExecutionGraph graph = WorkflowGraphConverter.toExecutionGraph(editorGraph);
        log.debug("Converted to execution graph nodes={} sources={}", graph.nodes().size(), graph.connections().size());
        return graph;
    }

    public EditorGraph toEditor(ExecutionGraph executionGraph) {
        log.debug("Converting execution graph nodes={} sources={}", executionGraph.nodes().size(), executionGraph.connections().size());
        EditorGraph graph = WorkflowGraphConverter.toEditorGraph(executionGraph);
        log.debug("Converted to editor graph nodes={} edges={}", graph.nodes().size(), graph.edges().size());
        return graph;
    }

    public ValidationResult validate(String name, ExecutionGraph graph) {
        ValidationResult result = WorkflowGraphValidator.validate(name, graph.nodes(), graph.connections(), deduplicateCycles);
        log.debug("Validated workflow name={} valid={} errors={} warnings={}",
                name, result.valid(), result.errors().size(), result.warnings().size());
        return result;
    }

    /**
     * Converts the editor graph and validates the result.
     *
     * @throws WorkflowGraphValidationException if the converted graph has blocking errors
     */
    public CompileResponse compile(String name, EditorGraph editorGraph) {
        ExecutionGraph graph = toExecution(editorGraph);
        ValidationResult result = validate(name, graph);
        if (!result.valid()) {
            throw new WorkflowGraphValidationException(result);
        }
        log.info("Compiled workflow name={} nodes={} warnings={}", name, graph.nodes().size(), result.warnings().size());
        return new CompileResponse(graph, result);
    }
}
