package com.example.workflowgraph.service;

import com.example.workflowgraph.api.v1.dto.CompileResponse;
import com.example.workflowgraph.graph.Connection;
import com.example.workflowgraph.graph.EditorEdge;
import com.example.workflowgraph.graph.EditorGraph;
import com.example.workflowgraph.graph.EditorNode;
import com.example.workflowgraph.graph.EditorPosition;
import com.example.workflowgraph.graph.ExecutionGraph;
import com.example.workflowgraph.graph.NodeConnections;
import com.example.workflowgraph.graph.WorkflowNode;
import com.example.workflowgraph.validation.ValidationIssue;
import com.example.workflowgraph.validation.ValidationResult;
import com.example.workflowgraph.validation.WorkflowGraphValidationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WorkflowGraphService")
class WorkflowGraphServiceTest {

    private final WorkflowGraphService service = new WorkflowGraphService(false);

    private static EditorNode editorNode(String id, String type, String label) {
        return new EditorNode(id, type, new EditorPosition(0, 0), Map.of(EditorNode.LABEL, label));
    }

    @Test
    @DisplayName("compile returns the execution graph with warnings for a valid workflow")
    void compileValid() {
        EditorGraph editor = new EditorGraph(
                List.of(editorNode("t", "manual-trigger", "Start"),
                        editorNode("a", "http-request", "Fetch"),
                        editorNode("x", "email", "Orphan")),
                List.of(new EditorEdge("e1", "t", "a")));

        CompileResponse response = service.compile("Fetch flow", editor);

        assertThat(response.graph().connections()).containsOnlyKeys("Start");
        assertThat(response.graph().connections().get("Start").main().get(0))
                .containsExactly(new Connection("Fetch", "main", 0));
        assertThat(response.validation().valid()).isTrue();
        assertThat(response.validation().warnings()).extracting(ValidationIssue::nodeId).containsExactly("x");
    }

    @Test
    @DisplayName("compile rejects a workflow with blocking errors")
    void compileInvalid() {
        EditorGraph editor = new EditorGraph(List.of(editorNode("a", "http-request", "Fetch")), List.of());

        assertThatThrownBy(() -> service.compile("", editor))
                .isInstanceOf(WorkflowGraphValidationException.class)
                .satisfies(ex -> assertThat(((WorkflowGraphValidationException) ex).getErrors())
                        .extracting(ValidationIssue::message)
                        .containsExactly("Workflow name is required", "Workflow must have at least one trigger node"));
    }

    @Test
    @DisplayName("validate honours the cycle de-duplication setting")
    void deduplicationSetting() {
        List<WorkflowNode> nodes = List.of(
                new WorkflowNode("t", "T", "manual-trigger", List.of(0.0, 0.0), Map.of()),
                new WorkflowNode("c", "C", "transform", List.of(0.0, 0.0), Map.of()),
                new WorkflowNode("d", "D", "transform", List.of(0.0, 0.0), Map.of()));
        Map<String, NodeConnections> connections = Map.of(
                "T", new NodeConnections(List.of(List.of(new Connection("C", "main", 0)))),
                "C", new NodeConnections(List.of(List.of(new Connection("D", "main", 0)))),
                "D", new NodeConnections(List.of(List.of(new Connection("C", "main", 0), new Connection("C", "main", 1)))));
        ExecutionGraph graph = new ExecutionGraph(nodes, connections);

        ValidationResult plain = service.validate("Loop", graph);
        ValidationResult deduplicated = new WorkflowGraphService(true).validate("Loop", graph);

        assertThat(plain.warnings()).hasSize(2);
        assertThat(deduplicated.warnings()).extracting(ValidationIssue::message)
                .containsExactly("Cycle detected: C -> D -> C");
    }

    @Test
    @DisplayName("toEditor and toExecution delegate to the converter")
    void conversions() {
        ExecutionGraph execution = new ExecutionGraph(
                List.of(new WorkflowNode("t", "Start", "manual-trigger", List.of(5.0, 6.0), Map.of()),
                        new WorkflowNode("a", "Fetch", "http-request", List.of(7.0, 8.0), Map.of())),
                Map.of("Start", new NodeConnections(List.of(List.of(new Connection("Fetch", "main", 0))))));

        EditorGraph editor = service.toEditor(execution);
        assertThat(editor.edges()).extracting(EditorEdge::id).containsExactly("e-t-a-0");

        ExecutionGraph back = service.toExecution(editor);
        assertThat(back.connections()).isEqualTo(execution.connections());
    }
}
