package com.example.workflowgraph.validation;

import com.example.workflowgraph.graph.WorkflowNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.workflowgraph.validation.GraphFixtures.connect;
import static com.example.workflowgraph.validation.GraphFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowGraphValidator")
class WorkflowGraphValidatorTest {

    @Nested
    @DisplayName("valid workflow")
    class ValidWorkflow {

        @Test
        @DisplayName("passes with a trigger connected to an action")
        void triggerAndAction() {
            List<WorkflowNode> nodes = List.of(
                    node("1", "Start", "manual-trigger"),
                    node("2", "API Call", "http-request"));

            ValidationResult result = WorkflowGraphValidator.validate("Test Workflow", nodes, connect("Start>API Call"));

            assertTrue(result.valid());
            assertThat(result.errors()).isEmpty();
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        @DisplayName("accepts every trigger type")
        void everyTriggerType() {
            for (String type : List.of("manual-trigger", "webhook-trigger", "schedule-trigger", "event-trigger")) {
                ValidationResult result = WorkflowGraphValidator.validate("Workflow", List.of(node("1", type)), Map.of());
                assertTrue(result.valid(), type);
            }
        }

        @Test
        @DisplayName("cycles alone do not invalidate")
        void simpleCycle() {
            List<WorkflowNode> nodes = List.of(
                    node("a", "A", "manual-trigger"),
                    node("b", "B", "http-request"));

            ValidationResult result = WorkflowGraphValidator.validate("Loop", nodes, connect("A>B", "B>A"));

            assertTrue(result.valid());
            assertThat(result.warnings()).extracting(ValidationIssue::message)
                    .containsExactly("Cycle detected: A -> B -> A");
            assertThat(result.warnings()).allMatch(w -> w.severity() == Severity.WARNING);
        }
    }

    @Nested
    @DisplayName("invalid workflow")
    class InvalidWorkflow {

        @Test
        @DisplayName("empty workflow reports name and node count but not trigger presence")
        void emptyWorkflow() {
            ValidationResult result = WorkflowGraphValidator.validate("", List.of(), Map.of());

            assertFalse(result.valid());
            assertThat(result.errors()).extracting(ValidationIssue::message)
                    .containsExactly("Workflow name is required", "Workflow must have at least one node");
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        @DisplayName("whitespace name is treated as missing")
        void blankName() {
            ValidationResult result = WorkflowGraphValidator.validate("   ", List.of(node("1", "manual-trigger")), Map.of());
            assertFalse(result.valid());
            assertEquals("name", result.errors().get(0).field());
        }

        @Test
        @DisplayName("no-break space name is treated as missing")
        void noBreakSpaceName() {
            ValidationResult result = WorkflowGraphValidator.validate("\u00A0\u2003", List.of(node("1", "manual-trigger")), Map.of());

            assertFalse(result.valid());
            assertThat(result.errors()).extracting(ValidationIssue::message)
                    .containsExactly("Workflow name is required");
        }

        @Test
        @DisplayName("result validity follows its errors")
        void validityDerivedFromErrors() {
            ValidationResult result = new ValidationResult(true,
                    List.of(ValidationIssue.error("1", "name", "Node name is required")), List.of());

            assertFalse(result.valid());
            assertTrue(new ValidationResult(false, List.of(), null).valid());
        }

        @Test
        @DisplayName("no trigger is an error and leaves every node unreachable")
        void noTrigger() {
            List<WorkflowNode> nodes = List.of(node("1", "Request", "http-request"));

            ValidationResult result = WorkflowGraphValidator.validate("No Trigger", nodes, Map.of());

            assertFalse(result.valid());
            assertThat(result.errors()).extracting(ValidationIssue::message)
                    .containsExactly("Workflow must have at least one trigger node");
            assertThat(result.warnings())
                    .extracting(ValidationIssue::nodeId, ValidationIssue::message)
                    .containsExactly(org.assertj.core.groups.Tuple.tuple("1", "Node is unreachable from any trigger"));
        }

        @Test
        @DisplayName("self-loop gives exactly one self-reference error")
        void selfLoop() {
            List<WorkflowNode> nodes = List.of(node("a", "A", "manual-trigger"));

            ValidationResult result = WorkflowGraphValidator.validate("Self", nodes, connect("A>A"));

            assertFalse(result.valid());
            assertThat(result.errors()).hasSize(1);
            assertEquals("Node \"A\" has a self-referencing connection", result.errors().get(0).message());
            assertEquals("a", result.errors().get(0).nodeId());
        }

        @Test
        @DisplayName("duplicate names are reported on each offending node")
        void duplicateNames() {
            List<WorkflowNode> nodes = List.of(
                    node("1", "Same", "manual-trigger"),
                    node("2", "Same", "http-request"));

            ValidationResult result = WorkflowGraphValidator.validate("Dupes", nodes, Map.of());

            List<ValidationIssue> duplicateNameErrors = result.errors().stream()
                    .filter(e -> e.message().startsWith("Duplicate node name"))
                    .toList();
            assertThat(duplicateNameErrors).hasSize(2);
            assertThat(duplicateNameErrors).extracting(ValidationIssue::nodeId).containsExactly("1", "2");
        }

        @Test
        @DisplayName("aggregates node and connection errors")
        void aggregatesErrors() {
            List<WorkflowNode> nodes = List.of(
                    node("1", "Trigger", "manual-trigger"),
                    node("1", "Duplicate ID", "http-request"));

            ValidationResult result = WorkflowGraphValidator.validate("Aggregated", nodes, connect("Trigger>NonExistent"));

            assertFalse(result.valid());
            assertThat(result.errors()).extracting(ValidationIssue::message)
                    .containsExactly("Duplicate node ID: 1", "Connection target node \"NonExistent\" does not exist");
        }

        @Test
        @DisplayName("rejects null graph arguments")
        void nullArguments() {
            assertThrows(NullPointerException.class, () -> WorkflowGraphValidator.validate("x", null, Map.of()));
            assertThrows(NullPointerException.class, () -> WorkflowGraphValidator.validate("x", List.of(), null));
        }
    }

    @Nested
    @DisplayName("warnings")
    class Warnings {

        @Test
        @DisplayName("isolated node is unreachable, connected nodes are not")
        void unreachableNode() {
            List<WorkflowNode> nodes = List.of(
                    node("a", "A", "manual-trigger"),
                    node("b", "B", "http-request"),
                    node("c", "C", "notification"));

            ValidationResult result = WorkflowGraphValidator.validate("Partial", nodes, connect("A>B"));

            assertTrue(result.valid());
            assertThat(result.warnings()).extracting(ValidationIssue::nodeId).containsExactly("c");
        }

        @Test
        @DisplayName("disabled node warns but stays valid")
        void disabledNode() {
            List<WorkflowNode> nodes = List.of(GraphFixtures.disabledNode("1", "Start", "manual-trigger"));

            ValidationResult result = WorkflowGraphValidator.validate("Disabled", nodes, Map.of());

            assertTrue(result.valid());
            assertThat(result.warnings()).extracting(ValidationIssue::message)
                    .containsExactly("Node \"Start\" is disabled and will not execute");
        }

        @Test
        @DisplayName("parallel back edges repeat a cycle unless de-duplication is on")
        void cycleDeduplication() {
            List<WorkflowNode> nodes = List.of(
                    node("t", "T", "manual-trigger"),
                    node("c", "C", "http-request"),
                    node("d", "D", "http-request"));
            var connections = connect("T>C", "C>D", "D>C", "D>C");

            ValidationResult plain = WorkflowGraphValidator.validate("Loop", nodes, connections);
            ValidationResult deduplicated = WorkflowGraphValidator.validate("Loop", nodes, connections, true);

            assertThat(plain.warnings()).extracting(ValidationIssue::message)
                    .containsExactly("Cycle detected: C -> D -> C", "Cycle detected: C -> D -> C");
            assertThat(deduplicated.warnings()).extracting(ValidationIssue::message)
                    .containsExactly("Cycle detected: C -> D -> C");
        }
    }
}
