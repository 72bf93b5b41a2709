/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowbridge.workflow.flowchart;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FlowchartValidator}.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
class FlowchartValidatorTest {
    
    private final ObjectMapper mapper = new ObjectMapper();
    private FlowchartValidator validator;
    
    @BeforeEach
    void setUp() {
        validator = new FlowchartValidator();
    }
    
    private FlowchartValidationResult validate(String json) throws Exception {
        return validator.validate(mapper.readTree(json));
    }
    
    @Nested
    @DisplayName("Graph rules")
    class GraphRules {
        
        @Test
        @DisplayName("A step whose next is itself is one circular failure")
        void testSelfLoop() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "loop",
                     "nodes": [{"type": "FlowStep", "x:Name": "loop", "next": "loop"}]}
                    """);
            
            assertFalse(result.isValid());
            assertEquals(1, result.getFailures().size());
            ValidationFailure failure = result.getFailures().get(0);
            assertEquals(FailureCategory.CIRCULAR, failure.getCategory());
            assertEquals(List.of("__ReferenceID0"), failure.getAffectedNodes());
        }
        
        @Test
        void testThreeStepCycle() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "a",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "a", "next": "b"},
                       {"type": "FlowStep", "x:Name": "b", "next": "c"},
                       {"type": "FlowStep", "x:Name": "c", "next": "a"}
                     ]}
                    """);
            
            List<ValidationFailure> circular = result.getFailures(FailureCategory.CIRCULAR);
            assertEquals(1, circular.size());
            assertEquals(List.of("__ReferenceID0", "__ReferenceID1", "__ReferenceID2"),
                    circular.get(0).getAffectedNodes());
            assertEquals(1, result.getFailures().size());
        }
        
        @Test
        @DisplayName("A decision with a null false branch is a legal terminal")
        void testNullBranchIsTerminal() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "s",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "s", "next": "d"},
                       {"type": "FlowDecision", "x:Name": "d", "condition": "[x > 1]",
                        "true": "e", "false": null},
                       {"type": "FlowStep", "x:Name": "e"}
                     ]}
                    """);
            
            assertTrue(result.isValid(), () -> result.getFailures().toString());
        }
        
        @Test
        void testOrphanedNodesReported() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "a",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "a", "next": "b"},
                       {"type": "FlowStep", "x:Name": "b"},
                       {"type": "FlowStep", "x:Name": "stray"}
                     ]}
                    """);
            
            List<ValidationFailure> orphans = result.getFailures(FailureCategory.REACHABILITY);
            assertEquals(1, orphans.size());
            assertEquals(List.of("__ReferenceID2"), orphans.get(0).getAffectedNodes());
            assertEquals("1 orphaned node(s)", orphans.get(0).getDetails());
        }
        
        @Test
        void testBackEdgeThroughDecisionIsCircular() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "s",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "s", "next": "d"},
                       {"type": "FlowDecision", "x:Name": "d", "true": "s", "false": null}
                     ]}
                    """);
            
            assertTrue(result.hasFailures(FailureCategory.CIRCULAR));
            assertThat(result.getFailures(FailureCategory.CIRCULAR).get(0).getDetails())
                    .isEqualTo("Circular path detected: __ReferenceID0 → __ReferenceID1 → __ReferenceID0");
        }
    }
    
    @Nested
    @DisplayName("Start node")
    class StartNode {
        
        @Test
        void testMissingStartNode() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "displayName": "Main",
                     "nodes": [{"type": "FlowStep", "x:Name": "a"}]}
                    """);
            
            assertEquals(1, result.getFailures().size());
            ValidationFailure failure = result.getFailures().get(0);
            assertEquals(FailureCategory.STRUCTURAL, failure.getCategory());
            assertEquals("Flowchart must have startNode property", failure.getRule());
            assertEquals(List.of("Main"), failure.getAffectedNodes());
        }
        
        @Test
        void testUnknownStartNode() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "ghost",
                     "nodes": [{"type": "FlowStep", "x:Name": "a"}]}
                    """);
            
            assertEquals(1, result.getFailures().size());
            assertEquals("StartNode must reference a valid node", result.getFailures().get(0).getRule());
            assertEquals(List.of("ghost"), result.getFailures().get(0).getAffectedNodes());
        }
        
        @Test
        void testStartNodeMustBeStep() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "d",
                     "nodes": [
                       {"type": "FlowDecision", "x:Name": "d", "true": "a", "false": null},
                       {"type": "FlowStep", "x:Name": "a"}
                     ]}
                    """);
            
            assertEquals(1, result.getFailures().size());
            assertEquals("StartNode must reference a FlowStep", result.getFailures().get(0).getRule());
            assertEquals(List.of("__ReferenceID0"), result.getFailures().get(0).getAffectedNodes());
        }
    }
    
    @Nested
    @DisplayName("References")
    class References {
        
        @Test
        void testDanglingNextReference() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "a",
                     "nodes": [{"type": "FlowStep", "x:Name": "a", "next": "nowhere"}]}
                    """);
            
            List<ValidationFailure> references = result.getFailures(FailureCategory.REFERENCE);
            assertEquals(1, references.size());
            assertEquals("Next reference must point to existing node", references.get(0).getRule());
            assertEquals("Reference nowhere not found", references.get(0).getDetails());
            assertEquals(List.of("__ReferenceID0"), references.get(0).getAffectedNodes());
        }
        
        @Test
        void testEmptyStringSuccessorIsDangling() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "s",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "s", "next": "d"},
                       {"type": "FlowDecision", "x:Name": "d", "true": "", "false": null}
                     ]}
                    """);
            
            List<ValidationFailure> references = result.getFailures(FailureCategory.REFERENCE);
            assertEquals(1, references.size());
            assertEquals("True reference must point to existing node", references.get(0).getRule());
            assertEquals(List.of("__ReferenceID1"), references.get(0).getAffectedNodes());
        }
        
        @Test
        void testInlineSuccessorIsLegal() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "s",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "s", "next": "d"},
                       {"type": "FlowDecision", "x:Name": "d",
                        "true": {"type": "FlowStep", "next": "end"},
                        "false": "end"},
                       {"type": "FlowStep", "x:Name": "end"}
                     ]}
                    """);
            
            assertTrue(result.isValid(), () -> result.getFailures().toString());
            JsonNode tree = result.getModifiedTree();
            assertEquals(4, tree.get("nodes").size());
            assertEquals("__ReferenceID2", tree.at("/nodes/1/true").asText());
            assertEquals("__ReferenceID2", tree.at("/nodes/2/x:Name").asText());
            assertEquals("__ReferenceID3", tree.at("/nodes/2/next").asText());
        }
        
        @Test
        @DisplayName("A named inline node can be the target of another member")
        void testNamedInlineNodeReferencedByAnotherMember() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "A",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "A",
                        "next": {"type": "FlowDecision", "x:Name": "D",
                                 "true": {"type": "FlowStep", "x:Name": "B"},
                                 "false": "C"}},
                       {"type": "FlowStep", "x:Name": "C", "next": "B"}
                     ]}
                    """);
            
            assertTrue(result.isValid(), () -> result.getFailures().toString());
            JsonNode tree = result.getModifiedTree();
            assertThat(tree.get("nodes")).hasSize(4);
            for (JsonNode node : tree.get("nodes")) {
                assertThat(node.get("x:Name").asText()).matches("__ReferenceID\\d+");
            }
            assertEquals("__ReferenceID2", tree.at("/nodes/1/true").asText());
            assertEquals("__ReferenceID2", tree.at("/nodes/3/next").asText());
            assertEquals(4, result.getLayouts().get(0).getNodeStates().size());
        }
        
        @Test
        void testDanglingReferenceInsideInlineSuccessor() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "s",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "s",
                        "next": {"type": "FlowStep", "next": "missing"}}
                     ]}
                    """);
            
            List<ValidationFailure> references = result.getFailures(FailureCategory.REFERENCE);
            assertEquals(1, references.size());
            assertEquals(List.of("__ReferenceID1"), references.get(0).getAffectedNodes());
        }
    }
    
    @Nested
    @DisplayName("Placement")
    class Placement {
        
        @Test
        void testStepOutsideFlowchart() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Sequence",
                     "children": [{"type": "FlowStep", "x:Name": "lost"}]}
                    """);
            
            assertEquals(1, result.getFailures().size());
            ValidationFailure failure = result.getFailures().get(0);
            assertEquals(FailureCategory.STRUCTURAL, failure.getCategory());
            assertEquals("FlowStep must be within Flowchart container", failure.getRule());
            assertEquals("FlowStep found in Sequence", failure.getDetails());
            assertEquals(List.of("lost"), failure.getAffectedNodes());
        }
        
        @Test
        void testDecisionAtRoot() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "FlowDecision", "true": null, "false": null}
                    """);
            
            assertEquals(1, result.getFailures().size());
            assertEquals("FlowDecision found in root", result.getFailures().get(0).getDetails());
            assertEquals(List.of("unnamed"), result.getFailures().get(0).getAffectedNodes());
            assertEquals(0, result.getFlowchartCount());
        }
        
        @Test
        @DisplayName("A step under a flowchart field other than nodes is misplaced")
        void testStepOutsideNodesListOfFlowchart() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "a",
                     "nodes": [{"type": "FlowStep", "x:Name": "a"}],
                     "body": {"type": "FlowStep", "x:Name": "stray"}}
                    """);
            
            assertFalse(result.isValid());
            List<ValidationFailure> structural = result.getFailures(FailureCategory.STRUCTURAL);
            assertEquals(1, structural.size());
            assertEquals("FlowStep found in Flowchart", structural.get(0).getDetails());
            assertEquals(List.of("stray"), structural.get(0).getAffectedNodes());
        }
        
        @Test
        void testDecisionInsideMemberActivityIsMisplaced() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "a",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "a",
                        "activity": {"type": "FlowDecision", "x:Name": "hidden",
                                     "true": null, "false": null}}
                     ]}
                    """);
            
            List<ValidationFailure> structural = result.getFailures(FailureCategory.STRUCTURAL);
            assertEquals(1, structural.size());
            assertEquals("FlowDecision found in FlowStep", structural.get(0).getDetails());
        }
        
        @Test
        void testNestedFlowchartsValidatedIndependently() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "outer",
                     "nodes": [
                       {"type": "FlowStep", "x:Name": "outer",
                        "activity": {"type": "Flowchart", "startNode": "inner",
                                     "nodes": [{"type": "FlowStep", "x:Name": "inner"}]}}
                     ]}
                    """);
            
            assertTrue(result.isValid(), () -> result.getFailures().toString());
            assertEquals(2, result.getFlowchartCount());
            assertEquals("__ReferenceID0",
                    result.getModifiedTree().at("/nodes/0/activity/startNode").asText());
        }
        
        @Test
        void testFailureInOneFlowchartIsReported() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Sequence",
                     "children": [
                       {"type": "Flowchart", "startNode": "a",
                        "nodes": [{"type": "FlowStep", "x:Name": "a"}]},
                       {"type": "Flowchart", "startNode": "b",
                        "nodes": [{"type": "FlowStep", "x:Name": "b", "next": "b"}]}
                     ]}
                    """);
            
            assertEquals(2, result.getFlowchartCount());
            assertEquals(1, result.getFailures().size());
            assertTrue(result.hasFailures(FailureCategory.CIRCULAR));
        }
        
        @Test
        void testContainsFlowchart() throws Exception {
            assertTrue(validator.containsFlowchart(mapper.readTree("""
                    {"type": "Sequence", "children": [{"type": "Flowchart"}]}
                    """)));
            assertFalse(validator.containsFlowchart(mapper.readTree("""
                    {"type": "Sequence", "children": [{"type": "Assign"}]}
                    """)));
            assertFalse(validator.containsFlowchart(null));
        }
    }
    
    @Nested
    @DisplayName("Output tree")
    class OutputTree {
        
        private static final String VALID = """
                {"type": "Flowchart", "startNode": "first",
                 "nodes": [
                   {"type": "FlowStep", "x:Name": "first", "next": "second"},
                   {"type": "FlowStep", "x:Name": "second"}
                 ]}
                """;
        
        @Test
        void testValidFlowchartGetsViewStates() throws Exception {
            FlowchartValidationResult result = validate(VALID);
            JsonNode tree = result.getModifiedTree();
            
            assertTrue(result.isValid());
            assertEquals("330,10", tree.at("/viewState/ShapeLocation").asText());
            assertEquals("355,60 355,200", tree.at("/viewState/ConnectorLocation").asText());
            assertEquals("300,200", tree.at("/nodes/0/viewState/ShapeLocation").asText());
            assertEquals("110,70", tree.at("/nodes/0/viewState/ShapeSize").asText());
            assertEquals("355,270 355,300", tree.at("/nodes/0/viewState/ConnectorLocation").asText());
        }
        
        @Test
        void testInvalidFlowchartGetsNoViewStates() throws Exception {
            FlowchartValidationResult result = validate("""
                    {"type": "Flowchart", "startNode": "a",
                     "nodes": [{"type": "FlowStep", "x:Name": "a", "next": "a"}]}
                    """);
            
            assertFalse(result.getModifiedTree().has("viewState"));
            assertFalse(result.getModifiedTree().at("/nodes/0").has("viewState"));
            assertEquals(1, result.getLayouts().size());
        }
        
        @Test
        void testInputTreeIsNotModified() throws Exception {
            JsonNode input = mapper.readTree(VALID);
            JsonNode pristine = input.deepCopy();
            
            validator.validate(input);
            
            assertEquals(pristine, input);
        }
        
        @Test
        void testReferenceIdsAreDeterministic() throws Exception {
            JsonNode first = validate(VALID).getModifiedTree();
            JsonNode second = validate(VALID).getModifiedTree();
            
            assertEquals(first, second);
            assertEquals("__ReferenceID0", first.get("startNode").asText());
            assertEquals("__ReferenceID1", first.at("/nodes/0/next").asText());
        }
        
        @Test
        void testRevalidatingOutputIsStable() throws Exception {
            JsonNode once = validate(VALID).getModifiedTree();
            JsonNode twice = validator.validate(once).getModifiedTree();
            
            assertEquals(once, twice);
        }
    }
    
    @Test
    void testNullTreeRejected() {
        assertThrows(NullPointerException.class, () -> validator.validate(null));
    }
}
