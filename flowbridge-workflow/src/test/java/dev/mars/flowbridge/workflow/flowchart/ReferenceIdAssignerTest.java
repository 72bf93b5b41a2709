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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ReferenceIdAssigner}.
 */
class ReferenceIdAssignerTest {
    
    private final ObjectMapper mapper = new ObjectMapper();
    private final ReferenceIdAssigner assigner = new ReferenceIdAssigner();
    
    private ObjectNode flowchart(String json) throws Exception {
        return (ObjectNode) mapper.readTree(json);
    }
    
    @Test
    void testRenumbersInDocumentOrderAndRewritesReferences() throws Exception {
        ObjectNode flowchart = flowchart("""
                {"type": "Flowchart", "startNode": "first",
                 "nodes": [
                   {"type": "FlowStep", "x:Name": "first", "next": "check"},
                   {"type": "FlowDecision", "x:Name": "check", "true": "first", "false": "done"},
                   {"type": "FlowStep", "x:Name": "done"}
                 ]}
                """);
        
        Map<String, String> mapping = assigner.assign(flowchart);
        
        assertEquals(Map.of("first", "__ReferenceID0", "check", "__ReferenceID1", "done", "__ReferenceID2"), mapping);
        assertEquals("__ReferenceID0", flowchart.get("startNode").asText());
        assertEquals("__ReferenceID1", flowchart.at("/nodes/0/next").asText());
        assertEquals("__ReferenceID0", flowchart.at("/nodes/1/true").asText());
        assertEquals("__ReferenceID2", flowchart.at("/nodes/1/false").asText());
        assertEquals("__ReferenceID2", flowchart.at("/nodes/2/x:Name").asText());
    }
    
    @Test
    void testMembersWithoutIdsStillGetOne() throws Exception {
        ObjectNode flowchart = flowchart("""
                {"type": "Flowchart",
                 "nodes": [{"type": "FlowStep"}, {"type": "FlowStep", "x:Name": "b"}]}
                """);
        
        Map<String, String> mapping = assigner.assign(flowchart);
        
        assertEquals(Map.of("b", "__ReferenceID1"), mapping);
        assertEquals("__ReferenceID0", flowchart.at("/nodes/0/x:Name").asText());
    }
    
    @Test
    void testUnknownReferencesLeftAsWritten() throws Exception {
        ObjectNode flowchart = flowchart("""
                {"type": "Flowchart", "startNode": "ghost",
                 "nodes": [{"type": "FlowStep", "x:Name": "a", "next": "nowhere"}]}
                """);
        
        assigner.assign(flowchart);
        
        assertEquals("ghost", flowchart.get("startNode").asText());
        assertEquals("nowhere", flowchart.at("/nodes/0/next").asText());
    }
    
    @Test
    void testInlineSuccessorReferencesRewritten() throws Exception {
        ObjectNode flowchart = flowchart("""
                {"type": "Flowchart", "startNode": "d",
                 "nodes": [
                   {"type": "FlowDecision", "x:Name": "d",
                    "true": {"type": "FlowStep", "next": "end"},
                    "false": null},
                   {"type": "FlowStep", "x:Name": "end"}
                 ]}
                """);
        
        Map<String, String> mapping = assigner.assign(flowchart);
        
        assertEquals(3, flowchart.get("nodes").size());
        assertEquals("__ReferenceID1", flowchart.at("/nodes/0/true").asText());
        assertEquals("__ReferenceID1", flowchart.at("/nodes/1/x:Name").asText());
        assertEquals("__ReferenceID2", flowchart.at("/nodes/1/next").asText());
        assertEquals(Map.of("d", "__ReferenceID0", "end", "__ReferenceID2"), mapping);
        assertTrue(flowchart.at("/nodes/0/false").isNull());
    }
    
    @Test
    void testNestedInlineNodesFlattenedInPreOrder() throws Exception {
        ObjectNode flowchart = flowchart("""
                {"type": "Flowchart", "startNode": "a",
                 "nodes": [
                   {"type": "FlowStep", "x:Name": "a",
                    "next": {"type": "FlowDecision", "x:Name": "d",
                             "true": {"type": "FlowStep", "x:Name": "b"},
                             "false": "c"}},
                   {"type": "FlowStep", "x:Name": "c", "next": "b"}
                 ]}
                """);
        
        Map<String, String> mapping = assigner.assign(flowchart);
        
        assertEquals(Map.of("a", "__ReferenceID0", "d", "__ReferenceID1",
                "b", "__ReferenceID2", "c", "__ReferenceID3"), mapping);
        assertEquals(4, flowchart.get("nodes").size());
        assertEquals("FlowDecision", flowchart.at("/nodes/1/type").asText());
        assertEquals("__ReferenceID1", flowchart.at("/nodes/0/next").asText());
        assertEquals("__ReferenceID2", flowchart.at("/nodes/1/true").asText());
        assertEquals("__ReferenceID3", flowchart.at("/nodes/1/false").asText());
        assertEquals("__ReferenceID2", flowchart.at("/nodes/3/next").asText());
    }
    
    @Test
    void testIdempotentOnAlreadyNumberedFlowchart() throws Exception {
        String json = """
                {"type": "Flowchart", "startNode": "__ReferenceID0",
                 "nodes": [{"type": "FlowStep", "x:Name": "__ReferenceID0", "next": "__ReferenceID1"},
                           {"type": "FlowStep", "x:Name": "__ReferenceID1"}]}
                """;
        ObjectNode once = flowchart(json);
        assigner.assign(once);
        ObjectNode twice = once.deepCopy();
        assigner.assign(twice);
        
        assertEquals(flowchart(json), once);
        assertEquals(once, twice);
    }
    
    @Test
    void testFlowchartWithoutNodes() throws Exception {
        assertTrue(assigner.assign(flowchart("{\"type\": \"Flowchart\"}")).isEmpty());
    }
}
