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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowbridge.ir.IrFields;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Flattens a flowchart's inline successor nodes into its member list, then renumbers the
 * members {@code __ReferenceID0..N-1} in document order and rewrites every reference to them.
 * <p>
 * An inline step or decision held in a {@code next}, {@code true} or {@code false} field is
 * moved into {@code nodes} directly after the node that contained it (pre-order) and replaced
 * there by a reference to its new ID. Input IDs, inline ones included, are only used to build
 * the old to new mapping. References the mapping does not know are left as written so the
 * validator can report them.
 */
public class ReferenceIdAssigner {
    
    public static final String PREFIX = "__ReferenceID";
    public static final Pattern REFERENCE_ID = Pattern.compile("^__ReferenceID\\d+$");
    
    /**
     * Flattens and assigns IDs in place.
     *
     * @param flowchart a flowchart node the caller owns
     * @return old ID to new ID; with duplicate input IDs the last occurrence wins
     */
    public Map<String, String> assign(ObjectNode flowchart) {
        Map<String, String> mapping = new LinkedHashMap<>();
        JsonNode nodes = flowchart.path(IrFields.NODES);
        if (!nodes.isArray()) {
            return mapping;
        }
        
        List<ObjectNode> members = new ArrayList<>();
        List<InlineLink> links = new ArrayList<>();
        for (JsonNode member : nodes) {
            if (member.isObject()) {
                members.add((ObjectNode) member);
                flatten((ObjectNode) member, members, links);
            }
        }
        
        int counter = 0;
        for (ObjectNode member : members) {
            String newId = PREFIX + counter++;
            JsonNode oldId = member.get(IrFields.REFERENCE_ID);
            if (oldId != null && oldId.isTextual()) {
                mapping.put(oldId.asText(), newId);
            }
            member.put(IrFields.REFERENCE_ID, newId);
        }
        
        JsonNode start = flowchart.get(IrFields.START_NODE);
        if (start != null && start.isTextual() && mapping.containsKey(start.asText())) {
            flowchart.put(IrFields.START_NODE, mapping.get(start.asText()));
        }
        
        // String successors first; inline slots already hold new IDs once replaced.
        for (ObjectNode member : members) {
            remapSuccessors(member, mapping);
        }
        for (InlineLink link : links) {
            link.owner.put(link.field, link.node.get(IrFields.REFERENCE_ID).asText());
        }
        
        ArrayNode memberArray = (ArrayNode) nodes;
        memberArray.removeAll();
        memberArray.addAll(members);
        return mapping;
    }
    
    private void flatten(ObjectNode node, List<ObjectNode> members, List<InlineLink> links) {
        FlowNodeKind kind = FlowNodeKind.of(node);
        if (kind == null) {
            return;
        }
        for (String field : kind.getSuccessorFields()) {
            JsonNode successor = node.get(field);
            if (FlowNodeKind.of(successor) != null) {
                ObjectNode inline = (ObjectNode) successor;
                members.add(inline);
                links.add(new InlineLink(node, field, inline));
                flatten(inline, members, links);
            }
        }
    }
    
    private void remapSuccessors(ObjectNode node, Map<String, String> mapping) {
        FlowNodeKind kind = FlowNodeKind.of(node);
        if (kind == null) {
            return;
        }
        for (String field : kind.getSuccessorFields()) {
            JsonNode successor = node.get(field);
            if (successor != null && successor.isTextual()) {
                String mapped = mapping.get(successor.asText());
                if (mapped != null) {
                    node.put(field, mapped);
                }
            }
        }
    }
    
    private static final class InlineLink {
        
        private final ObjectNode owner;
        private final String field;
        private final ObjectNode node;
        
        InlineLink(ObjectNode owner, String field, ObjectNode node) {
            this.owner = owner;
            this.field = field;
            this.node = node;
        }
    }
}
