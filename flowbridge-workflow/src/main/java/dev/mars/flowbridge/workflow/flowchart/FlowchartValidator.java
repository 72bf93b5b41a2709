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
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowbridge.config.FlowBridgeConfiguration;
import dev.mars.flowbridge.ir.IrFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates every flowchart in an IR tree and synthesizes its layout.
 * <p>
 * The tree is copied first and never modified. For each flowchart, in document pre-order:
 * <ol>
 *   <li>members are renumbered and references rewritten ({@link ReferenceIdAssigner})</li>
 *   <li>structural and reference rules are checked</li>
 *   <li>the successor graph is searched for cycles and orphans ({@link FlowchartGraph})</li>
 *   <li>a layout is computed ({@link FlowchartLayoutEngine})</li>
 * </ol>
 * Placement is checked over the whole tree first: a step or decision must be an entry of a
 * flowchart's {@code nodes} list or an inline successor of such an entry. Failures
 * accumulate; nothing is thrown for an invalid flowchart. Layouts are written into the copy
 * only when no flowchart failed.
 * <p>
 * Absent and {@code null} successors are terminals. A string successor that names no member,
 * the empty string included, is a dangling reference. Inline successor nodes are flattened
 * into the member list before renumbering, so other members may reference them by name.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class FlowchartValidator {
    
    private static final Logger logger = LoggerFactory.getLogger(FlowchartValidator.class);
    
    private static final String ROOT = "root";
    private static final String ARROW = " → ";
    
    private final ReferenceIdAssigner idAssigner;
    private final FlowchartLayoutEngine layoutEngine;
    
    public FlowchartValidator() {
        this(FlowBridgeConfiguration.defaults());
    }
    
    public FlowchartValidator(FlowBridgeConfiguration config) {
        this(new ReferenceIdAssigner(), new FlowchartLayoutEngine(config));
    }
    
    public FlowchartValidator(ReferenceIdAssigner idAssigner, FlowchartLayoutEngine layoutEngine) {
        this.idAssigner = Objects.requireNonNull(idAssigner, "ID assigner cannot be null");
        this.layoutEngine = Objects.requireNonNull(layoutEngine, "Layout engine cannot be null");
    }
    
    /**
     * True when a flowchart occurs anywhere in the tree.
     */
    public boolean containsFlowchart(JsonNode tree) {
        if (tree == null) {
            return false;
        }
        if (tree.isObject() && IrFields.FLOWCHART.equals(tree.path(IrFields.TYPE).asText())) {
            return true;
        }
        if (tree.isContainerNode()) {
            for (JsonNode child : tree) {
                if (containsFlowchart(child)) {
                    return true;
                }
            }
        }
        return false;
    }
    
    public FlowchartValidationResult validate(JsonNode tree) {
        Objects.requireNonNull(tree, "Tree cannot be null");
        JsonNode modified = tree.deepCopy();
        List<ValidationFailure> failures = new ArrayList<>();
        List<ObjectNode> flowcharts = new ArrayList<>();
        
        discover(modified, ROOT, false, flowcharts, failures);
        
        List<FlowchartScope> scopes = new ArrayList<>();
        for (ObjectNode flowchart : flowcharts) {
            FlowchartScope scope = new FlowchartScope(flowchart);
            scope.validate(failures);
            scopes.add(scope);
        }
        
        List<FlowchartLayout> layouts = new ArrayList<>();
        for (FlowchartScope scope : scopes) {
            layouts.add(scope.layout);
        }
        
        if (failures.isEmpty()) {
            for (FlowchartScope scope : scopes) {
                layoutEngine.annotate(scope.flowchart, scope.layout);
            }
        }
        
        logger.debug("Validated {} flowchart(s): {} failure(s)", flowcharts.size(), failures.size());
        return new FlowchartValidationResult(failures, modified, layouts);
    }
    
    /**
     * Pre-order walk collecting flowcharts and checking where steps and decisions sit.
     */
    private void discover(JsonNode node, String parentType, boolean placed,
                          List<ObjectNode> flowcharts, List<ValidationFailure> failures) {
        if (node.isArray()) {
            for (JsonNode item : node) {
                discover(item, parentType, placed, flowcharts, failures);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        
        String type = node.path(IrFields.TYPE).asText("");
        FlowNodeKind kind = FlowNodeKind.ofType(type);
        if (kind != null && !placed) {
            failures.add(new ValidationFailure(FailureCategory.STRUCTURAL,
                    type + " must be within Flowchart container",
                    type + " found in " + parentType,
                    List.of(node.path(IrFields.REFERENCE_ID).asText("unnamed"))));
        }
        if (IrFields.FLOWCHART.equals(type)) {
            flowcharts.add((ObjectNode) node);
        }
        
        String childParent = type.isEmpty() ? parentType : type;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            boolean member = IrFields.FLOWCHART.equals(type) && IrFields.NODES.equals(field.getKey());
            boolean successor = kind != null && kind.getSuccessorFields().contains(field.getKey());
            discover(field.getValue(), childParent, member || successor, flowcharts, failures);
        }
    }
    
    /**
     * Traversal state for one flowchart.
     */
    private final class FlowchartScope {
        
        private final ObjectNode flowchart;
        private final List<JsonNode> members;
        private final List<String> ids = new ArrayList<>();
        private final Set<String> allIds = new LinkedHashSet<>();
        private final FlowchartGraph graph = new FlowchartGraph();
        private FlowchartLayout layout;
        
        FlowchartScope(ObjectNode flowchart) {
            this.flowchart = flowchart;
            idAssigner.assign(flowchart);
            this.members = FlowchartLayoutEngine.members(flowchart);
            for (JsonNode member : members) {
                String id = member.path(IrFields.REFERENCE_ID).asText("");
                ids.add(id);
                allIds.add(id);
            }
        }
        
        void validate(List<ValidationFailure> failures) {
            String start = checkStart(failures);
            checkReferenceIds(failures);
            checkDangling(failures);
            
            for (int i = 0; i < members.size(); i++) {
                List<String> targets = new ArrayList<>();
                collectTargets(members.get(i), targets);
                if (!graph.containsNode(ids.get(i))) {
                    graph.addNode(ids.get(i), targets);
                }
            }
            
            for (List<String> cycle : graph.findCycles()) {
                failures.add(new ValidationFailure(FailureCategory.CIRCULAR,
                        "Flowchart must not contain circular references",
                        "Circular path detected: " + String.join(ARROW, cycle),
                        cycle.subList(0, cycle.size() - 1)));
            }
            
            if (start != null) {
                List<String> orphans = graph.unreachableFrom(start);
                if (!orphans.isEmpty()) {
                    failures.add(new ValidationFailure(FailureCategory.REACHABILITY,
                            "All nodes must be reachable from StartNode",
                            orphans.size() + " orphaned node(s)",
                            orphans));
                }
            }
            
            layout = layoutEngine.layout(flowchart);
        }
        
        /**
         * @return the start reference when it resolves to a member, otherwise {@code null}
         */
        private String checkStart(List<ValidationFailure> failures) {
            JsonNode startNode = flowchart.get(IrFields.START_NODE);
            String start = startNode != null && startNode.isTextual() ? startNode.asText() : "";
            
            if (start.isEmpty()) {
                failures.add(new ValidationFailure(FailureCategory.STRUCTURAL,
                        "Flowchart must have startNode property",
                        "startNode is missing or null",
                        List.of(flowchart.path(IrFields.DISPLAY_NAME).asText("Flowchart"))));
                return null;
            }
            
            int index = ids.indexOf(start);
            if (index < 0) {
                failures.add(new ValidationFailure(FailureCategory.STRUCTURAL,
                        "StartNode must reference a valid node",
                        "startNode '" + start + "' does not match any node reference ID",
                        List.of(start)));
                return null;
            }
            
            String startType = members.get(index).path(IrFields.TYPE).asText("");
            if (!IrFields.FLOW_STEP.equals(startType)) {
                failures.add(new ValidationFailure(FailureCategory.STRUCTURAL,
                        "StartNode must reference a FlowStep",
                        "startNode '" + start + "' references a " + startType + ", not a FlowStep",
                        List.of(start)));
            }
            return start;
        }
        
        private void checkReferenceIds(List<ValidationFailure> failures) {
            Set<String> seen = new HashSet<>();
            for (String id : ids) {
                if (!seen.add(id)) {
                    failures.add(new ValidationFailure(FailureCategory.REFERENCE,
                            "Reference IDs must be unique",
                            "Duplicate reference ID: " + id,
                            List.of(id)));
                }
            }
            for (String id : ids) {
                if (!ReferenceIdAssigner.REFERENCE_ID.matcher(id).matches()) {
                    failures.add(new ValidationFailure(FailureCategory.REFERENCE,
                            "Reference ID must match pattern __ReferenceID\\d+",
                            "Invalid reference ID format: " + id,
                            List.of(id)));
                }
            }
        }
        
        private void checkDangling(List<ValidationFailure> failures) {
            for (int i = 0; i < members.size(); i++) {
                checkSuccessors(members.get(i), ids.get(i), failures);
            }
        }
        
        private void checkSuccessors(JsonNode node, String ownerId, List<ValidationFailure> failures) {
            FlowNodeKind kind = FlowNodeKind.of(node);
            if (kind == null) {
                return;
            }
            for (String field : kind.getSuccessorFields()) {
                JsonNode successor = node.get(field);
                if (successor == null || successor.isNull()) {
                    continue;
                }
                if (successor.isTextual() && !allIds.contains(successor.asText())) {
                    failures.add(new ValidationFailure(FailureCategory.REFERENCE,
                            capitalize(field) + " reference must point to existing node",
                            "Reference " + successor.asText() + " not found",
                            List.of(ownerId)));
                }
            }
        }
        
        private void collectTargets(JsonNode node, List<String> targets) {
            FlowNodeKind kind = FlowNodeKind.of(node);
            if (kind == null) {
                return;
            }
            for (String field : kind.getSuccessorFields()) {
                JsonNode successor = node.get(field);
                if (successor == null) {
                    continue;
                }
                if (successor.isTextual() && allIds.contains(successor.asText())) {
                    targets.add(successor.asText());
                }
            }
        }
    }
    
    private static String capitalize(String field) {
        return Character.toUpperCase(field.charAt(0)) + field.substring(1);
    }
}
