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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes deterministic designer geometry for a flowchart whose members already carry
 * their final reference IDs.
 * <p>
 * Members are stacked in document order, one row each. Steps and decisions have fixed
 * columns and sizes; a step connects its bottom centre to its successor's top centre, a
 * decision routes its true branch through a lane on the left and its false branch through a
 * lane on the right. The output depends only on member order and kind.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class FlowchartLayoutEngine {
    
    private final FlowBridgeConfiguration config;
    
    public FlowchartLayoutEngine(FlowBridgeConfiguration config) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
    }
    
    /**
     * Lays out a flowchart without modifying it.
     *
     * @param flowchart the flowchart node
     * @return anchor and per-member view states
     */
    public FlowchartLayout layout(JsonNode flowchart) {
        List<JsonNode> members = members(flowchart);
        
        Map<String, Box> boxes = new HashMap<>();
        for (int index = 0; index < members.size(); index++) {
            JsonNode member = members.get(index);
            Box box = boxFor(FlowNodeKind.of(member), index);
            String id = member.path(IrFields.REFERENCE_ID).asText(null);
            if (box != null && id != null && !boxes.containsKey(id)) {
                boxes.put(id, box);
            }
        }
        
        ViewState anchor = new ViewState()
                .put(ViewState.SHAPE_LOCATION, config.getAnchorX() + "," + config.getAnchorY())
                .put(ViewState.SHAPE_SIZE, config.getAnchorSize() + "," + config.getAnchorSize());
        Box start = boxes.get(textOf(flowchart.get(IrFields.START_NODE)));
        if (start != null) {
            int anchorBottomX = config.getAnchorX() + config.getAnchorSize() / 2;
            int anchorBottomY = config.getAnchorY() + config.getAnchorSize();
            anchor.put(ViewState.CONNECTOR_LOCATION,
                    anchorBottomX + "," + anchorBottomY + " " + start.centreX() + "," + start.y);
        }
        
        Map<String, ViewState> states = new LinkedHashMap<>();
        for (int index = 0; index < members.size(); index++) {
            JsonNode member = members.get(index);
            FlowNodeKind kind = FlowNodeKind.of(member);
            Box box = boxFor(kind, index);
            String id = member.path(IrFields.REFERENCE_ID).asText(null);
            if (box == null || id == null || states.containsKey(id)) {
                continue;
            }
            
            ViewState state = new ViewState()
                    .put(ViewState.SHAPE_LOCATION, box.x + "," + box.y)
                    .put(ViewState.SHAPE_SIZE, box.width + "," + box.height);
            
            if (kind == FlowNodeKind.STEP) {
                Box next = boxes.get(textOf(member.get(IrFields.NEXT)));
                if (next != null) {
                    state.put(ViewState.CONNECTOR_LOCATION, box.centreX() + "," + (box.y + box.height)
                            + " " + next.centreX() + "," + next.y);
                }
            } else {
                int centreY = box.y + box.height / 2;
                Box whenTrue = boxes.get(textOf(member.get(IrFields.TRUE_BRANCH)));
                if (whenTrue != null) {
                    int lane = config.getTrueLaneX();
                    state.put(ViewState.TRUE_CONNECTOR, box.x + "," + centreY + " "
                            + lane + "," + centreY + " " + lane + "," + whenTrue.y);
                }
                Box whenFalse = boxes.get(textOf(member.get(IrFields.FALSE_BRANCH)));
                if (whenFalse != null) {
                    int lane = config.getFalseLaneX();
                    state.put(ViewState.FALSE_CONNECTOR, (box.x + box.width) + "," + centreY + " "
                            + lane + "," + centreY + " " + lane + "," + whenFalse.y);
                }
            }
            states.put(id, state);
        }
        
        return new FlowchartLayout(anchor, states);
    }
    
    /**
     * Writes a layout onto the flowchart and its members as {@code viewState} objects.
     */
    public void annotate(ObjectNode flowchart, FlowchartLayout layout) {
        flowchart.set(IrFields.VIEW_STATE, layout.getAnchor().toObjectNode());
        for (JsonNode member : members(flowchart)) {
            ViewState state = layout.getNodeState(member.path(IrFields.REFERENCE_ID).asText(null));
            if (state != null) {
                ((ObjectNode) member).set(IrFields.VIEW_STATE, state.toObjectNode());
            }
        }
    }
    
    static List<JsonNode> members(JsonNode flowchart) {
        List<JsonNode> members = new ArrayList<>();
        JsonNode nodes = flowchart.path(IrFields.NODES);
        if (nodes.isArray()) {
            for (JsonNode node : nodes) {
                if (node.isObject()) {
                    members.add(node);
                }
            }
        }
        return members;
    }
    
    private Box boxFor(FlowNodeKind kind, int index) {
        if (kind == null) {
            return null;
        }
        int y = config.getRowOriginY() + index * config.getRowSpacing();
        if (kind == FlowNodeKind.STEP) {
            return new Box(config.getStepX(), y, config.getStepWidth(), config.getStepHeight());
        }
        return new Box(config.getDecisionX(), y, config.getDecisionWidth(), config.getDecisionHeight());
    }
    
    private static String textOf(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
    
    private static final class Box {
        final int x;
        final int y;
        final int width;
        final int height;
        
        Box(int x, int y, int width, int height) {
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
        }
        
        int centreX() {
            return x + width / 2;
        }
    }
}
