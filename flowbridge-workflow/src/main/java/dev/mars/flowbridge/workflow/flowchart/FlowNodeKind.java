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
import dev.mars.flowbridge.ir.IrFields;

import java.util.List;

/**
 * The two flowchart node kinds and the fields that hold their successors.
 */
public enum FlowNodeKind {
    
    STEP(IrFields.FLOW_STEP, List.of(IrFields.NEXT)),
    DECISION(IrFields.FLOW_DECISION, List.of(IrFields.TRUE_BRANCH, IrFields.FALSE_BRANCH));
    
    private final String typeName;
    private final List<String> successorFields;
    
    FlowNodeKind(String typeName, List<String> successorFields) {
        this.typeName = typeName;
        this.successorFields = successorFields;
    }
    
    public String getTypeName() {
        return typeName;
    }
    
    public List<String> getSuccessorFields() {
        return successorFields;
    }
    
    /**
     * Returns the kind of a node, or {@code null} for anything that is not a step or decision.
     */
    public static FlowNodeKind of(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return ofType(node.path(IrFields.TYPE).asText(""));
    }
    
    public static FlowNodeKind ofType(String type) {
        for (FlowNodeKind kind : values()) {
            if (kind.typeName.equals(type)) {
                return kind;
            }
        }
        return null;
    }
}
