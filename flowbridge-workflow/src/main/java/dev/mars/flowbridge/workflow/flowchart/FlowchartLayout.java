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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Synthesized layout of one flowchart: the container's start anchor plus one view state
 * per positioned member, keyed by reference ID in document order.
 */
public final class FlowchartLayout {
    
    private final ViewState anchor;
    private final Map<String, ViewState> nodeStates;
    
    FlowchartLayout(ViewState anchor, Map<String, ViewState> nodeStates) {
        this.anchor = anchor;
        this.nodeStates = Collections.unmodifiableMap(new LinkedHashMap<>(nodeStates));
    }
    
    public ViewState getAnchor() {
        return anchor;
    }
    
    public Map<String, ViewState> getNodeStates() {
        return nodeStates;
    }
    
    public ViewState getNodeState(String referenceId) {
        return nodeStates.get(referenceId);
    }
    
    @Override
    public String toString() {
        return "FlowchartLayout{anchor=" + anchor + ", nodes=" + nodeStates.keySet() + "}";
    }
}
