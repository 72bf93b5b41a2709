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

/**
 * Category of a flowchart validation failure.
 */
public enum FailureCategory {
    
    /** Misplaced nodes and start-node problems. */
    STRUCTURAL("structural"),
    /** Malformed, duplicate or dangling reference IDs. */
    REFERENCE("reference"),
    CIRCULAR("circular"),
    /** Nodes the start node cannot reach. */
    REACHABILITY("reachability");
    
    private final String label;
    
    FailureCategory(String label) {
        this.label = label;
    }
    
    public String getLabel() {
        return label;
    }
    
    @Override
    public String toString() {
        return label;
    }
}
