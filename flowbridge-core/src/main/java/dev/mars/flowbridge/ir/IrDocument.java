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

package dev.mars.flowbridge.ir;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * An IR workflow: metadata plus the root activity tree.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class IrDocument {
    
    private final WorkflowMetadata metadata;
    private final ObjectNode workflow;
    
    public IrDocument(WorkflowMetadata metadata, ObjectNode workflow) {
        this.metadata = metadata != null ? metadata : new WorkflowMetadata();
        this.workflow = Objects.requireNonNull(workflow, "workflow");
    }
    
    public WorkflowMetadata getMetadata() {
        return metadata;
    }
    
    /**
     * Get the root activity tree. Callers that transform it work on a {@code deepCopy()}.
     * 
     * @return the root activity node
     */
    public ObjectNode getWorkflow() {
        return workflow;
    }
    
    @Override
    public String toString() {
        return "IrDocument{metadata=" + metadata + ", root=" + workflow.path(IrFields.TYPE).asText("?") + "}";
    }
}
