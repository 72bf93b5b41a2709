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

package dev.mars.flowbridge.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowbridge.diagnostics.ResolutionDiagnostics;
import dev.mars.flowbridge.ir.WorkflowMetadata;
import dev.mars.flowbridge.namespace.NamespaceResolution;
import dev.mars.flowbridge.namespace.ResolutionContext;
import dev.mars.flowbridge.workflow.correction.CorrectionReport;
import dev.mars.flowbridge.workflow.flowchart.FlowchartValidationResult;

import java.util.Objects;

/**
 * A workflow that has been corrected, resolved and validated, ready for translation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class PreparedWorkflow {
    
    private final WorkflowMetadata metadata;
    private final ObjectNode workflow;
    private final NamespaceResolution namespaces;
    private final FlowchartValidationResult validation;
    private final CorrectionReport corrections;
    private final ResolutionContext context;
    
    public PreparedWorkflow(WorkflowMetadata metadata, ObjectNode workflow, NamespaceResolution namespaces,
                            FlowchartValidationResult validation, CorrectionReport corrections,
                            ResolutionContext context) {
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        this.namespaces = Objects.requireNonNull(namespaces, "Namespaces cannot be null");
        this.validation = Objects.requireNonNull(validation, "Validation cannot be null");
        this.corrections = corrections;
        this.context = Objects.requireNonNull(context, "Context cannot be null");
    }
    
    public WorkflowMetadata getMetadata() {
        return metadata;
    }
    
    /**
     * The workflow tree after correction, with reference IDs and layout applied to every
     * valid flowchart.
     */
    public ObjectNode getWorkflow() {
        return workflow;
    }
    
    public NamespaceResolution getNamespaces() {
        return namespaces;
    }
    
    public FlowchartValidationResult getValidation() {
        return validation;
    }
    
    /**
     * What auto-correction changed, or {@code null} when correction was disabled or failed.
     */
    public CorrectionReport getCorrections() {
        return corrections;
    }
    
    public ResolutionContext getContext() {
        return context;
    }
    
    public boolean isValid() {
        return validation.isValid();
    }
    
    /**
     * All resolution findings, from both namespace resolution and type normalization.
     */
    public ResolutionDiagnostics getDiagnostics() {
        ResolutionDiagnostics all = new ResolutionDiagnostics();
        all.addAll(context.getDiagnostics());
        if (corrections != null) {
            all.addAll(corrections.getDiagnostics());
        }
        return all;
    }
    
    @Override
    public String toString() {
        return "PreparedWorkflow{class='" + metadata.getClassName() + "'"
                + ", valid=" + validation.isValid()
                + ", flowcharts=" + validation.getFlowchartCount()
                + ", " + namespaces.summary() + "}";
    }
}
