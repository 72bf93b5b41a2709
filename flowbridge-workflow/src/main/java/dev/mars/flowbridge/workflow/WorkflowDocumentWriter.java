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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowbridge.config.FlowBridgeConfiguration;
import dev.mars.flowbridge.core.exceptions.FlowBridgeException;
import dev.mars.flowbridge.diagnostics.ResolutionDiagnostics;
import dev.mars.flowbridge.ir.IrDocument;
import dev.mars.flowbridge.namespace.NamespaceResolution;
import dev.mars.flowbridge.namespace.NamespaceResolver;
import dev.mars.flowbridge.namespace.ResolutionContext;
import dev.mars.flowbridge.workflow.correction.CorrectionReport;
import dev.mars.flowbridge.workflow.correction.WorkflowAutoCorrector;
import dev.mars.flowbridge.workflow.flowchart.FlowchartValidationResult;
import dev.mars.flowbridge.workflow.flowchart.FlowchartValidator;
import dev.mars.flowbridge.workflow.flowchart.RemediationAdvisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Write path from an IR document to a target document.
 * <p>
 * Preparation runs these steps in order on an owned copy of the workflow tree:
 * <ol>
 *   <li>auto-correction of expressions and type names</li>
 *   <li>namespace, import and assembly resolution over the corrected tree</li>
 *   <li>flowchart validation, reference-ID assignment and layout</li>
 * </ol>
 * The translator is only invoked when every flowchart is valid.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class WorkflowDocumentWriter {
    
    private static final Logger logger = LoggerFactory.getLogger(WorkflowDocumentWriter.class);
    
    private final FlowBridgeConfiguration config;
    private final NamespaceResolver namespaceResolver;
    private final FlowchartValidator flowchartValidator;
    private final WorkflowAutoCorrector autoCorrector;
    private final RemediationAdvisor remediationAdvisor;
    
    public WorkflowDocumentWriter() {
        this(FlowBridgeConfiguration.defaults());
    }
    
    public WorkflowDocumentWriter(FlowBridgeConfiguration config) {
        this(config, new NamespaceResolver(), new FlowchartValidator(config),
                new WorkflowAutoCorrector(), new RemediationAdvisor());
    }
    
    public WorkflowDocumentWriter(FlowBridgeConfiguration config, NamespaceResolver namespaceResolver,
                                  FlowchartValidator flowchartValidator, WorkflowAutoCorrector autoCorrector,
                                  RemediationAdvisor remediationAdvisor) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.namespaceResolver = Objects.requireNonNull(namespaceResolver, "Namespace resolver cannot be null");
        this.flowchartValidator = Objects.requireNonNull(flowchartValidator, "Flowchart validator cannot be null");
        this.autoCorrector = Objects.requireNonNull(autoCorrector, "Auto-corrector cannot be null");
        this.remediationAdvisor = Objects.requireNonNull(remediationAdvisor, "Remediation advisor cannot be null");
    }
    
    /**
     * Corrects, resolves and validates a document without translating it.
     * The document itself is never modified.
     *
     * @param document the IR document to prepare
     * @return the prepared workflow, which may be invalid
     */
    public PreparedWorkflow prepare(IrDocument document) {
        Objects.requireNonNull(document, "Document cannot be null");
        
        ObjectNode workflow = document.getWorkflow().deepCopy();
        CorrectionReport corrections = null;
        
        if (config.isAutoCorrectionEnabled()) {
            try {
                WorkflowAutoCorrector.Corrected corrected = autoCorrector.correct(workflow);
                workflow = corrected.getWorkflow();
                corrections = corrected.getReport();
                logger.info("Auto-corrections: {} expressions wrapped, {} types normalized",
                        corrections.getWrappedExpressionCount(), corrections.getNormalizedTypeCount());
            } catch (RuntimeException e) {
                logger.warn("Auto-correction failed, continuing with uncorrected workflow: {}", e.getMessage(), e);
            }
        } else {
            logger.debug("Auto-correction disabled");
        }
        
        ResolutionContext context = ResolutionContext.empty();
        NamespaceResolution namespaces = namespaceResolver.resolve(workflow, document.getMetadata(), context);
        logger.info("Namespace resolution: {}", namespaces.summary());
        
        FlowchartValidationResult validation = flowchartValidator.validate(workflow);
        JsonNode validated = validation.getModifiedTree();
        ObjectNode prepared = validated instanceof ObjectNode ? (ObjectNode) validated : workflow;
        
        PreparedWorkflow result = new PreparedWorkflow(document.getMetadata(), prepared, namespaces,
                validation, corrections, context);
        logDiagnostics(result.getDiagnostics());
        return result;
    }
    
    /**
     * Prepares a document and hands it to the translator.
     *
     * @param document the IR document to write
     * @param translator renders the prepared workflow
     * @return whatever the translator produced
     * @throws FlowchartValidationException if any flowchart is invalid; the translator is not called
     * @throws FlowBridgeException if the translator fails
     */
    public <T> T write(IrDocument document, NodeTranslator<T> translator) throws FlowBridgeException {
        Objects.requireNonNull(translator, "Translator cannot be null");
        
        PreparedWorkflow prepared = prepare(document);
        FlowchartValidationResult validation = prepared.getValidation();
        
        if (!validation.isValid()) {
            RemediationAdvisor.Remediation remediation =
                    remediationAdvisor.advise(validation.getFailures()).orElse(null);
            logger.error("Refusing to write '{}': {} flowchart failure(s)",
                    document.getMetadata().getClassName(), validation.getFailures().size());
            throw new FlowchartValidationException(validation, remediation);
        }
        
        logger.debug("Translating {}", prepared);
        return translator.translate(prepared);
    }
    
    private void logDiagnostics(ResolutionDiagnostics diagnostics) {
        for (ResolutionDiagnostics.Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            logger.warn("{}", diagnostic);
        }
    }
}
