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

package dev.mars.flowbridge.workflow.correction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowbridge.ir.IrFields;
import dev.mars.flowbridge.types.TypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Pre-write pass that repairs common authoring mistakes in an IR workflow tree.
 * <p>
 * Two repairs are applied:
 * <ul>
 *   <li>expression values that are not bracket-wrapped get wrapped, including bare
 *       identifiers in fields whose type is not {@code x:String}</li>
 *   <li>fully-qualified type names are rewritten to prefixed form</li>
 * </ul>
 * The input tree is never modified; corrections are applied to a deep copy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class WorkflowAutoCorrector {
    
    private static final Logger logger = LoggerFactory.getLogger(WorkflowAutoCorrector.class);
    
    private static final String STRING_TYPE = "x:String";
    private static final String TYPE_ARGUMENTS = "x:TypeArguments";
    
    private static final List<String> EXPRESSION_KEYS = List.of("value", "condition", "expression", "to");
    
    private static final List<String> TYPE_KEYS = List.of(
            "type", TYPE_ARGUMENTS, "variableType", "argumentType",
            "exceptionType", "typeArguments", "typeArgument");
    
    private static final List<String> ACTIVITY_KEYS = List.of(
            "activity", "next", IrFields.TRUE_BRANCH, IrFields.FALSE_BRANCH,
            "then", "else", "try", "finally", "activityBody");
    
    /**
     * Result of a correction pass.
     */
    public static class Corrected {
        
        private final ObjectNode workflow;
        private final CorrectionReport report;
        
        Corrected(ObjectNode workflow, CorrectionReport report) {
            this.workflow = workflow;
            this.report = report;
        }
        
        public ObjectNode getWorkflow() {
            return workflow;
        }
        
        public CorrectionReport getReport() {
            return report;
        }
    }
    
    /**
     * Corrects a copy of the workflow tree.
     *
     * @param workflow the workflow root, left unmodified
     * @return the corrected copy and what was changed
     */
    public Corrected correct(ObjectNode workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        
        ObjectNode copy = workflow.deepCopy();
        CorrectionReport report = new CorrectionReport();
        correctActivity(copy, report);
        
        logger.debug("Auto-correction complete: {}", report);
        return new Corrected(copy, report);
    }
    
    private void correctActivity(JsonNode node, CorrectionReport report) {
        if (!(node instanceof ObjectNode)) {
            return;
        }
        ObjectNode activity = (ObjectNode) node;
        
        String activityHint = textOr(activity.get(TYPE_ARGUMENTS), STRING_TYPE);
        for (String key : EXPRESSION_KEYS) {
            JsonNode value = activity.get(key);
            if (value == null) {
                continue;
            }
            if (value.isTextual()) {
                activity.put(key, correctExpression(value.asText(), activityHint, report));
            } else if (value instanceof ObjectNode && value.has("value")) {
                ObjectNode wrapper = (ObjectNode) value;
                JsonNode inner = wrapper.get("value");
                if (inner.isTextual()) {
                    String hint = textOr(wrapper.get("type"), STRING_TYPE);
                    wrapper.put("value", correctExpression(inner.asText(), hint, report));
                }
            }
        }
        
        for (String key : TYPE_KEYS) {
            correctTypeField(activity, key, report);
        }
        
        for (JsonNode variable : arrayOf(activity, IrFields.VARIABLES)) {
            if (variable instanceof ObjectNode) {
                correctVariable((ObjectNode) variable, report);
            }
        }
        
        for (JsonNode child : arrayOf(activity, "children")) {
            correctActivity(child, report);
        }
        for (JsonNode child : arrayOf(activity, IrFields.NODES)) {
            correctActivity(child, report);
        }
        for (String key : ACTIVITY_KEYS) {
            correctActivity(activity.get(key), report);
        }
        
        for (JsonNode catchBlock : arrayOf(activity, "catches")) {
            if (catchBlock instanceof ObjectNode) {
                correctTypeField((ObjectNode) catchBlock, "exceptionType", report);
                correctActivity(catchBlock.get("handler"), report);
            }
        }
        
        JsonNode condition = activity.get("condition");
        if (condition != null && condition.isObject()) {
            correctActivity(condition.get("activity"), report);
        }
        
        JsonNode body = activity.get("body");
        if (body != null && body.isObject()) {
            if (body.has("activity")) {
                correctActivity(body.get("activity"), report);
            } else {
                correctActivity(body, report);
            }
        }
        
        for (JsonNode switchCase : arrayOf(activity, "cases")) {
            if (switchCase.isObject()) {
                correctActivity(switchCase.get("activity"), report);
            }
        }
        correctActivity(activity.get(IrFields.DEFAULT), report);
        correctActivity(activity.get("ifExists"), report);
        correctActivity(activity.get("ifNotExists"), report);
        
        for (JsonNode argument : arrayOf(activity, IrFields.ARGUMENTS)) {
            if (argument instanceof ObjectNode) {
                correctArgument((ObjectNode) argument, report);
            }
        }
    }
    
    private void correctVariable(ObjectNode variable, CorrectionReport report) {
        correctTypeField(variable, "type", report);
        
        JsonNode defaultValue = variable.get(IrFields.DEFAULT);
        if (defaultValue != null && defaultValue.isTextual()) {
            String hint = TypeResolver.toTypeReference(textOr(variable.get("type"), "String"));
            variable.put(IrFields.DEFAULT, correctExpression(defaultValue.asText(), hint, report));
        }
    }
    
    // Code-invocation arguments carry x:TypeArguments; workflow-invocation arguments carry an IR type.
    private void correctArgument(ObjectNode argument, CorrectionReport report) {
        String hint;
        if (argument.has(TYPE_ARGUMENTS)) {
            hint = textOr(argument.get(TYPE_ARGUMENTS), STRING_TYPE);
        } else {
            hint = TypeResolver.toTypeReference(textOr(argument.get("type"), "String"));
        }
        
        JsonNode value = argument.get("value");
        if (value != null && value.isTextual()) {
            argument.put("value", correctExpression(value.asText(), hint, report));
        }
        
        correctTypeField(argument, TYPE_ARGUMENTS, report);
        correctTypeField(argument, "type", report);
    }
    
    String correctExpression(String value, String typeHint, CorrectionReport report) {
        if (value == null || value.isEmpty() || ExpressionClassifier.isWrapped(value)) {
            return value;
        }
        if (ExpressionClassifier.isExpression(value)) {
            String wrapped = ExpressionClassifier.wrap(value);
            report.addCorrection(CorrectionReport.CorrectionType.EXPRESSION_WRAP, value, wrapped, null);
            return wrapped;
        }
        if (typeHint != null && !typeHint.isEmpty() && !STRING_TYPE.equals(typeHint)
                && !ExpressionClassifier.isLiteral(value)) {
            String wrapped = ExpressionClassifier.wrap(value);
            report.addCorrection(CorrectionReport.CorrectionType.SAFETY_NET_WRAP, value, wrapped, typeHint);
            return wrapped;
        }
        return value;
    }
    
    String correctTypeReference(String type, CorrectionReport report) {
        if (type == null || type.isEmpty()) {
            return type;
        }
        String normalized = TypeResolver.normalizeTypeReference(type, report.getDiagnostics());
        if (!normalized.equals(type)) {
            report.addCorrection(CorrectionReport.CorrectionType.TYPE_NORMALIZE, type, normalized, null);
        }
        report.recordType(normalized);
        return normalized;
    }
    
    private void correctTypeField(ObjectNode node, String key, CorrectionReport report) {
        JsonNode value = node.get(key);
        if (value != null && value.isTextual()) {
            node.put(key, correctTypeReference(value.asText(), report));
        }
    }
    
    private static Iterable<JsonNode> arrayOf(ObjectNode node, String key) {
        JsonNode value = node.get(key);
        if (value instanceof ArrayNode) {
            return value;
        }
        return List.of();
    }
    
    private static String textOr(JsonNode node, String fallback) {
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            return fallback;
        }
        return node.asText();
    }
}
