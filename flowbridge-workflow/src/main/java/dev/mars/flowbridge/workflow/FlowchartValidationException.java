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

import dev.mars.flowbridge.core.exceptions.FlowBridgeException;
import dev.mars.flowbridge.workflow.flowchart.FlowchartValidationResult;
import dev.mars.flowbridge.workflow.flowchart.RemediationAdvisor;
import dev.mars.flowbridge.workflow.flowchart.ValidationFailure;

/**
 * Thrown when a workflow cannot be written because one of its flowcharts is invalid.
 * Carries the full validation result and the suggested fix.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class FlowchartValidationException extends FlowBridgeException {
    
    private final FlowchartValidationResult result;
    private final RemediationAdvisor.Remediation remediation;
    
    public FlowchartValidationException(FlowchartValidationResult result,
                                        RemediationAdvisor.Remediation remediation) {
        super(buildMessage(result, remediation));
        this.result = result;
        this.remediation = remediation;
    }
    
    public FlowchartValidationResult getResult() {
        return result;
    }
    
    /**
     * The fix for the dominant failure category, or {@code null} if none applies.
     */
    public RemediationAdvisor.Remediation getRemediation() {
        return remediation;
    }
    
    private static String buildMessage(FlowchartValidationResult result,
                                       RemediationAdvisor.Remediation remediation) {
        StringBuilder sb = new StringBuilder("Flowchart validation failed with ");
        sb.append(result.getFailures().size()).append(" failure(s)");
        for (ValidationFailure failure : result.getFailures()) {
            sb.append("\n  - ").append(failure);
        }
        if (remediation != null) {
            sb.append("\nFix: ").append(remediation.getFix());
        }
        return sb.toString();
    }
}
