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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating every flowchart in an IR tree.
 * <p>
 * The modified tree always carries the reassigned reference IDs; it carries
 * {@code viewState} annotations only when the result is valid. Layouts are returned either
 * way, one per flowchart in document pre-order.
 */
public class FlowchartValidationResult {
    
    private final List<ValidationFailure> failures;
    private final JsonNode modifiedTree;
    private final List<FlowchartLayout> layouts;
    
    public FlowchartValidationResult(List<ValidationFailure> failures, JsonNode modifiedTree,
                                     List<FlowchartLayout> layouts) {
        this.failures = List.copyOf(failures != null ? failures : List.of());
        this.modifiedTree = modifiedTree;
        this.layouts = List.copyOf(layouts != null ? layouts : List.of());
    }
    
    public boolean isValid() {
        return failures.isEmpty();
    }
    
    public List<ValidationFailure> getFailures() {
        return failures;
    }
    
    public List<ValidationFailure> getFailures(FailureCategory category) {
        return failures.stream()
                .filter(failure -> failure.getCategory() == category)
                .collect(Collectors.toList());
    }
    
    public boolean hasFailures(FailureCategory category) {
        return failures.stream().anyMatch(failure -> failure.getCategory() == category);
    }
    
    public JsonNode getModifiedTree() {
        return modifiedTree;
    }
    
    public List<FlowchartLayout> getLayouts() {
        return layouts;
    }
    
    public int getFlowchartCount() {
        return layouts.size();
    }
    
    @Override
    public String toString() {
        return "FlowchartValidationResult{" +
               "valid=" + isValid() +
               ", flowcharts=" + layouts.size() +
               ", failures=" + failures.size() +
               '}';
    }
}
