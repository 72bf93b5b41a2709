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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns validation failures into one suggested fix.
 * <p>
 * Categories are considered in the order structural, circular, reachability, reference;
 * the first one present decides the advice.
 */
public class RemediationAdvisor {
    
    private static final String ARROW = " → ";
    
    public Optional<Remediation> advise(List<ValidationFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            return Optional.empty();
        }
        
        if (first(failures, FailureCategory.STRUCTURAL) != null) {
            return Optional.of(new Remediation(FailureCategory.STRUCTURAL,
                    "Nest FlowStep/FlowDecision inside Flowchart container",
                    "Flowchart" + ARROW + "nodes: [FlowStep, FlowDecision]"));
        }
        
        ValidationFailure circular = first(failures, FailureCategory.CIRCULAR);
        if (circular != null) {
            return Optional.of(new Remediation(FailureCategory.CIRCULAR,
                    "Break circular path by removing or redirecting one connection",
                    "Review path: " + String.join(ARROW, circular.getAffectedNodes()) + " and set one 'next' to null"));
        }
        
        ValidationFailure orphans = first(failures, FailureCategory.REACHABILITY);
        if (orphans != null) {
            return Optional.of(new Remediation(FailureCategory.REACHABILITY,
                    "Connect orphaned nodes to flowchart or remove them",
                    "Add reference from existing node to: " + String.join(", ", orphans.getAffectedNodes())));
        }
        
        return Optional.of(new Remediation(FailureCategory.REFERENCE,
                "Ensure all reference IDs are unique and properly formatted",
                "Use sequential IDs: __ReferenceID0, __ReferenceID1, etc."));
    }
    
    private static ValidationFailure first(List<ValidationFailure> failures, FailureCategory category) {
        for (ValidationFailure failure : failures) {
            if (failure.getCategory() == category) {
                return failure;
            }
        }
        return null;
    }
    
    /**
     * A fix and a concrete retry suggestion for the deciding category.
     */
    public static final class Remediation {
        
        private final FailureCategory category;
        private final String fix;
        private final String retrySuggestion;
        
        public Remediation(FailureCategory category, String fix, String retrySuggestion) {
            this.category = Objects.requireNonNull(category, "Category cannot be null");
            this.fix = Objects.requireNonNull(fix, "Fix cannot be null");
            this.retrySuggestion = Objects.requireNonNull(retrySuggestion, "Retry suggestion cannot be null");
        }
        
        public FailureCategory getCategory() {
            return category;
        }
        
        public String getFix() {
            return fix;
        }
        
        public String getRetrySuggestion() {
            return retrySuggestion;
        }
        
        @Override
        public String toString() {
            return fix + " (" + retrySuggestion + ")";
        }
    }
}
