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

/**
 * A single rule violation found in a flowchart.
 */
public final class ValidationFailure {
    
    private final FailureCategory category;
    private final String rule;
    private final String details;
    private final List<String> affectedNodes;
    
    public ValidationFailure(FailureCategory category, String rule, String details, List<String> affectedNodes) {
        this.category = Objects.requireNonNull(category, "Category cannot be null");
        this.rule = Objects.requireNonNull(rule, "Rule cannot be null");
        this.details = details;
        this.affectedNodes = List.copyOf(affectedNodes != null ? affectedNodes : List.of());
    }
    
    public FailureCategory getCategory() {
        return category;
    }
    
    public String getRule() {
        return rule;
    }
    
    public String getDetails() {
        return details;
    }
    
    /**
     * Reference IDs, or display names where a node has none.
     */
    public List<String> getAffectedNodes() {
        return affectedNodes;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationFailure that = (ValidationFailure) o;
        return category == that.category &&
               rule.equals(that.rule) &&
               Objects.equals(details, that.details) &&
               affectedNodes.equals(that.affectedNodes);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(category, rule, details, affectedNodes);
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(category.getLabel()).append(": ").append(rule);
        if (details != null) {
            sb.append(" (").append(details).append(")");
        }
        if (!affectedNodes.isEmpty()) {
            sb.append(" ").append(affectedNodes);
        }
        return sb.toString();
    }
}
