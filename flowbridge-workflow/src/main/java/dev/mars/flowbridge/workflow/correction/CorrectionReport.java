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

import dev.mars.flowbridge.diagnostics.ResolutionDiagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Record of what an auto-correction pass changed and which types it saw.
 */
public class CorrectionReport {
    
    public enum CorrectionType {
        /** Expression text wrapped in brackets. */
        EXPRESSION_WRAP,
        /** Non-literal wrapped because its field is not string-typed. */
        SAFETY_NET_WRAP,
        /** Fully-qualified type name rewritten to prefixed form. */
        TYPE_NORMALIZE
    }
    
    private final List<Correction> corrections = new ArrayList<>();
    private final Set<String> usedTypes = new TreeSet<>();
    private final Set<String> usedPrefixes = new TreeSet<>();
    private final ResolutionDiagnostics diagnostics = new ResolutionDiagnostics();
    
    void addCorrection(CorrectionType type, String before, String after, String typeHint) {
        corrections.add(new Correction(type, before, after, typeHint));
    }
    
    void recordType(String type) {
        usedTypes.add(type);
        int colon = type.indexOf(':');
        if (colon > 0) {
            usedPrefixes.add(type.substring(0, colon));
        }
    }
    
    public List<Correction> getCorrections() {
        return Collections.unmodifiableList(corrections);
    }
    
    public int count(CorrectionType type) {
        return (int) corrections.stream().filter(c -> c.getType() == type).count();
    }
    
    public int getWrappedExpressionCount() {
        return count(CorrectionType.EXPRESSION_WRAP) + count(CorrectionType.SAFETY_NET_WRAP);
    }
    
    public int getNormalizedTypeCount() {
        return count(CorrectionType.TYPE_NORMALIZE);
    }
    
    public boolean hasCorrections() {
        return !corrections.isEmpty();
    }
    
    public Set<String> getUsedTypes() {
        return Collections.unmodifiableSet(usedTypes);
    }
    
    public Set<String> getUsedPrefixes() {
        return Collections.unmodifiableSet(usedPrefixes);
    }
    
    /**
     * Type normalization gaps found during the pass.
     */
    public ResolutionDiagnostics getDiagnostics() {
        return diagnostics;
    }
    
    @Override
    public String toString() {
        return "CorrectionReport{wrapped=" + getWrappedExpressionCount()
                + ", normalized=" + getNormalizedTypeCount()
                + ", warnings=" + diagnostics.getCount() + "}";
    }
    
    public static final class Correction {
        
        private final CorrectionType type;
        private final String before;
        private final String after;
        private final String typeHint;
        
        public Correction(CorrectionType type, String before, String after, String typeHint) {
            this.type = Objects.requireNonNull(type, "Type cannot be null");
            this.before = before;
            this.after = after;
            this.typeHint = typeHint;
        }
        
        public CorrectionType getType() {
            return type;
        }
        
        public String getBefore() {
            return before;
        }
        
        public String getAfter() {
            return after;
        }
        
        /**
         * Type of the field that triggered a safety-net wrap, otherwise {@code null}.
         */
        public String getTypeHint() {
            return typeHint;
        }
        
        @Override
        public String toString() {
            return type + ": " + before + " -> " + after;
        }
    }
}
