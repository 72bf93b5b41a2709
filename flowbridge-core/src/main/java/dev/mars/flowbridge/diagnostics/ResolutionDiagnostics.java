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

package dev.mars.flowbridge.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates the non-fatal findings of type and namespace resolution.
 * Resolution never fails; every fallback it takes is recorded here instead.
 */
public class ResolutionDiagnostics {
    
    private final List<Diagnostic> diagnostics;
    
    public ResolutionDiagnostics() {
        this.diagnostics = new ArrayList<>();
    }
    
    public void add(Kind kind, String subject, String message) {
        diagnostics.add(new Diagnostic(kind, subject, message));
    }
    
    public void addAll(ResolutionDiagnostics other) {
        if (other != null) {
            diagnostics.addAll(other.diagnostics);
        }
    }
    
    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }
    
    public List<Diagnostic> getDiagnostics(Kind kind) {
        return diagnostics.stream()
                .filter(d -> d.getKind() == kind)
                .toList();
    }
    
    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
    
    public int getCount() {
        return diagnostics.size();
    }
    
    @Override
    public String toString() {
        return "ResolutionDiagnostics{count=" + diagnostics.size() + "}";
    }
    
    public enum Kind {
        /** Fully-qualified type whose namespace maps to more than one prefix. */
        AMBIGUOUS_TYPE,
        /** Fully-qualified type whose namespace maps to no prefix. */
        UNMAPPED_TYPE,
        /** Prefix with no registry URI and no custom binding. */
        UNKNOWN_PREFIX,
        /** Carried-over metadata entries that were blank and dropped. */
        BLANK_METADATA,
        /** Baseline imports seeded because metadata carried none. */
        BASELINE_IMPORTS,
        /** Default assembly list used because nothing else resolved. */
        DEFAULT_ASSEMBLIES,
        /** Custom namespace binding dropped because nothing references it. */
        UNUSED_CUSTOM_BINDING,
        /** Custom binding that tried to rebind a canonical prefix. */
        SHADOWED_CANONICAL_PREFIX
    }
    
    /**
     * A single resolution finding.
     */
    public static class Diagnostic {
        
        private final Kind kind;
        private final String subject;
        private final String message;
        
        public Diagnostic(Kind kind, String subject, String message) {
            this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
            this.subject = subject;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }
        
        public Kind getKind() {
            return kind;
        }
        
        public String getSubject() {
            return subject;
        }
        
        public String getMessage() {
            return message;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Diagnostic that = (Diagnostic) o;
            return kind == that.kind &&
                   Objects.equals(subject, that.subject) &&
                   Objects.equals(message, that.message);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(kind, subject, message);
        }
        
        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(kind.name());
            if (subject != null) {
                sb.append(" [").append(subject).append("]");
            }
            sb.append(": ").append(message);
            return sb.toString();
        }
    }
}
