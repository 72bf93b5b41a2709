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

package dev.mars.flowbridge.namespace;

import dev.mars.flowbridge.diagnostics.ResolutionDiagnostics;
import dev.mars.flowbridge.types.TypeResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-conversion resolution state: the document's namespace bindings, the URI to
 * canonical-prefix table derived from them, and the diagnostics sink.
 * <p>
 * One context is created at the start of a read or write and passed explicitly to every
 * call that needs it. Contexts are never shared between conversions.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class ResolutionContext {
    
    private static final Pattern PREFIX = Pattern.compile("(\\w+):");
    
    private final Map<String, String> bindings;
    private final Map<String, String> uriToCanonical;
    private final ResolutionDiagnostics diagnostics;
    
    private ResolutionContext(Map<String, String> bindings, Map<String, String> uriToCanonical,
                              ResolutionDiagnostics diagnostics) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.uriToCanonical = Collections.unmodifiableMap(new LinkedHashMap<>(uriToCanonical));
        this.diagnostics = diagnostics;
    }
    
    /**
     * Builds a context for a document declaring the given prefix to URI bindings.
     * Each bound URI known to the registry maps to its canonical prefix.
     *
     * @param documentBindings the document's xmlns declarations, the default namespace under {@code ""}
     * @return a fresh context with its own diagnostics
     */
    public static ResolutionContext forDocument(Map<String, String> documentBindings) {
        Objects.requireNonNull(documentBindings, "documentBindings");
        ResolutionDiagnostics diagnostics = new ResolutionDiagnostics();
        Map<String, String> uriToCanonical = new LinkedHashMap<>();
        
        for (Map.Entry<String, String> binding : documentBindings.entrySet()) {
            String prefix = binding.getKey();
            String uri = binding.getValue();
            String canonical = NamespaceRegistry.canonicalPrefixFor(uri);
            if (canonical != null) {
                uriToCanonical.put(uri, canonical);
            }
            
            String registryUri = NamespaceRegistry.uriFor(prefix);
            if (registryUri != null && !registryUri.equals(uri)) {
                diagnostics.add(ResolutionDiagnostics.Kind.SHADOWED_CANONICAL_PREFIX, prefix,
                        "Prefix '" + prefix + "' is bound to " + uri + " instead of " + registryUri);
            }
        }
        
        return new ResolutionContext(documentBindings, uriToCanonical, diagnostics);
    }
    
    /**
     * A context with no document bindings, used when writing IR that is already canonical.
     */
    public static ResolutionContext empty() {
        return new ResolutionContext(Map.of(), Map.of(), new ResolutionDiagnostics());
    }
    
    public Map<String, String> getBindings() {
        return bindings;
    }
    
    public Map<String, String> getUriToCanonical() {
        return uriToCanonical;
    }
    
    public ResolutionDiagnostics getDiagnostics() {
        return diagnostics;
    }
    
    /**
     * Canonicalizes a reference under this context's bindings. Prefixes the document never
     * bound are left as written and recorded as {@code UNKNOWN_PREFIX}.
     */
    public String canonicalize(String reference) {
        if (reference == null || bindings.isEmpty()) {
            return reference;
        }
        Matcher matcher = PREFIX.matcher(reference);
        while (matcher.find()) {
            String prefix = matcher.group(1);
            if (!bindings.containsKey(prefix)) {
                diagnostics.add(ResolutionDiagnostics.Kind.UNKNOWN_PREFIX, prefix,
                        "Prefix '" + prefix + "' in '" + reference + "' is not declared by the document");
            }
        }
        return TypeResolver.canonicalize(reference, bindings, uriToCanonical);
    }
    
    /**
     * Bindings whose prefix is neither blank nor a registry prefix, in declaration order.
     */
    public Map<String, String> customBindings() {
        Map<String, String> custom = new LinkedHashMap<>();
        bindings.forEach((prefix, uri) -> {
            if (prefix != null && !prefix.isBlank() && !NamespaceRegistry.isCanonicalPrefix(prefix)) {
                custom.put(prefix, uri);
            }
        });
        return custom;
    }
    
    /**
     * Document prefixes that canonicalization rewrites, mapped to their canonical prefix.
     */
    public Map<String, String> prefixRemappings() {
        Map<String, String> remappings = new LinkedHashMap<>();
        bindings.forEach((prefix, uri) -> {
            String canonical = uriToCanonical.get(uri);
            if (canonical != null && !canonical.equals(prefix)) {
                remappings.put(prefix, canonical);
            }
        });
        return remappings;
    }
    
    @Override
    public String toString() {
        return "ResolutionContext{bindings=" + bindings.size()
                + ", remapped=" + prefixRemappings().size()
                + ", diagnostics=" + diagnostics.getCount() + "}";
    }
}
