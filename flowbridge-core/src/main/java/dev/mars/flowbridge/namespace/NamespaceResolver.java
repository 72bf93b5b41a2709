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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowbridge.diagnostics.ResolutionDiagnostics;
import dev.mars.flowbridge.ir.IrFields;
import dev.mars.flowbridge.ir.WorkflowMetadata;
import dev.mars.flowbridge.types.TypeResolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which namespace declarations, expression imports and assembly references a
 * written document must carry.
 * <p>
 * Resolution never fails. Anything it cannot resolve falls back to a safe default,
 * biased toward declaring too much rather than too little, and is recorded in the
 * context's diagnostics when a context is supplied.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class NamespaceResolver {
    
    private static final Pattern PREFIXED_NAME = Pattern.compile("(\\w+):[\\w\\[\\]]+");
    
    /**
     * Scans an IR tree for every registered prefix its values need.
     *
     * @param tree the IR activity tree, may be {@code null}
     * @return the detected prefixes, sorted
     */
    public SortedSet<String> detectRequiredPrefixes(JsonNode tree) {
        SortedSet<String> prefixes = new TreeSet<>();
        if (tree != null && tree.isObject()) {
            scanObject(tree, prefixes);
        }
        return prefixes;
    }
    
    /**
     * Union of the three declaration tiers. The operation is commutative.
     */
    public SortedSet<String> resolveNamespaceDeclarations(Collection<String> autoDetected,
                                                          Collection<String> baselineRequired,
                                                          Collection<String> metadataPreserved) {
        SortedSet<String> all = new TreeSet<>();
        addAllNonNull(all, autoDetected);
        addAllNonNull(all, baselineRequired);
        addAllNonNull(all, metadataPreserved);
        return all;
    }
    
    public List<String> generateImportStrings(Collection<String> prefixes, List<String> existingImports) {
        return generateImportStrings(prefixes, existingImports, null);
    }
    
    /**
     * Expression imports for a set of prefixes plus the valid carried-over imports.
     * The baseline imports are seeded only when no valid carried-over import exists.
     *
     * @return sorted, de-duplicated imports
     */
    public List<String> generateImportStrings(Collection<String> prefixes, List<String> existingImports,
                                              ResolutionContext context) {
        SortedSet<String> imports = new TreeSet<>();
        if (prefixes != null) {
            for (String prefix : prefixes) {
                imports.addAll(NamespaceRegistry.importsFor(prefix));
            }
        }
        
        List<String> valid = validEntries(existingImports, "import", context);
        imports.addAll(valid);
        
        if (valid.isEmpty()) {
            imports.addAll(NamespaceRegistry.baselineImports());
            record(context, ResolutionDiagnostics.Kind.BASELINE_IMPORTS, "namespaces",
                    "No valid imports in metadata; seeded " + NamespaceRegistry.baselineImports().size()
                            + " baseline imports");
        }
        return new ArrayList<>(imports);
    }
    
    public List<String> generateMinimalAssemblyReferences(Collection<String> usedPrefixes,
                                                          List<String> existingReferences) {
        return generateMinimalAssemblyReferences(usedPrefixes, existingReferences, null);
    }
    
    /**
     * Valid existing references plus the assemblies the used prefixes imply. Only when that
     * combined set is empty is the full default list returned.
     *
     * @return sorted references, or the default list in its registry order
     */
    public List<String> generateMinimalAssemblyReferences(Collection<String> usedPrefixes,
                                                          List<String> existingReferences,
                                                          ResolutionContext context) {
        SortedSet<String> assemblies = new TreeSet<>(validEntries(existingReferences, "assembly reference", context));
        if (usedPrefixes != null) {
            for (String prefix : usedPrefixes) {
                for (String assembly : NamespaceRegistry.assembliesFor(prefix)) {
                    if (assembly != null && !assembly.isBlank()) {
                        assemblies.add(assembly);
                    }
                }
            }
        }
        
        if (assemblies.isEmpty()) {
            record(context, ResolutionDiagnostics.Kind.DEFAULT_ASSEMBLIES, "assemblyReferences",
                    "No assembly references resolved; using default set of "
                            + NamespaceRegistry.defaultAssemblyReferences().size());
            return new ArrayList<>(NamespaceRegistry.defaultAssemblyReferences());
        }
        return new ArrayList<>(assemblies);
    }
    
    public Map<String, String> filterUsedCustomNamespaces(Map<String, String> customBindings, JsonNode tree) {
        return filterUsedCustomNamespaces(customBindings, tree, null);
    }
    
    /**
     * Keeps the custom bindings whose prefix appears as {@code prefix:} in some string value
     * of the tree. Registry prefixes are never kept, so a custom binding cannot redefine them.
     *
     * @return the surviving bindings in their original order
     */
    public Map<String, String> filterUsedCustomNamespaces(Map<String, String> customBindings, JsonNode tree,
                                                          ResolutionContext context) {
        Map<String, String> used = new LinkedHashMap<>();
        if (customBindings == null || customBindings.isEmpty()) {
            return used;
        }
        
        for (Map.Entry<String, String> binding : customBindings.entrySet()) {
            String prefix = binding.getKey();
            if (prefix == null || prefix.isBlank() || NamespaceRegistry.isCanonicalPrefix(prefix)) {
                continue;
            }
            Pattern usage = Pattern.compile("\\b" + Pattern.quote(prefix) + ":");
            if (mentions(tree, usage)) {
                used.put(prefix, binding.getValue());
            } else {
                record(context, ResolutionDiagnostics.Kind.UNUSED_CUSTOM_BINDING, prefix,
                        "Custom binding '" + prefix + "' is not referenced and will not be declared");
            }
        }
        return used;
    }
    
    /**
     * Pairs each import with its providing assembly. Imports with no known assembly are skipped.
     */
    public List<ImportReference> generateImportReferences(List<String> imports) {
        List<ImportReference> references = new ArrayList<>();
        if (imports == null) {
            return references;
        }
        for (String importName : imports) {
            String assembly = NamespaceRegistry.assemblyForImport(importName);
            if (assembly != null && !assembly.isEmpty()) {
                references.add(new ImportReference(assembly, importName));
            }
        }
        return references;
    }
    
    /**
     * Runs the full resolution for one tree and its metadata.
     */
    public NamespaceResolution resolve(JsonNode tree, WorkflowMetadata metadata, ResolutionContext context) {
        Objects.requireNonNull(context, "context");
        WorkflowMetadata effective = metadata != null ? metadata : new WorkflowMetadata();
        
        SortedSet<String> autoDetected = detectRequiredPrefixes(tree);
        Set<String> baseline = NamespaceRegistry.baselinePrefixes();
        Map<String, String> usedCustom = filterUsedCustomNamespaces(effective.getXmlnsBindings(), tree, context);
        
        SortedSet<String> prefixes = resolveNamespaceDeclarations(autoDetected, baseline, usedCustom.keySet());
        Map<String, String> declarations = new TreeMap<>();
        for (String prefix : prefixes) {
            String uri = NamespaceRegistry.uriFor(prefix);
            declarations.put(prefix, uri != null ? uri : usedCustom.get(prefix));
        }
        
        List<String> imports = generateImportStrings(prefixes, effective.getNamespaces(), context);
        List<String> assemblies = generateMinimalAssemblyReferences(
                autoDetected, effective.getAssemblyReferences(), context);
        List<ImportReference> importReferences = generateImportReferences(imports);
        
        int metadataImports = (int) effective.getNamespaces().stream()
                .filter(ns -> ns != null && !ns.isBlank())
                .count();
        
        return new NamespaceResolution(declarations, imports, assemblies, importReferences,
                autoDetected.size(), baseline.size(), metadataImports, usedCustom.size());
    }
    
    private void scanObject(JsonNode node, Set<String> prefixes) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            
            if (IrFields.TYPE_FIELDS.contains(key)) {
                if (value.isTextual()) {
                    scanType(value.asText(), prefixes);
                } else {
                    scanAny(value, prefixes);
                }
            } else if (IrFields.VARIABLES.equals(key) && value.isArray()) {
                for (JsonNode variable : value) {
                    if (variable.isObject()) {
                        scanType(variable.path(IrFields.TYPE).asText(""), prefixes);
                        scanString(variable.path(IrFields.DEFAULT).asText(""), prefixes);
                        scanObject(variable, prefixes);
                    }
                }
            } else if (IrFields.EXPRESSION_FIELDS.contains(key) && value.isObject()) {
                scanType(value.path(IrFields.TYPE).asText(""), prefixes);
                scanObject(value, prefixes);
            } else {
                scanAny(value, prefixes);
            }
        }
    }
    
    private void scanAny(JsonNode value, Set<String> prefixes) {
        if (value.isObject()) {
            scanObject(value, prefixes);
        } else if (value.isArray()) {
            for (JsonNode item : value) {
                scanAny(item, prefixes);
            }
        } else if (value.isTextual()) {
            scanString(value.asText(), prefixes);
        }
    }
    
    /**
     * Type fields additionally go through the type table so {@code List<DataTable>} needs {@code scg} and {@code sd}.
     */
    private void scanType(String type, Set<String> prefixes) {
        scanString(type, prefixes);
        if (!type.isBlank()) {
            scanString(TypeResolver.toTypeReference(type), prefixes);
        }
    }
    
    private void scanString(String value, Set<String> prefixes) {
        Matcher matcher = PREFIXED_NAME.matcher(value);
        while (matcher.find()) {
            String candidate = matcher.group(1);
            if (NamespaceRegistry.isCanonicalPrefix(candidate)) {
                prefixes.add(candidate);
            }
        }
        String mapped = TypeResolver.canonicalTypeFor(value);
        if (mapped != null) {
            String prefix = TypeResolver.prefixOf(mapped);
            if (NamespaceRegistry.isCanonicalPrefix(prefix)) {
                prefixes.add(prefix);
            }
        }
    }
    
    private boolean mentions(JsonNode node, Pattern usage) {
        if (node == null) {
            return false;
        }
        if (node.isTextual()) {
            return usage.matcher(node.asText()).find();
        }
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                if (mentions(child, usage)) {
                    return true;
                }
            }
        }
        return false;
    }
    
    private List<String> validEntries(List<String> entries, String label, ResolutionContext context) {
        List<String> valid = new ArrayList<>();
        if (entries == null) {
            return valid;
        }
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                record(context, ResolutionDiagnostics.Kind.BLANK_METADATA, label,
                        "Ignored blank " + label + " in metadata");
            } else {
                valid.add(entry.trim());
            }
        }
        return valid;
    }
    
    private static void addAllNonNull(Set<String> target, Collection<String> source) {
        if (source != null) {
            for (String item : source) {
                if (item != null) {
                    target.add(item);
                }
            }
        }
    }
    
    private static void record(ResolutionContext context, ResolutionDiagnostics.Kind kind,
                               String subject, String message) {
        if (context != null) {
            context.getDiagnostics().add(kind, subject, message);
        }
    }
}
