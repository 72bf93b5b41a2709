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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything a written document must declare: xmlns declarations, expression imports,
 * assembly references and the import references derived from them.
 * All collections are sorted and unmodifiable.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class NamespaceResolution {
    
    private final SortedMap<String, String> declarations;
    private final List<String> imports;
    private final List<String> assemblyReferences;
    private final List<ImportReference> importReferences;
    private final int autoDetectedCount;
    private final int baselineCount;
    private final int metadataImportCount;
    private final int customBindingCount;
    
    public NamespaceResolution(Map<String, String> declarations, List<String> imports,
                               List<String> assemblyReferences, List<ImportReference> importReferences,
                               int autoDetectedCount, int baselineCount, int metadataImportCount,
                               int customBindingCount) {
        this.declarations = Collections.unmodifiableSortedMap(new TreeMap<>(declarations));
        this.imports = List.copyOf(imports);
        this.assemblyReferences = List.copyOf(assemblyReferences);
        this.importReferences = List.copyOf(importReferences);
        this.autoDetectedCount = autoDetectedCount;
        this.baselineCount = baselineCount;
        this.metadataImportCount = metadataImportCount;
        this.customBindingCount = customBindingCount;
    }
    
    /**
     * Prefix to URI, the default namespace under {@code ""}.
     */
    public SortedMap<String, String> getDeclarations() {
        return declarations;
    }
    
    public List<String> getImports() {
        return imports;
    }
    
    public List<String> getAssemblyReferences() {
        return assemblyReferences;
    }
    
    public List<ImportReference> getImportReferences() {
        return importReferences;
    }
    
    public int getAutoDetectedCount() {
        return autoDetectedCount;
    }
    
    public int getBaselineCount() {
        return baselineCount;
    }
    
    public int getMetadataImportCount() {
        return metadataImportCount;
    }
    
    public int getCustomBindingCount() {
        return customBindingCount;
    }
    
    /**
     * One-line summary of where the declarations came from.
     */
    public String summary() {
        return autoDetectedCount + " auto-detected, "
                + baselineCount + " defaults, "
                + metadataImportCount + " from metadata -> "
                + declarations.size() + " total xmlns declarations";
    }
    
    @Override
    public String toString() {
        return "NamespaceResolution{" + summary()
                + ", imports=" + imports.size()
                + ", assemblies=" + assemblyReferences.size() + "}";
    }
}
