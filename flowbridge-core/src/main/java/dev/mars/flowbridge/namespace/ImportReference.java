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

import java.util.Objects;

/**
 * An expression import paired with the assembly that provides it.
 */
public final class ImportReference {
    
    private final String assembly;
    private final String importName;
    
    public ImportReference(String assembly, String importName) {
        this.assembly = Objects.requireNonNull(assembly, "assembly");
        this.importName = Objects.requireNonNull(importName, "importName");
    }
    
    public String getAssembly() {
        return assembly;
    }
    
    public String getImportName() {
        return importName;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImportReference that = (ImportReference) o;
        return assembly.equals(that.assembly) && importName.equals(that.importName);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(assembly, importName);
    }
    
    @Override
    public String toString() {
        return importName + " @ " + assembly;
    }
}
