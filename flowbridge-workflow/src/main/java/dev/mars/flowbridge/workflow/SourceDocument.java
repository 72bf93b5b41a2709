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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A source document as handed over by the document parser: its namespace declarations, its
 * root-level metadata, and the activity tree with type attributes exactly as written.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class SourceDocument {
    
    private final Map<String, String> bindings = new LinkedHashMap<>();
    private final Map<String, String> members = new LinkedHashMap<>();
    private final List<String> namespaces = new ArrayList<>();
    private final List<String> assemblyReferences = new ArrayList<>();
    private String className = "";
    private ObjectNode workflow = JsonNodeFactory.instance.objectNode();
    
    /**
     * Declares a namespace prefix. The default namespace uses the empty prefix.
     */
    public SourceDocument bind(String prefix, String uri) {
        bindings.put(Objects.requireNonNull(prefix, "Prefix cannot be null"), uri);
        return this;
    }
    
    /**
     * Adds a workflow argument declaration, e.g. {@code ("in_Path", "InArgument(x:String)")}.
     */
    public SourceDocument member(String name, String rawType) {
        members.put(name, rawType);
        return this;
    }
    
    public SourceDocument namespace(String importName) {
        namespaces.add(importName);
        return this;
    }
    
    public SourceDocument assemblyReference(String assembly) {
        assemblyReferences.add(assembly);
        return this;
    }
    
    public SourceDocument className(String className) {
        this.className = className;
        return this;
    }
    
    public SourceDocument workflow(ObjectNode workflow) {
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        return this;
    }
    
    public Map<String, String> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }
    
    public Map<String, String> getMembers() {
        return Collections.unmodifiableMap(members);
    }
    
    public List<String> getNamespaces() {
        return Collections.unmodifiableList(namespaces);
    }
    
    public List<String> getAssemblyReferences() {
        return Collections.unmodifiableList(assemblyReferences);
    }
    
    public String getClassName() {
        return className;
    }
    
    public ObjectNode getWorkflow() {
        return workflow;
    }
}
