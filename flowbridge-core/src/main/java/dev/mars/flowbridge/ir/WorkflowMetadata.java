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

package dev.mars.flowbridge.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document-level metadata of an IR workflow.
 * <p>
 * Carries the root class name, the CLR-style imports and assembly references the
 * document declared, the workflow arguments and any custom (non-registry) xmlns bindings.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowMetadata {
    
    @JsonProperty("class")
    private String className = "";
    
    @JsonProperty("namespaces")
    private List<String> namespaces = new ArrayList<>();
    
    @JsonProperty("assemblyReferences")
    private List<String> assemblyReferences = new ArrayList<>();
    
    @JsonProperty("arguments")
    private List<WorkflowArgument> arguments = new ArrayList<>();
    
    @JsonProperty("xmlnsBindings")
    private Map<String, String> xmlnsBindings = new LinkedHashMap<>();
    
    /**
     * Default constructor.
     */
    public WorkflowMetadata() {
    }
    
    public String getClassName() {
        return className;
    }
    
    public void setClassName(String className) {
        this.className = className;
    }
    
    /**
     * Get the carried-over imports. Entries may be blank; consumers filter them.
     * 
     * @return the imports as declared
     */
    public List<String> getNamespaces() {
        return namespaces;
    }
    
    public void setNamespaces(List<String> namespaces) {
        this.namespaces = namespaces != null ? namespaces : new ArrayList<>();
    }
    
    public List<String> getAssemblyReferences() {
        return assemblyReferences;
    }
    
    public void setAssemblyReferences(List<String> assemblyReferences) {
        this.assemblyReferences = assemblyReferences != null ? assemblyReferences : new ArrayList<>();
    }
    
    public List<WorkflowArgument> getArguments() {
        return arguments;
    }
    
    public void setArguments(List<WorkflowArgument> arguments) {
        this.arguments = arguments != null ? arguments : new ArrayList<>();
    }
    
    /**
     * Get the custom prefix to URI bindings the source document declared.
     * 
     * @return custom bindings in declaration order
     */
    public Map<String, String> getXmlnsBindings() {
        return xmlnsBindings;
    }
    
    public void setXmlnsBindings(Map<String, String> xmlnsBindings) {
        this.xmlnsBindings = xmlnsBindings != null ? xmlnsBindings : new LinkedHashMap<>();
    }
    
    @Override
    public String toString() {
        return "WorkflowMetadata{" +
                "className='" + className + '\'' +
                ", namespaces=" + namespaces.size() +
                ", assemblyReferences=" + assemblyReferences.size() +
                ", arguments=" + arguments.size() +
                ", xmlnsBindings=" + xmlnsBindings.keySet() +
                '}';
    }
}
