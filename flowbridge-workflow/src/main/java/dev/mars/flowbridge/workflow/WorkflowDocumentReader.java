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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowbridge.diagnostics.ResolutionDiagnostics;
import dev.mars.flowbridge.ir.IrDocument;
import dev.mars.flowbridge.ir.IrFields;
import dev.mars.flowbridge.ir.WorkflowArgument;
import dev.mars.flowbridge.ir.WorkflowMetadata;
import dev.mars.flowbridge.namespace.ResolutionContext;
import dev.mars.flowbridge.types.ArgumentType;
import dev.mars.flowbridge.types.TypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read path from a source document to an IR document.
 * <p>
 * Documents may bind registry namespaces to prefixes of their own choosing. Every type
 * reference read from the document is rewritten to canonical prefixes under the document's
 * {@link ResolutionContext}, so the resulting IR never depends on the source's prefix choices.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class WorkflowDocumentReader {
    
    private static final Logger logger = LoggerFactory.getLogger(WorkflowDocumentReader.class);
    
    private static final Set<String> TYPE_ATTRIBUTES = Set.of(
            "x:TypeArguments", "typeArgument", "exceptionType", "argumentType", "variableType");
    
    /**
     * Reads a document under a context built from its own namespace declarations.
     */
    public IrDocument read(SourceDocument source) {
        Objects.requireNonNull(source, "Source cannot be null");
        return read(source, ResolutionContext.forDocument(source.getBindings()));
    }
    
    /**
     * Reads a document under the given context. Diagnostics accumulate in the context.
     *
     * @param source the source document, left unmodified
     * @param context resolution context for this conversion
     * @return the IR document
     */
    public IrDocument read(SourceDocument source, ResolutionContext context) {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(context, "Context cannot be null");
        
        context.prefixRemappings().forEach((prefix, canonical) ->
                logger.info("Prefix remapping: {}->{}", prefix, canonical));
        
        WorkflowMetadata metadata = new WorkflowMetadata();
        metadata.setClassName(source.getClassName());
        metadata.setNamespaces(trimmed(source.getNamespaces(), "namespaces", context));
        metadata.setAssemblyReferences(trimmed(source.getAssemblyReferences(), "assemblyReferences", context));
        metadata.setArguments(readArguments(source.getMembers(), context));
        metadata.setXmlnsBindings(context.customBindings());
        
        ObjectNode workflow = source.getWorkflow().deepCopy();
        canonicalizeTree(workflow, context);
        
        for (ResolutionDiagnostics.Diagnostic diagnostic : context.getDiagnostics().getDiagnostics()) {
            logger.warn("{}", diagnostic);
        }
        logger.debug("Read '{}' with {} argument(s) and {} custom binding(s)",
                metadata.getClassName(), metadata.getArguments().size(), metadata.getXmlnsBindings().size());
        
        return new IrDocument(metadata, workflow);
    }
    
    /**
     * Converts a raw argument type such as {@code OutArgument(sd2:DataTable)} to an IR argument.
     * Returns {@code null} for declarations missing a name or a type.
     */
    WorkflowArgument readArgument(String name, String rawType, ResolutionContext context) {
        if (name == null || name.isBlank() || rawType == null || rawType.isBlank()) {
            return null;
        }
        ArgumentType parsed = TypeResolver.parseArgumentType(rawType);
        String canonical = context.canonicalize(parsed.getTypeReference());
        return new WorkflowArgument(name, parsed.getDirection(), TypeResolver.toJsonType(canonical));
    }
    
    private List<WorkflowArgument> readArguments(Map<String, String> members, ResolutionContext context) {
        List<WorkflowArgument> arguments = new ArrayList<>();
        members.forEach((name, rawType) -> {
            WorkflowArgument argument = readArgument(name, rawType, context);
            if (argument != null) {
                arguments.add(argument);
            } else {
                logger.debug("Skipping argument declaration without name or type: {}", name);
            }
        });
        return arguments;
    }
    
    private void canonicalizeTree(JsonNode node, ResolutionContext context) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                canonicalizeTree(element, context);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        
        ObjectNode object = (ObjectNode) node;
        List<String> keys = new ArrayList<>();
        Iterator<String> names = object.fieldNames();
        names.forEachRemaining(keys::add);
        
        for (String key : keys) {
            JsonNode value = object.get(key);
            if (TYPE_ATTRIBUTES.contains(key) && value.isTextual()) {
                object.put(key, context.canonicalize(value.asText()));
            } else if (IrFields.VARIABLES.equals(key) && value.isArray()) {
                for (JsonNode variable : value) {
                    if (variable.isObject()) {
                        readVariable((ObjectNode) variable, context);
                    }
                }
            } else {
                canonicalizeTree(value, context);
            }
        }
    }
    
    private void readVariable(ObjectNode variable, ResolutionContext context) {
        JsonNode type = variable.get(IrFields.TYPE);
        if (type != null && type.isTextual()) {
            variable.put(IrFields.TYPE, TypeResolver.toJsonType(context.canonicalize(type.asText())));
        }
        canonicalizeTree(variable, context);
    }
    
    private static List<String> trimmed(List<String> entries, String field, ResolutionContext context) {
        List<String> kept = new ArrayList<>();
        int blank = 0;
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                blank++;
            } else {
                kept.add(entry.trim());
            }
        }
        if (blank > 0) {
            context.getDiagnostics().add(ResolutionDiagnostics.Kind.BLANK_METADATA, field,
                    "Dropped " + blank + " blank " + field + " entr" + (blank == 1 ? "y" : "ies"));
        }
        return kept;
    }
}
