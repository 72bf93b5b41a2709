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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads and writes IR documents.
 * <p>
 * JSON is handled by Jackson; YAML-authored IR is loaded with SnakeYAML's safe constructor
 * and converted to the same Jackson tree, so everything downstream sees one model.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class IrDocumentParser {
    
    private static final Logger logger = LoggerFactory.getLogger(IrDocumentParser.class);
    
    static final String METADATA = "metadata";
    static final String WORKFLOW = "workflow";
    
    private final ObjectMapper objectMapper;
    private final Yaml yaml;
    
    public IrDocumentParser() {
        this(new ObjectMapper());
    }
    
    public IrDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }
    
    /**
     * Parses a file, choosing YAML for {@code .yaml}/{@code .yml} and JSON otherwise.
     */
    public IrDocument parse(Path file) throws IrParseException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new IrParseException("Failed to read IR file: " + file, e);
        }
        
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return parseYaml(content, file.toString());
        }
        return parseJson(content, file.toString());
    }
    
    /**
     * Parses content whose format is sniffed from its first non-blank character.
     */
    public IrDocument parseFromString(String content) throws IrParseException {
        if (content == null || content.isBlank()) {
            throw new IrParseException("Empty or invalid IR content");
        }
        String trimmed = content.stripLeading();
        if (trimmed.startsWith("{")) {
            return parseJson(content, null);
        }
        return parseYaml(content, null);
    }
    
    public IrDocument parseJson(String json, String source) throws IrParseException {
        if (json == null || json.isBlank()) {
            throw new IrParseException(source, null, "Empty or invalid IR content");
        }
        try {
            return toDocument(objectMapper.readTree(json), source);
        } catch (JsonProcessingException e) {
            throw new IrParseException(source, null, "JSON parsing failed: " + e.getOriginalMessage(), e);
        }
    }
    
    public IrDocument parseYaml(String yamlContent, String source) throws IrParseException {
        Object data;
        try {
            data = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new IrParseException(source, null, "YAML parsing failed", e);
        }
        if (data == null) {
            throw new IrParseException(source, null, "Empty or invalid YAML content");
        }
        
        JsonNode root;
        try {
            root = objectMapper.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw new IrParseException(source, null, "YAML content cannot be represented as IR", e);
        }
        return toDocument(root, source);
    }
    
    /**
     * Converts a parsed tree to a document, checking the top-level shape.
     */
    public IrDocument toDocument(JsonNode root, String source) throws IrParseException {
        if (root == null || !root.isObject()) {
            throw new IrParseException(source, "$", "IR document must be an object");
        }
        
        JsonNode workflow = root.get(WORKFLOW);
        if (workflow == null || workflow.isNull()) {
            throw new IrParseException(source, WORKFLOW, "Missing required field");
        }
        if (!workflow.isObject()) {
            throw new IrParseException(source, WORKFLOW, "Expected an object but found " + workflow.getNodeType());
        }
        
        WorkflowMetadata metadata = new WorkflowMetadata();
        JsonNode metadataNode = root.get(METADATA);
        if (metadataNode != null && !metadataNode.isNull()) {
            if (!metadataNode.isObject()) {
                throw new IrParseException(source, METADATA,
                        "Expected an object but found " + metadataNode.getNodeType());
            }
            try {
                metadata = objectMapper.treeToValue(metadataNode, WorkflowMetadata.class);
            } catch (JsonProcessingException e) {
                throw new IrParseException(source, METADATA, "Invalid metadata: " + e.getOriginalMessage(), e);
            }
        }
        
        IrDocument document = new IrDocument(metadata, (ObjectNode) workflow);
        logger.debug("Parsed IR document {}: {}", source != null ? source : "<string>", document);
        return document;
    }
    
    /**
     * Serializes a document back to pretty-printed JSON.
     */
    public String toJson(IrDocument document) throws IrParseException {
        ObjectNode root = objectMapper.createObjectNode();
        root.set(METADATA, objectMapper.valueToTree(document.getMetadata()));
        root.set(WORKFLOW, document.getWorkflow());
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IrParseException("Failed to serialize IR document", e);
        }
    }
}
