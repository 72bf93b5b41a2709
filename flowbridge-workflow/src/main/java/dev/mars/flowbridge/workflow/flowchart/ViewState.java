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

package dev.mars.flowbridge.workflow.flowchart;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Designer view state of one shape: its location, size and connector geometry,
 * as ordered string entries.
 */
public final class ViewState {
    
    public static final String SHAPE_LOCATION = "ShapeLocation";
    public static final String SHAPE_SIZE = "ShapeSize";
    public static final String CONNECTOR_LOCATION = "ConnectorLocation";
    public static final String TRUE_CONNECTOR = "TrueConnector";
    public static final String FALSE_CONNECTOR = "FalseConnector";
    
    private final Map<String, String> entries = new LinkedHashMap<>();
    
    ViewState put(String key, String value) {
        entries.put(key, value);
        return this;
    }
    
    public String get(String key) {
        return entries.get(key);
    }
    
    public boolean has(String key) {
        return entries.containsKey(key);
    }
    
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }
    
    public ObjectNode toObjectNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        entries.forEach(node::put);
        return node;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((ViewState) o).entries);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }
    
    @Override
    public String toString() {
        return entries.toString();
    }
}
