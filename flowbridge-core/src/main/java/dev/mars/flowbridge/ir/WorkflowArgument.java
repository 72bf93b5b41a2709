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

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.flowbridge.types.ArgumentDirection;

import java.util.Objects;

/**
 * A workflow-level argument as carried in IR metadata.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkflowArgument {
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("direction")
    private String direction;
    
    @JsonProperty("type")
    private String type; // IR type name, e.g. "List<String>"
    
    /**
     * Default constructor.
     */
    public WorkflowArgument() {
    }
    
    public WorkflowArgument(String name, ArgumentDirection direction, String type) {
        this.name = name;
        this.direction = direction != null ? direction.getLabel() : ArgumentDirection.IN.getLabel();
        this.type = type;
    }
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }
    
    /**
     * Get the direction label: {@code In}, {@code Out} or {@code InOut}.
     * 
     * @return the direction label
     */
    public String getDirection() {
        return direction;
    }
    
    public void setDirection(String direction) {
        this.direction = direction;
    }
    
    public String getType() {
        return type;
    }
    
    public void setType(String type) {
        this.type = type;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowArgument that = (WorkflowArgument) o;
        return Objects.equals(name, that.name)
                && Objects.equals(direction, that.direction)
                && Objects.equals(type, that.type);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, direction, type);
    }
    
    @Override
    public String toString() {
        return "WorkflowArgument{name='" + name + "', direction=" + direction + ", type='" + type + "'}";
    }
}
