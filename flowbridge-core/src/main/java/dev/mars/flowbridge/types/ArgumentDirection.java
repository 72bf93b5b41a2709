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

package dev.mars.flowbridge.types;

/**
 * Direction of a workflow argument, with the wrapper type the document format uses for it.
 */
public enum ArgumentDirection {
    IN("In", "InArgument"),
    OUT("Out", "OutArgument"),
    IN_OUT("InOut", "InOutArgument");
    
    private final String label;
    private final String wrapper;
    
    ArgumentDirection(String label, String wrapper) {
        this.label = label;
        this.wrapper = wrapper;
    }
    
    /**
     * The label used in the IR ({@code In}, {@code Out}, {@code InOut}).
     */
    public String getLabel() {
        return label;
    }
    
    /**
     * The document wrapper type name, e.g. {@code InArgument}.
     */
    public String getWrapper() {
        return wrapper;
    }
    
    /**
     * Resolves an IR direction label. Unknown or missing labels default to {@link #IN}.
     */
    public static ArgumentDirection fromLabel(String label) {
        if (label != null) {
            for (ArgumentDirection direction : values()) {
                if (direction.label.equalsIgnoreCase(label.trim())) {
                    return direction;
                }
            }
        }
        return IN;
    }
    
    public static ArgumentDirection fromWrapper(String wrapper) {
        for (ArgumentDirection direction : values()) {
            if (direction.wrapper.equals(wrapper)) {
                return direction;
            }
        }
        return null;
    }
}
