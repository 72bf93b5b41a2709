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

import dev.mars.flowbridge.core.exceptions.FlowBridgeException;

/**
 * Exception thrown when an IR document cannot be parsed or has the wrong shape.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class IrParseException extends FlowBridgeException {
    
    private final String source;
    private final String fieldPath;
    
    public IrParseException(String message) {
        this(null, null, message, null);
    }
    
    public IrParseException(String message, Throwable cause) {
        this(null, null, message, cause);
    }
    
    public IrParseException(String source, String fieldPath, String message) {
        this(source, fieldPath, message, null);
    }
    
    public IrParseException(String source, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.fieldPath = fieldPath;
    }
    
    public String getSource() {
        return source;
    }
    
    public String getFieldPath() {
        return fieldPath;
    }
    
    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        
        if (source != null) {
            sb.append("Document '").append(source).append("': ");
        }
        
        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }
        
        sb.append(super.getMessage());
        
        return sb.toString();
    }
}
