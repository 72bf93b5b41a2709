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

import java.util.Objects;

/**
 * A document argument type split into its direction and inner type reference,
 * e.g. {@code OutArgument(scg:List(x:String))} is {@code (OUT, scg:List(x:String))}.
 */
public final class ArgumentType {
    
    private final ArgumentDirection direction;
    private final String typeReference;
    
    public ArgumentType(ArgumentDirection direction, String typeReference) {
        this.direction = Objects.requireNonNull(direction, "Direction cannot be null");
        this.typeReference = Objects.requireNonNull(typeReference, "Type reference cannot be null");
    }
    
    public ArgumentDirection getDirection() {
        return direction;
    }
    
    public String getTypeReference() {
        return typeReference;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArgumentType that = (ArgumentType) o;
        return direction == that.direction && typeReference.equals(that.typeReference);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(direction, typeReference);
    }
    
    @Override
    public String toString() {
        return direction.getWrapper() + "(" + typeReference + ")";
    }
}
