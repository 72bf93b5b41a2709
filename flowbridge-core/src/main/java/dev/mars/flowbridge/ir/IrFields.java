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

import java.util.List;

/**
 * Field names and node kinds of the IR tree.
 */
public final class IrFields {
    
    public static final String TYPE = "type";
    public static final String REFERENCE_ID = "x:Name";
    public static final String DISPLAY_NAME = "displayName";
    public static final String NEXT = "next";
    public static final String TRUE_BRANCH = "true";
    public static final String FALSE_BRANCH = "false";
    public static final String START_NODE = "startNode";
    public static final String NODES = "nodes";
    public static final String VIEW_STATE = "viewState";
    public static final String VARIABLES = "variables";
    public static final String ARGUMENTS = "arguments";
    public static final String DEFAULT = "default";
    public static final String VALUE = "value";
    
    public static final String FLOWCHART = "Flowchart";
    public static final String FLOW_STEP = "FlowStep";
    public static final String FLOW_DECISION = "FlowDecision";
    
    /** Fields whose string values are type references. */
    public static final List<String> TYPE_FIELDS = List.of(
            "type", "typeArgument", "TypeArguments", "x:TypeArguments",
            "argumentType", "variableType", "exceptionType");
    
    /** Fields holding expressions that may mention prefixed types. */
    public static final List<String> EXPRESSION_FIELDS = List.of("to", "value", "condition", "expression");
    
    /** Fields holding nested activities or collections of them. */
    public static final List<String> CONTAINER_FIELDS = List.of(
            "children", "activities", "body", "then", "else", "catches", "finally",
            "cases", "default", "trueBody", "falseBody", "nodes", "ifExists", "ifNotExists");
    
    private IrFields() {
    }
}
