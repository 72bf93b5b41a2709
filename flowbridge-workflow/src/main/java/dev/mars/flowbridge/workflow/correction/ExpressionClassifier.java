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

package dev.mars.flowbridge.workflow.correction;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Tells expression text apart from literal values.
 * <p>
 * Expressions must be bracket-wrapped in the written document; literals must not be.
 */
public final class ExpressionClassifier {
    
    private static final List<Pattern> EXPRESSION_PATTERNS = List.of(
            Pattern.compile("If\\("),
            Pattern.compile("New\\s+\\w+"),
            Pattern.compile("(?:CType|CInt|CStr|CDate|CDbl|CBool)\\("),
            Pattern.compile("DirectCast\\("),
            Pattern.compile("\\w+\\.\\w+"),
            Pattern.compile("[+\\-*/&]"),
            Pattern.compile("[<>=]"),
            Pattern.compile("\\b(?:And|Or|Not|Mod|AndAlso|OrElse)\\b"),
            Pattern.compile("\\.(?:Count|Length|Rows|Columns|ToString)\\b"));
    
    private static final List<Pattern> LITERAL_PATTERNS = List.of(
            Pattern.compile("^\".*\"$", Pattern.DOTALL),
            Pattern.compile("^-?\\d+(\\.\\d+)?$"),
            Pattern.compile("^(?:True|False|Nothing)$"),
            Pattern.compile("^\\[\\w+\\]$"));
    
    private ExpressionClassifier() {
    }
    
    public static boolean isWrapped(String value) {
        return value != null && value.startsWith("[") && value.endsWith("]");
    }
    
    public static boolean isLiteral(String value) {
        if (value == null) {
            return false;
        }
        for (Pattern pattern : LITERAL_PATTERNS) {
            if (pattern.matcher(value).matches()) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * True for unwrapped, non-literal text matching any expression pattern.
     */
    public static boolean isExpression(String value) {
        if (value == null || value.isEmpty() || isWrapped(value) || isLiteral(value)) {
            return false;
        }
        for (Pattern pattern : EXPRESSION_PATTERNS) {
            if (pattern.matcher(value).find()) {
                return true;
            }
        }
        return false;
    }
    
    public static String wrap(String value) {
        return "[" + value + "]";
    }
}
