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

import dev.mars.flowbridge.diagnostics.ResolutionDiagnostics;
import dev.mars.flowbridge.namespace.NamespaceRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts and canonicalizes type-reference strings.
 * <p>
 * Three notations meet here:
 * <ul>
 *   <li>IR type names: {@code String}, {@code List<DataTable>}, {@code Dictionary<String, Int32>}</li>
 *   <li>prefixed document references: {@code x:String}, {@code scg:List(sd:DataTable)}</li>
 *   <li>fully-qualified CLR names: {@code System.Data.DataTable}</li>
 * </ul>
 * Every method is a pure function of its arguments. Nothing here throws on unresolvable input;
 * unknown names pass through unchanged and, where a diagnostics sink is supplied, the gap is recorded.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class TypeResolver {
    
    private static final Pattern JSON_GENERIC = Pattern.compile("^(\\w+)<(.+)>$");
    private static final Pattern PREFIXED_GENERIC = Pattern.compile("^(\\w+):(\\w+)\\((.+)\\)$");
    private static final Pattern ARGUMENT_TYPE = Pattern.compile("^(InOutArgument|OutArgument|InArgument)\\((.+)\\)$");
    
    private static final String GENERIC_COLLECTIONS_PREFIX = "scg";
    
    private static final Map<String, String> CANONICAL_TYPES;
    private static final Map<String, String> REVERSE_TYPES;
    
    static {
        Map<String, String> types = new LinkedHashMap<>();
        // Simple names
        types.put("String", "x:String");
        types.put("Int32", "x:Int32");
        types.put("Int64", "x:Int64");
        types.put("Boolean", "x:Boolean");
        types.put("Double", "x:Double");
        types.put("Decimal", "x:Decimal");
        types.put("DateTime", "s:DateTime");
        types.put("TimeSpan", "s:TimeSpan");
        types.put("Object", "x:Object");
        types.put("DataTable", "sd:DataTable");
        types.put("DataRow", "sd:DataRow");
        types.put("Exception", "s:Exception");
        // Fully-qualified language primitives
        types.put("System.String", "x:String");
        types.put("System.Int32", "x:Int32");
        types.put("System.Int64", "x:Int64");
        types.put("System.Boolean", "x:Boolean");
        types.put("System.Double", "x:Double");
        types.put("System.Decimal", "x:Decimal");
        types.put("System.Object", "x:Object");
        // Fully-qualified System and System.Data types
        types.put("System.DateTime", "s:DateTime");
        types.put("System.TimeSpan", "s:TimeSpan");
        types.put("System.Exception", "s:Exception");
        types.put("System.Data.DataTable", "sd:DataTable");
        types.put("System.Data.DataRow", "sd:DataRow");
        CANONICAL_TYPES = Collections.unmodifiableMap(types);
        
        // Short names win over fully-qualified ones when both map to the same reference
        Map<String, String> reverse = new LinkedHashMap<>();
        types.forEach((name, reference) -> reverse.putIfAbsent(reference, name));
        types.forEach((name, reference) -> {
            if (name.indexOf('.') < 0) {
                reverse.put(reference, name);
            }
        });
        REVERSE_TYPES = Collections.unmodifiableMap(reverse);
    }
    
    private TypeResolver() {
    }
    
    /**
     * Maps an IR type name to its prefixed document reference.
     * <p>
     * {@code List<Inner>} and two-argument {@code Dictionary<K, V>} are recognized and their
     * arguments converted recursively. Unmapped names are returned unchanged.
     *
     * @param jsonType the IR type name, e.g. {@code List<String>}
     * @return the document reference, e.g. {@code scg:List(x:String)}
     */
    public static String toTypeReference(String jsonType) {
        if (jsonType == null) {
            return null;
        }
        String type = jsonType.trim();
        
        Matcher generic = JSON_GENERIC.matcher(type);
        if (generic.matches()) {
            String container = generic.group(1);
            String inner = generic.group(2);
            if ("List".equals(container)) {
                return GENERIC_COLLECTIONS_PREFIX + ":List(" + toTypeReference(inner) + ")";
            }
            if ("Dictionary".equals(container)) {
                List<String> parts = splitTypeArguments(inner);
                if (parts.size() == 2) {
                    return GENERIC_COLLECTIONS_PREFIX + ":Dictionary("
                            + toTypeReference(parts.get(0)) + ", "
                            + toTypeReference(parts.get(1)) + ")";
                }
            }
        }
        
        return CANONICAL_TYPES.getOrDefault(type, type);
    }
    
    /**
     * Maps a prefixed document reference back to its IR type name.
     * <p>
     * Generic references over {@code scg:} containers become {@code Name<Inner[, Inner2]>}
     * with each argument converted recursively; anything unmapped is returned unchanged.
     *
     * @param reference the document reference, e.g. {@code scg:Dictionary(x:String, sd:DataTable)}
     * @return the IR type name, e.g. {@code Dictionary<String, DataTable>}
     */
    public static String toJsonType(String reference) {
        if (reference == null) {
            return null;
        }
        String type = reference.trim();
        
        Matcher generic = PREFIXED_GENERIC.matcher(type);
        if (generic.matches() && GENERIC_COLLECTIONS_PREFIX.equals(generic.group(1))
                && closesAtEnd(type, type.indexOf('('))) {
            List<String> converted = new ArrayList<>();
            for (String argument : splitTypeArguments(generic.group(3))) {
                converted.add(toJsonType(argument));
            }
            return generic.group(2) + "<" + String.join(", ", converted) + ">";
        }
        
        return REVERSE_TYPES.getOrDefault(type, type);
    }
    
    /**
     * Rewrites every namespace prefix in a reference to the registry's canonical prefix.
     * <p>
     * Each prefix is looked up in the document's bindings to find its URI, and the URI in
     * {@code uriToCanonical} to find the canonical prefix. Generic argument lists, argument
     * wrappers such as {@code InArgument(...)} and top-level comma lists are handled recursively.
     * A prefix with no binding, or whose URI has no canonical prefix, is left untouched.
     *
     * @param reference the reference as written in the document
     * @param bindings the document's prefix to URI bindings
     * @param uriToCanonical URI to canonical prefix
     * @return the canonical reference
     */
    public static String canonicalize(String reference, Map<String, String> bindings,
                                      Map<String, String> uriToCanonical) {
        if (reference == null || reference.isEmpty()
                || bindings == null || bindings.isEmpty()
                || uriToCanonical == null || uriToCanonical.isEmpty()) {
            return reference;
        }
        
        List<String> topLevel = splitTypeArguments(reference);
        if (topLevel.size() > 1) {
            List<String> parts = new ArrayList<>();
            for (String part : topLevel) {
                parts.add(canonicalize(part, bindings, uriToCanonical));
            }
            return String.join(", ", parts);
        }
        
        String type = reference.trim();
        int open = type.indexOf('(');
        if (open > 0 && closesAtEnd(type, open)) {
            String head = type.substring(0, open);
            List<String> parts = new ArrayList<>();
            for (String argument : splitTypeArguments(type.substring(open + 1, type.length() - 1))) {
                parts.add(canonicalize(argument, bindings, uriToCanonical));
            }
            return canonicalizePrefix(head, bindings, uriToCanonical) + "(" + String.join(", ", parts) + ")";
        }
        
        return canonicalizePrefix(reference, bindings, uriToCanonical);
    }
    
    /**
     * Converts a fully-qualified type name to prefixed form without recording diagnostics.
     *
     * @see #normalizeTypeReference(String, ResolutionDiagnostics)
     */
    public static String normalizeTypeReference(String typeName) {
        return normalizeTypeReference(typeName, null);
    }
    
    /**
     * Converts a fully-qualified type name to prefixed form.
     * <ol>
     *   <li>already-prefixed names and bare names without a dot pass through</li>
     *   <li>names in the canonical type table map directly</li>
     *   <li>otherwise the namespace part is searched among the registry's prefix imports;
     *       exactly one matching prefix yields {@code prefix:ShortName}</li>
     *   <li>zero or several matches return the input unchanged and record a diagnostic</li>
     * </ol>
     *
     * @param typeName the type name to normalize
     * @param diagnostics sink for ambiguity and gap findings, may be {@code null}
     * @return the normalized reference, or the input when it cannot be resolved unambiguously
     */
    public static String normalizeTypeReference(String typeName, ResolutionDiagnostics diagnostics) {
        if (typeName == null || typeName.isEmpty()) {
            return typeName;
        }
        if (typeName.indexOf(':') >= 0 || typeName.indexOf('.') < 0) {
            return typeName;
        }
        
        String canonical = CANONICAL_TYPES.get(typeName);
        if (canonical != null) {
            return canonical;
        }
        
        int lastDot = typeName.lastIndexOf('.');
        String namespace = typeName.substring(0, lastDot);
        String shortName = typeName.substring(lastDot + 1);
        
        List<String> matches = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : NamespaceRegistry.prefixImports().entrySet()) {
            if (entry.getValue().contains(namespace)) {
                matches.add(entry.getKey());
            }
        }
        
        if (matches.size() == 1) {
            return matches.get(0) + ":" + shortName;
        }
        
        if (diagnostics != null) {
            if (matches.isEmpty()) {
                diagnostics.add(ResolutionDiagnostics.Kind.UNMAPPED_TYPE, typeName,
                        "Unmapped type: " + typeName + " has no matching namespace prefix");
            } else {
                Collections.sort(matches);
                diagnostics.add(ResolutionDiagnostics.Kind.AMBIGUOUS_TYPE, typeName,
                        "Ambiguous type: " + typeName + " matches prefixes " + matches);
            }
        }
        return typeName;
    }
    
    /**
     * Looks up a name in the canonical type table.
     *
     * @return the prefixed reference, or {@code null} when the name is not a known type
     */
    public static String canonicalTypeFor(String name) {
        return name == null ? null : CANONICAL_TYPES.get(name.trim());
    }
    
    /**
     * Returns the namespace prefix of a simple reference, or {@code null} when unprefixed.
     */
    public static String prefixOf(String reference) {
        if (reference == null) {
            return null;
        }
        int colon = reference.indexOf(':');
        return colon < 0 ? null : reference.substring(0, colon).trim();
    }
    
    /**
     * Splits a comma-joined type argument list, ignoring commas nested in parentheses or
     * angle brackets. Parts are trimmed.
     * <p>
     * {@code "scg:List(x:String), x:Object"} gives {@code ["scg:List(x:String)", "x:Object"]}.
     */
    public static List<String> splitTypeArguments(String arguments) {
        List<String> parts = new ArrayList<>();
        if (arguments == null) {
            return parts;
        }
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < arguments.length(); i++) {
            char ch = arguments.charAt(i);
            if (ch == '(' || ch == '<') {
                depth++;
            } else if (ch == ')' || ch == '>') {
                depth--;
            } else if (ch == ',' && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(ch);
        }
        if (current.length() > 0) {
            parts.add(current.toString().trim());
        }
        return parts;
    }
    
    /**
     * Splits a document argument type such as {@code InOutArgument(x:Int32)}.
     * Strings without a recognized wrapper are treated as {@code In} arguments of that type.
     */
    public static ArgumentType parseArgumentType(String rawType) {
        if (rawType == null) {
            return new ArgumentType(ArgumentDirection.IN, "x:String");
        }
        String type = rawType.trim();
        Matcher matcher = ARGUMENT_TYPE.matcher(type);
        if (matcher.matches()) {
            return new ArgumentType(ArgumentDirection.fromWrapper(matcher.group(1)), matcher.group(2).trim());
        }
        return new ArgumentType(ArgumentDirection.IN, type);
    }
    
    /**
     * Builds the document argument type for an IR argument, e.g. {@code OutArgument(sd:DataTable)}.
     */
    public static String formatArgumentType(ArgumentDirection direction, String jsonType) {
        ArgumentDirection effective = direction != null ? direction : ArgumentDirection.IN;
        String inner = jsonType == null || jsonType.isBlank() ? "String" : jsonType;
        return effective.getWrapper() + "(" + toTypeReference(inner) + ")";
    }
    
    private static String canonicalizePrefix(String prefixedType, Map<String, String> bindings,
                                             Map<String, String> uriToCanonical) {
        int colon = prefixedType.indexOf(':');
        if (colon < 0) {
            return prefixedType;
        }
        
        String prefix = prefixedType.substring(0, colon).trim();
        String localName = prefixedType.substring(colon + 1);
        String uri = bindings.get(prefix);
        if (uri == null) {
            return prefixedType;
        }
        
        String canonicalPrefix = uriToCanonical.get(uri);
        if (canonicalPrefix == null || canonicalPrefix.equals(prefix)) {
            return prefixedType;
        }
        
        // The default namespace is written without a prefix
        return canonicalPrefix.isEmpty() ? localName : canonicalPrefix + ":" + localName;
    }
    
    /**
     * True when the parenthesis opened at {@code open} is closed by the last character.
     */
    private static boolean closesAtEnd(String type, int open) {
        if (open < 0 || !type.endsWith(")")) {
            return false;
        }
        int depth = 0;
        for (int i = open; i < type.length(); i++) {
            char ch = type.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return i == type.length() - 1;
                }
            }
        }
        return false;
    }
}
