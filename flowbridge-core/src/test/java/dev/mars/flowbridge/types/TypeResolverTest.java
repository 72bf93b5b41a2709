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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TypeResolver}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
class TypeResolverTest {
    
    private static final String SD_URI = "clr-namespace:System.Data;assembly=System.Data.Common";
    private static final String SCG_URI = "clr-namespace:System.Collections.Generic;assembly=System.Private.CoreLib";
    private static final String X_URI = "http://schemas.microsoft.com/winfx/2006/xaml";
    private static final String ACTIVITIES_URI = "http://schemas.microsoft.com/netfx/2009/xaml/activities";
    
    @Nested
    @DisplayName("IR type to document reference")
    class ToTypeReference {
        
        @ParameterizedTest
        @CsvSource({
                "String, x:String",
                "Int32, x:Int32",
                "Boolean, x:Boolean",
                "DateTime, s:DateTime",
                "DataTable, sd:DataTable",
                "System.Data.DataTable, sd:DataTable",
                "System.Object, x:Object",
                "MyCustomType, MyCustomType"
        })
        void testSimpleNames(String jsonType, String expected) {
            assertEquals(expected, TypeResolver.toTypeReference(jsonType));
        }
        
        @Test
        void testList() {
            assertEquals("scg:List(x:String)", TypeResolver.toTypeReference("List<String>"));
        }
        
        @Test
        void testDictionary() {
            assertEquals("scg:Dictionary(x:String, sd:DataTable)",
                    TypeResolver.toTypeReference("Dictionary<String, DataTable>"));
        }
        
        @Test
        void testNestedGenerics() {
            assertEquals("scg:List(scg:Dictionary(x:String, x:Int32))",
                    TypeResolver.toTypeReference("List<Dictionary<String, Int32>>"));
        }
        
        @Test
        void testNullPassesThrough() {
            assertNull(TypeResolver.toTypeReference(null));
        }
    }
    
    @Nested
    @DisplayName("Document reference to IR type")
    class ToJsonType {
        
        @ParameterizedTest
        @CsvSource({
                "x:String, String",
                "x:Object, Object",
                "sd:DataTable, DataTable",
                "s:Exception, Exception",
                "ui:CustomThing, ui:CustomThing"
        })
        void testSimpleReferences(String reference, String expected) {
            assertEquals(expected, TypeResolver.toJsonType(reference));
        }
        
        @Test
        void testGenericList() {
            assertEquals("List<String>", TypeResolver.toJsonType("scg:List(x:String)"));
        }
        
        @Test
        void testGenericDictionary() {
            assertEquals("Dictionary<String, DataTable>",
                    TypeResolver.toJsonType("scg:Dictionary(x:String, sd:DataTable)"));
        }
        
        @Test
        void testNonCollectionWrapperIsNotConverted() {
            assertEquals("ui:Box(x:String)", TypeResolver.toJsonType("ui:Box(x:String)"));
        }
        
        @ParameterizedTest
        @ValueSource(strings = {
                "String",
                "DataTable",
                "List<String>",
                "List<DataRow>",
                "Dictionary<String, Int32>",
                "Dictionary<String, DataTable>",
                "List<Dictionary<String, Object>>"
        })
        void testGenericRoundTrip(String jsonType) {
            assertEquals(jsonType, TypeResolver.toJsonType(TypeResolver.toTypeReference(jsonType)));
        }
    }
    
    @Nested
    @DisplayName("Prefix canonicalization")
    class Canonicalize {
        
        private final Map<String, String> bindings = new LinkedHashMap<>();
        private final Map<String, String> uriToCanonical = new LinkedHashMap<>();
        
        Canonicalize() {
            bindings.put("data", SD_URI);
            bindings.put("col", SCG_URI);
            bindings.put("xx", X_URI);
            bindings.put("act", ACTIVITIES_URI);
            bindings.put("my", "urn:acme:custom");
            uriToCanonical.put(SD_URI, "sd");
            uriToCanonical.put(SCG_URI, "scg");
            uriToCanonical.put(X_URI, "x");
            uriToCanonical.put(ACTIVITIES_URI, "");
        }
        
        @Test
        void testSinglePrefix() {
            assertEquals("sd:DataTable", TypeResolver.canonicalize("data:DataTable", bindings, uriToCanonical));
        }
        
        @Test
        void testNestedGenericArguments() {
            assertEquals("scg:Dictionary(x:String, scg:List(sd:DataTable))",
                    TypeResolver.canonicalize("col:Dictionary(xx:String, col:List(data:DataTable))",
                            bindings, uriToCanonical));
        }
        
        @Test
        void testUnprefixedWrapper() {
            assertEquals("InArgument(sd:DataTable)",
                    TypeResolver.canonicalize("InArgument(data:DataTable)", bindings, uriToCanonical));
        }
        
        @Test
        void testTopLevelCommaList() {
            assertEquals("x:String, sd:DataRow",
                    TypeResolver.canonicalize("xx:String,data:DataRow", bindings, uriToCanonical));
        }
        
        @Test
        void testDefaultNamespaceDropsPrefix() {
            assertEquals("Sequence", TypeResolver.canonicalize("act:Sequence", bindings, uriToCanonical));
        }
        
        @Test
        void testUnknownPrefixUntouched() {
            assertEquals("zz:Thing", TypeResolver.canonicalize("zz:Thing", bindings, uriToCanonical));
        }
        
        @Test
        void testUnmappedUriUntouched() {
            assertEquals("my:Widget", TypeResolver.canonicalize("my:Widget", bindings, uriToCanonical));
        }
        
        @Test
        void testEmptyBindingsReturnInput() {
            assertEquals("data:DataTable", TypeResolver.canonicalize("data:DataTable", Map.of(), uriToCanonical));
        }
        
        @ParameterizedTest
        @ValueSource(strings = {
                "data:DataTable",
                "col:List(data:DataTable)",
                "OutArgument(col:Dictionary(xx:String, my:Widget))",
                "xx:Int32, data:DataRow",
                "sd:DataTable"
        })
        void testIdempotent(String reference) {
            String once = TypeResolver.canonicalize(reference, bindings, uriToCanonical);
            assertEquals(once, TypeResolver.canonicalize(once, bindings, uriToCanonical));
        }
        
        @Test
        void testDocumentsDifferingOnlyInPrefixSpellingConverge() {
            Map<String, String> otherBindings = Map.of("tbl", SD_URI, "gen", SCG_URI);
            String first = TypeResolver.canonicalize("col:List(data:DataTable)", bindings, uriToCanonical);
            String second = TypeResolver.canonicalize("gen:List(tbl:DataTable)", otherBindings, uriToCanonical);
            assertEquals(first, second);
        }
    }
    
    @Nested
    @DisplayName("Fully-qualified name normalization")
    class Normalize {
        
        @ParameterizedTest
        @MethodSource("dev.mars.flowbridge.types.TypeResolverTest#normalizationCases")
        void testNormalization(String input, String expected) {
            assertEquals(expected, TypeResolver.normalizeTypeReference(input));
        }
        
        @Test
        void testAmbiguousNamespaceRecordsDiagnostic() {
            ResolutionDiagnostics diagnostics = new ResolutionDiagnostics();
            
            assertEquals("System.Drawing.Color",
                    TypeResolver.normalizeTypeReference("System.Drawing.Color", diagnostics));
            
            List<ResolutionDiagnostics.Diagnostic> ambiguous =
                    diagnostics.getDiagnostics(ResolutionDiagnostics.Kind.AMBIGUOUS_TYPE);
            assertEquals(1, ambiguous.size());
            assertEquals("System.Drawing.Color", ambiguous.get(0).getSubject());
            assertTrue(ambiguous.get(0).getMessage().contains("[sd1, sd2]"));
        }
        
        @Test
        void testUnmappedNamespaceRecordsDiagnostic() {
            ResolutionDiagnostics diagnostics = new ResolutionDiagnostics();
            
            assertEquals("Acme.Widgets.Gadget",
                    TypeResolver.normalizeTypeReference("Acme.Widgets.Gadget", diagnostics));
            assertEquals(1, diagnostics.getDiagnostics(ResolutionDiagnostics.Kind.UNMAPPED_TYPE).size());
        }
        
        @Test
        void testResolvedNameRecordsNothing() {
            ResolutionDiagnostics diagnostics = new ResolutionDiagnostics();
            TypeResolver.normalizeTypeReference("System.Data.DataColumn", diagnostics);
            assertFalse(diagnostics.hasDiagnostics());
        }
    }
    
    static Stream<Arguments> normalizationCases() {
        return Stream.of(
                Arguments.of("x:String", "x:String"),
                Arguments.of("DataTable", "DataTable"),
                Arguments.of("System.String", "x:String"),
                Arguments.of("System.Exception", "s:Exception"),
                Arguments.of("System.Data.DataColumn", "sd:DataColumn"),
                Arguments.of("System.Uri", "s:Uri"),
                Arguments.of("UiPath.Core.Activities.LogMessage", "ui:LogMessage"),
                Arguments.of("System.Drawing.Color", "System.Drawing.Color"),
                Arguments.of("", ""));
    }
    
    @Nested
    @DisplayName("Argument types")
    class ArgumentTypes {
        
        @Test
        void testParseOutArgumentWithGeneric() {
            ArgumentType type = TypeResolver.parseArgumentType("OutArgument(scg:List(x:String))");
            assertEquals(ArgumentDirection.OUT, type.getDirection());
            assertEquals("scg:List(x:String)", type.getTypeReference());
        }
        
        @Test
        void testParseInOutArgument() {
            ArgumentType type = TypeResolver.parseArgumentType("InOutArgument(x:Int32)");
            assertEquals(ArgumentDirection.IN_OUT, type.getDirection());
            assertEquals("x:Int32", type.getTypeReference());
        }
        
        @Test
        void testUnwrappedTypeIsInArgument() {
            ArgumentType type = TypeResolver.parseArgumentType("sd:DataTable");
            assertEquals(ArgumentDirection.IN, type.getDirection());
            assertEquals("sd:DataTable", type.getTypeReference());
        }
        
        @Test
        void testFormatArgumentType() {
            assertEquals("OutArgument(sd:DataTable)",
                    TypeResolver.formatArgumentType(ArgumentDirection.OUT, "DataTable"));
            assertEquals("InArgument(scg:List(x:String))",
                    TypeResolver.formatArgumentType(null, "List<String>"));
            assertEquals("InOutArgument(x:String)",
                    TypeResolver.formatArgumentType(ArgumentDirection.IN_OUT, null));
        }
        
        @Test
        void testFormatThenParse() {
            String formatted = TypeResolver.formatArgumentType(ArgumentDirection.OUT, "Dictionary<String, Int32>");
            ArgumentType parsed = TypeResolver.parseArgumentType(formatted);
            assertEquals(ArgumentDirection.OUT, parsed.getDirection());
            assertEquals("Dictionary<String, Int32>", TypeResolver.toJsonType(parsed.getTypeReference()));
        }
    }
    
    @Test
    void testSplitTypeArgumentsRespectsNesting() {
        assertEquals(List.of("scg:List(x:String)", "x:Object"),
                TypeResolver.splitTypeArguments("scg:List(x:String), x:Object"));
        assertEquals(List.of("Dictionary<String, Int32>", "Object"),
                TypeResolver.splitTypeArguments("Dictionary<String, Int32>,Object"));
        assertTrue(TypeResolver.splitTypeArguments(null).isEmpty());
    }
    
    @Test
    void testPrefixOf() {
        assertEquals("sd", TypeResolver.prefixOf("sd:DataTable"));
        assertNull(TypeResolver.prefixOf("DataTable"));
    }
}
