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

package dev.mars.flowbridge.namespace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static, build-time-fixed namespace vocabulary of the workflow document format.
 * <p>
 * Maps canonical prefixes to namespace URIs, prefixes to the CLR-style imports and
 * assemblies they imply, and carries the baseline sets every fresh document needs.
 * All tables are immutable and iterate in declaration order.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class NamespaceRegistry {
    
    /** Prefix of the default (activities) namespace. */
    public static final String DEFAULT_PREFIX = "";
    
    private static final Map<String, String> NAMESPACES;
    private static final Map<String, String> URI_TO_PREFIX;
    private static final Set<String> BASELINE_PREFIXES;
    private static final Map<String, List<String>> PREFIX_TO_IMPORTS;
    private static final Map<String, List<String>> PREFIX_TO_ASSEMBLIES;
    private static final List<String> BASELINE_IMPORTS;
    private static final Map<String, String> IMPORT_TO_ASSEMBLY;
    private static final List<String> DEFAULT_ASSEMBLY_REFERENCES;
    
    static {
        Map<String, String> namespaces = new LinkedHashMap<>();
        namespaces.put(DEFAULT_PREFIX, "http://schemas.microsoft.com/netfx/2009/xaml/activities");
        namespaces.put("mc", "http://schemas.openxmlformats.org/markup-compatibility/2006");
        namespaces.put("mva", "clr-namespace:Microsoft.VisualBasic.Activities;assembly=System.Activities");
        namespaces.put("s", "clr-namespace:System;assembly=System.Private.CoreLib");
        namespaces.put("sap", "http://schemas.microsoft.com/netfx/2009/xaml/activities/presentation");
        namespaces.put("sap2010", "http://schemas.microsoft.com/netfx/2010/xaml/activities/presentation");
        namespaces.put("scg", "clr-namespace:System.Collections.Generic;assembly=System.Private.CoreLib");
        namespaces.put("sco", "clr-namespace:System.Collections.ObjectModel;assembly=System.Private.CoreLib");
        namespaces.put("sd", "clr-namespace:System.Data;assembly=System.Data.Common");
        namespaces.put("sd1", "clr-namespace:System.Drawing;assembly=System.Drawing.Primitives");
        namespaces.put("sd2", "clr-namespace:System.Drawing;assembly=System.Drawing.Common");
        namespaces.put("ui", "http://schemas.uipath.com/workflow/activities");
        namespaces.put("ue", "clr-namespace:UiPath.Excel;assembly=UiPath.Excel.Activities");
        namespaces.put("ueab", "clr-namespace:UiPath.Excel.Activities.Business;assembly=UiPath.Excel.Activities");
        namespaces.put("uix", "http://schemas.uipath.com/workflow/activities/uix");
        namespaces.put("x", "http://schemas.microsoft.com/winfx/2006/xaml");
        namespaces.put("av", "http://schemas.microsoft.com/winfx/2006/xaml/presentation");
        NAMESPACES = Collections.unmodifiableMap(namespaces);
        
        Map<String, String> uriToPrefix = new LinkedHashMap<>();
        namespaces.forEach((prefix, uri) -> uriToPrefix.put(uri, prefix));
        URI_TO_PREFIX = Collections.unmodifiableMap(uriToPrefix);
        
        // Every registry prefix is declared on a written document
        BASELINE_PREFIXES = Collections.unmodifiableSet(new LinkedHashSet<>(namespaces.keySet()));
        
        Map<String, List<String>> imports = new LinkedHashMap<>();
        imports.put("s", List.of("System"));
        imports.put("sd", List.of("System.Data"));
        imports.put("scg", List.of("System.Collections.Generic"));
        imports.put("sco", List.of("System.Collections.ObjectModel"));
        imports.put("ue", List.of("UiPath.Excel", "UiPath.Excel.Activities", "UiPath.Excel.Activities.Business"));
        imports.put("ueab", List.of("UiPath.Excel.Activities.Business"));
        imports.put("ui", List.of("UiPath.Core", "UiPath.Core.Activities"));
        imports.put("sd1", List.of("System.Drawing"));
        imports.put("sd2", List.of("System.Drawing"));
        imports.put("uix", List.of("UiPath.UIAutomationNext.Activities", "UiPath.UIAutomationNext.Enums"));
        imports.put("av", List.of("System.Windows", "System.Windows.Markup"));
        PREFIX_TO_IMPORTS = Collections.unmodifiableMap(imports);
        
        Map<String, List<String>> assemblies = new LinkedHashMap<>();
        assemblies.put("s", List.of("System.Private.CoreLib"));
        assemblies.put("sd", List.of("System.Data.Common", "System.Data"));
        assemblies.put("scg", List.of("System.Private.CoreLib"));
        assemblies.put("sco", List.of("System.Private.CoreLib"));
        assemblies.put("ue", List.of("UiPath.Excel.Activities", "UiPath.Excel"));
        assemblies.put("ueab", List.of("UiPath.Excel.Activities"));
        assemblies.put("ui", List.of("UiPath.System.Activities"));
        assemblies.put("uix", List.of("UiPath.UIAutomation.Activities"));
        assemblies.put("mva", List.of("System.Activities"));
        assemblies.put("sd1", List.of("System.Drawing.Primitives"));
        assemblies.put("sd2", List.of("System.Drawing.Common"));
        assemblies.put("av", List.of("PresentationFramework", "PresentationCore", "WindowsBase"));
        assemblies.put("x", List.of());
        assemblies.put("mc", List.of());
        assemblies.put("sap", List.of());
        assemblies.put("sap2010", List.of());
        PREFIX_TO_ASSEMBLIES = Collections.unmodifiableMap(assemblies);
        
        BASELINE_IMPORTS = List.of(
                "System",
                "System.Collections.Generic",
                "System.Collections.ObjectModel",
                "System.Data",
                "System.Drawing",
                "System.Linq",
                "UiPath.Core",
                "UiPath.Core.Activities",
                "UiPath.Excel",
                "UiPath.Excel.Activities",
                "UiPath.Excel.Activities.Business");
        
        Map<String, String> importToAssembly = new LinkedHashMap<>();
        importToAssembly.put("Microsoft.VisualBasic", "Microsoft.VisualBasic");
        importToAssembly.put("Microsoft.VisualBasic.Activities", "System.Activities");
        importToAssembly.put("System", "mscorlib");
        importToAssembly.put("System.Activities", "System.Activities");
        importToAssembly.put("System.Activities.Expressions", "System.Activities");
        importToAssembly.put("System.Activities.Statements", "System.Activities");
        importToAssembly.put("System.Activities.Validation", "System.Activities");
        importToAssembly.put("System.Activities.XamlIntegration", "System.Activities");
        importToAssembly.put("System.Collections", "mscorlib");
        importToAssembly.put("System.Collections.Generic", "mscorlib");
        importToAssembly.put("System.Collections.ObjectModel", "mscorlib");
        importToAssembly.put("System.Data", "System.Data");
        importToAssembly.put("System.Diagnostics", "System");
        importToAssembly.put("System.Drawing", "System.Drawing");
        importToAssembly.put("System.IO", "mscorlib");
        importToAssembly.put("System.Linq", "System.Core");
        importToAssembly.put("System.Net.Mail", "System.Net.Mail");
        importToAssembly.put("System.Windows", "PresentationFramework");
        importToAssembly.put("System.Windows.Markup", "PresentationFramework");
        importToAssembly.put("System.Xml", "System.Xml");
        importToAssembly.put("System.Xml.Linq", "System.Xml.Linq");
        importToAssembly.put("UiPath.Core", "UiPath.System.Activities");
        importToAssembly.put("UiPath.Core.Activities", "UiPath.System.Activities");
        importToAssembly.put("UiPath.Excel", "UiPath.Excel.Activities");
        importToAssembly.put("UiPath.Excel.Activities", "UiPath.Excel.Activities");
        importToAssembly.put("UiPath.Excel.Activities.Business", "UiPath.Excel.Activities");
        importToAssembly.put("UiPath.UIAutomationNext.Activities", "UiPath.UIAutomation.Activities");
        importToAssembly.put("UiPath.UIAutomationNext.Enums", "UiPath.UIAutomation.Activities");
        IMPORT_TO_ASSEMBLY = Collections.unmodifiableMap(importToAssembly);
        
        DEFAULT_ASSEMBLY_REFERENCES = List.of(
                "Microsoft.CSharp",
                "Microsoft.VisualBasic",
                "mscorlib",
                "PresentationCore",
                "PresentationFramework",
                "System",
                "System.Activities",
                "System.ComponentModel.Composition",
                "System.ComponentModel.TypeConverter",
                "System.Core",
                "System.Data",
                "System.Data.Common",
                "System.Data.DataSetExtensions",
                "System.Drawing",
                "System.Drawing.Common",
                "System.Drawing.Primitives",
                "System.Linq",
                "System.Memory",
                "System.ObjectModel",
                "System.Private.CoreLib",
                "System.Private.ServiceModel",
                "System.Runtime.Serialization",
                "System.ServiceModel",
                "System.ServiceModel.Activities",
                "System.Xaml",
                "System.Xml",
                "System.Xml.Linq",
                "UiPath.Excel",
                "UiPath.Excel.Activities",
                "UiPath.Mail.Activities",
                "UiPath.System.Activities",
                "UiPath.UIAutomation.Activities",
                "WindowsBase");
    }
    
    private NamespaceRegistry() {
    }
    
    /**
     * Canonical prefix to namespace URI, including the default namespace under {@code ""}.
     */
    public static Map<String, String> namespaces() {
        return NAMESPACES;
    }
    
    public static boolean isCanonicalPrefix(String prefix) {
        return prefix != null && NAMESPACES.containsKey(prefix);
    }
    
    public static String uriFor(String prefix) {
        return prefix == null ? null : NAMESPACES.get(prefix);
    }
    
    /**
     * Returns the canonical prefix the registry associates with a URI, or {@code null}.
     */
    public static String canonicalPrefixFor(String uri) {
        return uri == null ? null : URI_TO_PREFIX.get(uri);
    }
    
    /**
     * Namespace URI to canonical prefix for every registry entry.
     */
    public static Map<String, String> canonicalPrefixes() {
        return URI_TO_PREFIX;
    }
    
    public static Set<String> baselinePrefixes() {
        return BASELINE_PREFIXES;
    }
    
    public static Map<String, List<String>> prefixImports() {
        return PREFIX_TO_IMPORTS;
    }
    
    public static List<String> importsFor(String prefix) {
        return PREFIX_TO_IMPORTS.getOrDefault(prefix, List.of());
    }
    
    public static List<String> assembliesFor(String prefix) {
        return PREFIX_TO_ASSEMBLIES.getOrDefault(prefix, List.of());
    }
    
    public static List<String> baselineImports() {
        return BASELINE_IMPORTS;
    }
    
    public static String assemblyForImport(String importName) {
        return importName == null ? null : IMPORT_TO_ASSEMBLY.get(importName);
    }
    
    public static List<String> defaultAssemblyReferences() {
        return DEFAULT_ASSEMBLY_REFERENCES;
    }
}
