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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RemediationAdvisor}.
 */
class RemediationAdvisorTest {
    
    private final RemediationAdvisor advisor = new RemediationAdvisor();
    
    private static ValidationFailure failure(FailureCategory category, String... nodes) {
        return new ValidationFailure(category, "rule", "details", List.of(nodes));
    }
    
    @Test
    void testNoFailuresNoAdvice() {
        assertTrue(advisor.advise(List.of()).isEmpty());
        assertTrue(advisor.advise(null).isEmpty());
    }
    
    @Test
    void testStructuralTakesPriority() {
        Optional<RemediationAdvisor.Remediation> advice = advisor.advise(List.of(
                failure(FailureCategory.CIRCULAR, "__ReferenceID0"),
                failure(FailureCategory.REACHABILITY, "__ReferenceID1"),
                failure(FailureCategory.STRUCTURAL, "lost")));
        
        assertTrue(advice.isPresent());
        assertEquals(FailureCategory.STRUCTURAL, advice.get().getCategory());
        assertEquals("Nest FlowStep/FlowDecision inside Flowchart container", advice.get().getFix());
    }
    
    @Test
    void testCircularSuggestsBreakingThePath() {
        RemediationAdvisor.Remediation advice = advisor.advise(List.of(
                failure(FailureCategory.REACHABILITY, "__ReferenceID3"),
                failure(FailureCategory.CIRCULAR, "__ReferenceID0", "__ReferenceID1"))).orElseThrow();
        
        assertEquals(FailureCategory.CIRCULAR, advice.getCategory());
        assertEquals("Review path: __ReferenceID0 → __ReferenceID1 and set one 'next' to null",
                advice.getRetrySuggestion());
    }
    
    @Test
    void testReachabilityListsOrphans() {
        RemediationAdvisor.Remediation advice = advisor.advise(List.of(
                failure(FailureCategory.REFERENCE, "__ReferenceID0"),
                failure(FailureCategory.REACHABILITY, "__ReferenceID2", "__ReferenceID4"))).orElseThrow();
        
        assertEquals(FailureCategory.REACHABILITY, advice.getCategory());
        assertEquals("Add reference from existing node to: __ReferenceID2, __ReferenceID4",
                advice.getRetrySuggestion());
    }
    
    @Test
    void testReferenceOnly() {
        RemediationAdvisor.Remediation advice = advisor.advise(List.of(
                failure(FailureCategory.REFERENCE, "__ReferenceID0"))).orElseThrow();
        
        assertEquals(FailureCategory.REFERENCE, advice.getCategory());
        assertTrue(advice.getRetrySuggestion().startsWith("Use sequential IDs"));
    }
}
