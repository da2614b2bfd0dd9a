/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import static com.salesforce.mpst.ast.Interactions.message;
import static com.salesforce.mpst.ast.Interactions.parallel;
import static com.salesforce.mpst.ast.Interactions.protocol;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.salesforce.mpst.projection.CfsmAnalysis;

public class LocalConcurrencyTest {

    @Test
    public void interleavesTwoBranches() throws Exception {
        var par = protocol("Par", List.of("A", "B", "C"), parallel(message("A", "B", "x"), message("A", "C", "y")));
        var a = SafetyCheckerTest.cfsms(par).get("A");
        assertEquals(1, a.regions().size());

        var flat = LocalConcurrency.flatten(a, 100);
        assertTrue(flat.regions().isEmpty());
        assertEquals(Set.of("s0", "s1", "s6", "s1[s2|s3]", "s1[s6|s3]", "s1[s2|s6]"), flat.states());
        assertEquals(Set.of("s0 -tau-> s1", "s1 -tau-> s1[s2|s3]", "s1[s2|s3] -B!x[]-> s1[s6|s3]",
                            "s1[s2|s3] -C!y[]-> s1[s2|s6]", "s1[s6|s3] -C!y[]-> s6", "s1[s2|s6] -B!x[]-> s6"),
                     Set.copyOf(flat.transitions().stream().map(Object::toString).toList()));
        assertEquals(Set.of("s6"), flat.terminalStates());
        assertEquals(a.initialState(), flat.initialState());
        assertEquals(Set.of(List.of("B!x[]", "C!y[]"), List.of("C!y[]", "B!x[]")),
                     Set.copyOf(CfsmAnalysis.traces(flat, 10)
                                            .stream()
                                            .map(t -> t.stream().map(Object::toString).toList())
                                            .toList()));
    }

    @Test
    public void nestedRegionsExpandInnermostFirst() throws Exception {
        var nested = protocol("Nested", List.of("A", "B", "C", "D"),
                              parallel(message("A", "B", "x"),
                                       parallel(message("A", "C", "y"), message("A", "D", "z"))));
        var a = SafetyCheckerTest.cfsms(nested).get("A");
        assertEquals(2, a.regions().size());

        var flat = LocalConcurrency.flatten(a, 100);
        assertTrue(flat.regions().isEmpty());
        var traces = CfsmAnalysis.traces(flat, 20);
        assertEquals(6, traces.size());
        assertTrue(traces.stream().allMatch(t -> t.size() == 3));
    }

    @Test
    public void productBeyondBoundIsRejected() throws Exception {
        var par = protocol("Par", List.of("A", "B", "C"), parallel(message("A", "B", "x"), message("A", "C", "y")));
        var a = SafetyCheckerTest.cfsms(par).get("A");
        assertThrows(StateSpaceExceededException.class, () -> LocalConcurrency.flatten(a, 2));
    }

    @Test
    public void sequentialAutomatonIsUnchanged() throws Exception {
        var b = SafetyCheckerTest.cfsms(SafetyCheckerTest.requestResponse()).get("B");
        assertSame(b, LocalConcurrency.flatten(b, 1));
    }
}
