/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import static com.salesforce.mpst.projection.CfsmAction.TAU;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.salesforce.mpst.projection.CfsmAction.Receive;
import com.salesforce.mpst.projection.CfsmAction.Send;

public class CfsmAnalysisTest {

    /**
     * s0 offers B!more and B!stop; more loops back through s1
     */
    private static Cfsm stream() {
        var builder = Cfsm.newBuilder("Stream", "A");
        var s0 = builder.newState(StateKind.INTERNAL_CHOICE);
        var s1 = builder.newState(StateKind.PLAIN);
        var s2 = builder.newState(StateKind.PLAIN);
        builder.setInitialState(s0);
        builder.addTransition(s0, s1, new Send("B", "more", List.of()));
        builder.addTransition(s0, s2, new Send("B", "stop", List.of()));
        builder.addTransition(s1, s0, TAU);
        builder.markTerminal(s2);
        return builder.build();
    }

    @Test
    public void builderRejectsDuplicatesAndUnknownStates() throws Exception {
        var builder = Cfsm.newBuilder("P", "A");
        var s0 = builder.newState(StateKind.PLAIN);
        builder.setInitialState(s0);
        builder.addState("s1", StateKind.PLAIN);
        assertEquals("s2", builder.newState(StateKind.PLAIN));
        assertThrows(IllegalArgumentException.class, () -> builder.addState("s1", StateKind.MERGE));
        assertThrows(IllegalArgumentException.class, () -> builder.addTransition(s0, "nowhere", TAU));

        var receive = new Receive("B", "m", List.of());
        assertTrue(builder.addTransition(s0, "s1", receive));
        assertFalse(builder.addTransition(s0, "s1", receive));
        assertEquals(1, builder.build().transitions().size());
    }

    @Test
    public void cyclesAndBranching() throws Exception {
        var cfsm = stream();
        assertTrue(CfsmAnalysis.hasCycles(cfsm));
        assertEquals(List.of("s1 -tau-> s0"), CfsmAnalysis.backEdges(cfsm).stream().map(Object::toString).toList());
        assertEquals(Set.of("s0"), CfsmAnalysis.branchingStates(cfsm));
        assertTrue(CfsmAnalysis.mergeStates(cfsm).isEmpty());
        assertTrue(CfsmAnalysis.isChoiceDeterministic(cfsm));
        assertEquals(Set.of("more", "stop"), CfsmAnalysis.messageLabels(cfsm));
    }

    @Test
    public void nondeterministicSends() throws Exception {
        var builder = Cfsm.newBuilder("P", "A");
        var s0 = builder.newState(StateKind.INTERNAL_CHOICE);
        var s1 = builder.newState(StateKind.PLAIN);
        var s2 = builder.newState(StateKind.PLAIN);
        builder.setInitialState(s0);
        builder.addTransition(s0, s1, new Send("B", "m", List.of()));
        builder.addTransition(s0, s2, new Send("B", "m", List.of()));
        var cfsm = builder.build();

        assertFalse(CfsmAnalysis.isChoiceDeterministic(cfsm));
        assertFalse(CfsmAnalysis.hasCycles(cfsm));
        assertFalse(CfsmAnalysis.canReachTerminal(cfsm, s0));
    }

    @Test
    public void reachability() throws Exception {
        var cfsm = stream();
        assertEquals(Set.of("s0", "s1", "s2"), CfsmAnalysis.reachable(cfsm, "s1"));
        assertEquals(Set.of("s2"), CfsmAnalysis.reachable(cfsm, "s2"));
        assertTrue(CfsmAnalysis.canReachTerminal(cfsm, "s1"));
    }

    @Test
    public void tracesSkipSilentSteps() throws Exception {
        var traces = CfsmAnalysis.traces(stream(), 4)
                                 .stream()
                                 .map(t -> t.stream().map(a -> ((Send) a).label()).toList())
                                 .toList();
        assertEquals(List.of(List.of("more", "more"), List.of("more", "stop"), List.of("stop")), traces);
    }
}
