/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import static com.salesforce.mpst.ast.Interactions.alternative;
import static com.salesforce.mpst.ast.Interactions.choice;
import static com.salesforce.mpst.ast.Interactions.cont;
import static com.salesforce.mpst.ast.Interactions.message;
import static com.salesforce.mpst.ast.Interactions.protocol;
import static com.salesforce.mpst.ast.Interactions.recursion;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.salesforce.mpst.projection.Cfsm;
import com.salesforce.mpst.projection.CfsmAction.Receive;
import com.salesforce.mpst.projection.CfsmAction.Send;
import com.salesforce.mpst.projection.StateKind;

public class SimulatorTest {

    private final Simulator simulator = new Simulator(SafetyParameters.newBuilder().build());

    @Test
    public void boundedByStepLimit() throws Exception {
        var stream = protocol("Stream", List.of("A", "B"),
                              recursion("X", choice("A", alternative("more", message("A", "B", "more"), cont("X")),
                                                    alternative("stop", message("A", "B", "stop")))));
        var trace = simulator.run(SafetyCheckerTest.cfsms(stream), 5);

        assertEquals(5, trace.steps());
        assertEquals(6, trace.configurations().size());
        assertTrue(trace.communications().stream().allMatch(c -> c.label().equals("more")));
        assertFalse(trace.completed());
        assertFalse(trace.stuck());
    }

    @Test
    public void runsToCompletion() throws Exception {
        var trace = simulator.run(SafetyCheckerTest.cfsms(SafetyCheckerTest.login()), 10);

        assertTrue(trace.completed());
        assertFalse(trace.stuck());
        assertEquals(List.of("S->C:login", "C->A:passwd", "A->S:auth"),
                     trace.communications().stream().map(Object::toString).toList());
        assertTrue(trace.last().isTerminal());
    }

    @Test
    public void stuckWhenNoCommunicationMatches() throws Exception {
        var a = Cfsm.newBuilder("P", "A");
        var a0 = a.newState(StateKind.PLAIN);
        a.setInitialState(a0).addTransition(a0, a.newState(StateKind.PLAIN), new Send("B", "m", List.of()));
        var b = Cfsm.newBuilder("P", "B");
        var b0 = b.newState(StateKind.PLAIN);
        b.setInitialState(b0).addTransition(b0, b.newState(StateKind.PLAIN), new Receive("A", "n", List.of()));

        var trace = simulator.run(Map.of("A", a.build(), "B", b.build()), 10);
        assertEquals(0, trace.steps());
        assertTrue(trace.stuck());
        assertFalse(trace.completed());
        assertEquals(Map.of("A", "s0", "B", "s0"), trace.last().states());
    }
}
