/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import com.salesforce.mpst.projection.Cfsm;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Deterministic tau closure. A role moves over a tau transition only when it is the single transition leaving its
 * state: that is forced internal progress. A tau offered beside other transitions is an unresolved alternative and
 * is left in place.
 */
public interface TauClosure {

    static Configuration close(Configuration configuration) {
        var moves = new HashMap<String, String>();
        for (var role : configuration.roles()) {
            var cfsm = configuration.machine(role);
            var state = configuration.state(role);
            var seen = new HashSet<String>();
            seen.add(state);
            while (true) {
                var outgoing = cfsm.outgoing(state);
                if (outgoing.size() != 1 || !outgoing.get(0).action().isTau()) {
                    break;
                }
                var target = outgoing.get(0).target();
                if (!seen.add(target)) {
                    break;
                }
                state = target;
            }
            if (!state.equals(configuration.state(role))) {
                moves.put(role, state);
            }
        }
        return configuration.advance(moves);
    }

    static boolean isClosed(Configuration configuration) {
        return close(configuration).equals(configuration);
    }

    /**
     * The states reachable from the given one over tau transitions alone, the state itself first
     */
    static Set<String> silentlyReachable(Cfsm cfsm, String state) {
        var reached = new LinkedHashSet<String>();
        var pending = new ArrayDeque<String>();
        reached.add(state);
        pending.add(state);
        while (!pending.isEmpty()) {
            for (var transition : cfsm.outgoing(pending.poll())) {
                if (transition.action().isTau() && reached.add(transition.target())) {
                    pending.add(transition.target());
                }
            }
        }
        return reached;
    }
}
