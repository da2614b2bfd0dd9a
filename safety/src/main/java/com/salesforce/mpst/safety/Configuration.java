/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.salesforce.mpst.projection.Cfsm;
import com.salesforce.mpst.projection.CfsmTransition;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A snapshot of every role's current state. Configurations are values: equality is over the role to state mapping
 * only, and a step produces a new configuration. The automata are shared and read only.
 */
public final class Configuration {

    /**
     * The configuration placing every role at the initial state of its automaton
     */
    public static Configuration initial(Map<String, Cfsm> machines) {
        var states = ImmutableSortedMap.<String, String>naturalOrder();
        machines.forEach((role, cfsm) -> states.put(role, cfsm.initialState()));
        return new Configuration(ImmutableMap.copyOf(machines), states.build());
    }

    private final int                                 hash;
    private final ImmutableMap<String, Cfsm>          machines;
    private final ImmutableSortedMap<String, String> states;

    private Configuration(ImmutableMap<String, Cfsm> machines, ImmutableSortedMap<String, String> states) {
        this.machines = machines;
        this.states = states;
        this.hash = states.hashCode();
    }

    /**
     * Answer the configuration with the given roles moved to the given states
     */
    public Configuration advance(Map<String, String> moves) {
        if (moves.isEmpty()) {
            return this;
        }
        var next = ImmutableSortedMap.<String, String>naturalOrder();
        states.forEach((role, state) -> next.put(role, moves.getOrDefault(role, state)));
        return new Configuration(machines, next.build());
    }

    public Configuration advance(String role, String state) {
        return advance(Map.of(role, state));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Configuration other && hash == other.hash && states.equals(other.states);
    }

    public boolean hasRole(String role) {
        return states.containsKey(role);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Answer true if every role rests in a terminal state or reaches one over taus alone
     */
    public boolean isTerminal() {
        return states.entrySet().stream().allMatch(e -> {
            var cfsm = machines.get(e.getKey());
            return TauClosure.silentlyReachable(cfsm, e.getValue()).stream().anyMatch(cfsm::isTerminal);
        });
    }

    public Cfsm machine(String role) {
        var cfsm = machines.get(role);
        if (cfsm == null) {
            throw new IllegalArgumentException("No role: " + role + " in " + this);
        }
        return cfsm;
    }

    public Map<String, Cfsm> machines() {
        return machines;
    }

    public List<CfsmTransition> outgoing(String role) {
        return machine(role).outgoing(state(role));
    }

    public Set<String> roles() {
        return states.keySet();
    }

    public String state(String role) {
        var state = states.get(role);
        if (state == null) {
            throw new IllegalArgumentException("No role: " + role + " in " + this);
        }
        return state;
    }

    public Map<String, String> states() {
        return states;
    }

    @Override
    public String toString() {
        return states.toString();
    }
}
