/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The communicating finite state machine of one role. Actions live on transitions; choice is several
 * transitions leaving one state. Immutable once built.
 */
public final class Cfsm {

    public static Builder newBuilder(String protocol, String role) {
        return new Builder(protocol, role);
    }

    private final String                                        initialState;
    private final ImmutableListMultimap<String, CfsmTransition> outgoing;
    private final String                                        protocol;
    private final ImmutableList<ParallelRegion>                 regions;
    private final String                                        role;
    private final ImmutableMap<String, StateKind>               states;
    private final ImmutableSet<String>                          terminalStates;
    private final ImmutableList<CfsmTransition>                 transitions;

    private Cfsm(Builder builder) {
        protocol = builder.protocol;
        role = builder.role;
        states = ImmutableMap.copyOf(builder.states);
        transitions = ImmutableList.copyOf(builder.transitions);
        initialState = Objects.requireNonNull(builder.initialState, "initial state");
        terminalStates = ImmutableSet.copyOf(builder.terminalStates);
        regions = ImmutableList.copyOf(builder.regions);
        var out = ImmutableListMultimap.<String, CfsmTransition>builder();
        transitions.forEach(t -> out.put(t.source(), t));
        outgoing = out.build();
    }

    public String initialState() {
        return initialState;
    }

    public boolean isTerminal(String state) {
        return terminalStates.contains(state);
    }

    public StateKind kind(String state) {
        var kind = states.get(state);
        if (kind == null) {
            throw new IllegalArgumentException("No state: " + state + " in CFSM of: " + role);
        }
        return kind;
    }

    public List<CfsmTransition> outgoing(String state) {
        return outgoing.get(state);
    }

    public String protocol() {
        return protocol;
    }

    public List<CfsmTransition> receives() {
        return transitions.stream().filter(t -> t.action().kind() == CfsmAction.Kind.RECEIVE).toList();
    }

    public List<ParallelRegion> regions() {
        return regions;
    }

    public String role() {
        return role;
    }

    public List<CfsmTransition> sends() {
        return transitions.stream().filter(t -> t.action().kind() == CfsmAction.Kind.SEND).toList();
    }

    public Set<String> states() {
        return states.keySet();
    }

    public Set<String> terminalStates() {
        return terminalStates;
    }

    public List<CfsmTransition> transitions() {
        return transitions;
    }

    @Override
    public String toString() {
        var buff = new StringBuilder("CFSM ").append(role).append('@').append(protocol).append('\n');
        for (var state : states.keySet()) {
            buff.append("  ").append(state).append(' ').append(states.get(state));
            if (state.equals(initialState)) {
                buff.append(" initial");
            }
            if (terminalStates.contains(state)) {
                buff.append(" terminal");
            }
            buff.append('\n');
            outgoing(state).forEach(t -> buff.append("    ").append(t).append('\n'));
        }
        return buff.toString();
    }

    public static class Builder {
        private final String                 protocol;
        private final List<ParallelRegion>   regions        = new ArrayList<>();
        private final String                 role;
        private final Map<String, StateKind> states         = new LinkedHashMap<>();
        private final Set<String>            terminalStates = new LinkedHashSet<>();
        private final Set<CfsmTransition>    transitions    = new LinkedHashSet<>();
        private String                       initialState;
        private int                          nextState;

        private Builder(String protocol, String role) {
            this.protocol = protocol;
            this.role = Objects.requireNonNull(role, "role");
        }

        public Builder addRegion(ParallelRegion region) {
            regions.add(region);
            return this;
        }

        public Builder addState(String id, StateKind kind) {
            if (states.putIfAbsent(id, kind) != null) {
                throw new IllegalArgumentException("Duplicate state: " + id + " in CFSM of: " + role);
            }
            return this;
        }

        /**
         * Add the transition unless an identical one exists
         *
         * @return true if the transition was added
         */
        public boolean addTransition(String source, String target, CfsmAction action) {
            if (!states.containsKey(source) || !states.containsKey(target)) {
                throw new IllegalArgumentException(
                "Unknown endpoint of transition: " + source + " -> " + target + " in CFSM of: " + role);
            }
            return transitions.add(new CfsmTransition(source, target, action));
        }

        public Cfsm build() {
            return new Cfsm(this);
        }

        public StateKind kind(String state) {
            return states.get(state);
        }

        public Builder markTerminal(String state) {
            terminalStates.add(state);
            return this;
        }

        public String newState(StateKind kind) {
            String id;
            do {
                id = "s" + nextState++;
            } while (states.containsKey(id));
            states.put(id, kind);
            return id;
        }

        public List<CfsmTransition> outgoing(String state) {
            return transitions.stream().filter(t -> t.source().equals(state)).toList();
        }

        public Builder setInitialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder setKind(String state, StateKind kind) {
            states.replace(state, kind);
            return this;
        }
    }
}
