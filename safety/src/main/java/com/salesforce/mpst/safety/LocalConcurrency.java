/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import com.salesforce.mpst.projection.Cfsm;
import com.salesforce.mpst.projection.ParallelRegion;
import com.salesforce.mpst.projection.StateKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.salesforce.mpst.projection.CfsmAction.TAU;

/**
 * Expands the parallel regions of an automaton into the interleaving product of their branches, so that a role's
 * position in a configuration remains a single state. Nested regions are expanded innermost first.
 */
public final class LocalConcurrency {

    private static final Logger log = LoggerFactory.getLogger(LocalConcurrency.class);

    /**
     * Answer an equivalent automaton without parallel regions
     *
     * @throws StateSpaceExceededException if a product exceeds the state bound
     */
    public static Cfsm flatten(Cfsm cfsm, int maxStates) {
        var current = cfsm;
        while (!current.regions().isEmpty()) {
            current = new LocalConcurrency(current, innermost(current), maxStates).expand();
        }
        return current;
    }

    private static ParallelRegion innermost(Cfsm cfsm) {
        for (var region : cfsm.regions()) {
            var inside = new HashSet<String>();
            region.branchEntries().forEach(entry -> inside.addAll(branch(cfsm, entry, region.join())));
            if (cfsm.regions().stream().noneMatch(other -> other != region && inside.contains(other.fork()))) {
                return region;
            }
        }
        throw new IllegalStateException("Parallel regions of: " + cfsm.role() + " are not properly nested");
    }

    /**
     * The states reachable from the entry before the join
     */
    private static Set<String> branch(Cfsm cfsm, String entry, String join) {
        var seen = new HashSet<String>();
        var stack = new ArrayDeque<String>();
        stack.push(entry);
        while (!stack.isEmpty()) {
            var state = stack.pop();
            if (!state.equals(join) && seen.add(state)) {
                cfsm.outgoing(state).forEach(t -> stack.push(t.target()));
            }
        }
        return seen;
    }

    private final List<Set<String>> branches = new ArrayList<>();
    private final Cfsm              cfsm;
    private final Set<String>       inside   = new HashSet<>();
    private final int               maxStates;
    private final ParallelRegion    region;

    private LocalConcurrency(Cfsm cfsm, ParallelRegion region, int maxStates) {
        this.cfsm = cfsm;
        this.region = region;
        this.maxStates = maxStates;
        for (var entry : region.branchEntries()) {
            var states = branch(cfsm, entry, region.join());
            branches.add(states);
            inside.addAll(states);
        }
    }

    /**
     * Follow forced tau transitions of one branch, stopping at the join
     */
    private String close(String state) {
        var seen = new HashSet<String>();
        seen.add(state);
        while (!state.equals(region.join())) {
            var outgoing = cfsm.outgoing(state);
            if (outgoing.size() != 1 || !outgoing.get(0).action().isTau() || !seen.add(outgoing.get(0).target())) {
                break;
            }
            state = outgoing.get(0).target();
        }
        return state;
    }

    private Cfsm expand() {
        var builder = Cfsm.newBuilder(cfsm.protocol(), cfsm.role());
        for (var state : cfsm.states()) {
            if (!inside.contains(state)) {
                builder.addState(state, cfsm.kind(state));
            }
        }
        builder.setInitialState(cfsm.initialState());
        cfsm.terminalStates().stream().filter(s -> !inside.contains(s)).forEach(builder::markTerminal);
        cfsm.regions().stream().filter(r -> !r.equals(region)).forEach(builder::addRegion);
        for (var transition : cfsm.transitions()) {
            if (!inside.contains(transition.source()) && !transition.source().equals(region.fork())) {
                builder.addTransition(transition.source(), transition.target(), transition.action());
            }
        }

        var start = region.branchEntries().stream().map(this::close).toList();
        var ids = new HashMap<List<String>, String>();
        var frontier = new ArrayDeque<List<String>>();
        builder.addTransition(region.fork(), id(start, ids, builder), TAU);
        frontier.add(start);
        var expanded = new HashSet<List<String>>();
        while (!frontier.isEmpty()) {
            var product = frontier.poll();
            if (!expanded.add(product)) {
                continue;
            }
            var source = id(product, ids, builder);
            for (int i = 0; i < product.size(); i++) {
                var component = product.get(i);
                if (component.equals(region.join())) {
                    continue;
                }
                for (var transition : cfsm.outgoing(component)) {
                    var next = new ArrayList<>(product);
                    next.set(i, close(transition.target()));
                    var successor = List.copyOf(next);
                    builder.addTransition(source, id(successor, ids, builder), transition.action());
                    frontier.add(successor);
                }
            }
        }
        log.trace("Expanded region: {} of: {} into: {} states", region.fork(), cfsm.role(), ids.size());
        return builder.build();
    }

    private String id(List<String> product, Map<List<String>, String> ids, Cfsm.Builder builder) {
        var existing = ids.get(product);
        if (existing != null) {
            return existing;
        }
        if (ids.size() >= maxStates) {
            throw new StateSpaceExceededException(
            "Parallel region: " + region.fork() + " of: " + cfsm.role() + " exceeds: " + maxStates + " states");
        }
        String id;
        if (product.stream().allMatch(region.join()::equals)) {
            id = region.join();
        } else {
            id = region.fork() + "[" + String.join("|", product) + "]";
            builder.addState(id, StateKind.PLAIN);
        }
        ids.put(product, id);
        return id;
    }
}
