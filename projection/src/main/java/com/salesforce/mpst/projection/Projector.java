/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import com.salesforce.mpst.cfg.Cfg;
import com.salesforce.mpst.cfg.CfgEdge;
import com.salesforce.mpst.cfg.CfgNode;
import com.salesforce.mpst.cfg.CfgVisitor;
import com.salesforce.mpst.cfg.NodeKind;
import com.salesforce.mpst.projection.CfsmAction.Receive;
import com.salesforce.mpst.projection.CfsmAction.Send;
import com.salesforce.mpst.projection.ProjectionError.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.salesforce.mpst.projection.CfsmAction.TAU;

/**
 * Projects a control flow graph onto the communicating automaton of each role.
 * <p>
 * The walk is over <code>(cfg node, cfsm state)</code> pairs. Actions the role takes no part in are skipped
 * without a state or transition, so the role's automaton only carries its own sends and receives plus the tau
 * transitions that join branches, loops and parallel regions. Back edges are resolved in a second pass, once the
 * state every loop head was first reached at is known.
 */
public final class Projector {

    private static class RoleProjection implements CfgVisitor<Void, String> {
        record BackEdge(String from, CfgEdge edge) {
        }

        record PendingRegion(String fork, int join, List<String> entries) {
        }

        record Visit(int node, String state) {
        }

        private final Map<Integer, String>   arrivals      = new HashMap<>();
        private final Set<Integer>           backEdges;
        private final Map<String, Integer>   branchStates  = new LinkedHashMap<>();
        private final Cfg                    cfg;
        private final List<ProjectionError>  errors        = new ArrayList<>();
        private final Map<Integer, String>   joinStates    = new HashMap<>();
        private final Map<Integer, String>   loopEntries   = new HashMap<>();
        private final Cfsm.Builder           machine;
        private final Map<Integer, String>   mergeStates   = new HashMap<>();
        private final Map<String, Integer>   participation = new HashMap<>();
        private final List<BackEdge>         pending       = new ArrayList<>();
        private final List<PendingRegion>    regions       = new ArrayList<>();
        private final String                 role;
        private final Set<Visit>             visited       = new HashSet<>();
        private final Deque<Visit>           worklist      = new ArrayDeque<>();

        RoleProjection(Cfg cfg, String role, Set<Integer> backEdges) {
            this.cfg = cfg;
            this.role = role;
            this.backEdges = backEdges;
            this.machine = Cfsm.newBuilder(cfg.protocol(), role);
        }

        @Override
        public Void visitAction(CfgNode.Action node, String state) {
            var action = node.action();
            var current = state;
            if (action.sender().equals(role)) {
                for (var receiver : action.receivers()) {
                    var next = machine.newState(StateKind.PLAIN);
                    machine.addTransition(current, next, new Send(receiver, action.label(), action.payloadTypes()));
                    current = next;
                }
            }
            if (action.receivers().contains(role)) {
                var next = machine.newState(StateKind.PLAIN);
                machine.addTransition(current, next,
                                      new Receive(action.sender(), action.label(), action.payloadTypes()));
                current = next;
            }
            forward(node, current);
            return null;
        }

        @Override
        public Void visitBranch(CfgNode.Branch node, String state) {
            if (machine.kind(state) == StateKind.PLAIN) {
                machine.setKind(state,
                                node.decider().equals(role) ? StateKind.INTERNAL_CHOICE : StateKind.EXTERNAL_CHOICE);
            }
            // merge, join and loop entry states keep their kind but still open a choice
            if (!node.decider().equals(role)) {
                branchStates.putIfAbsent(state, node.id());
            }
            forward(node, state);
            return null;
        }

        @Override
        public Void visitFork(CfgNode.Fork node, String state) {
            var join = cfg.join(node.parallelId());
            if (join.isEmpty()) {
                errors.add(new ProjectionError(Kind.MALFORMED_GRAPH, role, node.id(),
                                               "fork " + node.parallelId() + " has no unique join"));
                return null;
            }
            var joinId = join.get().id();
            var participating = cfg.outgoing(node.id())
                                   .stream()
                                   .filter(e -> !backEdges.contains(e.id()))
                                   .filter(e -> participates(e.target(), joinId))
                                   .toList();
            participation.put(node.parallelId(), participating.size());
            switch (participating.size()) {
            case 0 -> enqueue(joinId, state);
            case 1 -> enqueue(participating.get(0).target(), state);
            default -> {
                var fork = machine.newState(StateKind.FORK);
                machine.addTransition(state, fork, TAU);
                var entries = new ArrayList<String>();
                for (var edge : participating) {
                    var entry = machine.newState(StateKind.PLAIN);
                    machine.addTransition(fork, entry, TAU);
                    entries.add(entry);
                    enqueue(edge.target(), entry);
                }
                regions.add(new PendingRegion(fork, joinId, entries));
            }
            }
            return null;
        }

        @Override
        public Void visitInitial(CfgNode.Initial node, String state) {
            forward(node, state);
            return null;
        }

        @Override
        public Void visitJoin(CfgNode.Join node, String state) {
            if (participation.getOrDefault(node.parallelId(), 0) < 2) {
                forward(node, state);
                return null;
            }
            var join = joinStates.computeIfAbsent(node.id(), k -> machine.newState(StateKind.JOIN));
            if (!join.equals(state)) {
                machine.addTransition(state, join, TAU);
            }
            forward(node, join);
            return null;
        }

        @Override
        public Void visitMerge(CfgNode.Merge node, String state) {
            var merge = mergeStates.computeIfAbsent(node.id(), k -> machine.newState(StateKind.MERGE));
            if (!merge.equals(state)) {
                machine.addTransition(state, merge, TAU);
            }
            forward(node, merge);
            return null;
        }

        @Override
        public Void visitRecursive(CfgNode.Recursive node, String state) {
            var entry = state;
            var kind = machine.kind(state);
            if (kind.isChoice() || kind == StateKind.FORK) {
                // a back edge into a shared choice state would re-offer the sibling alternatives
                entry = machine.newState(StateKind.PLAIN);
                machine.addTransition(state, entry, TAU);
            }
            var existing = loopEntries.putIfAbsent(node.id(), entry);
            if (existing != null) {
                if (!existing.equals(entry)) {
                    machine.addTransition(entry, existing, TAU);
                }
                return null;
            }
            forward(node, entry);
            return null;
        }

        @Override
        public Void visitTerminal(CfgNode.Terminal node, String state) {
            machine.markTerminal(state);
            return null;
        }

        Cfsm run() {
            var initial = machine.newState(StateKind.PLAIN);
            machine.setInitialState(initial);
            enqueue(cfg.initial().id(), initial);
            while (!worklist.isEmpty()) {
                var visit = worklist.poll();
                arrivals.putIfAbsent(visit.node(), visit.state());
                log.trace("Projecting: {} node: {} at: {}", role, cfg.node(visit.node()), visit.state());
                cfg.node(visit.node()).accept(this, visit.state());
            }
            resolveBackEdges();
            closeRegions();
            checkDeterminism();
            if (!errors.isEmpty()) {
                throw new ProjectionException(errors);
            }
            return machine.build();
        }

        private void checkDeterminism() {
            branchStates.forEach((state, branch) -> {
                var byMessage = machine.outgoing(state)
                                       .stream()
                                       .filter(t -> t.action() instanceof Receive)
                                       .collect(Collectors.groupingBy(t -> {
                                           var receive = (Receive) t.action();
                                           return receive.from() + "?" + receive.label();
                                       }, LinkedHashMap::new, Collectors.counting()));
                byMessage.forEach((message, count) -> {
                    if (count > 1) {
                        errors.add(new ProjectionError(Kind.NONDETERMINISTIC_CHOICE, role, branch,
                                                       "alternatives of choice at state " + state
                                                       + " both begin with " + message));
                    }
                });
            });
        }

        private void closeRegions() {
            for (var region : regions) {
                var join = joinStates.get(region.join());
                if (join == null) {
                    errors.add(new ProjectionError(Kind.MALFORMED_GRAPH, role, region.join(),
                                                   "parallel branches from " + region.fork() + " never join"));
                } else {
                    machine.addRegion(new ParallelRegion(region.fork(), join, region.entries()));
                }
            }
        }

        private void enqueue(int node, String state) {
            var visit = new Visit(node, state);
            if (visited.add(visit)) {
                worklist.add(visit);
            }
        }

        private void forward(CfgNode node, String state) {
            for (var edge : cfg.outgoing(node.id())) {
                if (backEdges.contains(edge.id())) {
                    pending.add(new BackEdge(state, edge));
                } else {
                    enqueue(edge.target(), state);
                }
            }
        }

        /**
         * Answer true if the role takes part in any action between the start and the join
         */
        private boolean participates(int start, int join) {
            var seen = new HashSet<Integer>();
            var stack = new ArrayDeque<Integer>();
            stack.push(start);
            while (!stack.isEmpty()) {
                var current = stack.pop();
                if (current == join || !seen.add(current)) {
                    continue;
                }
                if (cfg.node(current) instanceof CfgNode.Action a && a.action().involves(role)) {
                    return true;
                }
                cfg.outgoing(current)
                   .stream()
                   .filter(e -> !backEdges.contains(e.id()))
                   .forEach(e -> stack.push(e.target()));
            }
            return false;
        }

        private void resolveBackEdges() {
            for (var back : pending) {
                var target = cfg.node(back.edge().target());
                var to = target.kind() == NodeKind.RECURSIVE ? loopEntries.get(target.id())
                                                             : arrivals.get(target.id());
                if (to == null) {
                    var label = target instanceof CfgNode.Recursive r ? r.label() : String.valueOf(target.id());
                    errors.add(new ProjectionError(Kind.UNRESOLVED_RECURSION_LABEL, role, target.id(),
                                                   "back edge to " + label + " has no loop entry"));
                } else if (!to.equals(back.from())) {
                    machine.addTransition(back.from(), to, TAU);
                }
            }
        }
    }

    private static final Logger log = LoggerFactory.getLogger(Projector.class);

    /**
     * Answer the ids of the edges that close a cycle: every <code>continue</code> edge, plus the depth first back
     * edges of any cycle a hand assembled graph closes without one
     */
    public static Set<Integer> backEdges(Cfg cfg) {
        var back = new HashSet<Integer>();
        cfg.edges().stream().filter(CfgEdge::isBackEdge).forEach(e -> back.add(e.id()));

        var onPath = new HashSet<Integer>();
        var done = new HashSet<Integer>();
        var path = new ArrayDeque<Integer>();
        var iterators = new ArrayDeque<Iterator<CfgEdge>>();
        var start = cfg.initial().id();
        onPath.add(start);
        path.push(start);
        iterators.push(cfg.outgoing(start).iterator());
        while (!iterators.isEmpty()) {
            var edges = iterators.peek();
            if (!edges.hasNext()) {
                iterators.pop();
                var node = path.pop();
                onPath.remove(node);
                done.add(node);
                continue;
            }
            var edge = edges.next();
            if (back.contains(edge.id())) {
                continue;
            }
            if (onPath.contains(edge.target())) {
                back.add(edge.id());
            } else if (!done.contains(edge.target())) {
                onPath.add(edge.target());
                path.push(edge.target());
                iterators.push(cfg.outgoing(edge.target()).iterator());
            }
        }
        return back;
    }

    /**
     * Project the graph onto one role
     *
     * @throws ProjectionException if the role cannot be projected
     */
    public static Cfsm project(Cfg cfg, String role) {
        if (!cfg.roles().contains(role)) {
            throw new ProjectionException(new ProjectionError(Kind.UNKNOWN_ROLE, role, -1,
                                                              "not a role of " + cfg.protocol() + cfg.roles()));
        }
        var cfsm = new RoleProjection(cfg, role, backEdges(cfg)).run();
        log.debug("Projected: {} onto: {} states: {} transitions: {}", cfg.protocol(), role, cfsm.states().size(),
                  cfsm.transitions().size());
        return cfsm;
    }

    /**
     * Project the graph onto every declared role. Roles that fail are reported and omitted from the result.
     */
    public static ProjectionResult projectAll(Cfg cfg) {
        var cfsms = new LinkedHashMap<String, Cfsm>();
        var errors = new ArrayList<ProjectionError>();
        var back = backEdges(cfg);
        for (var role : cfg.roles()) {
            try {
                cfsms.put(role, new RoleProjection(cfg, role, back).run());
            } catch (ProjectionException e) {
                log.debug("Unable to project: {} onto: {} errors: {}", cfg.protocol(), role, e.getErrors());
                errors.addAll(e.getErrors());
            }
        }
        return new ProjectionResult(cfsms, errors);
    }

    private Projector() {
    }
}
