/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.verification;

import com.salesforce.mpst.cfg.Cfg;
import com.salesforce.mpst.cfg.CfgEdge;
import com.salesforce.mpst.cfg.CfgNode;
import com.salesforce.mpst.cfg.EdgeKind;
import com.salesforce.mpst.cfg.MessageAction;
import com.salesforce.mpst.cfg.NodeKind;
import com.salesforce.mpst.verification.Finding.AmbiguousChoice;
import com.salesforce.mpst.verification.Finding.DeadlockCycle;
import com.salesforce.mpst.verification.Finding.ForkJoinMismatch;
import com.salesforce.mpst.verification.Finding.LivenessWarning;
import com.salesforce.mpst.verification.Finding.ParallelConflict;
import com.salesforce.mpst.verification.Finding.ProgressViolation;
import com.salesforce.mpst.verification.Finding.RaceWarning;
import com.salesforce.mpst.verification.Finding.UnusedRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.IntPredicate;

/**
 * Static checks over a control flow graph. Every enabled check runs to completion and contributes its findings to
 * the report; none of them stops another.
 */
public class CfgVerifier {

    private static final Logger log = LoggerFactory.getLogger(CfgVerifier.class);

    private final VerifierOptions options;

    public CfgVerifier() {
        this(VerifierOptions.defaults());
    }

    public CfgVerifier(VerifierOptions options) {
        this.options = options;
    }

    /**
     * Alternatives of a choice whose first messages coincide
     */
    public List<AmbiguousChoice> ambiguousChoices(Cfg cfg) {
        var findings = new ArrayList<AmbiguousChoice>();
        for (var branch : cfg.nodes(NodeKind.BRANCH)) {
            var seen = new HashSet<List<String>>();
            var reported = new HashSet<List<String>>();
            for (var edge : cfg.outgoing(branch.id())) {
                if (edge.kind() == EdgeKind.CONTINUE) {
                    continue;
                }
                for (var action : firstActions(cfg, edge.target())) {
                    for (var receiver : action.receivers()) {
                        var key = List.of(action.sender(), receiver, action.label());
                        if (!seen.add(key) && reported.add(key)) {
                            findings.add(new AmbiguousChoice(branch.id(), action.sender(), receiver, action.label()));
                        }
                    }
                }
            }
        }
        return findings;
    }

    /**
     * Strongly connected components whose cycles are not all closed by <code>continue</code> edges
     */
    public List<DeadlockCycle> deadlockCycles(Cfg cfg) {
        var components = StronglyConnectedComponents.of(cfg.size(), v -> cfg.outgoing(v)
                                                                           .stream()
                                                                           .mapToInt(CfgEdge::target)
                                                                           .toArray());
        var cycles = new ArrayList<DeadlockCycle>();
        for (var component : components) {
            var members = new HashSet<>(component);
            var selfLoop = component.size() == 1 && cfg.outgoing(component.get(0))
                                                       .stream()
                                                       .anyMatch(e -> e.target() == component.get(0));
            if (component.size() == 1 && !selfLoop) {
                continue;
            }
            if (cyclicWithoutContinue(cfg, members)) {
                cycles.add(new DeadlockCycle(component));
            }
        }
        return cycles;
    }

    /**
     * Forks whose parallel id lacks a unique join, branches that never reach it, and joins without a fork
     */
    public List<ForkJoinMismatch> forkJoinMismatches(Cfg cfg) {
        var mismatches = new ArrayList<ForkJoinMismatch>();
        var forked = new HashSet<String>();
        for (var node : cfg.nodes(NodeKind.FORK)) {
            var fork = (CfgNode.Fork) node;
            forked.add(fork.parallelId());
            var joins = cfg.nodes(NodeKind.JOIN)
                           .stream()
                           .filter(n -> ((CfgNode.Join) n).parallelId().equals(fork.parallelId()))
                           .toList();
            if (joins.size() != 1) {
                mismatches.add(new ForkJoinMismatch(fork.parallelId(), fork.id(),
                                                    "expected one join but found " + joins.size()));
                continue;
            }
            var join = joins.get(0).id();
            var branches = cfg.outgoing(fork.id());
            for (int i = 0; i < branches.size(); i++) {
                if (!reachable(cfg, branches.get(i).target(), n -> n == join).contains(join)) {
                    mismatches.add(new ForkJoinMismatch(fork.parallelId(), fork.id(),
                                                        "branch " + i + " never reaches join " + join));
                }
            }
        }
        for (var node : cfg.nodes(NodeKind.JOIN)) {
            var join = (CfgNode.Join) node;
            if (!forked.contains(join.parallelId())) {
                mismatches.add(new ForkJoinMismatch(join.parallelId(), join.id(), "join without a fork"));
            }
        }
        return mismatches;
    }

    /**
     * Nodes reachable from the initial node that cannot reach any terminal node
     */
    public Optional<LivenessWarning> liveness(Cfg cfg) {
        var reachable = reachable(cfg, cfg.initial().id(), n -> false);
        var live = new HashSet<Integer>();
        var stack = new ArrayDeque<Integer>();
        cfg.terminals().forEach(t -> stack.push(t.id()));
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (live.add(node)) {
                cfg.incoming(node).forEach(e -> stack.push(e.source()));
            }
        }
        var trapped = new TreeSet<>(reachable);
        trapped.removeAll(live);
        if (trapped.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LivenessWarning(List.copyOf(trapped), trapped.contains(cfg.initial().id())));
    }

    /**
     * Roles sending in two branches of one fork, and messages carried by two branches of one fork
     */
    public void parallelism(Cfg cfg, List<ParallelConflict> conflicts, List<RaceWarning> races) {
        for (var node : cfg.nodes(NodeKind.FORK)) {
            var fork = (CfgNode.Fork) node;
            var join = cfg.join(fork.parallelId());
            if (join.isEmpty()) {
                continue;
            }
            var joinId = join.get().id();
            var branches = new ArrayList<List<MessageAction>>();
            for (var edge : cfg.outgoing(fork.id())) {
                var actions = new ArrayList<MessageAction>();
                for (var id : reachable(cfg, edge.target(), n -> n == joinId)) {
                    if (cfg.node(id) instanceof CfgNode.Action a) {
                        actions.add(a.action());
                    }
                }
                branches.add(actions);
            }
            for (int i = 0; i < branches.size(); i++) {
                for (int j = i + 1; j < branches.size(); j++) {
                    var senders = senders(branches.get(i));
                    senders.retainAll(senders(branches.get(j)));
                    for (var role : senders) {
                        conflicts.add(new ParallelConflict(fork.parallelId(), fork.id(), role, i, j));
                    }
                    var triples = triples(branches.get(i));
                    triples.retainAll(triples(branches.get(j)));
                    for (var triple : triples) {
                        races.add(new RaceWarning(fork.parallelId(), fork.id(), triple.get(0), triple.get(1),
                                                  triple.get(2), i, j));
                    }
                }
            }
        }
    }

    /**
     * Non terminal nodes without outgoing edges
     */
    public List<ProgressViolation> progressViolations(Cfg cfg) {
        var violations = new ArrayList<ProgressViolation>();
        for (var node : cfg.nodes()) {
            if (node.kind() != NodeKind.TERMINAL && cfg.outgoing(node.id()).isEmpty()) {
                violations.add(new ProgressViolation(node.id(), describe(node)));
            }
        }
        return violations;
    }

    /**
     * Declared roles that take part in no message
     */
    public List<UnusedRole> unusedRoles(Cfg cfg) {
        var used = new HashSet<String>();
        for (var node : cfg.nodes(NodeKind.ACTION)) {
            var action = ((CfgNode.Action) node).action();
            used.add(action.sender());
            used.addAll(action.receivers());
        }
        return cfg.roles().stream().filter(r -> !used.contains(r)).map(UnusedRole::new).toList();
    }

    public VerificationReport verify(Cfg cfg) {
        var conflicts = new ArrayList<ParallelConflict>();
        var races = new ArrayList<RaceWarning>();
        if (options.parallelConflicts() || options.races()) {
            parallelism(cfg, conflicts, races);
        }
        var report = new VerificationReport(options.deadlocks() ? deadlockCycles(cfg) : List.of(),
                                            options.progress() ? progressViolations(cfg) : List.of(),
                                            options.liveness() ? liveness(cfg) : Optional.empty(),
                                            options.forkJoin() ? forkJoinMismatches(cfg) : List.of(),
                                            options.parallelConflicts() ? conflicts : List.of(),
                                            options.races() ? races : List.of(),
                                            options.choiceDeterminism() ? ambiguousChoices(cfg) : List.of(),
                                            options.connectedness() ? unusedRoles(cfg) : List.of(),
                                            options.strict());
        log.debug("Verified: {} errors: {} warnings: {}", cfg.protocol(), report.errors().size(),
                  report.warnings().size());
        return report;
    }

    private boolean cyclicWithoutContinue(Cfg cfg, Set<Integer> members) {
        var inDegree = new HashMap<Integer, Integer>();
        members.forEach(m -> inDegree.put(m, 0));
        Function<Integer, List<CfgEdge>> internal = v -> cfg.outgoing(v)
                                                            .stream()
                                                            .filter(e -> e.kind() != EdgeKind.CONTINUE)
                                                            .filter(e -> members.contains(e.target()))
                                                            .toList();
        members.forEach(m -> internal.apply(m).forEach(e -> inDegree.merge(e.target(), 1, Integer::sum)));
        var ready = new ArrayDeque<Integer>();
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                ready.add(node);
            }
        });
        var removed = 0;
        while (!ready.isEmpty()) {
            var node = ready.poll();
            removed++;
            for (var edge : internal.apply(node)) {
                if (inDegree.merge(edge.target(), -1, Integer::sum) == 0) {
                    ready.add(edge.target());
                }
            }
        }
        return removed < members.size();
    }

    private String describe(CfgNode node) {
        if (node instanceof CfgNode.Action a) {
            return a.action().toString();
        }
        return node.kind().name().toLowerCase();
    }

    /**
     * The first action nodes reached from the start without passing another action
     */
    private List<MessageAction> firstActions(Cfg cfg, int start) {
        var actions = new ArrayList<MessageAction>();
        var seen = new HashSet<Integer>();
        var stack = new ArrayDeque<Integer>();
        stack.push(start);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (!seen.add(node)) {
                continue;
            }
            if (cfg.node(node) instanceof CfgNode.Action a) {
                actions.add(a.action());
                continue;
            }
            cfg.outgoing(node)
               .stream()
               .filter(e -> e.kind() != EdgeKind.CONTINUE)
               .forEach(e -> stack.push(e.target()));
        }
        return actions;
    }

    /**
     * Nodes reachable from the start, not expanding past nodes matching the stop predicate
     */
    private Set<Integer> reachable(Cfg cfg, int start, IntPredicate stop) {
        var seen = new LinkedHashSet<Integer>();
        var stack = new ArrayDeque<Integer>();
        stack.push(start);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (!seen.add(node) || stop.test(node)) {
                continue;
            }
            cfg.outgoing(node).forEach(e -> stack.push(e.target()));
        }
        return seen;
    }

    private Set<String> senders(List<MessageAction> actions) {
        var senders = new TreeSet<String>();
        actions.forEach(a -> senders.add(a.sender()));
        return senders;
    }

    private Set<List<String>> triples(List<MessageAction> actions) {
        var triples = new LinkedHashSet<List<String>>();
        for (var action : actions) {
            for (var receiver : action.receivers()) {
                triples.add(List.of(action.sender(), receiver, action.label()));
            }
        }
        return triples;
    }
}
