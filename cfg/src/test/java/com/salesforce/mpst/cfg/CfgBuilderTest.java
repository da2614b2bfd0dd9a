/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import static com.salesforce.mpst.ast.Interactions.alternative;
import static com.salesforce.mpst.ast.Interactions.choice;
import static com.salesforce.mpst.ast.Interactions.cont;
import static com.salesforce.mpst.ast.Interactions.invoke;
import static com.salesforce.mpst.ast.Interactions.message;
import static com.salesforce.mpst.ast.Interactions.parallel;
import static com.salesforce.mpst.ast.Interactions.protocol;
import static com.salesforce.mpst.ast.Interactions.recursion;
import static com.salesforce.mpst.ast.Interactions.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.salesforce.mpst.ast.GlobalProtocol;
import com.salesforce.mpst.ast.ProtocolModule;
import com.salesforce.mpst.cfg.StructuralError.Kind;

public class CfgBuilderTest {

    private static Set<Kind> kinds(CfgResult result) {
        return result.errors().stream().map(StructuralError::kind).collect(Collectors.toSet());
    }

    @Test
    public void branchesMergeOnlyFromAlternativesThatComplete() {
        var p = protocol("Loop", List.of("A", "B"),
                         recursion("X", choice("A", alternative("more", message("A", "B", "more"), cont("X")),
                                               alternative("stop", message("A", "B", "stop")))));
        var cfg = CfgBuilder.buildCfg(p).get();

        var merges = cfg.nodes(NodeKind.MERGE);
        assertEquals(1, merges.size());
        var incoming = cfg.incoming(merges.get(0).id());
        assertEquals(1, incoming.size());
        assertEquals("stop", ((CfgNode.Action) cfg.node(incoming.get(0).source())).action().label());

        var continues = cfg.edges().stream().filter(e -> e.kind() == EdgeKind.CONTINUE).toList();
        assertEquals(1, continues.size());
        assertEquals(NodeKind.RECURSIVE, cfg.node(continues.get(0).target()).kind());
        assertEquals("X", continues.get(0).label());
    }

    @Test
    public void choiceAtRole() {
        var p = protocol("Choice", List.of("A", "B"),
                         choice("A", alternative("yes", message("A", "B", "yes")),
                                alternative("no", message("A", "B", "no"))));
        var cfg = CfgBuilder.buildCfg(p).get();

        assertEquals(6, cfg.size());
        var branch = (CfgNode.Branch) cfg.node(1);
        assertEquals("A", branch.decider());
        var alternatives = cfg.outgoing(branch.id());
        assertEquals(2, alternatives.size());
        assertEquals(EdgeKind.BRANCH, alternatives.get(0).kind());
        assertEquals("yes", alternatives.get(0).label());
        assertEquals("no", alternatives.get(1).label());

        var merge = cfg.nodes(NodeKind.MERGE).get(0);
        assertEquals(2, cfg.incoming(merge.id()).size());
        assertTrue(cfg.incoming(merge.id()).stream().allMatch(e -> e.kind() == EdgeKind.MESSAGE));
        assertEquals(NodeKind.TERMINAL, cfg.node(cfg.outgoing(merge.id()).get(0).target()).kind());
    }

    @Test
    public void collectsErrorsOfEveryAlternative() {
        var p = protocol("Broken", List.of("A", "B"),
                         choice("A", alternative("left", message("A", "X", "m")),
                                alternative("right", message("B", "A", "n"), cont("Y"))));
        var result = CfgBuilder.buildCfg(p);

        assertFalse(result.isValid());
        assertEquals(Set.of(Kind.UNKNOWN_ROLE, Kind.UNKNOWN_RECURSION_LABEL), kinds(result));
        assertTrue(result.errors().stream().allMatch(e -> e.protocol().equals("Broken")));
    }

    @Test
    public void continueMayNotLeaveParallelBranch() {
        var p = protocol("Escape", List.of("A", "B"),
                         recursion("X", parallel(sequence(message("A", "B", "m"), cont("X")), message("B", "A", "n"))));
        var result = CfgBuilder.buildCfg(p);

        assertFalse(result.isValid());
        assertTrue(kinds(result).contains(Kind.CONTINUE_ESCAPES_PARALLEL));
    }

    @Test
    public void invocationIsClonedPerCallSite() {
        var ping = protocol("Ping", List.of("P", "Q"), message("P", "Q", "ping"), message("Q", "P", "pong"));
        var main = protocol("Main", List.of("A", "B", "C"), invoke("Ping", "A", "B"), invoke("Ping", "B", "C"));
        var cfg = CfgBuilder.buildCfg(main, ProtocolModule.of(main, ping)).get();

        assertEquals(8, cfg.size());
        var actions = cfg.nodes(NodeKind.ACTION)
                         .stream()
                         .map(n -> ((CfgNode.Action) n).action().toString())
                         .toList();
        assertEquals(List.of("A->B:ping", "B->A:pong", "B->C:ping", "C->B:pong"), actions);

        assertEquals(EdgeKind.EPSILON, cfg.edges().get(2).kind());
        assertEquals(2, cfg.edges().get(2).source());
        assertEquals(3, cfg.edges().get(2).target());
        assertEquals(NodeKind.MERGE, cfg.node(3).kind());
        assertEquals(NodeKind.MERGE, cfg.node(6).kind());
        assertEquals(List.of("A", "B", "C"), cfg.roles());
    }

    @Test
    public void invocationValidation() {
        var ping = protocol("Ping", List.of("P", "Q"), message("P", "Q", "ping"));
        var arity = protocol("Arity", List.of("A", "B"), invoke("Ping", "A"));
        var alias = protocol("Alias", List.of("A", "B"), invoke("Ping", "A", "A"));
        var scope = protocol("Scope", List.of("A", "B"), invoke("Ping", "A", "Z"));
        var unknown = protocol("Unknown", List.of("A", "B"), invoke("Pong", "A", "B"));
        var module = ProtocolModule.of(ping, arity, alias, scope, unknown);

        assertEquals(Set.of(Kind.ARITY_MISMATCH), kinds(CfgBuilder.buildCfg(arity, module)));
        assertEquals(Set.of(Kind.ROLE_ALIASING), kinds(CfgBuilder.buildCfg(alias, module)));
        assertEquals(Set.of(Kind.UNKNOWN_ROLE), kinds(CfgBuilder.buildCfg(scope, module)));
        assertEquals(Set.of(Kind.UNKNOWN_PROTOCOL), kinds(CfgBuilder.buildCfg(unknown, module)));
    }

    @Test
    public void malformedMessages() {
        assertEquals(Set.of(Kind.SELF_COMMUNICATION),
                     kinds(CfgBuilder.buildCfg(protocol("Self", List.of("A", "B"), message("A", "A", "m")))));
        assertEquals(Set.of(Kind.BLANK_LABEL),
                     kinds(CfgBuilder.buildCfg(protocol("Blank", List.of("A", "B"), message("A", "B", " ")))));
        assertEquals(Set.of(Kind.DUPLICATE_ROLE),
                     kinds(CfgBuilder.buildCfg(protocol("Twice", List.of("A", "A"), message("A", "B", "m")))));
        assertEquals(Set.of(Kind.EMPTY_COMPOSITE),
                     kinds(CfgBuilder.buildCfg(protocol("Empty", List.of("A", "B"), choice("A")))));
    }

    @Test
    public void mutualRecursionIsRejected() {
        var even = protocol("Even", List.of("A", "B"), message("A", "B", "e"), invoke("Odd", "A", "B"));
        var odd = protocol("Odd", List.of("A", "B"), message("B", "A", "o"), invoke("Even", "A", "B"));
        var result = CfgBuilder.buildCfg(even, ProtocolModule.of(even, odd));

        assertFalse(result.isValid());
        assertEquals(Set.of(Kind.RECURSIVE_INVOCATION), kinds(result));
    }

    @Test
    public void nestedLoopsRebindTheirLabel() {
        var p = protocol("Nested", List.of("A", "B"), recursion("X", choice("A", alternative("outer",
                                                                                           message("A", "B", "a"),
                                                                                           recursion("X",
                                                                                                     message("A", "B",
                                                                                                             "b"),
                                                                                                     cont("X"))),
                                                                            alternative("done",
                                                                                        message("A", "B", "done")))));
        var cfg = CfgBuilder.buildCfg(p).get();

        var heads = cfg.nodes(NodeKind.RECURSIVE);
        assertEquals(2, heads.size());
        var inner = heads.get(1).id();
        var continues = cfg.edges().stream().filter(CfgEdge::isBackEdge).toList();
        assertEquals(1, continues.size());
        assertEquals(inner, continues.get(0).target());
    }

    @Test
    public void parallelBranchesShareForkAndJoin() {
        var p = protocol("Par", List.of("A", "B", "C"),
                         parallel(message("A", "B", "x"), parallel(message("B", "C", "y"), message("C", "A", "z"))));
        var cfg = CfgBuilder.buildCfg(p).get();

        var forks = cfg.nodes(NodeKind.FORK);
        var joins = cfg.nodes(NodeKind.JOIN);
        assertEquals(2, forks.size());
        assertEquals(2, joins.size());
        var outer = (CfgNode.Fork) forks.get(0);
        var inner = (CfgNode.Fork) forks.get(1);
        assertNotEquals(outer.parallelId(), inner.parallelId());
        assertTrue(cfg.join(outer.parallelId()).isPresent());
        assertTrue(cfg.join(inner.parallelId()).isPresent());
        assertEquals(2, cfg.outgoing(outer.id()).size());
        assertTrue(cfg.outgoing(outer.id()).stream().allMatch(e -> e.kind() == EdgeKind.FORK));
        assertEquals(2, cfg.incoming(cfg.join(inner.parallelId()).get().id()).size());
    }

    @Test
    public void parallelBranchMustReachJoin() {
        var p = protocol("Stuck", List.of("A", "B"),
                         recursion("X", parallel(message("A", "B", "m"), recursion("Y", message("B", "A", "n"),
                                                                                    cont("Y")))));
        var result = CfgBuilder.buildCfg(p);

        assertFalse(result.isValid());
        assertEquals(Set.of(Kind.UNMATCHED_FORK_JOIN), kinds(result));
    }

    @Test
    public void requestResponse() {
        var p = protocol("RequestResponse", List.of("A", "B"), message("A", "B", "Req"), message("B", "A", "Res"));
        var result = CfgBuilder.buildCfg(p);
        assertTrue(result.isValid());
        var cfg = result.get();

        assertEquals(4, cfg.size());
        assertEquals(NodeKind.INITIAL, cfg.initial().kind());
        assertEquals(1, cfg.outgoing(cfg.initial().id()).size());
        assertEquals(EdgeKind.SEQUENCE, cfg.edges().get(0).kind());
        assertEquals(EdgeKind.MESSAGE, cfg.edges().get(1).kind());
        assertEquals("Req", cfg.edges().get(1).action().label());
        assertEquals(EdgeKind.MESSAGE, cfg.edges().get(2).kind());
        assertEquals(1, cfg.terminals().size());
        assertTrue(cfg.outgoing(cfg.terminals().get(0).id()).isEmpty());
    }

    @Test
    public void tailSelfInvocationLoops() {
        var p = protocol("Ticker", List.of("A", "B"), message("A", "B", "tick"), invoke("Ticker", "A", "B"));
        var cfg = CfgBuilder.buildCfg(p).get();

        var head = cfg.nodes(NodeKind.RECURSIVE);
        assertEquals(1, head.size());
        var back = cfg.edges().stream().filter(CfgEdge::isBackEdge).toList();
        assertEquals(1, back.size());
        assertEquals(head.get(0).id(), back.get(0).target());
        assertTrue(cfg.incoming(cfg.terminals().get(0).id()).isEmpty());

        var swapped = protocol("Swap", List.of("A", "B"), message("A", "B", "tick"), invoke("Swap", "B", "A"));
        assertEquals(Set.of(Kind.RECURSIVE_INVOCATION), kinds(CfgBuilder.buildCfg(swapped)));
        var notTail = protocol("NotTail", List.of("A", "B"), invoke("NotTail", "A", "B"), message("A", "B", "m"));
        assertEquals(Set.of(Kind.RECURSIVE_INVOCATION), kinds(CfgBuilder.buildCfg(notTail)));
    }

    @Test
    public void unreachableStatementAfterContinue() {
        var p = protocol("Dead", List.of("A", "B"), recursion("X", message("A", "B", "m"), cont("X"),
                                                              message("B", "A", "never")));
        var result = CfgBuilder.buildCfg(p);

        assertFalse(result.isValid());
        assertEquals(Set.of(Kind.UNREACHABLE_STATEMENT), kinds(result));
    }

    @Test
    public void unknownProtocolByName() {
        var builder = new CfgBuilder(ProtocolModule.of());
        var result = builder.build("Missing");
        assertFalse(result.isValid());
        assertEquals(Set.of(Kind.UNKNOWN_PROTOCOL), kinds(result));
    }

    @Test
    public void templatesAreNeverShared() {
        var ping = protocol("Ping", List.of("P", "Q"), message("P", "Q", "ping"));
        var main = protocol("Main", List.of("A", "B"), invoke("Ping", "A", "B"), invoke("Ping", "B", "A"));
        var builder = new CfgBuilder(ProtocolModule.of(main, ping));
        var template = builder.build("Ping").get();
        var cfg = builder.build(main).get();

        assertEquals(3, template.size());
        assertEquals("P->Q:ping", ((CfgNode.Action) template.node(1)).action().toString());
        var actions = cfg.nodes(NodeKind.ACTION);
        assertEquals(2, actions.size());
        assertNotEquals(actions.get(0).id(), actions.get(1).id());
        assertEquals("B->A:ping", ((CfgNode.Action) actions.get(1)).action().toString());
    }

    @Test
    public void emptyBodyConnectsInitialToTerminal() {
        GlobalProtocol p = protocol("Nothing", List.of("A"), sequence());
        var cfg = CfgBuilder.buildCfg(p).get();
        assertEquals(2, cfg.size());
        assertEquals(NodeKind.TERMINAL, cfg.node(cfg.outgoing(cfg.initial().id()).get(0).target()).kind());
    }
}
