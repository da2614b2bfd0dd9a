/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import com.google.common.collect.ImmutableMap;
import com.salesforce.mpst.ast.GlobalProtocol;
import com.salesforce.mpst.ast.Interaction;
import com.salesforce.mpst.ast.Interaction.Choice;
import com.salesforce.mpst.ast.Interaction.Continue;
import com.salesforce.mpst.ast.Interaction.Invocation;
import com.salesforce.mpst.ast.Interaction.Message;
import com.salesforce.mpst.ast.Interaction.Parallel;
import com.salesforce.mpst.ast.Interaction.Recursion;
import com.salesforce.mpst.ast.Interaction.Sequence;
import com.salesforce.mpst.ast.InteractionVisitor;
import com.salesforce.mpst.ast.ProtocolModule;
import com.salesforce.mpst.cfg.StructuralError.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Constructs the control flow graph of a global protocol.
 * <p>
 * Construction is forward: each interaction is built from an open entry point and answers the open exit point
 * that the following statement continues from, or nothing when control never falls through (a
 * <code>continue</code>, or a choice whose alternatives all loop). Invoked protocols are built once into a
 * template that is never spliced itself; every call site receives a fresh clone with new node and parallel ids
 * and the formal to actual role substitution applied.
 * <p>
 * A builder caches templates and is not thread safe. Use one per thread.
 */
public class CfgBuilder {

    /**
     * The open end of a construction: the next edge leaves <code>node</code> with this kind, label and action.
     */
    record Exit(int node, EdgeKind kind, String label, MessageAction action) {
        static Exit of(int node) {
            return new Exit(node, EdgeKind.SEQUENCE, null, null);
        }
    }

    /**
     * Construction context of one interaction. The recursion environment is immutable; a nested loop rebinds
     * its label in a new map visible only to its own body.
     *
     * @param scope the parallel branch the interaction lies in; a loop may only be continued from its own scope
     * @param tail  true if nothing in the enclosing protocol follows the interaction
     */
    record Frame(Exit entry, ImmutableMap<String, LoopHead> env, int scope, boolean tail) {
        Frame at(Exit entry, boolean tail) {
            return new Frame(entry, env, scope, tail);
        }
    }

    record LoopHead(int node, int scope) {
    }

    private static final Logger log = LoggerFactory.getLogger(CfgBuilder.class);

    public static CfgResult buildCfg(GlobalProtocol protocol) {
        return buildCfg(protocol, ProtocolModule.of(protocol));
    }

    /**
     * Build the CFG of the protocol, resolving invocations against the module
     */
    public static CfgResult buildCfg(GlobalProtocol protocol, ProtocolModule module) {
        return new CfgBuilder(module).build(protocol);
    }

    private final Deque<String>    inProgress = new ArrayDeque<>();
    private final ProtocolModule   module;
    private final Map<String, Cfg> templates  = new HashMap<>();

    public CfgBuilder(ProtocolModule module) {
        this.module = module;
    }

    public CfgResult build(GlobalProtocol protocol) {
        try {
            var cfg = template(protocol);
            log.debug("Built CFG of: {} nodes: {} edges: {}", protocol.name(), cfg.size(), cfg.edges().size());
            return CfgResult.valid(cfg);
        } catch (StructuralException e) {
            log.debug("Invalid protocol: {} errors: {}", protocol.name(), e.getErrors());
            return CfgResult.invalid(e.getErrors());
        }
    }

    public CfgResult build(String protocol) {
        var found = module.lookup(protocol);
        if (found.isEmpty()) {
            return CfgResult.invalid(
            List.of(new StructuralError(Kind.UNKNOWN_PROTOCOL, protocol, "No such protocol in " + module)));
        }
        return build(found.get());
    }

    private Cfg template(GlobalProtocol protocol) {
        var cached = templates.get(protocol.name());
        if (cached != null) {
            return cached;
        }
        inProgress.push(protocol.name());
        try {
            var cfg = new Construction(protocol).run();
            templates.put(protocol.name(), cfg);
            return cfg;
        } finally {
            inProgress.pop();
        }
    }

    /**
     * Builds the graph of a single protocol
     */
    private class Construction implements InteractionVisitor<Optional<Exit>, Frame> {
        private final Cfg.Builder    graph;
        private final GlobalProtocol protocol;
        private final Set<String>    roles = new HashSet<>();
        private int                  scopes;
        private Integer              selfHead;

        Construction(GlobalProtocol protocol) {
            this.protocol = protocol;
            this.graph = Cfg.newBuilder(protocol.name(), protocol.roles());
        }

        @Override
        public Optional<Exit> visitChoice(Choice choice, Frame frame) {
            checkRole(choice.decider(), "choice");
            if (choice.alternatives().isEmpty()) {
                throw error(Kind.EMPTY_COMPOSITE, "choice at " + choice.decider() + " has no alternatives");
            }
            var branch = graph.add(id -> new CfgNode.Branch(id, choice.decider()));
            connect(frame.entry(), branch);

            var exits = new ArrayList<Exit>();
            var errors = new ArrayList<StructuralError>();
            for (var alternative : choice.alternatives()) {
                try {
                    var start = new Exit(branch, EdgeKind.BRANCH, alternative.label(), null);
                    alternative.body().accept(this, frame.at(start, frame.tail())).ifPresent(exits::add);
                } catch (StructuralException e) {
                    errors.addAll(e.getErrors());
                }
            }
            if (!errors.isEmpty()) {
                throw new StructuralException(errors);
            }
            if (exits.isEmpty()) {
                return Optional.empty();
            }
            var merge = graph.add(CfgNode.Merge::new);
            exits.forEach(exit -> connect(exit, merge));
            return Optional.of(Exit.of(merge));
        }

        @Override
        public Optional<Exit> visitContinue(Continue cont, Frame frame) {
            var head = frame.env().get(cont.label());
            if (head == null) {
                throw error(Kind.UNKNOWN_RECURSION_LABEL, "continue " + cont.label() + " is not within rec "
                + cont.label());
            }
            if (head.scope() != frame.scope()) {
                throw error(Kind.CONTINUE_ESCAPES_PARALLEL,
                            "continue " + cont.label() + " crosses the boundary of a parallel branch");
            }
            graph.connect(EdgeKind.CONTINUE, frame.entry().node(), head.node(), cont.label(), null);
            return Optional.empty();
        }

        @Override
        public Optional<Exit> visitInvocation(Invocation invocation, Frame frame) {
            var callee = module.lookup(invocation.protocol())
                               .orElseThrow(() -> error(Kind.UNKNOWN_PROTOCOL,
                                                        "do " + invocation.protocol() + ": no such protocol"));
            var actuals = invocation.roleArguments();
            if (actuals.size() != callee.arity()) {
                throw error(Kind.ARITY_MISMATCH,
                            "do %s expects %s roles but received %s".formatted(callee.name(), callee.arity(),
                                                                               actuals.size()));
            }
            actuals.forEach(role -> checkRole(role, "do " + callee.name()));
            if (new HashSet<>(actuals).size() != actuals.size()) {
                throw error(Kind.ROLE_ALIASING, "do " + callee.name() + " binds one role twice: " + actuals);
            }
            if (callee.name().equals(protocol.name())) {
                if (!frame.tail() || !actuals.equals(protocol.roles()) || selfHead == null) {
                    throw error(Kind.RECURSIVE_INVOCATION,
                                "do " + callee.name() + " must be in tail position with the declared roles "
                                + protocol.roles());
                }
                graph.connect(EdgeKind.CONTINUE, frame.entry().node(), selfHead, callee.name(), null);
                return Optional.empty();
            }
            if (inProgress.contains(callee.name())) {
                throw error(Kind.RECURSIVE_INVOCATION,
                            "do " + callee.name() + " is mutually recursive with " + inProgress);
            }
            return splice(template(callee), RoleSubstitution.of(callee.roles(), actuals), frame.entry());
        }

        @Override
        public Optional<Exit> visitMessage(Message message, Frame frame) {
            checkLabel(message.label(), "message");
            checkRole(message.sender(), message.toString());
            if (message.receivers().isEmpty()) {
                throw error(Kind.MALFORMED_MESSAGE, message + " has no receiver");
            }
            if (new HashSet<>(message.receivers()).size() != message.receivers().size()) {
                throw error(Kind.MALFORMED_MESSAGE, message + " names a receiver twice");
            }
            for (var receiver : message.receivers()) {
                checkRole(receiver, message.toString());
                if (receiver.equals(message.sender())) {
                    throw error(Kind.SELF_COMMUNICATION, message + " sends to its own sender");
                }
            }
            var action = new MessageAction(message.label(), message.payloadTypes(), message.sender(),
                                           message.receivers());
            var node = graph.add(id -> new CfgNode.Action(id, action));
            connect(frame.entry(), node);
            return Optional.of(new Exit(node, EdgeKind.MESSAGE, message.label(), action));
        }

        @Override
        public Optional<Exit> visitParallel(Parallel parallel, Frame frame) {
            if (parallel.branches().isEmpty()) {
                throw error(Kind.EMPTY_COMPOSITE, "par has no branches");
            }
            var parallelId = graph.nextParallelId();
            var fork = graph.add(id -> new CfgNode.Fork(id, parallelId));
            connect(frame.entry(), fork);

            var exits = new ArrayList<Exit>();
            var errors = new ArrayList<StructuralError>();
            var branches = parallel.branches();
            for (int i = 0; i < branches.size(); i++) {
                var start = new Exit(fork, EdgeKind.FORK, "branch" + i, null);
                try {
                    var exit = branches.get(i).accept(this, new Frame(start, frame.env(), ++scopes, false));
                    if (exit.isEmpty()) {
                        errors.add(new StructuralError(Kind.UNMATCHED_FORK_JOIN, protocol.name(),
                                                       "branch " + i + " of " + parallelId
                                                       + " never reaches its join"));
                    } else {
                        exits.add(exit.get());
                    }
                } catch (StructuralException e) {
                    errors.addAll(e.getErrors());
                }
            }
            if (!errors.isEmpty()) {
                throw new StructuralException(errors);
            }
            var join = graph.add(id -> new CfgNode.Join(id, parallelId));
            exits.forEach(exit -> connect(exit, join));
            return Optional.of(Exit.of(join));
        }

        @Override
        public Optional<Exit> visitRecursion(Recursion recursion, Frame frame) {
            checkLabel(recursion.label(), "rec");
            var node = graph.add(id -> new CfgNode.Recursive(id, recursion.label()));
            connect(frame.entry(), node);
            var env = ImmutableMap.<String, LoopHead>builder()
                                  .putAll(frame.env())
                                  .put(recursion.label(), new LoopHead(node, frame.scope()))
                                  .buildKeepingLast();
            return recursion.body().accept(this, new Frame(Exit.of(node), env, frame.scope(), frame.tail()));
        }

        @Override
        public Optional<Exit> visitSequence(Sequence sequence, Frame frame) {
            var current = Optional.of(frame.entry());
            var statements = sequence.statements();
            for (int i = 0; i < statements.size(); i++) {
                if (current.isEmpty()) {
                    throw error(Kind.UNREACHABLE_STATEMENT,
                                "statement " + i + " follows a construct that never completes");
                }
                var tail = frame.tail() && i == statements.size() - 1;
                current = statements.get(i).accept(this, frame.at(current.get(), tail));
            }
            return current;
        }

        Cfg run() {
            var seen = new HashSet<String>();
            for (var role : protocol.roles()) {
                if (!seen.add(role)) {
                    throw error(Kind.DUPLICATE_ROLE, "role " + role + " is declared twice");
                }
            }
            roles.addAll(seen);

            var entry = Exit.of(graph.add(CfgNode.Initial::new));
            if (protocol.body().accept(new SelfInvocation(), protocol.name())) {
                selfHead = graph.add(id -> new CfgNode.Recursive(id, protocol.name()));
                connect(entry, selfHead);
                entry = Exit.of(selfHead);
            }
            var exit = protocol.body().accept(this, new Frame(entry, ImmutableMap.of(), 0, true));
            var terminal = graph.add(CfgNode.Terminal::new);
            exit.ifPresent(e -> connect(e, terminal));
            return graph.build();
        }

        private void checkLabel(String label, String construct) {
            if (label.isBlank()) {
                throw error(Kind.BLANK_LABEL, construct + " has a blank label");
            }
        }

        private void checkRole(String role, String context) {
            if (!roles.contains(role)) {
                throw error(Kind.UNKNOWN_ROLE, "role " + role + " of " + context + " is not declared in "
                + protocol.roles());
            }
        }

        private void connect(Exit exit, int target) {
            graph.connect(exit.kind(), exit.node(), target, exit.label(), exit.action());
        }

        private StructuralException error(Kind kind, String message) {
            return new StructuralException(new StructuralError(kind, protocol.name(), message));
        }

        /**
         * Clone the template into this graph between the entry and a fresh exit node
         */
        private Optional<Exit> splice(Cfg template, RoleSubstitution substitution, Exit entry) {
            var ids = new HashMap<Integer, Integer>();
            var parallelIds = new HashMap<String, String>();
            for (var node : template.nodes()) {
                if (node.kind() == NodeKind.INITIAL || node.kind() == NodeKind.TERMINAL) {
                    continue;
                }
                ids.put(node.id(), graph.add(
                id -> node.copy(id, substitution, pid -> parallelIds.computeIfAbsent(pid, k -> graph.nextParallelId()))));
            }
            var completes = template.edges()
                                    .stream()
                                    .anyMatch(e -> template.node(e.target()).kind() == NodeKind.TERMINAL);
            var exit = completes ? graph.add(CfgNode.Merge::new) : -1;

            for (var edge : template.edges()) {
                var toTerminal = template.node(edge.target()).kind() == NodeKind.TERMINAL;
                var target = toTerminal ? exit : ids.get(edge.target());
                if (template.node(edge.source()).kind() == NodeKind.INITIAL) {
                    connect(entry, target);
                } else {
                    var action = edge.action() == null ? null : edge.action().substitute(substitution);
                    graph.connect(toTerminal ? EdgeKind.EPSILON : edge.kind(), ids.get(edge.source()), target,
                                  edge.label(), action);
                }
            }
            log.trace("Spliced: {} into: {} nodes: {} roles: {}", template.protocol(), protocol.name(), ids.size(),
                      substitution.mapping());
            return completes ? Optional.of(Exit.of(exit)) : Optional.empty();
        }
    }

    /**
     * Answers true if the tree directly invokes the named protocol
     */
    private static class SelfInvocation implements InteractionVisitor<Boolean, String> {

        @Override
        public Boolean visitChoice(Choice choice, String name) {
            return choice.alternatives().stream().anyMatch(a -> a.body().accept(this, name));
        }

        @Override
        public Boolean visitContinue(Continue cont, String name) {
            return false;
        }

        @Override
        public Boolean visitInvocation(Invocation invocation, String name) {
            return invocation.protocol().equals(name);
        }

        @Override
        public Boolean visitMessage(Message message, String name) {
            return false;
        }

        @Override
        public Boolean visitParallel(Parallel parallel, String name) {
            return parallel.branches().stream().anyMatch(b -> b.accept(this, name));
        }

        @Override
        public Boolean visitRecursion(Recursion recursion, String name) {
            return recursion.body().accept(this, name);
        }

        @Override
        public Boolean visitSequence(Sequence sequence, String name) {
            return sequence.statements().stream().anyMatch(s -> s.accept(this, name));
        }
    }
}
