/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A node of the control flow graph, addressed by its integer id within the owning {@link Cfg}.
 */
public sealed interface CfgNode {

    <R, P> R accept(CfgVisitor<R, P> visitor, P param);

    /**
     * Answer a copy of this node under a new id, with roles and parallel ids rewritten
     */
    CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds);

    int id();

    NodeKind kind();

    record Action(int id, MessageAction action) implements CfgNode {
        public Action {
            Objects.requireNonNull(action, "action");
        }

        @Override
        public <R, P> R accept(CfgVisitor<R, P> visitor, P param) {
            return visitor.visitAction(this, param);
        }

        @Override
        public CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds) {
            return new Action(id, action.substitute(roles));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ACTION;
        }
    }

    record Branch(int id, String decider) implements CfgNode {
        public Branch {
            Objects.requireNonNull(decider, "decider");
        }

        @Override
        public <R, P> R accept(CfgVisitor<R, P> visitor, P param) {
            return visitor.visitBranch(this, param);
        }

        @Override
        public CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds) {
            return new Branch(id, roles.apply(decider));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BRANCH;
        }
    }

    record Fork(int id, String parallelId) implements CfgNode {
        public Fork {
            Objects.requireNonNull(parallelId, "parallelId");
        }

        @Override
        public <R, P> R accept(CfgVisitor<R, P> visitor, P param) {
            return visitor.visitFork(this, param);
        }

        @Override
        public CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds) {
            return new Fork(id, parallelIds.apply(parallelId));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FORK;
        }
    }

    record Initial(int id) implements CfgNode {
        @Override
        public <R, P> R accept(CfgVisitor<R, P> visitor, P param) {
            return visitor.visitInitial(this, param);
        }

        @Override
        public CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds) {
            return new Initial(id);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INITIAL;
        }
    }

    record Join(int id, String parallelId) implements CfgNode {
        public Join {
            Objects.requireNonNull(parallelId, "parallelId");
        }

        @Override
        public <R, P> R accept(CfgVisitor<R, P> visitor, P param) {
            return visitor.visitJoin(this, param);
        }

        @Override
        public CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds) {
            return new Join(id, parallelIds.apply(parallelId));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.JOIN;
        }
    }

    record Merge(int id) implements CfgNode {
        @Override
        public <R, P> R accept(CfgVisitor<R, P> visitor, P param) {
            return visitor.visitMerge(this, param);
        }

        @Override
        public CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds) {
            return new Merge(id);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MERGE;
        }
    }

    /**
     * The head of a loop. Transparent to projection; <code>continue</code> edges target it.
     */
    record Recursive(int id, String label) implements CfgNode {
        public Recursive {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public <R, P> R accept(CfgVisitor<R, P> visitor, P param) {
            return visitor.visitRecursive(this, param);
        }

        @Override
        public CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds) {
            return new Recursive(id, label);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RECURSIVE;
        }
    }

    record Terminal(int id) implements CfgNode {
        @Override
        public <R, P> R accept(CfgVisitor<R, P> visitor, P param) {
            return visitor.visitTerminal(this, param);
        }

        @Override
        public CfgNode copy(int id, RoleSubstitution roles, UnaryOperator<String> parallelIds) {
            return new Terminal(id);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TERMINAL;
        }
    }
}
