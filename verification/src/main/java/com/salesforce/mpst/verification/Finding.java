/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.verification;

import java.util.List;

/**
 * A diagnostic of the static verifier. Findings never interrupt verification.
 */
public sealed interface Finding {

    enum Severity {
        ERROR, WARNING;
    }

    String message();

    Severity severity();

    /**
     * Two alternatives of the choice at the branch node begin with the same message.
     */
    record AmbiguousChoice(int branch, String sender, String receiver, String label) implements Finding {
        @Override
        public String message() {
            return "choice at node %s has two alternatives beginning with %s->%s:%s".formatted(branch, sender,
                                                                                               receiver, label);
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * A cycle that is not closed by a <code>continue</code> edge.
     */
    record DeadlockCycle(List<Integer> nodes) implements Finding {
        public DeadlockCycle {
            nodes = List.copyOf(nodes);
        }

        @Override
        public String message() {
            return "nodes " + nodes + " form a cycle that is not a recursion";
        }

        @Override
        public Severity severity() {
            return Severity.ERROR;
        }
    }

    /**
     * @param node the fork, or the join if it has no fork
     */
    record ForkJoinMismatch(String parallelId, int node, String reason) implements Finding {
        @Override
        public String message() {
            return parallelId + " at node " + node + ": " + reason;
        }

        @Override
        public Severity severity() {
            return Severity.ERROR;
        }
    }

    /**
     * Nodes reachable from the initial node from which no terminal node is reachable. May be intended, as in a
     * server loop.
     */
    record LivenessWarning(List<Integer> trapped, boolean initialTrapped) implements Finding {
        public LivenessWarning {
            trapped = List.copyOf(trapped);
        }

        @Override
        public String message() {
            if (initialTrapped) {
                return "no execution of the protocol can terminate";
            }
            return "nodes " + trapped + " cannot reach a terminal node";
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * The role sends in two branches of the same fork.
     */
    record ParallelConflict(String parallelId, int fork, String role, int firstBranch, int secondBranch)
    implements Finding {
        @Override
        public String message() {
            return "%s sends in branches %s and %s of %s".formatted(role, firstBranch, secondBranch, parallelId);
        }

        @Override
        public Severity severity() {
            return Severity.ERROR;
        }
    }

    /**
     * A non terminal node without a successor.
     */
    record ProgressViolation(int node, String description) implements Finding {
        @Override
        public String message() {
            return "node " + node + " (" + description + ") has no successor and is not terminal";
        }

        @Override
        public Severity severity() {
            return Severity.ERROR;
        }
    }

    /**
     * Two branches of the same fork carry the same message, so the receiver cannot tell them apart.
     */
    record RaceWarning(String parallelId, int fork, String sender, String receiver, String label, int firstBranch,
                       int secondBranch) implements Finding {
        @Override
        public String message() {
            return "%s->%s:%s occurs in branches %s and %s of %s".formatted(sender, receiver, label, firstBranch,
                                                                            secondBranch, parallelId);
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    record UnusedRole(String role) implements Finding {
        @Override
        public String message() {
            return "role " + role + " never communicates";
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }
}
