/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.ast;

import java.util.List;
import java.util.Objects;

/**
 * The interaction tree of a global protocol. The variants are closed: every consumer dispatches through
 * {@link InteractionVisitor}, so adding a variant fails compilation everywhere it must be handled.
 */
public sealed interface Interaction {

    <R, P> R accept(InteractionVisitor<R, P> visitor, P param);

    /**
     * <code>sender -> receivers : label(payloadTypes)</code>. More than one receiver is a multicast.
     */
    record Message(String label, List<String> payloadTypes, String sender, List<String> receivers)
    implements Interaction {
        public Message {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(sender, "sender");
            payloadTypes = List.copyOf(payloadTypes);
            receivers = List.copyOf(receivers);
        }

        @Override
        public <R, P> R accept(InteractionVisitor<R, P> visitor, P param) {
            return visitor.visitMessage(this, param);
        }

        @Override
        public String toString() {
            return sender + "->" + String.join(",", receivers) + ":" + label + payloadTypes;
        }
    }

    record Sequence(List<Interaction> statements) implements Interaction {
        public Sequence {
            statements = List.copyOf(statements);
        }

        @Override
        public <R, P> R accept(InteractionVisitor<R, P> visitor, P param) {
            return visitor.visitSequence(this, param);
        }
    }

    /**
     * A choice made by the decider role; each alternative is labelled for diagnostics.
     */
    record Choice(String decider, List<Alternative> alternatives) implements Interaction {
        public Choice {
            Objects.requireNonNull(decider, "decider");
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public <R, P> R accept(InteractionVisitor<R, P> visitor, P param) {
            return visitor.visitChoice(this, param);
        }
    }

    record Alternative(String label, Interaction body) {
        public Alternative {
            Objects.requireNonNull(body, "body");
        }
    }

    record Recursion(String label, Interaction body) implements Interaction {
        public Recursion {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R, P> R accept(InteractionVisitor<R, P> visitor, P param) {
            return visitor.visitRecursion(this, param);
        }
    }

    record Continue(String label) implements Interaction {
        public Continue {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public <R, P> R accept(InteractionVisitor<R, P> visitor, P param) {
            return visitor.visitContinue(this, param);
        }
    }

    record Parallel(List<Interaction> branches) implements Interaction {
        public Parallel {
            branches = List.copyOf(branches);
        }

        @Override
        public <R, P> R accept(InteractionVisitor<R, P> visitor, P param) {
            return visitor.visitParallel(this, param);
        }
    }

    /**
     * <code>do protocol(roleArguments)</code>; arguments bind positionally to the callee's declared roles.
     */
    record Invocation(String protocol, List<String> roleArguments) implements Interaction {
        public Invocation {
            Objects.requireNonNull(protocol, "protocol");
            roleArguments = List.copyOf(roleArguments);
        }

        @Override
        public <R, P> R accept(InteractionVisitor<R, P> visitor, P param) {
            return visitor.visitInvocation(this, param);
        }
    }
}
