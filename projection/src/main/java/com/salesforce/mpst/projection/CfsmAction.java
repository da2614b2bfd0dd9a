/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import java.util.List;
import java.util.Objects;

/**
 * The action on a transition of a local automaton.
 */
public sealed interface CfsmAction {

    enum Kind {
        RECEIVE, SEND, TAU;
    }

    Tau TAU = new Tau();

    Kind kind();

    default boolean isTau() {
        return kind() == Kind.TAU;
    }

    /**
     * @param from the sending role
     */
    record Receive(String from, String label, List<String> payloadTypes) implements CfsmAction {
        public Receive {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(label, "label");
            payloadTypes = List.copyOf(payloadTypes);
        }

        @Override
        public Kind kind() {
            return Kind.RECEIVE;
        }

        @Override
        public String toString() {
            return from + "?" + label + payloadTypes;
        }
    }

    /**
     * @param to the receiving role
     */
    record Send(String to, String label, List<String> payloadTypes) implements CfsmAction {
        public Send {
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(label, "label");
            payloadTypes = List.copyOf(payloadTypes);
        }

        @Override
        public Kind kind() {
            return Kind.SEND;
        }

        /**
         * Answer true if the receive, performed by this send's target, accepts this send from the sender
         */
        public boolean matches(String sender, Receive receive) {
            return receive.from().equals(sender) && receive.label().equals(label) && receive.payloadTypes()
                                                                                            .equals(payloadTypes);
        }

        @Override
        public String toString() {
            return to + "!" + label + payloadTypes;
        }
    }

    record Tau() implements CfsmAction {
        @Override
        public Kind kind() {
            return Kind.TAU;
        }

        @Override
        public String toString() {
            return "tau";
        }
    }
}
