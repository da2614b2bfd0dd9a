/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import java.util.List;
import java.util.Objects;

/**
 * The communication carried by an action node: <code>sender -> receivers : label(payloadTypes)</code>.
 */
public record MessageAction(String label, List<String> payloadTypes, String sender, List<String> receivers) {
    public MessageAction {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(sender, "sender");
        payloadTypes = List.copyOf(payloadTypes);
        receivers = List.copyOf(receivers);
    }

    public static MessageAction of(String sender, String receiver, String label, String... payloadTypes) {
        return new MessageAction(label, List.of(payloadTypes), sender, List.of(receiver));
    }

    public boolean involves(String role) {
        return sender.equals(role) || receivers.contains(role);
    }

    public boolean isMulticast() {
        return receivers.size() > 1;
    }

    public MessageAction substitute(RoleSubstitution substitution) {
        return new MessageAction(label, payloadTypes, substitution.apply(sender), substitution.apply(receivers));
    }

    @Override
    public String toString() {
        var types = payloadTypes.isEmpty() ? "" : "(" + String.join(",", payloadTypes) + ")";
        return sender + "->" + String.join(",", receivers) + ":" + label + types;
    }
}
