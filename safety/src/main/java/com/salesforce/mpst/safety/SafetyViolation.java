/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import java.util.List;

/**
 * An enabled send whose target offers no matching receive.
 *
 * @param receiverState the receiver's state, or null if the receiver is not a role of the configuration
 */
public record SafetyViolation(String sender, String receiver, String label, List<String> payloadTypes,
                              String senderState, String receiverState, Configuration configuration) {
    public SafetyViolation {
        payloadTypes = List.copyOf(payloadTypes);
    }

    public String message() {
        if (receiverState == null) {
            return "%s sends %s to %s, which is not a role of the protocol".formatted(sender, label, receiver);
        }
        return "%s in state %s sends %s%s to %s, which cannot receive it in state %s".formatted(sender, senderState,
                                                                                               label, payloadTypes,
                                                                                               receiver,
                                                                                               receiverState);
    }

    @Override
    public String toString() {
        return message() + " at " + configuration;
    }
}
