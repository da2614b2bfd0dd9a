/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import com.salesforce.mpst.projection.CfsmAction.Receive;
import com.salesforce.mpst.projection.CfsmAction.Send;
import com.salesforce.mpst.projection.CfsmTransition;

/**
 * A rendezvous of a send and its matching receive, enabled in some configuration.
 */
public record Communication(String sender, String receiver, CfsmTransition send, CfsmTransition receive) {

    public String label() {
        return ((Send) send.action()).label();
    }

    public Receive receiveAction() {
        return (Receive) receive.action();
    }

    public Send sendAction() {
        return (Send) send.action();
    }

    @Override
    public String toString() {
        return sender + "->" + receiver + ":" + label();
    }
}
