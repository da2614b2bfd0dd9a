/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import com.salesforce.mpst.projection.CfsmAction.Receive;
import com.salesforce.mpst.projection.CfsmAction.Send;

import java.util.ArrayList;
import java.util.List;

/**
 * Every enabled send must meet a matching receive at its target, offered in the target's current state or beyond
 * taus that leave an alternative the target had no part in. A receive without a matching send is not a violation:
 * it cannot go wrong, it can only wait.
 */
public interface SafetyPredicate {

    static boolean isSafe(Configuration configuration) {
        return violations(configuration).isEmpty();
    }

    static List<SafetyViolation> violations(Configuration configuration) {
        var violations = new ArrayList<SafetyViolation>();
        for (var sender : configuration.roles()) {
            var senderState = configuration.state(sender);
            for (var transition : configuration.outgoing(sender)) {
                if (!(transition.action() instanceof Send send)) {
                    continue;
                }
                if (!configuration.hasRole(send.to())) {
                    violations.add(new SafetyViolation(sender, send.to(), send.label(), send.payloadTypes(),
                                                       senderState, null, configuration));
                    continue;
                }
                var matched = Reducer.receivable(configuration, send.to())
                                     .stream()
                                     .anyMatch(t -> t.action() instanceof Receive r && send.matches(sender, r));
                if (!matched) {
                    violations.add(new SafetyViolation(sender, send.to(), send.label(), send.payloadTypes(),
                                                       senderState, configuration.state(send.to()),
                                                       configuration));
                }
            }
        }
        return violations;
    }
}
