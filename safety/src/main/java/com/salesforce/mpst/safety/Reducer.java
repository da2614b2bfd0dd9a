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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The paired reduction relation over configurations.
 * <p>
 * A receiver resting in a choice between receives and a tau may resolve that choice by the tau and take a receive
 * further along: the tau is the exit of an alternative the role had no part in. It does so only while none of the
 * receives it offers directly has a sender ready, so a pending message of the live alternative is never bypassed.
 */
public interface Reducer {

    /**
     * The communications enabled in the configuration, in role order
     */
    static List<Communication> enabled(Configuration configuration) {
        var enabled = new ArrayList<Communication>();
        for (var sender : configuration.roles()) {
            for (var send : configuration.outgoing(sender)) {
                if (!(send.action() instanceof Send s) || s.to().equals(sender) || !configuration.hasRole(s.to())) {
                    continue;
                }
                var offered = directlyAwaited(configuration, s.to()) ? configuration.outgoing(s.to())
                                                                     : receivable(configuration, s.to());
                for (var receive : offered) {
                    if (receive.action() instanceof Receive r && s.matches(sender, r)) {
                        enabled.add(new Communication(sender, s.to(), send, receive));
                    }
                }
            }
        }
        return enabled;
    }

    /**
     * The receives the role offers in its current state or in any state it reaches over taus alone
     */
    static List<CfsmTransition> receivable(Configuration configuration, String role) {
        var cfsm = configuration.machine(role);
        var transitions = new ArrayList<CfsmTransition>();
        for (var state : TauClosure.silentlyReachable(cfsm, configuration.state(role))) {
            for (var transition : cfsm.outgoing(state)) {
                if (transition.action() instanceof Receive) {
                    transitions.add(transition);
                }
            }
        }
        return transitions;
    }

    /**
     * Both parties advance together; the result is tau closed
     */
    static Configuration reduce(Configuration configuration, Communication communication) {
        var next = configuration.advance(Map.of(communication.sender(), communication.send().target(),
                                                communication.receiver(), communication.receive().target()));
        return TauClosure.close(next);
    }

    static List<Configuration> successors(Configuration configuration) {
        return enabled(configuration).stream().map(c -> reduce(configuration, c)).distinct().toList();
    }

    /**
     * Answer true if some receive offered in the role's current state has a sender ready for it
     */
    private static boolean directlyAwaited(Configuration configuration, String role) {
        for (var receive : configuration.outgoing(role)) {
            if (!(receive.action() instanceof Receive r) || !configuration.hasRole(r.from())
            || r.from().equals(role)) {
                continue;
            }
            for (var send : configuration.outgoing(r.from())) {
                if (send.action() instanceof Send s && s.to().equals(role) && s.matches(r.from(), r)) {
                    return true;
                }
            }
        }
        return false;
    }
}
