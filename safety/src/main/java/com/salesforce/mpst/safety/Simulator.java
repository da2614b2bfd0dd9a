/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import com.salesforce.mpst.projection.Cfsm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;

/**
 * Executes a protocol step by step, always performing the first enabled communication in role order.
 */
public class Simulator {

    private static final Logger log = LoggerFactory.getLogger(Simulator.class);

    private final SafetyParameters parameters;

    public Simulator(SafetyParameters parameters) {
        this.parameters = parameters;
    }

    public Trace run(Map<String, Cfsm> cfsms, int maxSteps) {
        var flat = SafetyChecker.flatten(cfsms, parameters.maxLocalStates());
        var current = TauClosure.close(Configuration.initial(flat));
        var configurations = new ArrayList<Configuration>();
        var communications = new ArrayList<Communication>();
        configurations.add(current);
        while (communications.size() < maxSteps && !current.isTerminal()) {
            var enabled = Reducer.enabled(current);
            if (enabled.isEmpty()) {
                break;
            }
            var communication = enabled.get(0);
            current = Reducer.reduce(current, communication);
            log.trace("Step: {} {} -> {}", communications.size(), communication, current);
            communications.add(communication);
            configurations.add(current);
        }
        var completed = current.isTerminal();
        var stuck = !completed && Reducer.enabled(current).isEmpty();
        return new Trace(configurations, communications, completed, stuck);
    }
}
