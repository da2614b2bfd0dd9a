/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import java.util.List;

/**
 * One deterministic execution.
 *
 * @param configurations the configurations visited, starting with the tau closed initial one
 * @param communications the communications performed, one per step
 * @param completed      every role ended in a terminal state
 * @param stuck          no communication was enabled before completion or the step bound
 */
public record Trace(List<Configuration> configurations, List<Communication> communications, boolean completed,
                    boolean stuck) {
    public Trace {
        configurations = List.copyOf(configurations);
        communications = List.copyOf(communications);
    }

    public Configuration last() {
        return configurations.get(configurations.size() - 1);
    }

    public int steps() {
        return communications.size();
    }
}
