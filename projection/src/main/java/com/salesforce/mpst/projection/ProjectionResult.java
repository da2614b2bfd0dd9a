/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * The automata of every role that projected, and the errors of those that did not.
 */
public record ProjectionResult(Map<String, Cfsm> cfsms, List<ProjectionError> errors) {
    public ProjectionResult {
        cfsms = ImmutableMap.copyOf(cfsms);
        errors = List.copyOf(errors);
    }

    public boolean isComplete() {
        return errors.isEmpty();
    }

    public int totalStates() {
        return cfsms.values().stream().mapToInt(c -> c.states().size()).sum();
    }
}
