/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import java.util.List;

/**
 * Local concurrency preserved in a role's automaton: the fork state's tau transitions lead to the branch entries,
 * and every branch ends with a tau into the join state.
 */
public record ParallelRegion(String fork, String join, List<String> branchEntries) {
    public ParallelRegion {
        branchEntries = List.copyOf(branchEntries);
    }
}
