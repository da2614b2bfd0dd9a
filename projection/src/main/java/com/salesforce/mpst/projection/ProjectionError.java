/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import java.util.Objects;

/**
 * A defect preventing the projection of one role. Other roles still project.
 *
 * @param node the CFG node the defect was found at, or -1 if it is not tied to one
 */
public record ProjectionError(Kind kind, String role, int node, String message) {

    public enum Kind {
        MALFORMED_GRAPH, NONDETERMINISTIC_CHOICE, UNKNOWN_ROLE, UNRESOLVED_RECURSION_LABEL;
    }

    public ProjectionError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(role, "role");
    }

    @Override
    public String toString() {
        return kind + " projecting " + role + (node < 0 ? "" : " at node " + node) + ": " + message;
    }
}
