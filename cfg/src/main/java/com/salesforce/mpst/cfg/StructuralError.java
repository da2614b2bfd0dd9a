/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import java.util.Objects;

/**
 * A fatal defect found while constructing the control flow graph of a protocol.
 *
 * @param protocol the protocol whose construction failed
 */
public record StructuralError(Kind kind, String protocol, String message) {

    public enum Kind {
        ARITY_MISMATCH, BLANK_LABEL, CONTINUE_ESCAPES_PARALLEL, DUPLICATE_ROLE, EMPTY_COMPOSITE, MALFORMED_MESSAGE,
        RECURSIVE_INVOCATION, ROLE_ALIASING, SELF_COMMUNICATION, UNKNOWN_PROTOCOL, UNKNOWN_RECURSION_LABEL,
        UNKNOWN_ROLE, UNMATCHED_FORK_JOIN, UNREACHABLE_STATEMENT;
    }

    public StructuralError {
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public String toString() {
        return kind + " in " + protocol + ": " + message;
    }
}
