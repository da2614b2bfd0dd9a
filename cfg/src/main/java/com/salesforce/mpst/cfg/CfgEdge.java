/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import java.util.Objects;

/**
 * A directed edge of the control flow graph. The label and action are optional and may be null: branch edges
 * carry the alternative label, fork edges the branch name, continue edges the loop label and message edges the
 * action of their source node.
 */
public record CfgEdge(int id, EdgeKind kind, int source, int target, String label, MessageAction action) {
    public CfgEdge {
        Objects.requireNonNull(kind, "kind");
    }

    public boolean isBackEdge() {
        return kind == EdgeKind.CONTINUE;
    }

    @Override
    public String toString() {
        return "%s[%s -> %s%s]".formatted(kind, source, target, label == null ? "" : " " + label);
    }
}
