/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import java.util.Objects;

public record CfsmTransition(String source, String target, CfsmAction action) {
    public CfsmTransition {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(action, "action");
    }

    @Override
    public String toString() {
        return source + " -" + action + "-> " + target;
    }
}
