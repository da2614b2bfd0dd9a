/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.ast;

import java.util.List;
import java.util.Objects;

/**
 * A named global protocol: the declared roles, in parameter order, and the interaction tree over them.
 */
public record GlobalProtocol(String name, List<String> roles, Interaction body) {
    public GlobalProtocol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        roles = List.copyOf(roles);
    }

    public int arity() {
        return roles.size();
    }
}
