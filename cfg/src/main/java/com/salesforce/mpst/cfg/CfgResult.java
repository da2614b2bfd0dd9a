/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of CFG construction: either a graph or the structural errors that prevented one. An invalid result
 * must not be projected or verified.
 */
public record CfgResult(Optional<Cfg> cfg, List<StructuralError> errors) {

    public static CfgResult invalid(List<StructuralError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result requires at least one error");
        }
        return new CfgResult(Optional.empty(), errors);
    }

    public static CfgResult valid(Cfg cfg) {
        return new CfgResult(Optional.of(cfg), List.of());
    }

    public CfgResult {
        errors = List.copyOf(errors);
    }

    public Cfg get() {
        return cfg.orElseThrow(() -> new IllegalStateException("Invalid CFG: " + errors));
    }

    public boolean isValid() {
        return cfg.isPresent();
    }
}
