/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import java.util.List;

/**
 * Signals structural errors during construction; caught at the builder boundary and returned as a
 * {@link CfgResult}.
 */
public class StructuralException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<StructuralError> errors;

    public StructuralException(List<StructuralError> errors) {
        super(errors.toString());
        this.errors = List.copyOf(errors);
    }

    public StructuralException(StructuralError error) {
        this(List.of(error));
    }

    public List<StructuralError> getErrors() {
        return errors;
    }
}
