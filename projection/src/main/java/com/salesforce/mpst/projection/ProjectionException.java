/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import java.util.List;

public class ProjectionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<ProjectionError> errors;

    public ProjectionException(List<ProjectionError> errors) {
        super(errors.toString());
        this.errors = List.copyOf(errors);
    }

    public ProjectionException(ProjectionError error) {
        this(List.of(error));
    }

    public List<ProjectionError> getErrors() {
        return errors;
    }
}
