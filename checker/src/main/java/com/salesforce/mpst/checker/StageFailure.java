/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.checker;

/**
 * An unexpected failure of one stage of a check, captured so that it does not escape the check boundary.
 */
public record StageFailure(String stage, String error) {

    public static StageFailure of(String stage, Throwable t) {
        return new StageFailure(stage, t.getClass().getSimpleName() + ": " + t.getMessage());
    }
}
