/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

/**
 * Thrown when expanding local concurrency would exceed the configured number of states.
 */
public class StateSpaceExceededException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public StateSpaceExceededException(String message) {
        super(message);
    }
}
