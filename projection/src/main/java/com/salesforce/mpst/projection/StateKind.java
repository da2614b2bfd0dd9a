/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

public enum StateKind {
    EXTERNAL_CHOICE, FORK, INTERNAL_CHOICE, JOIN, MERGE, PLAIN;

    public boolean isChoice() {
        return this == EXTERNAL_CHOICE || this == INTERNAL_CHOICE;
    }
}
