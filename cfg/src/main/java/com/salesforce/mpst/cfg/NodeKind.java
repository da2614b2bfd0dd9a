/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

public enum NodeKind {
    ACTION, BRANCH, FORK, INITIAL, JOIN, MERGE, RECURSIVE, TERMINAL;
}
