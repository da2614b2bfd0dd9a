/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import com.salesforce.mpst.cfg.CfgNode.Action;
import com.salesforce.mpst.cfg.CfgNode.Branch;
import com.salesforce.mpst.cfg.CfgNode.Fork;
import com.salesforce.mpst.cfg.CfgNode.Initial;
import com.salesforce.mpst.cfg.CfgNode.Join;
import com.salesforce.mpst.cfg.CfgNode.Merge;
import com.salesforce.mpst.cfg.CfgNode.Recursive;
import com.salesforce.mpst.cfg.CfgNode.Terminal;

public interface CfgVisitor<R, P> {

    R visitAction(Action node, P param);

    R visitBranch(Branch node, P param);

    R visitFork(Fork node, P param);

    R visitInitial(Initial node, P param);

    R visitJoin(Join node, P param);

    R visitMerge(Merge node, P param);

    R visitRecursive(Recursive node, P param);

    R visitTerminal(Terminal node, P param);
}
