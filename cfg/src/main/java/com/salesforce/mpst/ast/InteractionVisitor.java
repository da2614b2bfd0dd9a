/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.ast;

import com.salesforce.mpst.ast.Interaction.Choice;
import com.salesforce.mpst.ast.Interaction.Continue;
import com.salesforce.mpst.ast.Interaction.Invocation;
import com.salesforce.mpst.ast.Interaction.Message;
import com.salesforce.mpst.ast.Interaction.Parallel;
import com.salesforce.mpst.ast.Interaction.Recursion;
import com.salesforce.mpst.ast.Interaction.Sequence;

/**
 * @param <R> result type
 * @param <P> parameter threaded through the traversal
 */
public interface InteractionVisitor<R, P> {

    R visitChoice(Choice choice, P param);

    R visitContinue(Continue cont, P param);

    R visitInvocation(Invocation invocation, P param);

    R visitMessage(Message message, P param);

    R visitParallel(Parallel parallel, P param);

    R visitRecursion(Recursion recursion, P param);

    R visitSequence(Sequence sequence, P param);
}
