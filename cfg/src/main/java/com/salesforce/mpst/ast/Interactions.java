/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.ast;

import com.salesforce.mpst.ast.Interaction.Alternative;
import com.salesforce.mpst.ast.Interaction.Choice;
import com.salesforce.mpst.ast.Interaction.Continue;
import com.salesforce.mpst.ast.Interaction.Invocation;
import com.salesforce.mpst.ast.Interaction.Message;
import com.salesforce.mpst.ast.Interaction.Parallel;
import com.salesforce.mpst.ast.Interaction.Recursion;
import com.salesforce.mpst.ast.Interaction.Sequence;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories for interaction trees, for callers that assemble protocols without a parser.
 */
public interface Interactions {

    static Alternative alternative(String label, Interaction... body) {
        return new Alternative(label, body.length == 1 ? body[0] : sequence(body));
    }

    static Choice choice(String decider, Alternative... alternatives) {
        return new Choice(decider, Arrays.asList(alternatives));
    }

    static Continue cont(String label) {
        return new Continue(label);
    }

    static Invocation invoke(String protocol, String... roles) {
        return new Invocation(protocol, Arrays.asList(roles));
    }

    static Message message(String sender, String receiver, String label, String... payloadTypes) {
        return new Message(label, Arrays.asList(payloadTypes), sender, List.of(receiver));
    }

    static Message multicast(String sender, List<String> receivers, String label, String... payloadTypes) {
        return new Message(label, Arrays.asList(payloadTypes), sender, receivers);
    }

    static Parallel parallel(Interaction... branches) {
        return new Parallel(Arrays.asList(branches));
    }

    static GlobalProtocol protocol(String name, List<String> roles, Interaction... body) {
        return new GlobalProtocol(name, roles, body.length == 1 ? body[0] : sequence(body));
    }

    static Recursion recursion(String label, Interaction... body) {
        return new Recursion(label, body.length == 1 ? body[0] : sequence(body));
    }

    static Sequence sequence(Interaction... statements) {
        return new Sequence(Arrays.asList(statements));
    }
}
