/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.ast;

import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.Optional;

/**
 * The set of protocols that <code>do</code> invocations resolve against.
 */
public final class ProtocolModule {

    public static ProtocolModule of(GlobalProtocol... protocols) {
        var builder = ImmutableMap.<String, GlobalProtocol>builder();
        for (var protocol : protocols) {
            builder.put(protocol.name(), protocol);
        }
        try {
            return new ProtocolModule(builder.buildOrThrow());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Duplicate protocol name in module", e);
        }
    }

    private final ImmutableMap<String, GlobalProtocol> protocols;

    private ProtocolModule(ImmutableMap<String, GlobalProtocol> protocols) {
        this.protocols = protocols;
    }

    public Optional<GlobalProtocol> lookup(String name) {
        return Optional.ofNullable(protocols.get(name));
    }

    public Collection<GlobalProtocol> protocols() {
        return protocols.values();
    }

    @Override
    public String toString() {
        return "ProtocolModule" + protocols.keySet();
    }
}
