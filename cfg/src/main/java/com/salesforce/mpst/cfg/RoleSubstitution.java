/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.HashSet;
import java.util.List;

/**
 * A bijective formal to actual role mapping applied to an inlined protocol. Roles outside the mapping are left
 * unchanged.
 */
public record RoleSubstitution(ImmutableMap<String, String> mapping) {

    public static RoleSubstitution of(List<String> formals, List<String> actuals) {
        if (formals.size() != actuals.size()) {
            throw new IllegalArgumentException(
            "Expected " + formals.size() + " role arguments but received " + actuals.size());
        }
        if (new HashSet<>(actuals).size() != actuals.size()) {
            throw new IllegalArgumentException("Role arguments must be distinct: " + actuals);
        }
        var builder = ImmutableMap.<String, String>builder();
        for (int i = 0; i < formals.size(); i++) {
            builder.put(formals.get(i), actuals.get(i));
        }
        return new RoleSubstitution(builder.buildOrThrow());
    }

    public String apply(String role) {
        return mapping.getOrDefault(role, role);
    }

    public List<String> apply(List<String> roles) {
        return roles.stream().map(this::apply).collect(ImmutableList.toImmutableList());
    }
}
