/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of safety exploration. An exhausted budget with no violation found is inconclusive, never safe.
 */
public record SafetyReport(Verdict verdict, List<SafetyViolation> violations, Metrics metrics) {

    public enum Verdict {
        INCONCLUSIVE, SAFE, UNSAFE;
    }

    public record Metrics(int statesExplored, Duration elapsed) {
    }

    public SafetyReport {
        Objects.requireNonNull(verdict, "verdict");
        violations = List.copyOf(violations);
    }

    public boolean isSafe() {
        return verdict == Verdict.SAFE;
    }

    @Override
    public String toString() {
        return "%s explored: %s elapsed: %sms violations: %s".formatted(verdict, metrics.statesExplored(),
                                                                       metrics.elapsed().toMillis(), violations);
    }
}
