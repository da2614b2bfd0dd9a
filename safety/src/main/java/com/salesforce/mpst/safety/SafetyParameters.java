/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds on safety exploration.
 *
 * @param maxConfigurations    configurations explored before the result is inconclusive
 * @param timeout              wall clock bound on exploration
 * @param maxLocalStates       product states a single role's parallel regions may expand to
 * @param stopAtFirstViolation end exploration at the first unsafe configuration
 */
public record SafetyParameters(int maxConfigurations, Duration timeout, int maxLocalStates,
                               boolean stopAtFirstViolation) {

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int      maxConfigurations    = 100_000;
        private int      maxLocalStates       = 10_000;
        private boolean  stopAtFirstViolation = false;
        private Duration timeout              = Duration.ofSeconds(30);

        public SafetyParameters build() {
            Objects.requireNonNull(timeout, "Timeout cannot be null");
            if (maxConfigurations <= 0 || maxLocalStates <= 0) {
                throw new IllegalArgumentException("Exploration bounds must be positive");
            }
            return new SafetyParameters(maxConfigurations, timeout, maxLocalStates, stopAtFirstViolation);
        }

        public int getMaxConfigurations() {
            return maxConfigurations;
        }

        public int getMaxLocalStates() {
            return maxLocalStates;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public boolean isStopAtFirstViolation() {
            return stopAtFirstViolation;
        }

        public Builder setMaxConfigurations(int maxConfigurations) {
            this.maxConfigurations = maxConfigurations;
            return this;
        }

        public Builder setMaxLocalStates(int maxLocalStates) {
            this.maxLocalStates = maxLocalStates;
            return this;
        }

        public Builder setStopAtFirstViolation(boolean stopAtFirstViolation) {
            this.stopAtFirstViolation = stopAtFirstViolation;
            return this;
        }

        public Builder setTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }
    }
}
