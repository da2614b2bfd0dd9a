/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.verification;

/**
 * Selects the checks the verifier runs. In strict mode warnings make a report invalid.
 */
public record VerifierOptions(boolean deadlocks, boolean progress, boolean liveness, boolean forkJoin,
                              boolean parallelConflicts, boolean races, boolean choiceDeterminism,
                              boolean connectedness, boolean strict) {

    public static VerifierOptions defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private boolean choiceDeterminism = true;
        private boolean connectedness     = true;
        private boolean deadlocks         = true;
        private boolean forkJoin          = true;
        private boolean liveness          = true;
        private boolean parallelConflicts = true;
        private boolean progress          = true;
        private boolean races             = true;
        private boolean strict            = false;

        public VerifierOptions build() {
            return new VerifierOptions(deadlocks, progress, liveness, forkJoin, parallelConflicts, races,
                                       choiceDeterminism, connectedness, strict);
        }

        public boolean isChoiceDeterminism() {
            return choiceDeterminism;
        }

        public boolean isConnectedness() {
            return connectedness;
        }

        public boolean isDeadlocks() {
            return deadlocks;
        }

        public boolean isForkJoin() {
            return forkJoin;
        }

        public boolean isLiveness() {
            return liveness;
        }

        public boolean isParallelConflicts() {
            return parallelConflicts;
        }

        public boolean isProgress() {
            return progress;
        }

        public boolean isRaces() {
            return races;
        }

        public boolean isStrict() {
            return strict;
        }

        public Builder setChoiceDeterminism(boolean choiceDeterminism) {
            this.choiceDeterminism = choiceDeterminism;
            return this;
        }

        public Builder setConnectedness(boolean connectedness) {
            this.connectedness = connectedness;
            return this;
        }

        public Builder setDeadlocks(boolean deadlocks) {
            this.deadlocks = deadlocks;
            return this;
        }

        public Builder setForkJoin(boolean forkJoin) {
            this.forkJoin = forkJoin;
            return this;
        }

        public Builder setLiveness(boolean liveness) {
            this.liveness = liveness;
            return this;
        }

        public Builder setParallelConflicts(boolean parallelConflicts) {
            this.parallelConflicts = parallelConflicts;
            return this;
        }

        public Builder setProgress(boolean progress) {
            this.progress = progress;
            return this;
        }

        public Builder setRaces(boolean races) {
            this.races = races;
            return this;
        }

        public Builder setStrict(boolean strict) {
            this.strict = strict;
            return this;
        }
    }
}
