/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.verification;

import com.salesforce.mpst.verification.Finding.AmbiguousChoice;
import com.salesforce.mpst.verification.Finding.DeadlockCycle;
import com.salesforce.mpst.verification.Finding.ForkJoinMismatch;
import com.salesforce.mpst.verification.Finding.LivenessWarning;
import com.salesforce.mpst.verification.Finding.ParallelConflict;
import com.salesforce.mpst.verification.Finding.ProgressViolation;
import com.salesforce.mpst.verification.Finding.RaceWarning;
import com.salesforce.mpst.verification.Finding.UnusedRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The findings of every check the verifier ran, grouped by check.
 */
public record VerificationReport(List<DeadlockCycle> deadlockCycles, List<ProgressViolation> progressViolations,
                                 Optional<LivenessWarning> liveness, List<ForkJoinMismatch> forkJoinMismatches,
                                 List<ParallelConflict> parallelConflicts, List<RaceWarning> raceWarnings,
                                 List<AmbiguousChoice> ambiguousChoices, List<UnusedRole> unusedRoles,
                                 boolean strict) {
    public VerificationReport {
        deadlockCycles = List.copyOf(deadlockCycles);
        progressViolations = List.copyOf(progressViolations);
        forkJoinMismatches = List.copyOf(forkJoinMismatches);
        parallelConflicts = List.copyOf(parallelConflicts);
        raceWarnings = List.copyOf(raceWarnings);
        ambiguousChoices = List.copyOf(ambiguousChoices);
        unusedRoles = List.copyOf(unusedRoles);
    }

    public List<Finding> errors() {
        return findings().stream().filter(f -> f.severity() == Finding.Severity.ERROR).toList();
    }

    public List<Finding> findings() {
        var all = new ArrayList<Finding>();
        all.addAll(deadlockCycles);
        all.addAll(progressViolations);
        liveness.ifPresent(all::add);
        all.addAll(forkJoinMismatches);
        all.addAll(parallelConflicts);
        all.addAll(raceWarnings);
        all.addAll(ambiguousChoices);
        all.addAll(unusedRoles);
        return all;
    }

    public boolean isValid() {
        return strict ? findings().isEmpty() : errors().isEmpty();
    }

    public List<Finding> warnings() {
        return findings().stream().filter(f -> f.severity() == Finding.Severity.WARNING).toList();
    }
}
