/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.checker;

import com.salesforce.mpst.cfg.Cfg;
import com.salesforce.mpst.cfg.StructuralError;
import com.salesforce.mpst.projection.ProjectionResult;
import com.salesforce.mpst.safety.SafetyReport;
import com.salesforce.mpst.verification.VerificationReport;

import java.util.List;
import java.util.Optional;

/**
 * Everything a combined check learned about one protocol. Stages that did not run are empty: nothing follows a
 * structural error, and safety is not checked unless every role projected.
 */
public record ProtocolReport(String protocol, List<StructuralError> structuralErrors, Optional<Cfg> cfg,
                             Optional<VerificationReport> verification, Optional<ProjectionResult> projection,
                             Optional<SafetyReport> safety, List<StageFailure> failures) {

    public static ProtocolReport invalid(String protocol, List<StructuralError> errors) {
        return new ProtocolReport(protocol, errors, Optional.empty(), Optional.empty(), Optional.empty(),
                                  Optional.empty(), List.of());
    }

    public ProtocolReport {
        structuralErrors = List.copyOf(structuralErrors);
        failures = List.copyOf(failures);
    }

    /**
     * True only if safety was checked and found no violation within its bounds
     */
    public boolean isSafe() {
        return safety.map(SafetyReport::isSafe).orElse(false);
    }

    public boolean isStructurallyValid() {
        return structuralErrors.isEmpty();
    }

    public int roleCount() {
        return cfg.map(c -> c.roles().size()).orElse(0);
    }

    public int totalCfsmStates() {
        return projection.map(ProjectionResult::totalStates).orElse(0);
    }
}
