/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.checker;

import com.codahale.metrics.Timer;
import com.salesforce.mpst.safety.SafetyReport;

public interface CheckerMetrics {

    Timer buildDuration();

    Timer projectionDuration();

    void safetyChecked(SafetyReport report);

    Timer safetyDuration();

    void stageFailed(String stage);

    void structuralFailure();

    Timer verificationDuration();

    void verified(int errors, int warnings);
}
