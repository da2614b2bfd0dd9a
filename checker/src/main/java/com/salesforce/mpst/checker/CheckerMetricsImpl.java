/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.checker;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.salesforce.mpst.safety.SafetyReport;

import static com.codahale.metrics.MetricRegistry.name;

public class CheckerMetricsImpl implements CheckerMetrics {

    private final Timer          buildDuration;
    private final Meter          inconclusive;
    private final String         prefix;
    private final Timer          projectionDuration;
    private final MetricRegistry registry;
    private final Meter          safe;
    private final Timer          safetyDuration;
    private final Counter        stageFailures;
    private final Histogram      statesExplored;
    private final Meter          structuralFailures;
    private final Meter          unsafe;
    private final Timer          verificationDuration;
    private final Histogram      verificationErrors;
    private final Histogram      verificationWarnings;

    public CheckerMetricsImpl(String prefix, MetricRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;
        buildDuration = registry.timer(name(prefix, "cfg.build.duration"));
        structuralFailures = registry.meter(name(prefix, "cfg.structural.failures"));
        verificationDuration = registry.timer(name(prefix, "verification.duration"));
        verificationErrors = registry.histogram(name(prefix, "verification.errors"));
        verificationWarnings = registry.histogram(name(prefix, "verification.warnings"));
        projectionDuration = registry.timer(name(prefix, "projection.duration"));
        safetyDuration = registry.timer(name(prefix, "safety.duration"));
        statesExplored = registry.histogram(name(prefix, "safety.states.explored"));
        safe = registry.meter(name(prefix, "safety.safe"));
        unsafe = registry.meter(name(prefix, "safety.unsafe"));
        inconclusive = registry.meter(name(prefix, "safety.inconclusive"));
        stageFailures = registry.counter(name(prefix, "stage.failures"));
    }

    @Override
    public Timer buildDuration() {
        return buildDuration;
    }

    @Override
    public Timer projectionDuration() {
        return projectionDuration;
    }

    @Override
    public void safetyChecked(SafetyReport report) {
        statesExplored.update(report.metrics().statesExplored());
        switch (report.verdict()) {
        case SAFE -> safe.mark();
        case UNSAFE -> unsafe.mark();
        case INCONCLUSIVE -> inconclusive.mark();
        }
    }

    @Override
    public Timer safetyDuration() {
        return safetyDuration;
    }

    @Override
    public void stageFailed(String stage) {
        stageFailures.inc();
        registry.counter(name(prefix, "stage", stage, "failures")).inc();
    }

    @Override
    public void structuralFailure() {
        structuralFailures.mark();
    }

    @Override
    public Timer verificationDuration() {
        return verificationDuration;
    }

    @Override
    public void verified(int errors, int warnings) {
        verificationErrors.update(errors);
        verificationWarnings.update(warnings);
    }
}
