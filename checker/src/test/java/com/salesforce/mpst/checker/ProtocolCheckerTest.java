/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.checker;

import static com.codahale.metrics.MetricRegistry.name;
import static com.salesforce.mpst.ast.Interactions.alternative;
import static com.salesforce.mpst.ast.Interactions.choice;
import static com.salesforce.mpst.ast.Interactions.cont;
import static com.salesforce.mpst.ast.Interactions.invoke;
import static com.salesforce.mpst.ast.Interactions.message;
import static com.salesforce.mpst.ast.Interactions.protocol;
import static com.salesforce.mpst.ast.Interactions.recursion;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;

import com.codahale.metrics.MetricRegistry;
import com.salesforce.mpst.ast.GlobalProtocol;
import com.salesforce.mpst.ast.ProtocolModule;
import com.salesforce.mpst.cfg.StructuralError;
import com.salesforce.mpst.safety.SafetyParameters;
import com.salesforce.mpst.safety.SafetyReport.Verdict;

public class ProtocolCheckerTest {

    private static GlobalProtocol stream() {
        return protocol("Stream", List.of("A", "B"),
                        recursion("X", choice("A", alternative("more", message("A", "B", "more"), cont("X")),
                                              alternative("stop", message("A", "B", "stop")))));
    }

    @Test
    public void failingStageIsReportedAndOthersComplete() throws Exception {
        var metrics = mock(CheckerMetrics.class);
        when(metrics.verificationDuration()).thenThrow(new IllegalStateException("boom"));
        var checker = new ProtocolChecker(ProtocolChecker.Parameters.newBuilder().build(), Runnable::run, metrics);
        var p = stream();
        var report = checker.check(p, ProtocolModule.of(p));

        assertEquals(List.of(new StageFailure("verification", "IllegalStateException: boom")), report.failures());
        assertTrue(report.verification().isEmpty());
        assertTrue(report.isSafe());
        verify(metrics).stageFailed("verification");
    }

    @Test
    public void incompleteProjectionSkipsSafety() throws Exception {
        var p = protocol("Ambiguous", List.of("A", "B", "C"),
                         choice("A", alternative("x", message("A", "B", "x"), message("B", "C", "y")),
                                alternative("z", message("A", "B", "z"), message("B", "C", "y"))));
        var metrics = mock(CheckerMetrics.class);
        var checker = new ProtocolChecker(ProtocolChecker.Parameters.newBuilder().build(), Runnable::run, metrics);
        var report = checker.check(p, ProtocolModule.of(p));

        assertFalse(report.projection().get().isComplete());
        assertTrue(report.safety().isEmpty());
        assertFalse(report.isSafe());
        verify(metrics, never()).safetyChecked(any());
    }

    @Test
    public void invocationsResolveAgainstTheModule() throws Exception {
        var ping = protocol("Ping", List.of("P", "Q"), message("P", "Q", "ping"), message("Q", "P", "pong"));
        var main = protocol("Main", List.of("A", "B", "C"), invoke("Ping", "A", "B"), invoke("Ping", "B", "C"));
        var checker = new ProtocolChecker(ProtocolChecker.Parameters.newBuilder().build(), Runnable::run);
        var report = checker.check(ProtocolModule.of(main, ping), "Main");

        assertEquals("Main", report.protocol());
        assertTrue(report.isSafe());
        assertEquals(3, report.roleCount());
    }

    @Test
    public void metricsAreRecorded() throws Exception {
        var registry = new MetricRegistry();
        var checker = new ProtocolChecker(ProtocolChecker.Parameters.newBuilder().build(), Runnable::run,
                                          new CheckerMetricsImpl("test", registry));
        var p = stream();
        checker.check(p, ProtocolModule.of(p));
        var broken = protocol("Broken", List.of("A", "B"), message("A", "Z", "m"));
        checker.check(broken, ProtocolModule.of(broken));

        assertEquals(2, registry.timer(name("test", "cfg.build.duration")).getCount());
        assertEquals(1, registry.meter(name("test", "cfg.structural.failures")).getCount());
        assertEquals(1, registry.timer(name("test", "verification.duration")).getCount());
        assertEquals(1, registry.timer(name("test", "projection.duration")).getCount());
        assertEquals(1, registry.timer(name("test", "safety.duration")).getCount());
        assertEquals(1, registry.meter(name("test", "safety.safe")).getCount());
        assertEquals(0, registry.meter(name("test", "safety.unsafe")).getCount());
        assertEquals(0, registry.counter(name("test", "stage.failures")).getCount());
    }

    @Test
    public void parametersReachTheSafetyChecker() throws Exception {
        var parameters = ProtocolChecker.Parameters.newBuilder()
                                                   .setSafety(SafetyParameters.newBuilder()
                                                                              .setMaxConfigurations(1)
                                                                              .setTimeout(Duration.ofSeconds(5))
                                                                              .build())
                                                   .build();
        var checker = new ProtocolChecker(parameters, Runnable::run);
        var p = stream();
        var report = checker.check(p, ProtocolModule.of(p));

        assertEquals(Verdict.INCONCLUSIVE, report.safety().get().verdict());
        assertEquals(1, checker.getParameters().safety().maxConfigurations());
    }

    @Test
    public void runsStagesOnTheExecutor() throws Exception {
        var executor = Executors.newFixedThreadPool(2);
        try {
            var checker = new ProtocolChecker(ProtocolChecker.Parameters.newBuilder().build(), executor);
            for (int i = 0; i < 10; i++) {
                var p = stream();
                var report = checker.check(p, ProtocolModule.of(p));
                assertTrue(report.isSafe());
                assertTrue(report.verification().get().isValid());
                assertTrue(report.failures().isEmpty());
            }
        } finally {
            executor.shutdown();
        }
    }

    @Test
    public void structuralErrorsStopTheCheck() throws Exception {
        var metrics = mock(CheckerMetrics.class);
        var checker = new ProtocolChecker(ProtocolChecker.Parameters.newBuilder().build(), Runnable::run, metrics);
        var broken = protocol("Broken", List.of("A", "B"), message("A", "A", "m"));
        var report = checker.check(broken, ProtocolModule.of(broken));

        assertFalse(report.isStructurallyValid());
        assertEquals(StructuralError.Kind.SELF_COMMUNICATION, report.structuralErrors().get(0).kind());
        assertTrue(report.cfg().isEmpty());
        assertTrue(report.safety().isEmpty());
        verify(metrics).structuralFailure();
        verify(metrics, never()).verified(0, 0);
    }

    @Test
    public void unknownProtocol() throws Exception {
        var checker = new ProtocolChecker(ProtocolChecker.Parameters.newBuilder().build(), Runnable::run);
        var report = checker.check(ProtocolModule.of(stream()), "Missing");

        assertFalse(report.isStructurallyValid());
        assertEquals(StructuralError.Kind.UNKNOWN_PROTOCOL, report.structuralErrors().get(0).kind());
        assertEquals(0, report.roleCount());
    }

    @Test
    public void unexpectedBuildFailureIsContained() throws Exception {
        var metrics = mock(CheckerMetrics.class);
        when(metrics.buildDuration()).thenThrow(new IllegalStateException("no timer"));
        var checker = new ProtocolChecker(ProtocolChecker.Parameters.newBuilder().build(), Runnable::run, metrics);
        var p = stream();
        var report = checker.check(p, ProtocolModule.of(p));

        assertEquals("cfg", report.failures().get(0).stage());
        assertTrue(report.cfg().isEmpty());
        verify(metrics).stageFailed("cfg");
    }
}
