/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.checker;

import com.codahale.metrics.Timer;
import com.codahale.metrics.Timer.Context;
import com.salesforce.mpst.ast.GlobalProtocol;
import com.salesforce.mpst.ast.ProtocolModule;
import com.salesforce.mpst.cfg.Cfg;
import com.salesforce.mpst.cfg.CfgBuilder;
import com.salesforce.mpst.cfg.CfgResult;
import com.salesforce.mpst.cfg.StructuralError;
import com.salesforce.mpst.projection.Cfsm;
import com.salesforce.mpst.projection.ProjectionResult;
import com.salesforce.mpst.projection.Projector;
import com.salesforce.mpst.safety.SafetyChecker;
import com.salesforce.mpst.safety.SafetyParameters;
import com.salesforce.mpst.safety.SafetyReport;
import com.salesforce.mpst.verification.CfgVerifier;
import com.salesforce.mpst.verification.VerificationReport;
import com.salesforce.mpst.verification.VerifierOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The library boundary of protocol checking. The individual stages are exposed for callers that want one of
 * them; {@link #check} builds the graph and then runs the static verifier and the projection and safety pipeline
 * concurrently, since they share nothing but the immutable graph. No exception escapes a check.
 */
public class ProtocolChecker {

    public record Parameters(SafetyParameters safety, VerifierOptions verifier) {

        public static Builder newBuilder() {
            return new Builder();
        }

        public static class Builder {
            private SafetyParameters safety   = SafetyParameters.newBuilder().build();
            private VerifierOptions  verifier = VerifierOptions.defaults();

            public Parameters build() {
                Objects.requireNonNull(safety, "Safety parameters cannot be null");
                Objects.requireNonNull(verifier, "Verifier options cannot be null");
                return new Parameters(safety, verifier);
            }

            public SafetyParameters getSafety() {
                return safety;
            }

            public VerifierOptions getVerifier() {
                return verifier;
            }

            public Builder setSafety(SafetyParameters safety) {
                this.safety = safety;
                return this;
            }

            public Builder setVerifier(VerifierOptions verifier) {
                this.verifier = verifier;
                return this;
            }
        }
    }

    private record Pipeline(ProjectionResult projection, Optional<SafetyReport> safety) {
    }

    private static final Logger log = LoggerFactory.getLogger(ProtocolChecker.class);

    private final Executor       executor;
    private final CheckerMetrics metrics;
    private final Parameters     parameters;

    public ProtocolChecker(Parameters parameters, Executor executor) {
        this(parameters, executor, null);
    }

    public ProtocolChecker(Parameters parameters, Executor executor, CheckerMetrics metrics) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = metrics;
    }

    public CfgResult buildCfg(GlobalProtocol protocol, ProtocolModule module) {
        var result = timed(metrics == null ? null : metrics.buildDuration(),
                           () -> CfgBuilder.buildCfg(protocol, module));
        if (!result.isValid() && metrics != null) {
            metrics.structuralFailure();
        }
        return result;
    }

    /**
     * Build, verify, project and check the safety of the protocol
     */
    public ProtocolReport check(GlobalProtocol protocol, ProtocolModule module) {
        CfgResult built;
        try {
            built = buildCfg(protocol, module);
        } catch (RuntimeException e) {
            log.warn("CFG construction of: {} failed", protocol.name(), e);
            return failed(protocol.name(), StageFailure.of("cfg", e));
        }
        if (!built.isValid()) {
            log.info("Protocol: {} is structurally invalid: {}", protocol.name(), built.errors());
            return ProtocolReport.invalid(protocol.name(), built.errors());
        }
        var cfg = built.get();
        var verification = CompletableFuture.supplyAsync(() -> verify(cfg), executor);
        var pipeline = CompletableFuture.supplyAsync(() -> {
            var projection = projectAll(cfg);
            if (!projection.isComplete()) {
                return new Pipeline(projection, Optional.empty());
            }
            return new Pipeline(projection, Optional.of(checkSafety(projection.cfsms())));
        }, executor);

        var failures = new ArrayList<StageFailure>();
        var verified = await(verification, "verification", failures);
        var projected = await(pipeline, "safety", failures);
        var report = new ProtocolReport(protocol.name(), List.of(), Optional.of(cfg), verified,
                                        projected.map(Pipeline::projection),
                                        projected.flatMap(Pipeline::safety), failures);
        log.info("Checked: {} roles: {} cfsm states: {} safety: {}", protocol.name(), report.roleCount(),
                 report.totalCfsmStates(), report.safety().map(SafetyReport::verdict).orElse(null));
        return report;
    }

    /**
     * Check the named protocol of the module
     */
    public ProtocolReport check(ProtocolModule module, String protocol) {
        return module.lookup(protocol)
                     .map(p -> check(p, module))
                     .orElseGet(() -> ProtocolReport.invalid(protocol, List.of(
                     new StructuralError(StructuralError.Kind.UNKNOWN_PROTOCOL, protocol,
                                         "No such protocol in " + module))));
    }

    public SafetyReport checkSafety(Map<String, Cfsm> cfsms) {
        var report = timed(metrics == null ? null : metrics.safetyDuration(),
                           () -> new SafetyChecker(parameters.safety()).check(cfsms));
        if (metrics != null) {
            metrics.safetyChecked(report);
        }
        return report;
    }

    public Parameters getParameters() {
        return parameters;
    }

    public ProjectionResult projectAll(Cfg cfg) {
        return timed(metrics == null ? null : metrics.projectionDuration(), () -> Projector.projectAll(cfg));
    }

    public VerificationReport verify(Cfg cfg) {
        var report = timed(metrics == null ? null : metrics.verificationDuration(),
                           () -> new CfgVerifier(parameters.verifier()).verify(cfg));
        if (metrics != null) {
            metrics.verified(report.errors().size(), report.warnings().size());
        }
        return report;
    }

    private <T> Optional<T> await(CompletableFuture<T> future, String stage, List<StageFailure> failures) {
        return future.thenApply(Optional::of).exceptionally(captured(stage, failures)).join();
    }

    private <T> Function<Throwable, Optional<T>> captured(String stage, List<StageFailure> failures) {
        return t -> {
            var cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
            log.warn("Stage: {} failed", stage, cause);
            if (metrics != null) {
                metrics.stageFailed(stage);
            }
            synchronized (failures) {
                failures.add(StageFailure.of(stage, cause));
            }
            return Optional.empty();
        };
    }

    private ProtocolReport failed(String protocol, StageFailure failure) {
        if (metrics != null) {
            metrics.stageFailed(failure.stage());
        }
        return new ProtocolReport(protocol, List.of(), Optional.empty(), Optional.empty(), Optional.empty(),
                                  Optional.empty(), List.of(failure));
    }

    private <T> T timed(Timer timer, Supplier<T> stage) {
        Context context = timer != null ? timer.time() : null;
        try {
            return stage.get();
        } finally {
            if (context != null) {
                context.close();
            }
        }
    }
}
