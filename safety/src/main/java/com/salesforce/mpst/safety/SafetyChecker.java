/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.safety;

import com.salesforce.mpst.projection.Cfsm;
import com.salesforce.mpst.safety.SafetyReport.Metrics;
import com.salesforce.mpst.safety.SafetyReport.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution based safety checking. Explores the configurations reachable from the tau closed initial
 * configuration breadth first, checking the safety predicate at each one. Exploration is bounded; an exhausted
 * bound with no violation found is reported as inconclusive.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
public class SafetyChecker {

    private static final Logger log = LoggerFactory.getLogger(SafetyChecker.class);

    public static Map<String, Cfsm> flatten(Map<String, Cfsm> cfsms, int maxLocalStates) {
        var flat = new LinkedHashMap<String, Cfsm>();
        cfsms.forEach((role, cfsm) -> flat.put(role, LocalConcurrency.flatten(cfsm, maxLocalStates)));
        return flat;
    }

    private final SafetyParameters parameters;

    public SafetyChecker() {
        this(SafetyParameters.newBuilder().build());
    }

    public SafetyChecker(SafetyParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Check the protocol whose roles have the given automata
     */
    public SafetyReport check(Map<String, Cfsm> cfsms) {
        var start = System.nanoTime();
        Map<String, Cfsm> flat;
        try {
            flat = flatten(cfsms, parameters.maxLocalStates());
        } catch (StateSpaceExceededException | IllegalStateException e) {
            log.warn("Safety check inconclusive: {}", e.getMessage());
            return new SafetyReport(Verdict.INCONCLUSIVE, List.of(), new Metrics(0, since(start)));
        }
        return explore(TauClosure.close(Configuration.initial(flat)), start);
    }

    /**
     * Check every configuration reachable from the given one, whose automata must not carry parallel regions
     */
    public SafetyReport check(Configuration configuration) {
        return explore(TauClosure.close(configuration), System.nanoTime());
    }

    public SafetyParameters getParameters() {
        return parameters;
    }

    private SafetyReport explore(Configuration initial, long start) {
        var deadline = start + parameters.timeout().toNanos();
        var visited = new HashSet<Configuration>();
        var frontier = new ArrayDeque<Configuration>();
        var violations = new ArrayList<SafetyViolation>();
        visited.add(initial);
        frontier.add(initial);
        var explored = 0;
        var exhausted = false;
        while (!frontier.isEmpty()) {
            if (explored >= parameters.maxConfigurations() || System.nanoTime() > deadline) {
                exhausted = true;
                break;
            }
            var configuration = frontier.poll();
            explored++;
            var found = SafetyPredicate.violations(configuration);
            if (!found.isEmpty()) {
                log.trace("Unsafe configuration: {} violations: {}", configuration, found);
                violations.addAll(found);
                if (parameters.stopAtFirstViolation()) {
                    break;
                }
            }
            for (var successor : Reducer.successors(configuration)) {
                if (visited.add(successor)) {
                    frontier.add(successor);
                }
            }
        }

        Verdict verdict;
        if (!violations.isEmpty()) {
            verdict = Verdict.UNSAFE;
        } else if (exhausted) {
            verdict = Verdict.INCONCLUSIVE;
            log.warn("Safety budget exhausted after: {} configurations, frontier: {}", explored, frontier.size());
        } else {
            verdict = Verdict.SAFE;
        }
        var report = new SafetyReport(verdict, violations, new Metrics(explored, since(start)));
        log.debug("Safety: {}", report);
        return report;
    }

    private Duration since(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
