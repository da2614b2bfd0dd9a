/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.projection;

import com.salesforce.mpst.projection.CfsmAction.Receive;
import com.salesforce.mpst.projection.CfsmAction.Send;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Queries over a single automaton, treated as a labelled transition system.
 */
public interface CfsmAnalysis {

    /**
     * Transitions that close a cycle in a depth first walk from the initial state
     */
    static List<CfsmTransition> backEdges(Cfsm cfsm) {
        var back = new ArrayList<CfsmTransition>();
        var onPath = new HashSet<String>();
        var done = new HashSet<String>();
        var path = new ArrayDeque<String>();
        var iterators = new ArrayDeque<Iterator<CfsmTransition>>();
        onPath.add(cfsm.initialState());
        path.push(cfsm.initialState());
        iterators.push(cfsm.outgoing(cfsm.initialState()).iterator());
        while (!iterators.isEmpty()) {
            var transitions = iterators.peek();
            if (!transitions.hasNext()) {
                iterators.pop();
                var state = path.pop();
                onPath.remove(state);
                done.add(state);
                continue;
            }
            var transition = transitions.next();
            if (onPath.contains(transition.target())) {
                back.add(transition);
            } else if (!done.contains(transition.target())) {
                onPath.add(transition.target());
                path.push(transition.target());
                iterators.push(cfsm.outgoing(transition.target()).iterator());
            }
        }
        return back;
    }

    /**
     * States offering more than one transition
     */
    static Set<String> branchingStates(Cfsm cfsm) {
        var result = new TreeSet<String>();
        for (var state : cfsm.states()) {
            if (cfsm.outgoing(state).size() > 1) {
                result.add(state);
            }
        }
        return result;
    }

    static boolean canReachTerminal(Cfsm cfsm, String from) {
        return reachable(cfsm, from).stream().anyMatch(cfsm::isTerminal);
    }

    static boolean hasCycles(Cfsm cfsm) {
        return !backEdges(cfsm).isEmpty();
    }

    /**
     * Answer true if no state offers two sends to the same role with the same label, or two receives from the
     * same role with the same label, that lead to different states
     */
    static boolean isChoiceDeterministic(Cfsm cfsm) {
        for (var state : cfsm.states()) {
            var targets = new HashMap<String, String>();
            for (var transition : cfsm.outgoing(state)) {
                String key;
                if (transition.action() instanceof Send send) {
                    key = send.to() + "!" + send.label();
                } else if (transition.action() instanceof Receive receive) {
                    key = receive.from() + "?" + receive.label();
                } else {
                    continue;
                }
                var previous = targets.putIfAbsent(key, transition.target());
                if (previous != null && !previous.equals(transition.target())) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * States entered by more than one transition
     */
    static Set<String> mergeStates(Cfsm cfsm) {
        var incoming = new HashMap<String, Integer>();
        cfsm.transitions().forEach(t -> incoming.merge(t.target(), 1, Integer::sum));
        var result = new TreeSet<String>();
        incoming.forEach((state, count) -> {
            if (count > 1) {
                result.add(state);
            }
        });
        return result;
    }

    static Set<String> messageLabels(Cfsm cfsm) {
        var labels = new TreeSet<String>();
        for (var transition : cfsm.transitions()) {
            if (transition.action() instanceof Send send) {
                labels.add(send.label());
            } else if (transition.action() instanceof Receive receive) {
                labels.add(receive.label());
            }
        }
        return labels;
    }

    static Set<String> reachable(Cfsm cfsm, String from) {
        var seen = new HashSet<String>();
        var stack = new ArrayDeque<String>();
        stack.push(from);
        while (!stack.isEmpty()) {
            var state = stack.pop();
            if (seen.add(state)) {
                cfsm.outgoing(state).forEach(t -> stack.push(t.target()));
            }
        }
        return seen;
    }

    /**
     * The observable action sequences of the paths from the initial state that end in a terminal state or reach
     * the step bound. Tau transitions count as steps but are not recorded.
     */
    static List<List<CfsmAction>> traces(Cfsm cfsm, int maxSteps) {
        var traces = new ArrayList<List<CfsmAction>>();
        record Path(String state, List<CfsmAction> actions, int steps) {
        }
        var stack = new ArrayDeque<Path>();
        stack.push(new Path(cfsm.initialState(), List.of(), 0));
        while (!stack.isEmpty()) {
            var path = stack.pop();
            var outgoing = cfsm.outgoing(path.state());
            if (outgoing.isEmpty() || path.steps() == maxSteps) {
                traces.add(path.actions());
                continue;
            }
            if (cfsm.isTerminal(path.state())) {
                traces.add(path.actions());
            }
            for (int i = outgoing.size() - 1; i >= 0; i--) {
                var transition = outgoing.get(i);
                var actions = path.actions();
                if (!transition.action().isTau()) {
                    var extended = new ArrayList<>(actions);
                    extended.add(transition.action());
                    actions = List.copyOf(extended);
                }
                stack.push(new Path(transition.target(), actions, path.steps() + 1));
            }
        }
        return traces;
    }
}
