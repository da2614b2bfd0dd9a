/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.verification;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Tarjan's strongly connected components, iterative so that long chains do not exhaust the stack.
 */
public final class StronglyConnectedComponents {

    /**
     * @param size       the number of vertices, identified 0 to size - 1
     * @param successors the successors of each vertex
     * @return the components, each listing its vertices in ascending order, in reverse topological order
     */
    public static List<List<Integer>> of(int size, IntFunction<int[]> successors) {
        return new StronglyConnectedComponents(size, successors).compute();
    }

    private final int[][]             adjacency;
    private final List<List<Integer>> components = new ArrayList<>();
    private final int[]               index;
    private final int[]               lowLink;
    private final boolean[]           onStack;
    private final ArrayDeque<Integer> stack      = new ArrayDeque<>();
    private final IntFunction<int[]>  successors;
    private int                       counter;

    private StronglyConnectedComponents(int size, IntFunction<int[]> successors) {
        this.successors = successors;
        index = new int[size];
        lowLink = new int[size];
        onStack = new boolean[size];
        adjacency = new int[size][];
        Arrays.fill(index, -1);
    }

    private List<List<Integer>> compute() {
        for (int v = 0; v < index.length; v++) {
            if (index[v] < 0) {
                visit(v);
            }
        }
        return components;
    }

    private void visit(int root) {
        // each frame is {vertex, position in its successor array}
        var frames = new ArrayDeque<int[]>();
        open(root);
        frames.push(new int[] { root, 0 });
        while (!frames.isEmpty()) {
            var frame = frames.peek();
            var v = frame[0];
            if (frame[1] < adjacency[v].length) {
                var w = adjacency[v][frame[1]++];
                if (index[w] < 0) {
                    open(w);
                    frames.push(new int[] { w, 0 });
                } else if (onStack[w]) {
                    lowLink[v] = Math.min(lowLink[v], index[w]);
                }
                continue;
            }
            frames.pop();
            if (!frames.isEmpty()) {
                var parent = frames.peek()[0];
                lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
            }
            if (lowLink[v] == index[v]) {
                var component = new ArrayList<Integer>();
                int w;
                do {
                    w = stack.pop();
                    onStack[w] = false;
                    component.add(w);
                } while (w != v);
                component.sort(null);
                components.add(component);
            }
        }
    }

    private void open(int v) {
        index[v] = counter;
        lowLink[v] = counter;
        counter++;
        stack.push(v);
        onStack[v] = true;
        adjacency[v] = successors.apply(v);
    }
}
