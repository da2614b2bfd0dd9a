/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.mpst.cfg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * The control flow graph of a global protocol. Nodes and edges live in flat arenas addressed by integer id, so
 * cycles are plain data. Instances are immutable and may be shared between threads.
 */
public final class Cfg {

    public static Builder newBuilder(String protocol, List<String> roles) {
        return new Builder(protocol, roles);
    }

    private final ImmutableList<CfgEdge>                 edges;
    private final ImmutableListMultimap<Integer, CfgEdge> incoming;
    private final int                                    initial;
    private final ImmutableList<CfgNode>                 nodes;
    private final ImmutableListMultimap<Integer, CfgEdge> outgoing;
    private final String                                 protocol;
    private final ImmutableList<String>                  roles;

    private Cfg(String protocol, List<String> roles, List<CfgNode> nodes, List<CfgEdge> edges) {
        this.protocol = protocol;
        this.roles = ImmutableList.copyOf(roles);
        this.nodes = ImmutableList.copyOf(nodes);
        this.edges = ImmutableList.copyOf(edges);
        var out = ImmutableListMultimap.<Integer, CfgEdge>builder();
        var in = ImmutableListMultimap.<Integer, CfgEdge>builder();
        for (var edge : edges) {
            out.put(edge.source(), edge);
            in.put(edge.target(), edge);
        }
        outgoing = out.build();
        incoming = in.build();
        initial = nodes.stream()
                       .filter(n -> n.kind() == NodeKind.INITIAL)
                       .mapToInt(CfgNode::id)
                       .findFirst()
                       .orElseThrow(() -> new IllegalStateException("No initial node in CFG of: " + protocol));
    }

    public List<CfgEdge> edges() {
        return edges;
    }

    public List<CfgEdge> incoming(int node) {
        return incoming.get(node);
    }

    public CfgNode initial() {
        return nodes.get(initial);
    }

    /**
     * Answer the unique join of the parallel id, if exactly one exists
     */
    public Optional<CfgNode.Join> join(String parallelId) {
        var joins = nodes.stream()
                         .filter(n -> n instanceof CfgNode.Join j && j.parallelId().equals(parallelId))
                         .map(n -> (CfgNode.Join) n)
                         .toList();
        return joins.size() == 1 ? Optional.of(joins.get(0)) : Optional.empty();
    }

    public CfgNode node(int id) {
        return nodes.get(id);
    }

    public List<CfgNode> nodes() {
        return nodes;
    }

    public List<CfgNode> nodes(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }

    public List<CfgEdge> outgoing(int node) {
        return outgoing.get(node);
    }

    public String protocol() {
        return protocol;
    }

    public List<String> roles() {
        return roles;
    }

    public int size() {
        return nodes.size();
    }

    public List<CfgNode> terminals() {
        return nodes(NodeKind.TERMINAL);
    }

    @Override
    public String toString() {
        var buff = new StringBuilder("CFG ").append(protocol).append(roles).append('\n');
        for (var node : nodes) {
            buff.append("  ").append(node).append('\n');
            for (var edge : outgoing(node.id())) {
                buff.append("    ").append(edge).append('\n');
            }
        }
        return buff.toString();
    }

    /**
     * Mutable arena used while constructing a graph. Node ids are dense and assigned in insertion order.
     */
    public static class Builder {
        private final List<CfgEdge> edges = new ArrayList<>();
        private final List<CfgNode> nodes = new ArrayList<>();
        private final String        protocol;
        private final List<String>  roles;
        private int                 parallelIds;

        private Builder(String protocol, List<String> roles) {
            this.protocol = Objects.requireNonNull(protocol, "protocol");
            this.roles = List.copyOf(roles);
        }

        /**
         * Add the node produced by the factory, which receives the id allocated to it
         *
         * @return the id of the new node
         */
        public int add(IntFunction<CfgNode> factory) {
            var id = nodes.size();
            var node = factory.apply(id);
            if (node.id() != id) {
                throw new IllegalArgumentException("Node: " + node + " does not carry allocated id: " + id);
            }
            nodes.add(node);
            return id;
        }

        public Cfg build() {
            return new Cfg(protocol, roles, nodes, edges);
        }

        public CfgEdge connect(EdgeKind kind, int source, int target) {
            return connect(kind, source, target, null, null);
        }

        public CfgEdge connect(EdgeKind kind, int source, int target, String label, MessageAction action) {
            if (source < 0 || source >= nodes.size() || target < 0 || target >= nodes.size()) {
                throw new IllegalArgumentException("Edge endpoints out of range: " + source + " -> " + target);
            }
            var edge = new CfgEdge(edges.size(), kind, source, target, label, action);
            edges.add(edge);
            return edge;
        }

        public String nextParallelId() {
            return "par" + parallelIds++;
        }
    }
}
