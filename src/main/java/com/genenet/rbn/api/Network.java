package com.genenet.rbn.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable Boolean network: for every node, its ordered parent list and its
 * update rule.
 *
 * A network is built once per experiment and only read afterwards, so it can
 * be shared freely between simulations and attractor finders.
 *
 * Invariants checked on construction:
 * - node indices are {@code 0..n-1} in order and names are unique;
 * - every parent index is in range and appears at most once per node;
 * - every rule's arity equals its node's parent count.
 */
public final class Network {
    private final NetworkNode[] nodes;
    private final Map<String, Integer> nameToIndex;
    private final int maxArity;

    public Network(List<NetworkNode> nodes) {
        if (nodes.isEmpty())
            throw new IllegalArgumentException("Network must contain at least one node");
        this.nodes = nodes.toArray(new NetworkNode[0]);
        this.nameToIndex = new HashMap<>(nodes.size() * 2);
        int n = this.nodes.length;
        int widest = 0;
        for (int i = 0; i < n; i++) {
            NetworkNode node = this.nodes[i];
            if (node.index() != i)
                throw new IllegalArgumentException("Node at position " + i + " has index " + node.index());
            if (nameToIndex.put(node.name(), i) != null)
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
            boolean[] seen = new boolean[n];
            for (int p : node.parents()) {
                if (p < 0 || p >= n)
                    throw new IllegalArgumentException("Node " + node.name() + " has unknown parent " + p);
                if (seen[p])
                    throw new IllegalArgumentException("Node " + node.name() + " lists parent " + p + " twice");
                seen[p] = true;
            }
            widest = Math.max(widest, node.parentCount());
        }
        this.maxArity = widest;
    }

    public int size() {
        return nodes.length;
    }

    public NetworkNode node(int index) {
        return nodes[index];
    }

    public List<NetworkNode> nodes() {
        return Collections.unmodifiableList(Arrays.asList(nodes));
    }

    public Rule rule(int index) {
        return nodes[index].rule();
    }

    public int[] parents(int index) {
        return nodes[index].parents();
    }

    public String nodeName(int index) {
        return nodes[index].name();
    }

    public List<String> nodeNames() {
        List<String> names = new ArrayList<>(nodes.length);
        for (NetworkNode node : nodes)
            names.add(node.name());
        return names;
    }

    /** Resolves a node name to its index. */
    public int indexOf(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    /** Largest parent count of any node; sizes evaluation scratch buffers. */
    public int maxArity() {
        return maxArity;
    }

    /** True if some node lists itself as a parent. */
    public boolean hasSelfLoops() {
        for (NetworkNode node : nodes) {
            for (int p : node.parents()) {
                if (p == node.index())
                    return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Network[" + nodes.length + " nodes]";
    }
}
