package com.genenet.rbn.api;

import java.util.Arrays;

/**
 * A node of a Boolean network: its index, display name, ordered parent
 * indices and update rule.
 *
 * @param index   node id in {@code [0, n)}.
 * @param name    identifier used in expressions and exports, e.g. {@code X3}.
 * @param parents parent node ids, in the order the rule reads them.
 * @param rule    update rule with arity equal to {@code parents.length}.
 */
public record NetworkNode(int index, String name, int[] parents, Rule rule) {

    public NetworkNode {
        if (rule.arity() != parents.length)
            throw new IllegalArgumentException("Node " + name + " has " + parents.length
                    + " parents but its rule reads " + rule.arity());
        parents = parents.clone();
    }

    @Override
    public int[] parents() {
        return parents.clone();
    }

    public int parentCount() {
        return parents.length;
    }

    public int parent(int i) {
        return parents[i];
    }

    public boolean hasParents() {
        return parents.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NetworkNode other))
            return false;
        return index == other.index && name.equals(other.name)
                && Arrays.equals(parents, other.parents) && rule.equals(other.rule);
    }

    @Override
    public int hashCode() {
        int h = 31 * index + name.hashCode();
        h = 31 * h + Arrays.hashCode(parents);
        return 31 * h + rule.hashCode();
    }

    @Override
    public String toString() {
        return "NetworkNode[" + index + ", " + name + ", parents=" + Arrays.toString(parents) + ", " + rule + "]";
    }
}
