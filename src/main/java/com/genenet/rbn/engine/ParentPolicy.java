package com.genenet.rbn.engine;

import com.genenet.rbn.api.ConfigurationException;

/**
 * How {@link NetworkBuilder} chooses the parent count and the candidate
 * parents of each node.
 */
public enum ParentPolicy {
    /**
     * Default. Every node gets between 1 and {@code min(maxParents, n-1)}
     * parents and never depends on itself. Rule files for network inference
     * tools such as BNFinder reject self-dependencies.
     */
    EXCLUDE_SELF(1, false),

    /**
     * Relaxed variant. Between 0 and {@code min(maxParents, n)} parents, and
     * a node may be drawn as its own parent.
     */
    ALLOW_SELF_AND_EMPTY(0, true);

    private final int minParents;
    private final boolean selfAllowed;

    ParentPolicy(int minParents, boolean selfAllowed) {
        this.minParents = minParents;
        this.selfAllowed = selfAllowed;
    }

    public int minParents() {
        return minParents;
    }

    public boolean selfAllowed() {
        return selfAllowed;
    }

    /** Number of nodes a node of an {@code n}-node network may pick parents from. */
    public int candidateCount(int n) {
        return selfAllowed ? n : n - 1;
    }

    /**
     * Largest parent count this policy can produce.
     *
     * @throws ConfigurationException if the network has too few candidates for
     *                                the policy's minimum, or fewer than
     *                                {@code maxParents}.
     */
    public int maxParents(int n, int maxParents) {
        if (n < 1)
            throw new ConfigurationException("Node count must be >= 1, got " + n);
        if (maxParents < 1)
            throw new ConfigurationException("Max parents must be >= 1, got " + maxParents);
        int candidates = candidateCount(n);
        if (candidates < minParents)
            throw new ConfigurationException("Policy " + name() + " needs at least " + minParents
                    + " parent(s) per node but a " + n + "-node network offers " + candidates
                    + " candidate(s)");
        if (maxParents > candidates)
            throw new ConfigurationException("Max parents must be <= " + candidates + " for a " + n
                    + "-node network under " + name() + ", got " + maxParents);
        return maxParents;
    }
}
