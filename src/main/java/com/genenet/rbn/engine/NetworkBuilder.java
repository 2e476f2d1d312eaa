package com.genenet.rbn.engine;

import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.NetworkNode;
import com.genenet.rbn.api.Rule;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates random Boolean networks, and assembles hand-written ones.
 *
 * <p>
 * Random generation, per node {@code i}:
 * <ol>
 * <li>draw {@code k} uniformly from the range allowed by the
 * {@link ParentPolicy};</li>
 * <li>sample {@code k} distinct parents without replacement from the
 * candidates (parent order is the sampling order);</li>
 * <li>draw a rule for those parents from the {@link RuleGenerator}.</li>
 * </ol>
 *
 * Node {@code i} is named {@code X<i>}.
 */
@Log4j2
public final class NetworkBuilder {
    public static final String NODE_PREFIX = "X";

    private final Random random;
    private final RuleGenerator ruleGenerator;
    private ParentPolicy policy = ParentPolicy.EXCLUDE_SELF;

    public NetworkBuilder(Random random) {
        this.random = random;
        this.ruleGenerator = new RuleGenerator(random);
    }

    public NetworkBuilder policy(ParentPolicy policy) {
        this.policy = policy;
        return this;
    }

    public ParentPolicy policy() {
        return policy;
    }

    public static String nodeName(int index) {
        return NODE_PREFIX + index;
    }

    /**
     * Builds a random network.
     *
     * @param n          number of nodes, at least 1.
     * @param maxParents upper bound on parents per node, at least 1.
     * @return the network.
     * @throws com.genenet.rbn.api.ConfigurationException if the parameters
     *                                                    cannot satisfy the
     *                                                    policy.
     */
    public Network build(int n, int maxParents) {
        int upper = policy.maxParents(n, maxParents);
        int lower = policy.minParents();

        List<NetworkNode> nodes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int k = lower + random.nextInt(upper - lower + 1);
            int[] parents = sampleParents(i, n, k);

            List<String> names = new ArrayList<>(k);
            for (int p : parents)
                names.add(nodeName(p));
            Rule rule = ruleGenerator.generate(names);
            nodes.add(new NetworkNode(i, nodeName(i), parents, rule));
        }
        log.debug("Generated {}-node network (maxParents={}, policy={})", n, maxParents, policy);
        return new Network(nodes);
    }

    // Partial Fisher-Yates over the candidate list.
    private int[] sampleParents(int self, int n, int k) {
        int[] candidates = new int[policy.candidateCount(n)];
        int c = 0;
        for (int j = 0; j < n; j++) {
            if (j != self || policy.selfAllowed())
                candidates[c++] = j;
        }
        for (int i = 0; i < k; i++) {
            int pick = i + random.nextInt(candidates.length - i);
            int tmp = candidates[i];
            candidates[i] = candidates[pick];
            candidates[pick] = tmp;
        }
        int[] parents = new int[k];
        System.arraycopy(candidates, 0, parents, 0, k);
        return parents;
    }

    /** Starts a hand-assembled network. */
    public static Manual manual() {
        return new Manual();
    }

    /**
     * Assembles a network node by node. Node {@code i} is the {@code i}-th
     * node added.
     */
    public static final class Manual {
        private final List<NetworkNode> nodes = new ArrayList<>();

        /**
         * Adds the next node.
         *
         * @param rule    update rule, arity equal to the parent count.
         * @param parents parent indices in the order the rule reads them.
         */
        public Manual addNode(Rule rule, int... parents) {
            int index = nodes.size();
            nodes.add(new NetworkNode(index, nodeName(index), parents, rule));
            return this;
        }

        public Network build() {
            return new Network(nodes);
        }
    }
}
