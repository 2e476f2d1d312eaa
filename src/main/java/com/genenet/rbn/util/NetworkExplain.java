package com.genenet.rbn.util;

import com.genenet.rbn.api.Attractor;
import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.NetworkNode;
import com.genenet.rbn.api.State;

import java.util.List;

/**
 * Human-readable descriptions of a network and its attractors.
 *
 * <p>
 * <b>Usage:</b> reports, logs and debugging sessions. Allocates strings; not
 * meant for simulation loops.
 */
public final class NetworkExplain {
    private final Network network;

    public NetworkExplain(Network network) {
        this.network = network;
    }

    /**
     * Wiring and rules, two lines per node:
     *
     * <pre>
     * X2 &lt;- X0, X1
     *    f2 = (X0 ∧ ¬X1)
     * </pre>
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(network.size() * 48);
        for (NetworkNode node : network.nodes()) {
            sb.append(node.name()).append(" <- ");
            if (!node.hasParents()) {
                sb.append("NONE");
            } else {
                for (int j = 0; j < node.parentCount(); j++) {
                    if (j > 0)
                        sb.append(", ");
                    sb.append(network.nodeName(node.parent(j)));
                }
            }
            sb.append('\n');
            sb.append("   f").append(node.index()).append(" = ").append(node.rule().expression()).append('\n');
        }
        return sb.toString();
    }

    /** One line per attractor with its size and states. */
    public String explainAttractors(List<Attractor> attractors) {
        StringBuilder sb = new StringBuilder(256);
        for (int i = 0; i < attractors.size(); i++) {
            Attractor a = attractors.get(i);
            sb.append("  [").append(i).append("] size=").append(a.size()).append(' ');
            boolean first = true;
            for (State s : a.states()) {
                if (!first)
                    sb.append(' ');
                sb.append(s);
                first = false;
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram of the wiring, parent to child,
     * with each node labelled by its rule.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        for (NetworkNode node : network.nodes()) {
            sb.append("  ").append(sanitize(node.name())).append("[\"").append(node.name()).append(": ")
                    .append(node.rule().expression().replace("\"", "'")).append("\"];\n");
        }
        for (NetworkNode node : network.nodes()) {
            for (int j = 0; j < node.parentCount(); j++) {
                sb.append("  ").append(sanitize(network.nodeName(node.parent(j))))
                        .append(" --> ").append(sanitize(node.name())).append(";\n");
            }
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
