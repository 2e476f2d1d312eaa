package com.genenet.rbn.io;

import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.NetworkNode;
import com.genenet.rbn.api.Rule;
import com.genenet.rbn.api.TranslationException;
import com.genenet.rbn.fn.ConstantRule;
import com.genenet.rbn.fn.Expr;
import com.genenet.rbn.fn.ExpressionRule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes the {@code .bnet} rule-file format used by trap-space
 * solvers such as PyBoolNet.
 *
 * <p>
 * One line per node: {@code <node-id>, <expression>}, with {@code !},
 * {@code &} and {@code |} for NOT, AND and OR. When writing, node {@code i} is
 * identified as {@code v<i>} regardless of its display name, since solvers
 * require plain identifiers.
 */
public final class BnetFormat {
    public static final String ID_PREFIX = "v";

    private BnetFormat() {
        // Utility class
    }

    public static String nodeId(int index) {
        return ID_PREFIX + index;
    }

    /**
     * Inverse of {@link #nodeId(int)}.
     *
     * @param id        solver identifier, e.g. {@code v3}.
     * @param nodeCount network size.
     * @return the node index.
     * @throws IllegalArgumentException if {@code id} is not a valid
     *                                  identifier for the network.
     */
    public static int nodeIndex(String id, int nodeCount) {
        if (id == null || id.length() <= ID_PREFIX.length() || !id.startsWith(ID_PREFIX))
            throw new IllegalArgumentException("Not a node identifier: " + id);
        String digits = id.substring(ID_PREFIX.length());
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i)))
                throw new IllegalArgumentException("Not a node identifier: " + id);
        }
        if (digits.length() > 9)
            throw new IllegalArgumentException("Node identifier out of range: " + id);
        int index = Integer.parseInt(digits);
        if (index >= nodeCount)
            throw new IllegalArgumentException("Node identifier out of range: " + id + " (" + nodeCount + " nodes)");
        return index;
    }

    /**
     * Translates one symbolic rule expression into the {@code .bnet}
     * grammar: {@code ¬ ∧ ∨} become {@code ! & |} and node names become
     * {@code v<i>} identifiers.
     *
     * @throws TranslationException if the expression contains anything the
     *                              solver grammar cannot express.
     */
    public static String translate(String expression, Network network) {
        StringBuilder sb = new StringBuilder(expression.length());
        for (String token : BnetExpressionParser.tokens(expression)) {
            char c = token.charAt(0);
            if (BnetExpressionParser.constantWord(token) != null) {
                sb.append(BnetExpressionParser.constantWord(token));
            } else if (BnetExpressionParser.isIdentifierStart(c)) {
                int index;
                try {
                    index = network.indexOf(token);
                } catch (IllegalArgumentException e) {
                    throw new TranslationException("Unknown node '" + token + "' in expression: " + expression);
                }
                sb.append(nodeId(index));
            } else if (token.equals("0") || token.equals("1")) {
                sb.append(token);
            } else {
                switch (c) {
                    case '¬', '!' -> sb.append('!');
                    case '∧', '&' -> sb.append(" & ");
                    case '∨', '|' -> sb.append(" | ");
                    case '(', ')' -> sb.append(c);
                    default -> throw new TranslationException(
                            "Symbol '" + token + "' has no solver equivalent in expression: " + expression);
                }
            }
        }
        return sb.toString();
    }

    /** Renders the whole network as {@code .bnet} text, one line per node. */
    public static String toBnet(Network network) {
        StringBuilder sb = new StringBuilder(network.size() * 32);
        for (int i = 0; i < network.size(); i++) {
            sb.append(nodeId(i)).append(", ")
                    .append(translate(network.rule(i).expression(), network))
                    .append('\n');
        }
        return sb.toString();
    }

    public static void write(Network network, Path path) throws IOException {
        Files.writeString(path, toBnet(network), StandardCharsets.UTF_8);
    }

    public static Network load(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Parses {@code .bnet} text into a network.
     *
     * <p>
     * Blank lines, {@code #} comments, lines without a comma and the
     * {@code targets, factors} header are skipped. Nodes are indexed in order
     * of definition; identifiers that are referenced but never defined become
     * input nodes, appended after the defined ones, whose rule keeps their
     * current value. A node's parents are the nodes its expression mentions,
     * in index order. {@code True} and {@code False} are constants, never
     * node names.
     *
     * @throws IllegalArgumentException on duplicate targets or malformed
     *                                  expressions.
     */
    public static Network parse(String text) {
        Map<String, String> expressions = new LinkedHashMap<>();
        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#"))
                continue;
            int comma = line.indexOf(',');
            if (comma < 0)
                continue;
            String target = line.substring(0, comma).strip();
            if (target.equalsIgnoreCase("targets"))
                continue;
            if (BnetExpressionParser.isKeyword(target))
                throw new IllegalArgumentException("Reserved word used as a target: " + target);
            if (expressions.put(target, line.substring(comma + 1).strip()) != null)
                throw new IllegalArgumentException("Duplicate target: " + target);
        }
        if (expressions.isEmpty())
            throw new IllegalArgumentException("No rules found");

        List<String> names = new ArrayList<>(expressions.keySet());
        Set<String> inputs = new LinkedHashSet<>();
        for (String expr : expressions.values()) {
            for (String id : BnetExpressionParser.identifiers(expr)) {
                if (!expressions.containsKey(id))
                    inputs.add(id);
            }
        }
        names.addAll(inputs);

        Map<String, Integer> nameToIndex = new HashMap<>(names.size() * 2);
        for (int i = 0; i < names.size(); i++)
            nameToIndex.put(names.get(i), i);

        List<NetworkNode> nodes = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            String expr = expressions.getOrDefault(name, name);

            int[] parents = BnetExpressionParser.identifiers(expr).stream()
                    .mapToInt(nameToIndex::get)
                    .sorted()
                    .toArray();
            Map<String, Integer> positions = new HashMap<>(parents.length * 2);
            for (int j = 0; j < parents.length; j++)
                positions.put(names.get(parents[j]), j);

            nodes.add(new NetworkNode(i, name, parents, toRule(BnetExpressionParser.parse(expr, positions), parents)));
        }
        return new Network(nodes);
    }

    private static Rule toRule(Expr expr, int[] parents) {
        if (parents.length == 0 && expr instanceof Expr.Const c)
            return ConstantRule.of(c.value());
        return new ExpressionRule(parents.length, expr);
    }
}
