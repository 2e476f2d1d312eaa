package com.genenet.rbn.io;

import com.genenet.rbn.fn.BoolOp;
import com.genenet.rbn.fn.Expr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive descent parser for rule expressions.
 *
 * <p>
 * Accepts both the {@code .bnet} operators ({@code !}, {@code &},
 * {@code |}) and the symbolic ones ({@code ¬}, {@code ∧}, {@code ∨}).
 * Binary operators are left associative and AND binds tighter than OR:
 *
 * <pre>
 * or     := and ('|' and)*
 * and    := unary ('&amp;' unary)*
 * unary  := '!' unary | '(' or ')' | IDENT | '0' | '1' | 'True' | 'False'
 * </pre>
 *
 * <p>
 * {@code True}, {@code False}, {@code not}, {@code and} and {@code or} are
 * never node names. The first two are constants; the others are rejected.
 */
public final class BnetExpressionParser {
    private static final Set<String> RESERVED = Set.of("not", "and", "or");

    private final String input;
    private final Map<String, Integer> positions;
    private int pos;

    private BnetExpressionParser(String input, Map<String, Integer> positions) {
        this.input = input;
        this.positions = positions;
    }

    /**
     * Parses an expression.
     *
     * @param expression the expression text.
     * @param positions  parent position of every identifier the expression may
     *                   use.
     * @return the expression tree.
     * @throws IllegalArgumentException on a syntax error or unknown identifier.
     */
    public static Expr parse(String expression, Map<String, Integer> positions) {
        BnetExpressionParser p = new BnetExpressionParser(expression, positions);
        Expr e = p.parseOr();
        p.skipWS();
        if (p.pos < p.input.length())
            throw p.err("Unexpected '" + p.input.charAt(p.pos) + "'");
        return e;
    }

    /** Identifiers used by an expression, in order of first appearance. */
    public static Set<String> identifiers(String expression) {
        Set<String> ids = new LinkedHashSet<>();
        for (String token : tokens(expression)) {
            if (isIdentifierStart(token.charAt(0)) && !isKeyword(token))
                ids.add(token);
        }
        return ids;
    }

    /**
     * Splits an expression into identifiers, constants and single-character
     * operators.
     */
    static List<String> tokens(String expression) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isIdentifierStart(c)) {
                int start = i;
                while (i < expression.length() && isIdentifierPart(expression.charAt(i)))
                    i++;
                tokens.add(expression.substring(start, i));
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < expression.length() && Character.isDigit(expression.charAt(i)))
                    i++;
                tokens.add(expression.substring(start, i));
            } else {
                tokens.add(String.valueOf(c));
                i++;
            }
        }
        return tokens;
    }

    /** Whether {@code word} is a constant or reserved word rather than a node name. */
    static boolean isKeyword(String word) {
        return constantWord(word) != null || RESERVED.contains(word);
    }

    /** {@code "1"} or {@code "0"} for {@code True} and {@code False}, otherwise null. */
    static String constantWord(String word) {
        return switch (word) {
            case "True" -> "1";
            case "False" -> "0";
            default -> null;
        };
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private Expr parseOr() {
        Expr left = parseAnd();
        while (peek('|') || peek('∨')) {
            pos++;
            left = Expr.binary(BoolOp.OR, left, parseAnd());
        }
        return left;
    }

    private Expr parseAnd() {
        Expr left = parseUnary();
        while (peek('&') || peek('∧')) {
            pos++;
            left = Expr.binary(BoolOp.AND, left, parseUnary());
        }
        return left;
    }

    private Expr parseUnary() {
        skipWS();
        if (pos >= input.length())
            throw err("Unexpected end");
        char c = input.charAt(pos);
        if (c == '!' || c == '¬') {
            pos++;
            return Expr.not(parseUnary());
        }
        if (c == '(') {
            pos++;
            Expr inner = parseOr();
            skipWS();
            expect(')');
            return inner;
        }
        if (c == '0' || c == '1') {
            pos++;
            if (pos < input.length() && isIdentifierPart(input.charAt(pos)))
                throw err("Malformed constant");
            return Expr.constant(c == '1');
        }
        if (isIdentifierStart(c)) {
            int start = pos;
            while (pos < input.length() && isIdentifierPart(input.charAt(pos)))
                pos++;
            String name = input.substring(start, pos);
            String constant = constantWord(name);
            if (constant != null)
                return Expr.constant(constant.equals("1"));
            if (RESERVED.contains(name)) {
                pos = start;
                throw err("Reserved word '" + name + "'");
            }
            Integer position = positions.get(name);
            if (position == null)
                throw err("Unknown identifier '" + name + "'");
            return Expr.var(position, name);
        }
        throw err("Unexpected '" + c + "'");
    }

    private boolean peek(char c) {
        skipWS();
        return pos < input.length() && input.charAt(pos) == c;
    }

    private void expect(char c) {
        if (pos >= input.length() || input.charAt(pos) != c)
            throw err("Expected '" + c + "'");
        pos++;
    }

    private void skipWS() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
            pos++;
    }

    private IllegalArgumentException err(String msg) {
        return new IllegalArgumentException(msg + " at position " + pos + " in '" + input + "'");
    }
}
