package com.mathdocx.parser;

import com.mathdocx.expression.LargeOperator.LimitLocation;
import com.mathdocx.expression.LargeOperators;
import com.mathdocx.expression.MathNode;

import java.util.Objects;

/**
 * One element of the token stream produced by the first parsing pass.
 *
 * <p>The first pass cannot build script nodes directly because {@code ^} and
 * {@code _} modify the node before them. It emits three kinds of tokens
 * instead, and {@link ScriptReducer} binds them in a second pass:
 * <ul>
 *   <li>{@code NODE} - a finished node (run, fraction, group, ...)</li>
 *   <li>{@code SUPERSCRIPT} / {@code SUBSCRIPT} - a pending script and its argument</li>
 *   <li>{@code OPERATOR} - a large operator still waiting for limits and operand</li>
 * </ul>
 */
final class LatexToken {

    enum Type {
        NODE,
        SUPERSCRIPT,
        SUBSCRIPT,
        OPERATOR
    }

    private final Type type;
    private final MathNode node;
    private final LargeOperators.Entry operator;
    private final LimitLocation limitLocation;

    private LatexToken(Type type, MathNode node, LargeOperators.Entry operator, LimitLocation limitLocation) {
        this.type = type;
        this.node = node;
        this.operator = operator;
        this.limitLocation = limitLocation;
    }

    static LatexToken node(MathNode node) {
        return new LatexToken(Type.NODE, Objects.requireNonNull(node, "node must not be null"), null, null);
    }

    static LatexToken superscript(MathNode argument) {
        return new LatexToken(Type.SUPERSCRIPT, Objects.requireNonNull(argument, "argument must not be null"), null, null);
    }

    static LatexToken subscript(MathNode argument) {
        return new LatexToken(Type.SUBSCRIPT, Objects.requireNonNull(argument, "argument must not be null"), null, null);
    }

    static LatexToken operator(LargeOperators.Entry entry, LimitLocation limitLocation) {
        return new LatexToken(Type.OPERATOR, null,
            Objects.requireNonNull(entry, "entry must not be null"),
            Objects.requireNonNull(limitLocation, "limitLocation must not be null"));
    }

    Type type() {
        return type;
    }

    boolean isScript() {
        return type == Type.SUPERSCRIPT || type == Type.SUBSCRIPT;
    }

    /**
     * Returns the node of a NODE token, or the argument of a script token.
     */
    MathNode node() {
        return node;
    }

    LargeOperators.Entry operator() {
        return operator;
    }

    LimitLocation limitLocation() {
        return limitLocation;
    }

    /**
     * Returns a copy of an OPERATOR token with its limit location replaced,
     * as done by {@code \limits} and {@code \nolimits}.
     */
    LatexToken withLimitLocation(LimitLocation location) {
        if (type != Type.OPERATOR) {
            throw new IllegalStateException("Only operator tokens carry a limit location: " + type);
        }
        return new LatexToken(Type.OPERATOR, null, operator, location);
    }

    @Override
    public String toString() {
        switch (type) {
            case OPERATOR:
                return "OPERATOR(" + operator.glyph() + ", " + limitLocation + ")";
            default:
                return type + "(" + node + ")";
        }
    }
}
