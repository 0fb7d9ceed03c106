package com.mathdocx.expression;

import java.util.List;

/**
 * Sealed interface for all nodes of a math expression tree.
 *
 * <p>A tree is built once per conversion by one of the front ends
 * ({@link com.mathdocx.parser.LatexParser} or {@link com.mathdocx.parser.MathMLParser})
 * and consumed by one of the generators. Node kinds:
 * <ul>
 *   <li>{@link Run} - literal text</li>
 *   <li>{@link Row} - ordered sequence of nodes</li>
 *   <li>{@link Fraction} - numerator over denominator</li>
 *   <li>{@link Radical} - root with optional degree</li>
 *   <li>{@link Superscript}, {@link Subscript}, {@link SubSuperscript} - scripted base</li>
 *   <li>{@link LargeOperator} - sum, integral and friends with limits and operand</li>
 * </ul>
 *
 * <p>All implementations are final and immutable and hold no reference to their
 * parent, so a tree can never contain a cycle.
 */
public sealed interface MathNode
    permits Run, Row, Fraction, Radical, Superscript, Subscript, SubSuperscript, LargeOperator {

    /**
     * Returns the direct children of this node in document order.
     *
     * <p>Optional parts that are absent (a radical degree, a missing limit)
     * are not included.
     *
     * @return the children, never null
     */
    List<MathNode> children();

    /**
     * Returns a short name of the node kind, used in logs and error messages.
     *
     * @return the kind name
     */
    default String kind() {
        return getClass().getSimpleName();
    }
}
