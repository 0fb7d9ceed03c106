package com.mathdocx.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * N-ary operator (sum, product, integral, ...) with optional limits and an operand.
 *
 * <p>Examples:
 * <pre>
 *   \sum_{i=1}^{n} x_i     -- glyph ∑, sub i=1, sup n, operand x_i
 *   \int_0^1 f             -- glyph ∫, SUB_SUP limits, operand f
 *   \prod x                -- no limits, operand x
 * </pre>
 *
 * <p>The operand is always present; an operator with nothing after it gets an
 * empty {@link Row}.
 */
public final class LargeOperator implements MathNode {

    /**
     * Where the limits are drawn relative to the operator glyph.
     */
    public enum LimitLocation {
        /** Limits stacked under and over the glyph (display sums). */
        UNDER_OVER,
        /** Limits drawn as sub/superscripts beside the glyph (integrals). */
        SUB_SUP
    }

    private final String glyph;
    private final LimitLocation limitLocation;
    private final MathNode sub;
    private final MathNode sup;
    private final MathNode operand;

    /**
     * Creates a large operator.
     *
     * @param glyph the operator glyph, e.g. "∑"
     * @param limitLocation where the limits go
     * @param sub the lower limit, or null
     * @param sup the upper limit, or null
     * @param operand the operand
     */
    public LargeOperator(String glyph, LimitLocation limitLocation,
                         MathNode sub, MathNode sup, MathNode operand) {
        Objects.requireNonNull(glyph, "glyph must not be null");
        if (glyph.isEmpty()) {
            throw new IllegalArgumentException("glyph must not be empty");
        }
        this.glyph = glyph;
        this.limitLocation = Objects.requireNonNull(limitLocation, "limitLocation must not be null");
        this.sub = sub;
        this.sup = sup;
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public String glyph() {
        return glyph;
    }

    public LimitLocation limitLocation() {
        return limitLocation;
    }

    public Optional<MathNode> sub() {
        return Optional.ofNullable(sub);
    }

    public Optional<MathNode> sup() {
        return Optional.ofNullable(sup);
    }

    public MathNode operand() {
        return operand;
    }

    /**
     * Returns a copy of this operator with a different operand.
     *
     * @param newOperand the operand
     * @return the new operator
     */
    public LargeOperator withOperand(MathNode newOperand) {
        return new LargeOperator(glyph, limitLocation, sub, sup, newOperand);
    }

    @Override
    public List<MathNode> children() {
        List<MathNode> result = new ArrayList<>(3);
        if (sub != null) result.add(sub);
        if (sup != null) result.add(sup);
        result.add(operand);
        return List.copyOf(result);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LargeOperator)) return false;
        LargeOperator that = (LargeOperator) obj;
        return glyph.equals(that.glyph)
            && limitLocation == that.limitLocation
            && Objects.equals(sub, that.sub)
            && Objects.equals(sup, that.sup)
            && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(glyph, limitLocation, sub, sup, operand);
    }

    @Override
    public String toString() {
        return "LargeOperator(" + glyph + ", " + limitLocation
            + ", sub=" + sub + ", sup=" + sup + ", operand=" + operand + ")";
    }
}
