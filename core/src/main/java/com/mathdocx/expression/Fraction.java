package com.mathdocx.expression;

import java.util.List;
import java.util.Objects;

/**
 * Fraction: a numerator stacked over a denominator.
 *
 * <p>Produced by {@code \frac{a}{b}} and by MathML {@code <mfrac>}.
 */
public final class Fraction implements MathNode {

    private final MathNode numerator;
    private final MathNode denominator;

    /**
     * Creates a fraction.
     *
     * @param numerator the numerator
     * @param denominator the denominator
     */
    public Fraction(MathNode numerator, MathNode denominator) {
        this.numerator = Objects.requireNonNull(numerator, "numerator must not be null");
        this.denominator = Objects.requireNonNull(denominator, "denominator must not be null");
    }

    public MathNode numerator() {
        return numerator;
    }

    public MathNode denominator() {
        return denominator;
    }

    @Override
    public List<MathNode> children() {
        return List.of(numerator, denominator);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fraction)) return false;
        Fraction that = (Fraction) obj;
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        return "Fraction(" + numerator + ", " + denominator + ")";
    }
}
