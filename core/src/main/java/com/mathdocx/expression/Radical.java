package com.mathdocx.expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Radical: a square root, or an n-th root when a degree is present.
 *
 * <p>Produced by {@code \sqrt{x}}, {@code \sqrt[n]{x}}, MathML {@code <msqrt>}
 * and {@code <mroot>}.
 */
public final class Radical implements MathNode {

    private final MathNode body;
    private final MathNode degree;

    /**
     * Creates a square root.
     *
     * @param body the radicand
     */
    public Radical(MathNode body) {
        this(body, null);
    }

    /**
     * Creates a root.
     *
     * @param body the radicand
     * @param degree the root degree, or null for a square root
     */
    public Radical(MathNode body, MathNode degree) {
        this.body = Objects.requireNonNull(body, "body must not be null");
        this.degree = degree;
    }

    public MathNode body() {
        return body;
    }

    /**
     * Returns the degree of the root.
     *
     * @return the degree, or empty for a square root
     */
    public Optional<MathNode> degree() {
        return Optional.ofNullable(degree);
    }

    public boolean hasDegree() {
        return degree != null;
    }

    @Override
    public List<MathNode> children() {
        return degree == null ? List.of(body) : List.of(degree, body);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Radical)) return false;
        Radical that = (Radical) obj;
        return body.equals(that.body) && Objects.equals(degree, that.degree);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, degree);
    }

    @Override
    public String toString() {
        return degree == null ? "Radical(" + body + ")" : "Radical(" + body + ", degree=" + degree + ")";
    }
}
