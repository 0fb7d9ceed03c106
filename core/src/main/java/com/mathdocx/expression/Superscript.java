package com.mathdocx.expression;

import java.util.List;
import java.util.Objects;

/**
 * Base raised to a superscript, as in {@code x^2}.
 *
 * <p>The base is never missing; a leading {@code ^2} binds to {@link Run#empty()}.
 */
public final class Superscript implements MathNode {

    private final MathNode base;
    private final MathNode sup;

    public Superscript(MathNode base, MathNode sup) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.sup = Objects.requireNonNull(sup, "sup must not be null");
    }

    public MathNode base() {
        return base;
    }

    public MathNode sup() {
        return sup;
    }

    @Override
    public List<MathNode> children() {
        return List.of(base, sup);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Superscript)) return false;
        Superscript that = (Superscript) obj;
        return base.equals(that.base) && sup.equals(that.sup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, sup);
    }

    @Override
    public String toString() {
        return "Superscript(" + base + ", " + sup + ")";
    }
}
