package com.mathdocx.expression;

import java.util.List;
import java.util.Objects;

/**
 * Base carrying both a subscript and a superscript.
 *
 * <p>{@code x^2_3} and {@code x_3^2} both produce
 * {@code SubSuperscript(base=x, sub=3, sup=2)}.
 */
public final class SubSuperscript implements MathNode {

    private final MathNode base;
    private final MathNode sub;
    private final MathNode sup;

    public SubSuperscript(MathNode base, MathNode sub, MathNode sup) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.sub = Objects.requireNonNull(sub, "sub must not be null");
        this.sup = Objects.requireNonNull(sup, "sup must not be null");
    }

    public MathNode base() {
        return base;
    }

    public MathNode sub() {
        return sub;
    }

    public MathNode sup() {
        return sup;
    }

    @Override
    public List<MathNode> children() {
        return List.of(base, sub, sup);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SubSuperscript)) return false;
        SubSuperscript that = (SubSuperscript) obj;
        return base.equals(that.base) && sub.equals(that.sub) && sup.equals(that.sup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, sub, sup);
    }

    @Override
    public String toString() {
        return "SubSuperscript(" + base + ", sub=" + sub + ", sup=" + sup + ")";
    }
}
