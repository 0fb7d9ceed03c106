package com.mathdocx.expression;

import java.util.List;
import java.util.Objects;

/**
 * Base with a subscript, as in {@code x_i}.
 */
public final class Subscript implements MathNode {

    private final MathNode base;
    private final MathNode sub;

    public Subscript(MathNode base, MathNode sub) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.sub = Objects.requireNonNull(sub, "sub must not be null");
    }

    public MathNode base() {
        return base;
    }

    public MathNode sub() {
        return sub;
    }

    @Override
    public List<MathNode> children() {
        return List.of(base, sub);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Subscript)) return false;
        Subscript that = (Subscript) obj;
        return base.equals(that.base) && sub.equals(that.sub);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, sub);
    }

    @Override
    public String toString() {
        return "Subscript(" + base + ", " + sub + ")";
    }
}
