package com.mathdocx.expression;

import java.util.List;
import java.util.Objects;

/**
 * Leaf node holding literal text.
 *
 * <p>A run is either math text (identifiers, numbers, operators, rendered
 * italic where the target supports it) or normal text (upright prose such as
 * the argument of {@code \text{...}}).
 *
 * <p>An empty run is a legal node: it stands in for a missing script base,
 * as in {@code ^2}.
 */
public final class Run implements MathNode {

    /**
     * Rendering style of a run.
     */
    public enum Style {
        MATH,
        NORMAL
    }

    private static final Run EMPTY = new Run("", Style.MATH);

    private final String text;
    private final Style style;

    /**
     * Creates a math-style run.
     *
     * @param text the literal text
     */
    public Run(String text) {
        this(text, Style.MATH);
    }

    /**
     * Creates a run with the given style.
     *
     * @param text the literal text
     * @param style the rendering style
     */
    public Run(String text, Style style) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.style = Objects.requireNonNull(style, "style must not be null");
    }

    /**
     * Returns the shared empty run used as a placeholder base.
     *
     * @return the empty run
     */
    public static Run empty() {
        return EMPTY;
    }

    /**
     * Creates a normal-style (upright text) run.
     *
     * @param text the literal text
     * @return the run
     */
    public static Run normal(String text) {
        return new Run(text, Style.NORMAL);
    }

    public String text() {
        return text;
    }

    public Style style() {
        return style;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public List<MathNode> children() {
        return List.of();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Run)) return false;
        Run that = (Run) obj;
        return text.equals(that.text) && style == that.style;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, style);
    }

    @Override
    public String toString() {
        return style == Style.NORMAL ? "Run(\"" + text + "\", NORMAL)" : "Run(\"" + text + "\")";
    }
}
