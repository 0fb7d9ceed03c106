package com.mathdocx.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of nodes with no visual wrapper of its own.
 *
 * <p>Rows come from brace groups, command arguments and MathML grouping
 * elements. Rows may nest arbitrarily; a nested row is semantically
 * transparent, so {@code Row(a, Row(b, c))} renders exactly like
 * {@code Row(a, b, c)}. See {@link MathNodes#flatten(MathNode)}.
 */
public final class Row implements MathNode {

    private static final Row EMPTY = new Row(List.of());

    private final List<MathNode> children;

    /**
     * Creates a row.
     *
     * @param children the ordered children
     */
    public Row(List<MathNode> children) {
        Objects.requireNonNull(children, "children must not be null");
        List<MathNode> copy = new ArrayList<>(children.size());
        for (MathNode child : children) {
            copy.add(Objects.requireNonNull(child, "row child must not be null"));
        }
        this.children = List.copyOf(copy);
    }

    /**
     * Creates a row from the given nodes.
     *
     * @param children the ordered children
     * @return the row
     */
    public static Row of(MathNode... children) {
        return new Row(List.of(children));
    }

    /**
     * Returns the empty row.
     *
     * @return the empty row
     */
    public static Row empty() {
        return EMPTY;
    }

    /**
     * Wraps a list of nodes as a single node: a list of exactly one node is
     * returned as is, anything else becomes a row.
     *
     * @param nodes the nodes
     * @return a single node representing the list
     */
    public static MathNode wrap(List<MathNode> nodes) {
        if (nodes.size() == 1) {
            return nodes.get(0);
        }
        return nodes.isEmpty() ? EMPTY : new Row(nodes);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public int size() {
        return children.size();
    }

    @Override
    public List<MathNode> children() {
        return children;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Row)) return false;
        return children.equals(((Row) obj).children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + children;
    }
}
