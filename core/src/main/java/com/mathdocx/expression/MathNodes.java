package com.mathdocx.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility methods over math expression trees.
 */
public final class MathNodes {

    private MathNodes() {}

    /**
     * Returns the concatenated text of all runs under a node, in document order.
     *
     * @param node the node
     * @return the text content, possibly empty
     */
    public static String textContent(MathNode node) {
        StringBuilder sb = new StringBuilder();
        appendText(node, sb);
        return sb.toString();
    }

    private static void appendText(MathNode node, StringBuilder sb) {
        if (node instanceof Run) {
            sb.append(((Run) node).text());
            return;
        }
        if (node instanceof LargeOperator) {
            LargeOperator op = (LargeOperator) node;
            sb.append(op.glyph());
        }
        for (MathNode child : node.children()) {
            appendText(child, sb);
        }
    }

    /**
     * Returns an equivalent tree in which no row directly contains another row.
     *
     * <p>Rows nested in rows are spliced into their parent. A row that is the
     * sole child of a structural slot (a numerator, a script) is kept, since the
     * slot needs a single node. Rendering a flattened tree gives the same output
     * as rendering the original.
     *
     * @param node the root
     * @return the flattened tree
     */
    public static MathNode flatten(MathNode node) {
        if (node instanceof Run) {
            return node;
        }
        if (node instanceof Row) {
            List<MathNode> flat = new ArrayList<>();
            spliceInto((Row) node, flat);
            return new Row(flat);
        }
        if (node instanceof Fraction) {
            Fraction f = (Fraction) node;
            return new Fraction(flatten(f.numerator()), flatten(f.denominator()));
        }
        if (node instanceof Radical) {
            Radical r = (Radical) node;
            return new Radical(flatten(r.body()), r.degree().map(MathNodes::flatten).orElse(null));
        }
        if (node instanceof Superscript) {
            Superscript s = (Superscript) node;
            return new Superscript(flatten(s.base()), flatten(s.sup()));
        }
        if (node instanceof Subscript) {
            Subscript s = (Subscript) node;
            return new Subscript(flatten(s.base()), flatten(s.sub()));
        }
        if (node instanceof SubSuperscript) {
            SubSuperscript s = (SubSuperscript) node;
            return new SubSuperscript(flatten(s.base()), flatten(s.sub()), flatten(s.sup()));
        }
        LargeOperator op = (LargeOperator) node;
        return new LargeOperator(op.glyph(), op.limitLocation(),
            op.sub().map(MathNodes::flatten).orElse(null),
            op.sup().map(MathNodes::flatten).orElse(null),
            flatten(op.operand()));
    }

    private static void spliceInto(Row row, List<MathNode> out) {
        for (MathNode child : row.children()) {
            if (child instanceof Row) {
                spliceInto((Row) child, out);
            } else {
                out.add(flatten(child));
            }
        }
    }

    /**
     * Returns the nesting depth of a tree; a single leaf has depth 1.
     *
     * @param node the root
     * @return the depth
     */
    public static int depth(MathNode node) {
        int max = 0;
        for (MathNode child : node.children()) {
            max = Math.max(max, depth(child));
        }
        return max + 1;
    }
}
