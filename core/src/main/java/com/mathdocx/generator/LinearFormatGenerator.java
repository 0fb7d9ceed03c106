package com.mathdocx.generator;

import com.mathdocx.expression.Fraction;
import com.mathdocx.expression.LargeOperator;
import com.mathdocx.expression.MathNode;
import com.mathdocx.expression.Radical;
import com.mathdocx.expression.Row;
import com.mathdocx.expression.Run;
import com.mathdocx.expression.SubSuperscript;
import com.mathdocx.expression.Subscript;
import com.mathdocx.expression.Superscript;

import java.util.Objects;

/**
 * Generator that renders a tree in Word's linear math format (UnicodeMath),
 * the plain-text notation Word builds up into an equation.
 *
 * <p>Examples:
 * <pre>
 *   \frac{a}{b}        -&gt; (a)/(b)
 *   \sqrt[3]{x}        -&gt; \sqrt(3&amp;x)
 *   x^2_i              -&gt; x_(i)^(2)
 *   \sum_{i=1}^n x     -&gt; ∑_(i=1)^(n)▒(x)
 *   \text{if}          -&gt; "if"
 * </pre>
 *
 * <p>Arguments are always parenthesized; Word drops the parentheses when it
 * builds the equation up. Runs of whitespace are collapsed in the result.
 */
public class LinearFormatGenerator {

    /** Separates an n-ary operator from its operand in linear format. */
    static final char NARY_SEPARATOR = '▒';

    /**
     * Generates the linear format text for a tree.
     *
     * @param root the tree
     * @return the linear format string
     */
    public String generate(MathNode root) {
        Objects.requireNonNull(root, "root must not be null");
        StringBuilder linear = new StringBuilder();
        visit(root, linear);
        return linear.toString().replaceAll("\\s+", " ").trim();
    }

    private void visit(MathNode node, StringBuilder linear) {
        if (node instanceof Run) {
            Run run = (Run) node;
            if (run.style() == Run.Style.NORMAL) {
                linear.append('"').append(run.text()).append('"');
            } else {
                linear.append(run.text());
            }
        } else if (node instanceof Fraction) {
            Fraction fraction = (Fraction) node;
            argument(fraction.numerator(), linear);
            linear.append('/');
            argument(fraction.denominator(), linear);
        } else if (node instanceof Radical) {
            Radical radical = (Radical) node;
            linear.append("\\sqrt(");
            radical.degree().ifPresent(degree -> {
                visit(degree, linear);
                linear.append('&');
            });
            visit(radical.body(), linear);
            linear.append(')');
        } else if (node instanceof Superscript) {
            Superscript s = (Superscript) node;
            base(s.base(), linear);
            linear.append('^');
            argument(s.sup(), linear);
        } else if (node instanceof Subscript) {
            Subscript s = (Subscript) node;
            base(s.base(), linear);
            linear.append('_');
            argument(s.sub(), linear);
        } else if (node instanceof SubSuperscript) {
            SubSuperscript s = (SubSuperscript) node;
            base(s.base(), linear);
            linear.append('_');
            argument(s.sub(), linear);
            linear.append('^');
            argument(s.sup(), linear);
        } else if (node instanceof LargeOperator) {
            LargeOperator op = (LargeOperator) node;
            linear.append(op.glyph());
            op.sub().ifPresent(sub -> {
                linear.append('_');
                argument(sub, linear);
            });
            op.sup().ifPresent(sup -> {
                linear.append('^');
                argument(sup, linear);
            });
            linear.append(NARY_SEPARATOR);
            argument(op.operand(), linear);
        } else {
            for (MathNode child : node.children()) {
                visit(child, linear);
            }
        }
    }

    private void argument(MathNode node, StringBuilder linear) {
        linear.append('(');
        visit(node, linear);
        linear.append(')');
    }

    /**
     * Script bases are bare when they are a single run, parenthesized otherwise.
     */
    private void base(MathNode node, StringBuilder linear) {
        if (node instanceof Run || (node instanceof Row && ((Row) node).isEmpty())) {
            visit(node, linear);
        } else {
            argument(node, linear);
        }
    }
}
