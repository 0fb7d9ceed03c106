package com.mathdocx.component;

import com.mathdocx.exception.MathGenerationException;
import com.mathdocx.expression.Fraction;
import com.mathdocx.expression.LargeOperator;
import com.mathdocx.expression.MathNode;
import com.mathdocx.expression.Radical;
import com.mathdocx.expression.Row;
import com.mathdocx.expression.Run;
import com.mathdocx.expression.SubSuperscript;
import com.mathdocx.expression.Subscript;
import com.mathdocx.expression.Superscript;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generator that turns a math expression tree into a flat list of typed
 * {@link MathComponent}s for a document-object builder.
 *
 * <p>The mapping mirrors {@link com.mathdocx.generator.OmmlGenerator} node for
 * node; rows are spliced into the enclosing list. Stateless and shareable.
 */
public class ComponentGenerator {

    /**
     * Generates the component list for a tree.
     *
     * @param root the tree
     * @return the components in document order
     * @throws MathGenerationException if the tree cannot be rendered
     */
    public List<MathComponent> generate(MathNode root) {
        Objects.requireNonNull(root, "root must not be null");
        try {
            return components(root);
        } catch (MathGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MathGenerationException("Unexpected error during component generation", e, root);
        }
    }

    private List<MathComponent> components(MathNode node) {
        List<MathComponent> out = new ArrayList<>();
        visit(node, out);
        return out;
    }

    private void visit(MathNode node, List<MathComponent> out) {
        if (node instanceof Run) {
            Run run = (Run) node;
            out.add(new MathRun(run.text(), run.style() == Run.Style.NORMAL));
        } else if (node instanceof Row) {
            for (MathNode child : node.children()) {
                visit(child, out);
            }
        } else if (node instanceof Fraction) {
            Fraction f = (Fraction) node;
            out.add(new MathFraction(components(f.numerator()), components(f.denominator())));
        } else if (node instanceof Radical) {
            Radical r = (Radical) node;
            List<MathComponent> degree = r.degree().map(this::components).orElse(List.of());
            out.add(new MathRadical(degree, components(r.body()), !r.hasDegree()));
        } else if (node instanceof Superscript) {
            Superscript s = (Superscript) node;
            out.add(new MathSuperScript(components(s.base()), components(s.sup())));
        } else if (node instanceof Subscript) {
            Subscript s = (Subscript) node;
            out.add(new MathSubScript(components(s.base()), components(s.sub())));
        } else if (node instanceof SubSuperscript) {
            SubSuperscript s = (SubSuperscript) node;
            out.add(new MathSubSuperScript(components(s.base()), components(s.sub()), components(s.sup())));
        } else if (node instanceof LargeOperator) {
            LargeOperator op = (LargeOperator) node;
            out.add(new MathNary(op.glyph(), op.limitLocation(),
                op.sub().map(this::components).orElse(List.of()),
                op.sup().map(this::components).orElse(List.of()),
                components(op.operand()),
                op.sub().isEmpty(),
                op.sup().isEmpty()));
        } else {
            for (MathNode child : node.children()) {
                visit(child, out);
            }
        }
    }
}
