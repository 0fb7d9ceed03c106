package com.mathdocx.generator;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static com.mathdocx.generator.OmmlQuoting.*;

/**
 * Generator that renders a math expression tree as Office Math Markup (OMML).
 *
 * <p>One visit method per node kind:
 * <pre>
 *   Run            -&gt; &lt;m:r&gt;&lt;m:t&gt;x&lt;/m:t&gt;&lt;/m:r&gt;
 *   Row            -&gt; children, no wrapper
 *   Fraction       -&gt; &lt;m:f&gt;&lt;m:num/&gt;&lt;m:den/&gt;&lt;/m:f&gt;
 *   Radical        -&gt; &lt;m:rad&gt;&lt;m:radPr/&gt;&lt;m:deg/&gt;&lt;m:e/&gt;&lt;/m:rad&gt;
 *   Superscript    -&gt; &lt;m:sSup&gt;&lt;m:e/&gt;&lt;m:sup/&gt;&lt;/m:sSup&gt;
 *   Subscript      -&gt; &lt;m:sSub&gt;&lt;m:e/&gt;&lt;m:sub/&gt;&lt;/m:sSub&gt;
 *   SubSuperscript -&gt; &lt;m:sSubSup&gt;&lt;m:e/&gt;&lt;m:sub/&gt;&lt;m:sup/&gt;&lt;/m:sSubSup&gt;
 *   LargeOperator  -&gt; &lt;m:nary&gt;&lt;m:naryPr/&gt;&lt;m:sub/&gt;&lt;m:sup/&gt;&lt;m:e/&gt;&lt;/m:nary&gt;
 * </pre>
 *
 * <p>Every slot of a construct is emitted even when empty, because Word
 * expects a fixed number of children per construct.
 *
 * <p>The generator keeps no state between calls and may be shared.
 *
 * <p>Example usage:
 * <pre>
 *   MathNode tree = new LatexParser().parse("\\frac{1}{2}");
 *   String omml = new OmmlGenerator().generate(tree, DisplayMode.INLINE);
 * </pre>
 */
public class OmmlGenerator {

    private static final Logger logger = LoggerFactory.getLogger(OmmlGenerator.class);

    public static final String MATH_NS = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    /**
     * Generates an inline {@code <m:oMath>} element.
     *
     * @param root the tree to render
     * @return the OMML markup
     * @throws MathGenerationException if the tree cannot be rendered
     */
    public String generate(MathNode root) {
        return generate(root, DisplayMode.INLINE);
    }

    /**
     * Generates OMML for a tree.
     *
     * <p>Inline math becomes a namespaced {@code <m:oMath>}; block math is
     * additionally wrapped in {@code <m:oMathPara>}.
     *
     * @param root the tree to render
     * @param mode inline or block
     * @return the OMML markup
     * @throws MathGenerationException if the tree cannot be rendered
     */
    public String generate(MathNode root, DisplayMode mode) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        StringBuilder omml = new StringBuilder(128);
        try {
            if (mode == DisplayMode.BLOCK) {
                omml.append("<m:oMathPara xmlns:m=\"").append(MATH_NS).append("\"><m:oMath>");
                visit(root, omml);
                omml.append("</m:oMath></m:oMathPara>");
            } else {
                omml.append("<m:oMath xmlns:m=\"").append(MATH_NS).append("\">");
                visit(root, omml);
                omml.append("</m:oMath>");
            }
        } catch (MathGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MathGenerationException("Unexpected error during OMML generation", e, root);
        }

        logger.debug("Generated OMML ({} chars) for {}", omml.length(), root.kind());
        return omml.toString();
    }

    /**
     * Visitor dispatch method.
     */
    private void visit(MathNode node, StringBuilder omml) {
        if (node instanceof Run) {
            visitRun((Run) node, omml);
        } else if (node instanceof Row) {
            visitChildren(node, omml);
        } else if (node instanceof Fraction) {
            visitFraction((Fraction) node, omml);
        } else if (node instanceof Radical) {
            visitRadical((Radical) node, omml);
        } else if (node instanceof Superscript) {
            visitSuperscript((Superscript) node, omml);
        } else if (node instanceof Subscript) {
            visitSubscript((Subscript) node, omml);
        } else if (node instanceof SubSuperscript) {
            visitSubSuperscript((SubSuperscript) node, omml);
        } else if (node instanceof LargeOperator) {
            visitLargeOperator((LargeOperator) node, omml);
        } else {
            visitChildren(node, omml);
        }
    }

    private void visitChildren(MathNode node, StringBuilder omml) {
        for (MathNode child : node.children()) {
            visit(child, omml);
        }
    }

    private void visitRun(Run run, StringBuilder omml) {
        omml.append("<m:r>");
        if (run.style() == Run.Style.NORMAL) {
            omml.append("<m:rPr><m:nor/></m:rPr>");
        }
        omml.append(needsPreserve(run.text()) ? "<m:t xml:space=\"preserve\">" : "<m:t>");
        omml.append(escapeText(run.text()));
        omml.append("</m:t></m:r>");
    }

    private void visitFraction(Fraction fraction, StringBuilder omml) {
        checkArity(fraction, 2);
        omml.append("<m:f>");
        slot("m:num", fraction.numerator(), omml);
        slot("m:den", fraction.denominator(), omml);
        omml.append("</m:f>");
    }

    private void visitRadical(Radical radical, StringBuilder omml) {
        omml.append("<m:rad>");
        if (radical.hasDegree()) {
            slot("m:deg", radical.degree().get(), omml);
        } else {
            omml.append("<m:radPr><m:degHide m:val=\"on\"/></m:radPr><m:deg></m:deg>");
        }
        slot("m:e", radical.body(), omml);
        omml.append("</m:rad>");
    }

    private void visitSuperscript(Superscript node, StringBuilder omml) {
        checkArity(node, 2);
        omml.append("<m:sSup>");
        slot("m:e", node.base(), omml);
        slot("m:sup", node.sup(), omml);
        omml.append("</m:sSup>");
    }

    private void visitSubscript(Subscript node, StringBuilder omml) {
        checkArity(node, 2);
        omml.append("<m:sSub>");
        slot("m:e", node.base(), omml);
        slot("m:sub", node.sub(), omml);
        omml.append("</m:sSub>");
    }

    private void visitSubSuperscript(SubSuperscript node, StringBuilder omml) {
        checkArity(node, 3);
        omml.append("<m:sSubSup>");
        slot("m:e", node.base(), omml);
        slot("m:sub", node.sub(), omml);
        slot("m:sup", node.sup(), omml);
        omml.append("</m:sSubSup>");
    }

    private void visitLargeOperator(LargeOperator op, StringBuilder omml) {
        omml.append("<m:nary><m:naryPr>");
        omml.append("<m:chr m:val=\"").append(escapeAttribute(op.glyph())).append("\"/>");
        omml.append("<m:limLoc m:val=\"").append(limitLocation(op.limitLocation())).append("\"/>");
        if (op.sub().isEmpty()) {
            omml.append("<m:subHide m:val=\"on\"/>");
        }
        if (op.sup().isEmpty()) {
            omml.append("<m:supHide m:val=\"on\"/>");
        }
        omml.append("</m:naryPr>");
        omml.append("<m:sub>");
        op.sub().ifPresent(sub -> visit(sub, omml));
        omml.append("</m:sub><m:sup>");
        op.sup().ifPresent(sup -> visit(sup, omml));
        omml.append("</m:sup>");
        slot("m:e", op.operand(), omml);
        omml.append("</m:nary>");
    }

    private void slot(String tag, MathNode content, StringBuilder omml) {
        omml.append('<').append(tag).append('>');
        visit(content, omml);
        omml.append("</").append(tag).append('>');
    }

    private static String limitLocation(LargeOperator.LimitLocation location) {
        switch (location) {
            case UNDER_OVER:
                return "undOvr";
            case SUB_SUP:
                return "subSup";
            default:
                throw new IllegalArgumentException("Unknown limit location: " + location);
        }
    }

    private static void checkArity(MathNode node, int expected) {
        int actual = node.children().size();
        if (actual != expected) {
            throw new MathGenerationException(
                "Expected " + expected + " children but found " + actual, node);
        }
    }
}
