package com.mathdocx;

import com.mathdocx.component.ComponentGenerator;
import com.mathdocx.component.MathComponent;
import com.mathdocx.expression.MathNode;
import com.mathdocx.expression.Row;
import com.mathdocx.expression.Run;
import com.mathdocx.generator.DisplayMode;
import com.mathdocx.generator.LinearFormatGenerator;
import com.mathdocx.generator.OmmlGenerator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of converting one math fragment.
 *
 * <p>A successful result holds the parsed tree. A fallback result holds the
 * reason the fragment could not be converted; it still renders, as the raw
 * source in a single upright text run, so the surrounding document is never
 * left with a hole.
 *
 * <p>Usage:
 * <pre>
 *   ConversionResult result = converter.convertLatex("\\frac{1}{2}", DisplayMode.INLINE);
 *   if (result.isFallback()) {
 *       logger.warn("Fragment kept as text: {}", result.failure().get());
 *   }
 *   paragraph.appendOmml(result.toOmml());
 * </pre>
 */
public final class ConversionResult {

    private static final OmmlGenerator OMML = new OmmlGenerator();
    private static final ComponentGenerator COMPONENTS = new ComponentGenerator();
    private static final LinearFormatGenerator LINEAR = new LinearFormatGenerator();

    private final String source;
    private final DisplayMode displayMode;
    private final MathNode tree;
    private final String failure;

    private ConversionResult(String source, DisplayMode displayMode, MathNode tree, String failure) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.displayMode = Objects.requireNonNull(displayMode, "displayMode must not be null");
        this.tree = tree;
        this.failure = failure;
    }

    static ConversionResult success(String source, DisplayMode displayMode, MathNode tree) {
        return new ConversionResult(source, displayMode, Objects.requireNonNull(tree, "tree must not be null"), null);
    }

    static ConversionResult fallback(String source, DisplayMode displayMode, String failure) {
        return new ConversionResult(source, displayMode, null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public String source() {
        return source;
    }

    public DisplayMode displayMode() {
        return displayMode;
    }

    /**
     * Returns the parsed tree.
     *
     * @return the tree, or empty for a fallback result
     */
    public Optional<MathNode> tree() {
        return Optional.ofNullable(tree);
    }

    /**
     * Returns why the fragment could not be converted.
     *
     * @return the failure message, or empty for a successful result
     */
    public Optional<String> failure() {
        return Optional.ofNullable(failure);
    }

    public boolean isFallback() {
        return tree == null;
    }

    /**
     * Renders the fragment as OMML ({@code <m:oMathPara>} in block mode).
     *
     * @return the OMML markup
     */
    public String toOmml() {
        return OMML.generate(renderTree(), displayMode);
    }

    /**
     * Renders the fragment as typed components.
     *
     * @return the components
     */
    public List<MathComponent> toComponents() {
        return COMPONENTS.generate(renderTree());
    }

    /**
     * Renders the fragment in Word's linear format.
     *
     * @return the linear format text
     */
    public String toLinearFormat() {
        return LINEAR.generate(renderTree());
    }

    private MathNode renderTree() {
        return tree != null ? tree : Row.of(Run.normal(source));
    }

    @Override
    public String toString() {
        return isFallback()
            ? "ConversionResult{fallback, source=" + source + ", failure=" + failure + "}"
            : "ConversionResult{" + displayMode + ", tree=" + tree + "}";
    }
}
