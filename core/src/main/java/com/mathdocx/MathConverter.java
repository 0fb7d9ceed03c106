package com.mathdocx;

import com.mathdocx.config.ConverterConfig;
import com.mathdocx.exception.MathConversionException;
import com.mathdocx.expression.MathNode;
import com.mathdocx.expression.MathNodes;
import com.mathdocx.generator.DisplayMode;
import com.mathdocx.parser.LatexParser;
import com.mathdocx.parser.MathMLParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Entry point for document builders: converts math fragments into OMML,
 * typed components or linear format.
 *
 * <p>Two families of methods:
 * <ul>
 *   <li>{@link #parseLatex(String)} and {@link #parseMathML(String)} return the
 *       tree and throw {@link MathConversionException} on bad input.</li>
 *   <li>{@link #convertLatex(String, DisplayMode)} and
 *       {@link #convertMathML(String, DisplayMode)} never throw for bad input;
 *       a fragment that cannot be converted yields a fallback result carrying
 *       its raw source, so one broken formula does not abort a document.</li>
 * </ul>
 *
 * <p>The converter is immutable and thread-safe.
 *
 * <p>Usage:
 * <pre>
 *   MathConverter converter = new MathConverter();
 *   String omml = converter.convertLatex("E = mc^2", DisplayMode.BLOCK).toOmml();
 * </pre>
 */
public class MathConverter {

    private static final Logger logger = LoggerFactory.getLogger(MathConverter.class);

    private static final int MAX_LOGGED_SOURCE = 200;

    private final ConverterConfig config;
    private final LatexParser latexParser;
    private final MathMLParser mathMLParser;

    /**
     * Creates a converter configured from system properties.
     *
     * @see ConverterConfig#fromSystemProperties()
     */
    public MathConverter() {
        this(ConverterConfig.fromSystemProperties());
    }

    public MathConverter(ConverterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.latexParser = new LatexParser(config);
        this.mathMLParser = new MathMLParser(config);
        logger.debug("Created MathConverter with {}", config);
    }

    public ConverterConfig config() {
        return config;
    }

    /**
     * Parses a LaTeX fragment.
     *
     * @param latex the fragment
     * @return the tree
     * @throws MathConversionException if the fragment cannot be parsed
     */
    public MathNode parseLatex(String latex) {
        return latexParser.parse(latex);
    }

    /**
     * Parses a MathML fragment.
     *
     * @param mathml the markup
     * @return the tree
     * @throws MathConversionException if the markup cannot be parsed
     */
    public MathNode parseMathML(String mathml) {
        return mathMLParser.parse(mathml);
    }

    /**
     * Converts a LaTeX fragment, falling back to its raw text on failure.
     *
     * @param latex the fragment
     * @param mode inline or block
     * @return the result, never null
     */
    public ConversionResult convertLatex(String latex, DisplayMode mode) {
        return convert(latex, mode, latexParser::parse);
    }

    /**
     * Converts a MathML fragment, falling back to its raw markup on failure.
     *
     * @param mathml the markup
     * @param mode inline or block
     * @return the result, never null
     */
    public ConversionResult convertMathML(String mathml, DisplayMode mode) {
        return convert(mathml, mode, mathMLParser::parse);
    }

    private ConversionResult convert(String source, DisplayMode mode, Function<String, ? extends MathNode> parser) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        try {
            MathNode tree = parser.apply(source);
            logger.debug("Converted fragment ({} mode, depth {})", mode, MathNodes.depth(tree));
            return ConversionResult.success(source, mode, tree);
        } catch (MathConversionException e) {
            logger.warn("Keeping math fragment as text: {} (source: {})", e.getMessage(), abbreviate(source));
            return ConversionResult.fallback(source, mode, e.getMessage());
        }
    }

    private static String abbreviate(String source) {
        return source.length() <= MAX_LOGGED_SOURCE
            ? source
            : source.substring(0, MAX_LOGGED_SOURCE) + "... (" + source.length() + " chars)";
    }
}
