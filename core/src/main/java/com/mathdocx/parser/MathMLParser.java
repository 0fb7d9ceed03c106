package com.mathdocx.parser;

import com.mathdocx.config.ConverterConfig;
import com.mathdocx.exception.MathParseException;
import com.mathdocx.exception.UnsupportedConstructException;
import com.mathdocx.expression.Fraction;
import com.mathdocx.expression.LargeOperator;
import com.mathdocx.expression.LargeOperator.LimitLocation;
import com.mathdocx.expression.LargeOperators;
import com.mathdocx.expression.MathNode;
import com.mathdocx.expression.Radical;
import com.mathdocx.expression.Row;
import com.mathdocx.expression.Run;
import com.mathdocx.expression.SubSuperscript;
import com.mathdocx.expression.Subscript;
import com.mathdocx.expression.Superscript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parses presentation MathML (as produced by an external TeX renderer) into a
 * {@link MathNode} tree, so that pre-rendered math can share the generators
 * with the LaTeX front end.
 *
 * <p>Element mapping:
 * <ul>
 *   <li>{@code math, mrow, mstyle, mpadded, menclose, merror} - flattened into a row</li>
 *   <li>{@code mfrac} - {@link Fraction}; {@code msqrt, mroot} - {@link Radical}</li>
 *   <li>{@code msup, msub, msubsup} - the matching script node</li>
 *   <li>{@code mi, mn, mo, ms} - math {@link Run}; {@code mtext} - normal run</li>
 *   <li>{@code mspace, mphantom, annotation} - no node</li>
 * </ul>
 *
 * <p>Large operators: an {@code munderover}, {@code munder}, {@code mover},
 * {@code msubsup}, {@code msub}, {@code msup} or bare {@code mo} whose base
 * text is a large-operator glyph (∑, Σ, ∫, ...) is folded together with the
 * immediately following sibling into one {@link LargeOperator}, the sibling
 * becoming the operand. Only that one sibling is ever consumed. A base with
 * anything besides the glyph is not folded, so none of its content is lost.
 *
 * <p>Nesting is bounded by {@link ConverterConfig#maxDepth()}, including the
 * descendants of token elements whose text is collected.
 *
 * <p>Instances are thread-safe; the XML parser is pooled per thread.
 */
public class MathMLParser {

    private static final Logger logger = LoggerFactory.getLogger(MathMLParser.class);

    private static final ThreadLocal<DocumentBuilder> BUILDER_POOL =
        ThreadLocal.withInitial(MathMLParser::newDocumentBuilder);

    private static final Set<String> WRAPPERS =
        Set.of("math", "mrow", "mstyle", "mpadded", "menclose", "merror");

    private static final Set<String> INVISIBLE =
        Set.of("mspace", "mphantom", "annotation", "annotation-xml", "none",
               "mprescripts", "maligngroup", "malignmark");

    private static final Set<String> DECORATED =
        Set.of("munderover", "munder", "mover", "msubsup", "msub", "msup");

    private final ConverterConfig config;

    public MathMLParser() {
        this(ConverterConfig.defaults());
    }

    public MathMLParser(ConverterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Parses a MathML document string.
     *
     * @param mathml the MathML markup, normally rooted at {@code <math>}
     * @return a row holding the top-level nodes
     * @throws MathParseException if the markup is not well-formed or an element has the wrong arity
     */
    public Row parse(String mathml) {
        Objects.requireNonNull(mathml, "mathml must not be null");
        if (mathml.isBlank()) {
            throw new MathParseException("MathML input is empty", mathml, -1);
        }
        logger.debug("Parsing MathML: {}", mathml);

        Document document;
        try {
            DocumentBuilder builder = BUILDER_POOL.get();
            builder.reset();
            builder.setErrorHandler(STRICT_ERRORS);
            document = builder.parse(new InputSource(new StringReader(mathml)));
        } catch (SAXException | IOException e) {
            throw new MathParseException("Malformed MathML: " + e.getMessage(), mathml, e);
        }
        return parse(document.getDocumentElement(), mathml);
    }

    /**
     * Parses an already-built MathML element tree.
     *
     * @param root the root element, normally {@code <math>}
     * @return a row holding the top-level nodes
     * @throws MathParseException if an element has the wrong arity or nesting is too deep
     */
    public Row parse(Element root) {
        Objects.requireNonNull(root, "root must not be null");
        return parse(root, null);
    }

    private Row parse(Element root, String source) {
        Conversion conversion = new Conversion(source);
        Row result;
        if (WRAPPERS.contains(localName(root))) {
            result = new Row(conversion.convertChildren(root, 1));
        } else {
            MathNode node = conversion.convert(root, 1);
            result = node == null ? Row.empty() : Row.of(node);
        }
        logger.debug("Parsed MathML into {}", result);
        return result;
    }

    /**
     * Per-call conversion state.
     */
    private final class Conversion {

        private final String source;

        Conversion(String source) {
            this.source = source;
        }

        /**
         * Converts the element children of a node, folding large operators
         * with their following sibling.
         */
        List<MathNode> convertChildren(Element parent, int depth) {
            List<Element> children = elementChildren(parent);
            List<MathNode> result = new ArrayList<>(children.size());
            for (int i = 0; i < children.size(); i++) {
                Element child = children.get(i);
                Optional<LargeOperator> operator = largeOperator(child, depth + 1);
                if (operator.isPresent()) {
                    MathNode operand = null;
                    if (i + 1 < children.size()) {
                        operand = convert(children.get(i + 1), depth + 1);
                        i++;
                    }
                    result.add(operator.get().withOperand(operand == null ? Row.empty() : operand));
                    continue;
                }
                MathNode node = convert(child, depth + 1);
                if (node != null) {
                    result.add(node);
                }
            }
            return result;
        }

        /**
         * Converts one element.
         *
         * @return the node, or null for elements that render nothing
         */
        MathNode convert(Element element, int depth) {
            checkDepth(depth);

            String name = localName(element);
            if (WRAPPERS.contains(name)) {
                return Row.wrap(convertChildren(element, depth));
            }
            if (INVISIBLE.contains(name)) {
                return null;
            }

            switch (name) {
                case "semantics": {
                    List<Element> children = elementChildren(element);
                    return children.isEmpty() ? null : convert(children.get(0), depth + 1);
                }
                case "mfrac": {
                    List<Element> children = requireChildren(element, 2);
                    return new Fraction(slot(children.get(0), depth), slot(children.get(1), depth));
                }
                case "msqrt":
                    return new Radical(Row.wrap(convertChildren(element, depth)));
                case "mroot": {
                    List<Element> children = requireChildren(element, 2);
                    return new Radical(slot(children.get(0), depth), slot(children.get(1), depth));
                }
                case "msup":
                case "mover": {
                    List<Element> children = requireChildren(element, 2);
                    return new Superscript(slot(children.get(0), depth), slot(children.get(1), depth));
                }
                case "msub":
                case "munder": {
                    List<Element> children = requireChildren(element, 2);
                    return new Subscript(slot(children.get(0), depth), slot(children.get(1), depth));
                }
                case "msubsup":
                case "munderover": {
                    List<Element> children = requireChildren(element, 3);
                    return new SubSuperscript(slot(children.get(0), depth),
                        slot(children.get(1), depth), slot(children.get(2), depth));
                }
                case "mi":
                case "mn":
                case "mo":
                case "ms":
                    return new Run(normalizedText(element, depth));
                case "mtext":
                    return Run.normal(normalizedText(element, depth));
                default:
                    return unsupported(element, name, depth);
            }
        }

        /**
         * Builds a large operator, with a placeholder operand, when the element's
         * base carries a large-operator glyph.
         */
        private Optional<LargeOperator> largeOperator(Element element, int depth) {
            checkDepth(depth);
            String name = localName(element);
            if ("mo".equals(name)) {
                return LargeOperators.forGlyph(normalizedText(element, depth))
                    .map(entry -> new LargeOperator(entry.glyph(), entry.defaultLimits(), null, null, Row.empty()));
            }
            if (!DECORATED.contains(name)) {
                return Optional.empty();
            }

            int arity = "munderover".equals(name) || "msubsup".equals(name) ? 3 : 2;
            List<Element> children = requireChildren(element, arity);
            Optional<LargeOperators.Entry> entry =
                LargeOperators.forGlyph(normalizedText(children.get(0), depth + 1));
            if (entry.isEmpty()) {
                return Optional.empty();
            }

            boolean underOver = name.startsWith("mu") || "mover".equals(name);
            LimitLocation location = underOver ? LimitLocation.UNDER_OVER : LimitLocation.SUB_SUP;
            MathNode sub = null;
            MathNode sup = null;
            switch (name) {
                case "munderover":
                case "msubsup":
                    sub = slot(children.get(1), depth);
                    sup = slot(children.get(2), depth);
                    break;
                case "munder":
                case "msub":
                    sub = slot(children.get(1), depth);
                    break;
                default:
                    sup = slot(children.get(1), depth);
            }
            logger.debug("Folding <{}> with glyph {} into a large operator", name, entry.get().glyph());
            return Optional.of(new LargeOperator(entry.get().glyph(), location, sub, sup, Row.empty()));
        }

        /**
         * Converts a child that fills a structural slot; slots are never left empty-handed.
         */
        private MathNode slot(Element element, int depth) {
            MathNode node = convert(element, depth + 1);
            return node == null ? Row.empty() : node;
        }

        private List<Element> requireChildren(Element element, int expected) {
            List<Element> children = elementChildren(element);
            if (children.size() != expected) {
                throw new MathParseException(
                    "<" + localName(element) + "> expects " + expected
                        + " child elements but has " + children.size(), source, -1);
            }
            return children;
        }

        private MathNode unsupported(Element element, String name, int depth) {
            if (config.strict()) {
                throw new UnsupportedConstructException("<" + name + ">");
            }
            String text = normalizedText(element, depth);
            logger.debug("Unsupported element <{}> kept as literal text '{}'", name, text);
            return text.isEmpty() ? null : new Run(text);
        }

        /**
         * Returns the element's descendant text with runs of whitespace collapsed
         * to one space and the ends trimmed.
         *
         * @param depth nesting depth of {@code element}
         */
        private String normalizedText(Element element, int depth) {
            StringBuilder text = new StringBuilder();
            appendText(element, depth, text);
            return text.toString().replaceAll("\\s+", " ").trim();
        }

        private void appendText(Node node, int depth, StringBuilder text) {
            checkDepth(depth);
            for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
                short type = child.getNodeType();
                if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                    text.append(child.getNodeValue());
                } else if (type == Node.ELEMENT_NODE) {
                    appendText(child, depth + 1, text);
                }
            }
        }

        private void checkDepth(int depth) {
            if (depth > config.maxDepth()) {
                throw new MathParseException(
                    "Maximum nesting depth of " + config.maxDepth() + " exceeded", source, -1);
            }
        }
    }

    // ========== DOM Helpers ==========

    private static List<Element> elementChildren(Element parent) {
        NodeList nodes = parent.getChildNodes();
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static String localName(Element element) {
        String name = element.getLocalName();
        if (name == null) {
            name = element.getNodeName();
            int colon = name.indexOf(':');
            if (colon >= 0) {
                name = name.substring(colon + 1);
            }
        }
        return name;
    }

    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            logger.debug("MathML parser warning: {}", e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure configuration", e);
        }
    }
}
