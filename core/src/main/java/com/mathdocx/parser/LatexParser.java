package com.mathdocx.parser;

import com.mathdocx.config.ConverterConfig;
import com.mathdocx.exception.MathParseException;
import com.mathdocx.exception.UnsupportedConstructException;
import com.mathdocx.expression.Fraction;
import com.mathdocx.expression.LargeOperator.LimitLocation;
import com.mathdocx.expression.LargeOperators;
import com.mathdocx.expression.MathNode;
import com.mathdocx.expression.Radical;
import com.mathdocx.expression.Row;
import com.mathdocx.expression.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses a LaTeX math fragment into a {@link MathNode} tree.
 *
 * <p>Single-pass recursive descent over the characters, producing a
 * {@link LatexToken} stream per group which {@link ScriptReducer} then reduces.
 * The parser is permissive: unknown commands become literal text runs
 * carrying the raw command (unless the configuration is strict), stray closing
 * braces are skipped. The only hard failures are an unterminated group or
 * degree, and nesting beyond {@link ConverterConfig#maxDepth()}. Groups,
 * arguments and chained large operators all count towards that depth.
 *
 * <p>The parser holds no per-call state; every call to {@link #parse(String)}
 * uses its own cursor, so one instance can serve many threads.
 *
 * <p>Usage:
 * <pre>
 *   LatexParser parser = new LatexParser();
 *   MathNode tree = parser.parse("\\frac{1}{2} + x^2");
 *   String omml = new OmmlGenerator().generate(tree);
 * </pre>
 */
public class LatexParser {

    private static final Logger logger = LoggerFactory.getLogger(LatexParser.class);

    private final ConverterConfig config;

    public LatexParser() {
        this(ConverterConfig.defaults());
    }

    public LatexParser(ConverterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Parses a LaTeX math fragment.
     *
     * @param source the fragment, without surrounding {@code $} delimiters
     * @return a row holding the top-level nodes
     * @throws MathParseException if a group is unterminated or nesting is too deep
     * @throws UnsupportedConstructException in strict mode, for unknown commands
     */
    public Row parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        logger.debug("Parsing LaTeX: {}", source);

        Cursor cursor = new Cursor(source, config);
        Row root = new Row(cursor.parseSequence(Cursor.END_OF_INPUT, 0));

        logger.debug("Parsed LaTeX into {}", root);
        return root;
    }

    /**
     * Per-call parsing state.
     */
    private static final class Cursor {

        static final char END_OF_INPUT = 0;

        private final String source;
        private final ConverterConfig config;
        private int pos;
        private int depth;

        Cursor(String source, ConverterConfig config) {
            this.source = source;
            this.config = config;
        }

        /**
         * Parses tokens until {@code terminator} (consumed) or end of input.
         *
         * @param terminator '}' for a brace group, ']' for a root degree, or END_OF_INPUT
         * @param openPos position of the opening delimiter, for error messages
         */
        List<MathNode> parseSequence(char terminator, int openPos) {
            List<LatexToken> tokens = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (atEnd()) {
                    if (terminator != END_OF_INPUT) {
                        String what = terminator == '}' ? "opening brace" : "root degree bracket";
                        throw new MathParseException("Unmatched " + what, source, openPos);
                    }
                    break;
                }
                char c = source.charAt(pos);
                if (terminator != END_OF_INPUT && c == terminator) {
                    pos++;
                    break;
                }
                if (c == '}') {
                    logger.debug("Skipping stray closing brace at position {}", pos);
                    pos++;
                    continue;
                }
                parseToken(tokens);
            }
            return ScriptReducer.reduce(tokens, depth, config.maxDepth(), source);
        }

        private void parseToken(List<LatexToken> tokens) {
            char c = source.charAt(pos);
            switch (c) {
                case '\\':
                    parseCommand(tokens);
                    break;
                case '^':
                    pos++;
                    tokens.add(LatexToken.superscript(parseArgument()));
                    break;
                case '_':
                    pos++;
                    tokens.add(LatexToken.subscript(parseArgument()));
                    break;
                case '{':
                    tokens.add(LatexToken.node(parseGroup()));
                    break;
                case '~':
                    pos++;
                    break;
                case '\'':
                    pos++;
                    tokens.add(LatexToken.node(new Run("′")));
                    break;
                default:
                    int cp = source.codePointAt(pos);
                    pos += Character.charCount(cp);
                    tokens.add(LatexToken.node(new Run(new String(Character.toChars(cp)))));
            }
        }

        private MathNode parseGroup() {
            int openPos = pos;
            pos++;
            enter();
            try {
                return Row.wrap(parseSequence('}', openPos));
            } finally {
                depth--;
            }
        }

        /**
         * Parses a command or script argument: a brace group or the single next token.
         */
        private MathNode parseArgument() {
            skipWhitespace();
            if (atEnd()) {
                return Row.empty();
            }
            char c = source.charAt(pos);
            if (c == '{') {
                return parseGroup();
            }
            if (c == '}' || c == '^' || c == '_') {
                return Row.empty();
            }
            enter();
            try {
                List<LatexToken> tokens = new ArrayList<>(1);
                parseToken(tokens);
                return Row.wrap(ScriptReducer.reduce(tokens, depth, config.maxDepth(), source));
            } finally {
                depth--;
            }
        }

        private void parseCommand(List<LatexToken> tokens) {
            int start = pos;
            pos++;
            if (atEnd()) {
                tokens.add(LatexToken.node(unknown("\\")));
                return;
            }

            char first = source.charAt(pos);
            if (!isLetter(first)) {
                pos++;
                parseControlSymbol(tokens, first);
                return;
            }

            while (!atEnd() && isLetter(source.charAt(pos))) {
                pos++;
            }
            String name = source.substring(start + 1, pos);

            switch (LatexCommands.kindOf(name)) {
                case FRACTION: {
                    MathNode numerator = parseArgument();
                    MathNode denominator = parseArgument();
                    tokens.add(LatexToken.node(new Fraction(numerator, denominator)));
                    break;
                }
                case SQRT: {
                    MathNode degree = parseOptionalDegree();
                    MathNode body = parseArgument();
                    tokens.add(LatexToken.node(new Radical(body, degree)));
                    break;
                }
                case TEXT:
                    tokens.add(LatexToken.node(Run.normal(parseRawText())));
                    break;
                case STYLE:
                    tokens.add(LatexToken.node(parseArgument()));
                    break;
                case LARGE_OPERATOR: {
                    LargeOperators.Entry entry = LargeOperators.forCommand(name).orElseThrow();
                    tokens.add(LatexToken.operator(entry, entry.defaultLimits()));
                    break;
                }
                case LIMITS:
                    overrideLimits(tokens, LimitLocation.UNDER_OVER, name);
                    break;
                case NOLIMITS:
                    overrideLimits(tokens, LimitLocation.SUB_SUP, name);
                    break;
                case DELIMITER: {
                    String delimiter = parseDelimiter();
                    if (!delimiter.isEmpty()) {
                        tokens.add(LatexToken.node(new Run(delimiter)));
                    }
                    break;
                }
                case LAYOUT:
                case SPACE:
                    break;
                case SYMBOL:
                    tokens.add(LatexToken.node(new Run(LatexCommands.glyphOf(name))));
                    break;
                case FUNCTION:
                    tokens.add(LatexToken.node(Run.normal(name)));
                    break;
                default:
                    tokens.add(LatexToken.node(unknown(source.substring(start, pos))));
            }
        }

        private void parseControlSymbol(List<LatexToken> tokens, char c) {
            if (LatexCommands.isSpacingSymbol(c)) {
                return;
            }
            String escaped = LatexCommands.escapedCharacter(c);
            if (escaped != null) {
                tokens.add(LatexToken.node(new Run(escaped)));
                return;
            }
            tokens.add(LatexToken.node(unknown("\\" + c)));
        }

        private Run unknown(String raw) {
            if (config.strict()) {
                throw new UnsupportedConstructException(raw);
            }
            logger.debug("Unrecognized command {} kept as literal text", raw);
            return new Run(raw);
        }

        private void overrideLimits(List<LatexToken> tokens, LimitLocation location, String name) {
            int last = tokens.size() - 1;
            if (last >= 0 && tokens.get(last).type() == LatexToken.Type.OPERATOR) {
                tokens.set(last, tokens.get(last).withLimitLocation(location));
            } else {
                logger.debug("Ignoring \\{} with no preceding operator", name);
            }
        }

        /**
         * Parses the {@code [n]} of {@code \sqrt[n]{x}}, if present.
         *
         * @return the degree, or null when the next character is not '['
         */
        private MathNode parseOptionalDegree() {
            skipWhitespace();
            if (atEnd() || source.charAt(pos) != '[') {
                return null;
            }
            int openPos = pos;
            pos++;
            enter();
            try {
                return Row.wrap(parseSequence(']', openPos));
            } finally {
                depth--;
            }
        }

        /**
         * Reads the argument of a text command verbatim, keeping its spaces.
         */
        private String parseRawText() {
            skipWhitespace();
            if (atEnd()) {
                return "";
            }
            if (source.charAt(pos) != '{') {
                int cp = source.codePointAt(pos);
                pos += Character.charCount(cp);
                return new String(Character.toChars(cp));
            }

            int openPos = pos;
            pos++;
            int braceDepth = 1;
            StringBuilder text = new StringBuilder();
            while (!atEnd()) {
                char c = source.charAt(pos);
                if (c == '\\' && pos + 1 < source.length()
                        && LatexCommands.escapedCharacter(source.charAt(pos + 1)) != null) {
                    text.append(LatexCommands.escapedCharacter(source.charAt(pos + 1)));
                    pos += 2;
                    continue;
                }
                if (c == '{') {
                    braceDepth++;
                } else if (c == '}') {
                    braceDepth--;
                    if (braceDepth == 0) {
                        pos++;
                        return text.toString();
                    }
                }
                text.append(c);
                pos++;
            }
            throw new MathParseException("Unmatched opening brace", source, openPos);
        }

        /**
         * Reads the delimiter after {@code \left}, {@code \right} or a sizing command.
         *
         * @return the delimiter glyph, empty for the null delimiter {@code .}
         */
        private String parseDelimiter() {
            skipWhitespace();
            if (atEnd()) {
                return "";
            }
            char c = source.charAt(pos);
            if (c == '.') {
                pos++;
                return "";
            }
            if (c != '\\') {
                int cp = source.codePointAt(pos);
                pos += Character.charCount(cp);
                return new String(Character.toChars(cp));
            }

            int start = pos;
            pos++;
            if (atEnd()) {
                return unknown("\\").text();
            }
            char next = source.charAt(pos);
            if (!isLetter(next)) {
                pos++;
                String escaped = LatexCommands.escapedCharacter(next);
                return escaped != null ? escaped : unknown("\\" + next).text();
            }
            while (!atEnd() && isLetter(source.charAt(pos))) {
                pos++;
            }
            String glyph = LatexCommands.glyphOf(source.substring(start + 1, pos));
            return glyph != null ? glyph : unknown(source.substring(start, pos)).text();
        }

        private void enter() {
            depth++;
            if (depth > config.maxDepth()) {
                throw new MathParseException(
                    "Maximum nesting depth of " + config.maxDepth() + " exceeded", source, pos);
            }
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
        }

        private boolean atEnd() {
            return pos >= source.length();
        }

        private static boolean isLetter(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
        }
    }
}
