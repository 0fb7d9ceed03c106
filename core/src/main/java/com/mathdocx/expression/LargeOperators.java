package com.mathdocx.expression;

import com.mathdocx.expression.LargeOperator.LimitLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Table of large operators shared by both front ends.
 *
 * <p>The LaTeX parser looks operators up by command name ({@code sum}), the
 * MathML parser by glyph ({@code ∑}). Both end up with the same glyph and
 * default limit location, so {@code \sum_{i}^{n} x} produces the same tree
 * whichever way it arrives.
 */
public final class LargeOperators {

    /**
     * A known large operator.
     */
    public static final class Entry {
        private final String command;
        private final String glyph;
        private final LimitLocation defaultLimits;

        private Entry(String command, String glyph, LimitLocation defaultLimits) {
            this.command = command;
            this.glyph = glyph;
            this.defaultLimits = defaultLimits;
        }

        public String command() {
            return command;
        }

        public String glyph() {
            return glyph;
        }

        public LimitLocation defaultLimits() {
            return defaultLimits;
        }

        @Override
        public String toString() {
            return "\\" + command + "(" + glyph + ")";
        }
    }

    private static final Map<String, Entry> BY_COMMAND;
    private static final Map<String, Entry> BY_GLYPH;

    static {
        Map<String, Entry> byCommand = new LinkedHashMap<>();
        Map<String, Entry> byGlyph = new LinkedHashMap<>();

        register(byCommand, byGlyph, "sum", "∑", LimitLocation.UNDER_OVER);
        register(byCommand, byGlyph, "prod", "∏", LimitLocation.UNDER_OVER);
        register(byCommand, byGlyph, "coprod", "∐", LimitLocation.UNDER_OVER);
        register(byCommand, byGlyph, "bigcup", "⋃", LimitLocation.UNDER_OVER);
        register(byCommand, byGlyph, "bigcap", "⋂", LimitLocation.UNDER_OVER);
        register(byCommand, byGlyph, "int", "∫", LimitLocation.SUB_SUP);
        register(byCommand, byGlyph, "iint", "∬", LimitLocation.SUB_SUP);
        register(byCommand, byGlyph, "iiint", "∭", LimitLocation.SUB_SUP);
        register(byCommand, byGlyph, "oint", "∮", LimitLocation.SUB_SUP);

        // Greek capital sigma is what hand-written MathML often uses for a sum
        byGlyph.put("Σ", byGlyph.get("∑"));

        BY_COMMAND = Collections.unmodifiableMap(byCommand);
        BY_GLYPH = Collections.unmodifiableMap(byGlyph);
    }

    private static void register(Map<String, Entry> byCommand, Map<String, Entry> byGlyph,
                                 String command, String glyph, LimitLocation limits) {
        Entry entry = new Entry(command, glyph, limits);
        byCommand.put(command, entry);
        byGlyph.put(glyph, entry);
    }

    private LargeOperators() {}

    /**
     * Looks up an operator by LaTeX command name, without the backslash.
     *
     * @param command the command name, e.g. "sum"
     * @return the entry, or empty if the command is not a large operator
     */
    public static Optional<Entry> forCommand(String command) {
        return Optional.ofNullable(BY_COMMAND.get(command));
    }

    /**
     * Looks up an operator by glyph. The text must be exactly one known glyph,
     * ignoring surrounding whitespace.
     *
     * @param text flattened text content of a node
     * @return the entry, or empty if the text is not a large-operator glyph
     */
    public static Optional<Entry> forGlyph(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_GLYPH.get(text.trim()));
    }

    /**
     * Returns whether a command name denotes a large operator.
     *
     * @param command the command name, without the backslash
     * @return true if known
     */
    public static boolean isLargeOperator(String command) {
        return BY_COMMAND.containsKey(command);
    }
}
