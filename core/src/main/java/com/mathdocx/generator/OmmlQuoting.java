package com.mathdocx.generator;

/**
 * Escaping helpers for emitting OMML markup.
 */
public final class OmmlQuoting {

    private OmmlQuoting() {}

    /**
     * Escapes text for use as element content.
     *
     * @param text the raw text
     * @return the escaped text
     */
    public static String escapeText(String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement;
            switch (c) {
                case '&':
                    replacement = "&amp;";
                    break;
                case '<':
                    replacement = "&lt;";
                    break;
                case '>':
                    replacement = "&gt;";
                    break;
                default:
                    replacement = null;
            }
            if (replacement != null) {
                if (sb == null) {
                    sb = new StringBuilder(text.length() + 16);
                    sb.append(text, 0, i);
                }
                sb.append(replacement);
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? text : sb.toString();
    }

    /**
     * Escapes text for use inside a double-quoted attribute value.
     *
     * @param value the raw value
     * @return the escaped value
     */
    public static String escapeAttribute(String value) {
        return escapeText(value).replace("\"", "&quot;");
    }

    /**
     * Returns whether a text run needs {@code xml:space="preserve"}, i.e. has
     * whitespace a consumer would otherwise strip.
     *
     * @param text the run text
     * @return true if leading or trailing whitespace is present
     */
    public static boolean needsPreserve(String text) {
        return !text.isEmpty()
            && (Character.isWhitespace(text.charAt(0))
                || Character.isWhitespace(text.charAt(text.length() - 1)));
    }
}
