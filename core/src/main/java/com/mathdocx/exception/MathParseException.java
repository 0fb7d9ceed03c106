package com.mathdocx.exception;

/**
 * Exception thrown when a math fragment cannot be parsed at all.
 *
 * <p>Common causes:
 * <ul>
 *   <li>An opening brace with no matching closing brace</li>
 *   <li>An unterminated {@code \sqrt[} degree</li>
 *   <li>Nesting deeper than the configured maximum</li>
 *   <li>MathML that is not well-formed XML, or an element with the wrong number of children</li>
 * </ul>
 *
 * <p>The position is a character offset into the LaTeX source, or -1 when the
 * failure has no meaningful offset (MathML input).
 */
public class MathParseException extends MathConversionException {

    private final String source;
    private final int position;

    /**
     * Creates a parse exception.
     *
     * @param message the error message
     * @param source the fragment being parsed
     * @param position the character offset of the error, or -1
     */
    public MathParseException(String message, String source, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.source = source;
        this.position = position;
    }

    /**
     * Creates a parse exception with a cause.
     *
     * @param message the error message
     * @param source the fragment being parsed
     * @param cause the underlying cause
     */
    public MathParseException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.position = -1;
    }

    /**
     * Returns the fragment that failed to parse.
     *
     * @return the source text, or null if not available
     */
    public String getSource() {
        return source;
    }

    /**
     * Returns the character offset of the failure.
     *
     * @return the offset, or -1 if unknown
     */
    public int getPosition() {
        return position;
    }
}
