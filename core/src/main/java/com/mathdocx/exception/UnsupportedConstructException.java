package com.mathdocx.exception;

/**
 * Exception thrown in strict mode when input uses a command or element that
 * has no mapping.
 *
 * <p>In the default (lenient) mode the parsers never throw this; they degrade
 * the construct to a literal text run instead.
 */
public class UnsupportedConstructException extends MathConversionException {

    private final String construct;

    /**
     * Creates an unsupported-construct exception.
     *
     * @param construct the raw command (e.g. {@code \foo}) or element name
     */
    public UnsupportedConstructException(String construct) {
        super("Unsupported math construct: " + construct);
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
