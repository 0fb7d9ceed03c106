package com.mathdocx.exception;

/**
 * Base class for failures that are confined to a single math fragment.
 *
 * <p>A caller converting a whole document catches this exception per fragment,
 * substitutes a fallback for that fragment and carries on. See
 * {@link com.mathdocx.MathConverter} which does exactly that.
 */
public class MathConversionException extends RuntimeException {

    public MathConversionException(String message) {
        super(message);
    }

    public MathConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
