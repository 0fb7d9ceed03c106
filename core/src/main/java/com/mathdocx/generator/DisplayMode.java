package com.mathdocx.generator;

/**
 * How a math fragment sits in the surrounding document.
 */
public enum DisplayMode {
    /** Math inside a line of text ({@code $...$}). */
    INLINE,
    /** Math on its own line ({@code $$...$$}), rendered as an equation paragraph. */
    BLOCK
}
