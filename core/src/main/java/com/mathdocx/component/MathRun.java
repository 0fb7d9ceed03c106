package com.mathdocx.component;

import java.util.Objects;

/**
 * Text run; {@code normal} marks upright (non-math) text.
 */
public record MathRun(String text, boolean normal) implements MathComponent {

    public MathRun {
        Objects.requireNonNull(text, "text must not be null");
    }
}
