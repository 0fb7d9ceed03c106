package com.mathdocx.component;

import java.util.List;
import java.util.Objects;

/**
 * Radical; {@code hideDegree} is set for square roots, whose degree list is empty.
 */
public record MathRadical(List<MathComponent> degree, List<MathComponent> children, boolean hideDegree)
    implements MathComponent {

    public MathRadical {
        degree = List.copyOf(Objects.requireNonNull(degree, "degree must not be null"));
        children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
    }
}
