package com.mathdocx.component;

import java.util.List;
import java.util.Objects;

public record MathFraction(List<MathComponent> numerator, List<MathComponent> denominator)
    implements MathComponent {

    public MathFraction {
        numerator = List.copyOf(Objects.requireNonNull(numerator, "numerator must not be null"));
        denominator = List.copyOf(Objects.requireNonNull(denominator, "denominator must not be null"));
    }
}
