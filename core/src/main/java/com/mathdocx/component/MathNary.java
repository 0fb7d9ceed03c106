package com.mathdocx.component;

import com.mathdocx.expression.LargeOperator.LimitLocation;

import java.util.List;
import java.util.Objects;

/**
 * N-ary operator. Both limit lists are always present; an absent limit is an
 * empty list with its hide flag set.
 */
public record MathNary(String character,
                       LimitLocation limitLocation,
                       List<MathComponent> subScript,
                       List<MathComponent> superScript,
                       List<MathComponent> children,
                       boolean hideSubScript,
                       boolean hideSuperScript) implements MathComponent {

    public MathNary {
        Objects.requireNonNull(character, "character must not be null");
        Objects.requireNonNull(limitLocation, "limitLocation must not be null");
        subScript = List.copyOf(Objects.requireNonNull(subScript, "subScript must not be null"));
        superScript = List.copyOf(Objects.requireNonNull(superScript, "superScript must not be null"));
        children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
    }
}
