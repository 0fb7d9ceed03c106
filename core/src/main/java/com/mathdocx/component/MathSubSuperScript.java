package com.mathdocx.component;

import java.util.List;
import java.util.Objects;

public record MathSubSuperScript(List<MathComponent> base,
                                 List<MathComponent> subScript,
                                 List<MathComponent> superScript) implements MathComponent {

    public MathSubSuperScript {
        base = List.copyOf(Objects.requireNonNull(base, "base must not be null"));
        subScript = List.copyOf(Objects.requireNonNull(subScript, "subScript must not be null"));
        superScript = List.copyOf(Objects.requireNonNull(superScript, "superScript must not be null"));
    }
}
