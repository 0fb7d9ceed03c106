package com.mathdocx.component;

import java.util.List;
import java.util.Objects;

public record MathSuperScript(List<MathComponent> base, List<MathComponent> superScript)
    implements MathComponent {

    public MathSuperScript {
        base = List.copyOf(Objects.requireNonNull(base, "base must not be null"));
        superScript = List.copyOf(Objects.requireNonNull(superScript, "superScript must not be null"));
    }
}
