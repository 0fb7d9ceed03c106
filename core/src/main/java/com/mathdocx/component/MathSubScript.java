package com.mathdocx.component;

import java.util.List;
import java.util.Objects;

public record MathSubScript(List<MathComponent> base, List<MathComponent> subScript)
    implements MathComponent {

    public MathSubScript {
        base = List.copyOf(Objects.requireNonNull(base, "base must not be null"));
        subScript = List.copyOf(Objects.requireNonNull(subScript, "subScript must not be null"));
    }
}
