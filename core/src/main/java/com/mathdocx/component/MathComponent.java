package com.mathdocx.component;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed math component handed to a document-object builder.
 *
 * <p>Components correspond one to one with the OMML constructs emitted by
 * {@link com.mathdocx.generator.OmmlGenerator}: a builder can turn each record
 * straight into its equation object without re-parsing markup. Rows do not
 * exist at this level; their children are spliced into the enclosing list.
 *
 * <p>Serialized to JSON with a {@code type} discriminator, see
 * {@link ComponentJsonWriter}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MathRun.class, name = "run"),
    @JsonSubTypes.Type(value = MathFraction.class, name = "fraction"),
    @JsonSubTypes.Type(value = MathRadical.class, name = "radical"),
    @JsonSubTypes.Type(value = MathSuperScript.class, name = "superScript"),
    @JsonSubTypes.Type(value = MathSubScript.class, name = "subScript"),
    @JsonSubTypes.Type(value = MathSubSuperScript.class, name = "subSuperScript"),
    @JsonSubTypes.Type(value = MathNary.class, name = "nary")
})
public sealed interface MathComponent
    permits MathRun, MathFraction, MathRadical, MathSuperScript,
            MathSubScript, MathSubSuperScript, MathNary {
}
