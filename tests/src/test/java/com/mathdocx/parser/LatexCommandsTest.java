package com.mathdocx.parser;

import com.mathdocx.test.TestBase;
import com.mathdocx.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LatexCommands} lookups.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Parser
@DisplayName("LaTeX Command Table Tests")
public class LatexCommandsTest extends TestBase {

    @Test
    @DisplayName("Commands are classified by kind")
    void testKinds() {
        assertThat(LatexCommands.kindOf("frac")).isEqualTo(LatexCommands.Kind.FRACTION);
        assertThat(LatexCommands.kindOf("sqrt")).isEqualTo(LatexCommands.Kind.SQRT);
        assertThat(LatexCommands.kindOf("sum")).isEqualTo(LatexCommands.Kind.LARGE_OPERATOR);
        assertThat(LatexCommands.kindOf("left")).isEqualTo(LatexCommands.Kind.DELIMITER);
        assertThat(LatexCommands.kindOf("alpha")).isEqualTo(LatexCommands.Kind.SYMBOL);
        assertThat(LatexCommands.kindOf("nonexistent")).isEqualTo(LatexCommands.Kind.UNKNOWN);
    }

    @Test
    @DisplayName("Function names are recognized")
    void testFunctions() {
        assertThat(LatexCommands.isFunction("sin")).isTrue();
        assertThat(LatexCommands.isFunction("lim")).isTrue();
        assertThat(LatexCommands.isFunction("alpha")).isFalse();
        assertThat(LatexCommands.kindOf("log")).isEqualTo(LatexCommands.Kind.FUNCTION);
    }

    @Test
    @DisplayName("Symbols map to glyphs and unknown names to null")
    void testGlyphs() {
        assertThat(LatexCommands.glyphOf("pi")).isEqualTo("π");
        assertThat(LatexCommands.glyphOf("times")).isEqualTo("×");
        assertThat(LatexCommands.glyphOf("nonexistent")).isNull();
    }

    @Test
    @DisplayName("Escaped control symbols")
    void testEscapes() {
        assertThat(LatexCommands.escapedCharacter('{')).isEqualTo("{");
        assertThat(LatexCommands.escapedCharacter('_')).isEqualTo("_");
        assertThat(LatexCommands.escapedCharacter('|')).isEqualTo("‖");
        assertThat(LatexCommands.escapedCharacter('a')).isNull();
    }
}
