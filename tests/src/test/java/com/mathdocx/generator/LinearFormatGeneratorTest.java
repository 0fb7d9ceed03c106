package com.mathdocx.generator;

import com.mathdocx.parser.LatexParser;
import com.mathdocx.test.TestBase;
import com.mathdocx.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LinearFormatGenerator}, driven from LaTeX input.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Generator
@DisplayName("Linear Format Generator Tests")
public class LinearFormatGeneratorTest extends TestBase {

    private final LatexParser parser = new LatexParser();
    private final LinearFormatGenerator generator = new LinearFormatGenerator();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "\\frac{a}{b}          | (a)/(b)",
        "\\sqrt{x}             | \\sqrt(x)",
        "\\sqrt[3]{x}          | \\sqrt(3&x)",
        "x^2                   | x^(2)",
        "x^2_i                 | x_(i)^(2)",
        "{a+b}^2               | (a+b)^(2)",
        "\\sum_{i=1}^n x       | ∑_(i=1)^(n)▒(x)",
        "\\int f               | ∫▒(f)",
        "\\text{if} x          | \"if\"x",
        "a + b                 | a+b"
    })
    @DisplayName("LaTeX renders to linear format")
    void testLinearFormat(String latex, String expected) {
        assertThat(generator.generate(parser.parse(latex))).isEqualTo(expected);
    }
}
