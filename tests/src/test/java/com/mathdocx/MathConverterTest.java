package com.mathdocx;

import com.mathdocx.component.MathComponent;
import com.mathdocx.component.MathRun;
import com.mathdocx.config.ConverterConfig;
import com.mathdocx.exception.MathParseException;
import com.mathdocx.generator.DisplayMode;
import com.mathdocx.test.TestBase;
import com.mathdocx.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link MathConverter}.
 */
@TestCategories.Integration
@DisplayName("Math Converter Tests")
public class MathConverterTest extends TestBase {

    private static final String SUM_MATHML =
        "<math xmlns=\"http://www.w3.org/1998/Math/MathML\">"
            + "<munderover><mo>∑</mo><mrow><mi>i</mi><mo>=</mo><mn>1</mn></mrow><mi>n</mi></munderover>"
            + "<msub><mi>x</mi><mi>i</mi></msub></math>";

    private final MathConverter converter = new MathConverter(ConverterConfig.defaults());

    @Nested
    @TestCategories.Tier1
    @DisplayName("Conversion")
    class Conversion {

        @Test
        @DisplayName("A valid fragment converts with a tree")
        void testSuccess() {
            ConversionResult result = converter.convertLatex("E = mc^2", DisplayMode.INLINE);

            assertThat(result.isFallback()).isFalse();
            assertThat(result.tree()).isPresent();
            assertThat(result.failure()).isEmpty();
            assertThat(result.toOmml()).startsWith("<m:oMath ").contains("<m:sSup>");
            assertThat(result.toLinearFormat()).isEqualTo("E=mc^(2)");
        }

        @Test
        @DisplayName("Block mode is carried through to the OMML")
        void testBlockMode() {
            ConversionResult result = converter.convertLatex("x", DisplayMode.BLOCK);

            assertThat(result.displayMode()).isEqualTo(DisplayMode.BLOCK);
            assertThat(result.toOmml()).startsWith("<m:oMathPara ");
        }

        @Test
        @DisplayName("A broken fragment falls back to its raw text")
        void testFallback() {
            ConversionResult result = converter.convertLatex("\\frac{a", DisplayMode.INLINE);

            assertThat(result.isFallback()).isTrue();
            assertThat(result.tree()).isEmpty();
            assertThat(result.failure()).hasValueSatisfying(f -> assertThat(f).contains("Unmatched"));
            assertThat(result.source()).isEqualTo("\\frac{a");
            assertThat(result.toComponents()).containsExactly(new MathRun("\\frac{a", true));
            assertThat(result.toOmml()).contains("<m:nor/>").contains("\\frac{a");
        }

        @Test
        @DisplayName("Malformed MathML falls back too")
        void testMathMLFallback() {
            ConversionResult result = converter.convertMathML("<math><mi>x</math>", DisplayMode.INLINE);

            assertThat(result.isFallback()).isTrue();
            assertThat(result.failure()).hasValueSatisfying(f -> assertThat(f).startsWith("Malformed MathML"));
        }

        @Test
        @DisplayName("Strict mode turns unknown commands into fallbacks")
        void testStrictFallback() {
            MathConverter strict = new MathConverter(ConverterConfig.builder().strict(true).build());

            assertThat(strict.convertLatex("\\foo x", DisplayMode.INLINE).isFallback()).isTrue();
            assertThat(converter.convertLatex("\\foo x", DisplayMode.INLINE).isFallback()).isFalse();
        }

        @Test
        @DisplayName("parseLatex throws instead of falling back")
        void testParseThrows() {
            assertThatThrownBy(() -> converter.parseLatex("{"))
                .isInstanceOf(MathParseException.class);
        }
    }

    @Nested
    @TestCategories.Tier1
    @DisplayName("Front End Parity")
    class FrontEndParity {

        @Test
        @DisplayName("LaTeX and MathML summations give the same tree")
        void testSumParity() {
            assertThat(converter.parseMathML(SUM_MATHML)).isEqualTo(converter.parseLatex("\\sum_{i=1}^{n} x_i"));
        }

        @Test
        @DisplayName("LaTeX and MathML summations give the same OMML and components")
        void testSumOutputParity() {
            ConversionResult latex = converter.convertLatex("\\sum_{i=1}^{n} x_i", DisplayMode.BLOCK);
            ConversionResult mathml = converter.convertMathML(SUM_MATHML, DisplayMode.BLOCK);

            assertThat(mathml.toOmml()).isEqualTo(latex.toOmml());
            List<MathComponent> components = latex.toComponents();
            assertThat(mathml.toComponents()).isEqualTo(components).hasSize(1);
        }

        @Test
        @DisplayName("Fractions with scripts agree across front ends")
        void testFractionParity() {
            String mathml = "<math><mfrac><msup><mi>x</mi><mn>2</mn></msup><mn>2</mn></mfrac></math>";

            assertThat(converter.parseMathML(mathml)).isEqualTo(converter.parseLatex("\\frac{x^2}{2}"));
        }
    }

    @Nested
    @TestCategories.Tier1
    @DisplayName("Pathological Input")
    class PathologicalInput {

        @Test
        @DisplayName("Deep LaTeX nesting falls back instead of overflowing the stack")
        void testDeepLatex() {
            List<String> sources = List.of(
                "\\sum".repeat(50_000) + " x",
                "{".repeat(100_000) + "x" + "}".repeat(100_000),
                "\\frac".repeat(20_000) + "x",
                "\\sqrt[".repeat(50_000) + "x");

            for (String source : sources) {
                ConversionResult result = converter.convertLatex(source, DisplayMode.INLINE);

                assertThat(result.isFallback()).isTrue();
                assertThat(result.failure()).hasValueSatisfying(f -> assertThat(f).contains("nesting depth"));
            }
        }

        @Test
        @DisplayName("Deep MathML nesting falls back instead of overflowing the stack")
        void testDeepMathML() {
            String deepToken = "<b>".repeat(200_000) + "x" + "</b>".repeat(200_000);
            List<String> sources = List.of(
                "<math><mi>" + deepToken + "</mi></math>",
                "<math><mo>" + deepToken + "</mo><mi>x</mi></math>",
                "<math>" + "<mrow>".repeat(200_000) + "<mi>x</mi>" + "</mrow>".repeat(200_000) + "</math>");

            for (String source : sources) {
                ConversionResult result = converter.convertMathML(source, DisplayMode.INLINE);

                assertThat(result.isFallback()).isTrue();
                assertThat(result.failure()).hasValueSatisfying(f -> assertThat(f).contains("nesting depth"));
            }
        }
    }

    @Nested
    @TestCategories.Tier2
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("One converter serves many threads")
        void testConcurrentConversion() throws Exception {
            String expectedLatex = converter.convertLatex("\\frac{1}{2}", DisplayMode.INLINE).toOmml();
            String expectedMathML = converter.convertMathML(SUM_MATHML, DisplayMode.INLINE).toOmml();

            logStep("Submitting 200 conversions to 8 threads");
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<Boolean>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    boolean useLatex = i % 2 == 0;
                    futures.add(pool.submit(() -> useLatex
                        ? converter.convertLatex("\\frac{1}{2}", DisplayMode.INLINE).toOmml().equals(expectedLatex)
                        : converter.convertMathML(SUM_MATHML, DisplayMode.INLINE).toOmml().equals(expectedMathML)));
                }
                for (Future<Boolean> future : futures) {
                    assertThat(future.get()).isTrue();
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
