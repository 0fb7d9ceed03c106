package com.mathdocx.component;

import com.mathdocx.expression.LargeOperator.LimitLocation;
import com.mathdocx.parser.LatexParser;
import com.mathdocx.test.TestBase;
import com.mathdocx.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComponentGenerator} and {@link ComponentJsonWriter}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Generator
@DisplayName("Component Generator Tests")
public class ComponentGeneratorTest extends TestBase {

    private final LatexParser parser = new LatexParser();
    private final ComponentGenerator generator = new ComponentGenerator();

    private List<MathComponent> components(String latex) {
        return generator.generate(parser.parse(latex));
    }

    private static MathRun run(String text) {
        return new MathRun(text, false);
    }

    @Nested
    @DisplayName("Mapping")
    class Mapping {

        @Test
        @DisplayName("Top-level rows are spliced into a flat list")
        void testFlatList() {
            assertThat(components("a + {b c}")).containsExactly(run("a"), run("+"), run("b"), run("c"));
        }

        @Test
        @DisplayName("A fraction holds numerator and denominator lists")
        void testFraction() {
            assertThat(components("\\frac{1}{x+1}")).containsExactly(
                new MathFraction(List.of(run("1")), List.of(run("x"), run("+"), run("1"))));
        }

        @Test
        @DisplayName("Radicals report whether their degree is hidden")
        void testRadicals() {
            assertThat(components("\\sqrt{x}"))
                .containsExactly(new MathRadical(List.of(), List.of(run("x")), true));
            assertThat(components("\\sqrt[3]{x}"))
                .containsExactly(new MathRadical(List.of(run("3")), List.of(run("x")), false));
        }

        @Test
        @DisplayName("Scripts map to their component records")
        void testScripts() {
            assertThat(components("x^2 y_i z_j^3")).containsExactly(
                new MathSuperScript(List.of(run("x")), List.of(run("2"))),
                new MathSubScript(List.of(run("y")), List.of(run("i"))),
                new MathSubSuperScript(List.of(run("z")), List.of(run("j")), List.of(run("3"))));
        }

        @Test
        @DisplayName("A large operator becomes an nary component")
        void testNary() {
            assertThat(components("\\sum_{i}^{n} x")).containsExactly(new MathNary("∑",
                LimitLocation.UNDER_OVER, List.of(run("i")), List.of(run("n")), List.of(run("x")), false, false));
        }

        @Test
        @DisplayName("Absent limits are empty lists flagged hidden")
        void testNaryHiddenLimits() {
            MathNary nary = (MathNary) components("\\int f").get(0);

            assertThat(nary.subScript()).isEmpty();
            assertThat(nary.superScript()).isEmpty();
            assertThat(nary.hideSubScript()).isTrue();
            assertThat(nary.hideSuperScript()).isTrue();
            assertThat(nary.limitLocation()).isEqualTo(LimitLocation.SUB_SUP);
        }

        @Test
        @DisplayName("Upright text is flagged normal")
        void testNormalRun() {
            assertThat(components("\\text{d}x")).containsExactly(new MathRun("d", true), run("x"));
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("Components serialize with a type discriminator")
        void testTypeDiscriminator() {
            String json = ComponentJsonWriter.toJson(components("\\frac{1}{2}"));

            assertThat(json).startsWith("[{\"type\":\"fraction\"")
                .contains("\"numerator\":[{\"type\":\"run\"")
                .contains("\"text\":\"1\"");
        }

        @Test
        @DisplayName("A mixed expression reads back equal")
        void testReadBack() {
            List<MathComponent> original = components("\\sum_{i=1}^{n} \\frac{\\sqrt[3]{x_i^2}}{2} + \\text{if}");

            String json = ComponentJsonWriter.toJson(original);
            logData("JSON", json);

            assertThat(ComponentJsonWriter.fromJson(json)).isEqualTo(original);
        }

        @Test
        @DisplayName("Invalid JSON is rejected")
        void testInvalidJson() {
            assertThatThrownBy(() -> ComponentJsonWriter.fromJson("[{\"type\":\"matrix\"}]"))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ComponentJsonWriter.fromJson("not json"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
