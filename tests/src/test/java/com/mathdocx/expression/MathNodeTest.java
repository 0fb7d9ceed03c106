package com.mathdocx.expression;

import com.mathdocx.expression.LargeOperator.LimitLocation;
import com.mathdocx.test.TestBase;
import com.mathdocx.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the expression tree node classes and {@link MathNodes}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Math Node Tests")
public class MathNodeTest extends TestBase {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Fraction always exposes numerator and denominator as its two children")
        void testFractionChildren() {
            Fraction fraction = new Fraction(new Run("a"), new Run("b"));

            assertThat(fraction.children()).containsExactly(new Run("a"), new Run("b"));
        }

        @Test
        @DisplayName("Fraction rejects a missing denominator")
        void testFractionRequiresDenominator() {
            assertThatThrownBy(() -> new Fraction(new Run("a"), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("denominator");
        }

        @Test
        @DisplayName("Square root has no degree child")
        void testSquareRoot() {
            Radical radical = new Radical(new Run("x"));

            assertThat(radical.hasDegree()).isFalse();
            assertThat(radical.degree()).isEmpty();
            assertThat(radical.children()).containsExactly(new Run("x"));
        }

        @Test
        @DisplayName("N-th root lists degree before body")
        void testNthRoot() {
            Radical radical = new Radical(new Run("x"), new Run("3"));

            assertThat(radical.degree()).contains(new Run("3"));
            assertThat(radical.children()).containsExactly(new Run("3"), new Run("x"));
        }

        @Test
        @DisplayName("Script nodes reject a null base")
        void testScriptBaseRequired() {
            assertThatThrownBy(() -> new Superscript(null, new Run("2")))
                .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> new Subscript(null, new Run("2")))
                .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> new SubSuperscript(new Run("x"), new Run("1"), null))
                .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("Empty run is a legal script base")
        void testEmptyRunBase() {
            Superscript sup = new Superscript(Run.empty(), new Run("2"));

            assertThat(sup.base()).isInstanceOf(Run.class);
            assertThat(((Run) sup.base()).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Large operator rejects an empty glyph")
        void testLargeOperatorGlyph() {
            assertThatThrownBy(() -> new LargeOperator("", LimitLocation.UNDER_OVER, null, null, Row.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Large operator children skip absent limits")
        void testLargeOperatorChildren() {
            LargeOperator op = new LargeOperator("∑", LimitLocation.UNDER_OVER,
                new Run("i"), null, new Run("x"));

            assertThat(op.children()).containsExactly(new Run("i"), new Run("x"));
            assertThat(op.sup()).isEmpty();
        }

        @Test
        @DisplayName("Row copies its input list")
        void testRowIsImmutable() {
            List<MathNode> children = new ArrayList<>(List.of(new Run("a")));
            Row row = new Row(children);
            children.add(new Run("b"));

            assertThat(row.children()).containsExactly(new Run("a"));
            assertThatThrownBy(() -> row.children().add(new Run("c")))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Row.wrap unwraps a single node and keeps lists as rows")
        void testRowWrap() {
            assertThat(Row.wrap(List.of(new Run("a")))).isEqualTo(new Run("a"));
            assertThat(Row.wrap(List.of())).isEqualTo(Row.empty());
            assertThat(Row.wrap(List.of(new Run("a"), new Run("b"))))
                .isEqualTo(Row.of(new Run("a"), new Run("b")));
        }
    }

    @Nested
    @DisplayName("Equality")
    class Equality {

        @Test
        @DisplayName("Structurally equal trees are equal")
        void testStructuralEquality() {
            MathNode a = new Fraction(Row.of(new Run("1")), new Superscript(new Run("x"), new Run("2")));
            MathNode b = new Fraction(Row.of(new Run("1")), new Superscript(new Run("x"), new Run("2")));

            assertThat(a).isEqualTo(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
        }

        @Test
        @DisplayName("Run style takes part in equality")
        void testRunStyleEquality() {
            assertThat(new Run("sin")).isNotEqualTo(Run.normal("sin"));
        }
    }

    @Nested
    @DisplayName("MathNodes Utilities")
    class Utilities {

        @Test
        @DisplayName("textContent concatenates runs in document order")
        void testTextContent() {
            MathNode tree = Row.of(new Run("a"),
                new Fraction(new Run("b"), Row.of(new Run("c"), new Run("d"))));

            assertThat(MathNodes.textContent(tree)).isEqualTo("abcd");
        }

        @Test
        @DisplayName("textContent includes large operator glyphs")
        void testTextContentLargeOperator() {
            MathNode op = new LargeOperator("∑", LimitLocation.UNDER_OVER, new Run("i"), null, new Run("x"));

            assertThat(MathNodes.textContent(op)).isEqualTo("∑ix");
        }

        @Test
        @DisplayName("flatten splices nested rows into their parent")
        void testFlattenNestedRows() {
            MathNode nested = Row.of(new Run("a"), Row.of(new Run("b"), Row.of(new Run("c"))), new Run("d"));

            MathNode flat = MathNodes.flatten(nested);

            assertThat(flat).isEqualTo(Row.of(new Run("a"), new Run("b"), new Run("c"), new Run("d")));
        }

        @Test
        @DisplayName("flatten reaches into structural slots")
        void testFlattenInsideFraction() {
            MathNode nested = new Fraction(Row.of(Row.of(new Run("a")), new Run("b")), new Run("c"));

            MathNode flat = MathNodes.flatten(nested);

            assertThat(flat).isEqualTo(new Fraction(Row.of(new Run("a"), new Run("b")), new Run("c")));
        }

        @Test
        @DisplayName("depth counts the longest path")
        void testDepth() {
            assertThat(MathNodes.depth(new Run("x"))).isEqualTo(1);
            assertThat(MathNodes.depth(Row.of(new Fraction(new Run("a"), Row.of(new Run("b")))))).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Large Operator Table")
    class LargeOperatorTable {

        @Test
        @DisplayName("Commands map to glyphs with default limit locations")
        void testCommandLookup() {
            assertThat(LargeOperators.forCommand("sum")).hasValueSatisfying(entry -> {
                assertThat(entry.glyph()).isEqualTo("∑");
                assertThat(entry.defaultLimits()).isEqualTo(LimitLocation.UNDER_OVER);
            });
            assertThat(LargeOperators.forCommand("int")).hasValueSatisfying(entry -> {
                assertThat(entry.glyph()).isEqualTo("∫");
                assertThat(entry.defaultLimits()).isEqualTo(LimitLocation.SUB_SUP);
            });
            assertThat(LargeOperators.forCommand("frac")).isEmpty();
        }

        @Test
        @DisplayName("Greek capital sigma is recognised as a sum")
        void testSigmaAlias() {
            assertThat(LargeOperators.forGlyph("Σ")).hasValueSatisfying(
                entry -> assertThat(entry.glyph()).isEqualTo("∑"));
            assertThat(LargeOperators.forGlyph(" ∫ ")).hasValueSatisfying(
                entry -> assertThat(entry.command()).isEqualTo("int"));
        }

        @Test
        @DisplayName("Text other than a lone operator glyph finds nothing")
        void testNoGlyph() {
            for (String text : Arrays.asList("x", "", null, "lim", "+", "∑k", "∑ ∑")) {
                assertThat(LargeOperators.forGlyph(text)).isEmpty();
            }
        }
    }
}
