package com.nestplan.expression;

import com.nestplan.test.TestBase;
import com.nestplan.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.nestplan.expression.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for expression nodes and {@link ExpressionUtils}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Expression Tests")
public class ExpressionTest extends TestBase {

    // ==================== Rendering ====================

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Comparisons and logical operators")
        void testBinary() {
            assertThat(eq(field(0, "title"), param(1)).render()).isEqualTo("&0.title == ^1");
            assertThat(and(eq(field(0, "a"), literal("x")), or(gt(field(1, "b"), literal(2)), literal(true))).render())
                .isEqualTo("&0.a == \"x\" and (&1.b > 2 or true)");
            assertThat(in(field(0, "id"), list(literal(1), literal(2))).render()).isEqualTo("&0.id in [1, 2]");
        }

        @Test
        @DisplayName("Maps, structs, updates and merges")
        void testCollections() {
            assertThat(map(entry("text", field(0, "text"))).render()).isEqualTo("%{text: &0.text}");
            assertThat(map().render()).isEqualTo("%{}");
            assertThat(new MapLiteral(List.of(new MapEntry(literal("k"), literal(1)))).render())
                .isEqualTo("%{\"k\" => 1}");
            assertThat(struct("Post", entry("id", literal(null))).render()).isEqualTo("%Post{id: nil}");
            assertThat(update(source(0), entry("title", param(0))).render()).isEqualTo("%{&0 | title: ^0}");
            assertThat(merge(source(0), map()).render()).isEqualTo("merge(&0, %{})");
        }

        @Test
        @DisplayName("Fragments, subsets, sort orders and atoms")
        void testOthers() {
            assertThat(fragment("lower(?)", field(0, "title")).render()).isEqualTo("fragment(\"lower(?)\", &0.title)");
            assertThat(take(0, "id", "title").render()).isEqualTo("take(&0, [:id, :title])");
            assertThat(SortOrder.desc(field(0, "id")).render()).isEqualTo("desc: &0.id");
            assertThat(atom("name").render()).isEqualTo(":name");
            assertThat(atom("true").isBoolean()).isTrue();
        }

        @Test
        @DisplayName("Custom render contexts resolve names and values")
        void testCustomContext() {
            RenderContext named = new RenderContext() {
                @Override
                public String source(int index) {
                    return index == 0 ? "p" : "c";
                }

                @Override
                public String parameter(int index) {
                    return "?" + index;
                }
            };

            assertThat(eq(field(1, "post_id"), param(3)).render(named)).isEqualTo("c.post_id == ?3");
        }
    }

    // ==================== Utilities ====================

    @Nested
    @DisplayName("ExpressionUtils")
    class Utilities {

        private final Expression expr = and(
            eq(field(0, "title"), param(0)),
            in(field(1, "id"), list(param(1), literal(3))));

        @Test
        @DisplayName("shiftParameters moves every placeholder")
        void testShift() {
            Expression shifted = ExpressionUtils.shiftParameters(expr, 2);

            assertThat(shifted).isEqualTo(and(
                eq(field(0, "title"), param(2)),
                in(field(1, "id"), list(param(3), literal(3)))));
            assertThat(ExpressionUtils.shiftParameters(expr, 0)).isSameAs(expr);
        }

        @Test
        @DisplayName("transform leaves untouched subtrees shared")
        void testTransform() {
            Expression unchanged = ExpressionUtils.transform(expr, e -> e);
            assertThat(unchanged).isSameAs(expr);

            Expression renamed = ExpressionUtils.transform(expr,
                e -> e instanceof FieldAccess f && f.field().equals("title") ? field(0, "text") : e);
            assertThat(renamed.render()).isEqualTo("&0.text == ^0 and &1.id in [^1, 3]");
        }

        @Test
        @DisplayName("walk visits parents before children")
        void testWalk() {
            List<String> visited = new ArrayList<>();
            ExpressionUtils.walk(eq(field(0, "a"), param(0)), e -> visited.add(e.getClass().getSimpleName()));

            assertThat(visited).containsExactly("BinaryExpression", "FieldAccess", "Parameter");
        }

        @Test
        @DisplayName("parameters, field accesses and parameter span")
        void testCollectors() {
            assertThat(ExpressionUtils.parameters(expr)).containsExactly(param(0), param(1));
            assertThat(ExpressionUtils.fieldAccesses(expr)).containsExactly(field(0, "title"), field(1, "id"));
            assertThat(ExpressionUtils.parameterSpan(expr)).isEqualTo(2);
            assertThat(ExpressionUtils.parameterSpan(literal(1))).isZero();
        }
    }

    @Test
    @DisplayName("Invalid nodes are rejected on construction")
    void testValidation() {
        assertThatThrownBy(() -> param(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MapEntry(null, literal(1))).isInstanceOf(NullPointerException.class);
    }
}
