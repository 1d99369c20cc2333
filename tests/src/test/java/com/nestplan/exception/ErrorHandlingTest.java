package com.nestplan.exception;

import com.nestplan.query.Clause;
import com.nestplan.query.Query;
import com.nestplan.query.Subquery;
import com.nestplan.test.TestBase;
import com.nestplan.test.TestCategories;
import com.nestplan.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.nestplan.expression.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for error messages and exception context.
 *
 * <p>These tests verify that:
 * <ul>
 *   <li>messages end with the rendering of the offending query</li>
 *   <li>technical details are available for debugging</li>
 *   <li>subquery failures keep the inner failure and name the outer query</li>
 * </ul>
 */
@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("Error Handling Tests")
public class ErrorHandlingTest extends TestBase {

    private final Query query = Query.from("Post").where(eq(field(0, "title"), param(0)), 1);

    @Nested
    @DisplayName("QueryCompilationException")
    class CompilationExceptionTests {

        @Test
        @DisplayName("Message ends with the query")
        void testMessageIncludesQuery() {
            // Given
            QueryCompilationException ex = new QueryCompilationException(ErrorKind.UNKNOWN_FIELD,
                "field `x` does not exist", query, Clause.WHERE);

            // Then
            assertThat(ex.getMessage())
                .isEqualTo("field `x` does not exist in query:\n\nfrom p in Post, where: p.title == ^1");
            assertThat(ex.getReason()).isEqualTo("field `x` does not exist");
            assertThat(ex.getQuery()).isSameAs(query);
            assertThat(ex.getClause()).isEqualTo(Clause.WHERE);
        }

        @Test
        @DisplayName("Message without a query is the reason alone")
        void testMessageWithoutQuery() {
            QueryCompilationException ex = new QueryCompilationException(ErrorKind.UNKNOWN_SCHEMA, "boom", null);

            assertThat(ex.getMessage()).isEqualTo("boom");
            assertThat(ex.getClause()).isNull();
        }

        @Test
        @DisplayName("Technical message includes full context")
        void testTechnicalMessage() {
            QueryCompilationException ex = new QueryCompilationException(ErrorKind.UNKNOWN_FIELD,
                "field `x` does not exist", query, Clause.WHERE);

            String technical = ex.getTechnicalMessage();

            assertThat(technical).startsWith("Query Compilation Failed");
            assertThat(technical).contains("Kind: UNKNOWN_FIELD");
            assertThat(technical).contains("Error: field `x` does not exist");
            assertThat(technical).contains("Clause: where");
            assertThat(technical).contains("Query: from p in Post");
            assertThat(technical).doesNotContain("Cause:");
        }
    }

    @Test
    @DisplayName("Cast exceptions describe the value, clause and type")
    void testCastException() {
        CastException ex = new CastException(1, StringType.get(), Clause.WHERE, query);

        assertThat(ex.getKind()).isEqualTo(ErrorKind.CAST_ERROR);
        assertThat(ex.getReason()).isEqualTo("value `1` in `where` cannot be cast to type string");
        assertThat(ex.getValue()).isEqualTo(1);
        assertThat(ex.getType()).isEqualTo(StringType.get());
    }

    @Nested
    @DisplayName("SubqueryException")
    class SubqueryExceptionTests {

        @Test
        @DisplayName("Wraps the inner failure and names the outer query")
        void testWrapping() {
            // Given
            CastException inner = new CastException(1, StringType.get(), Clause.WHERE, query);
            Query outer = Query.from(Subquery.of(query));

            // When
            SubqueryException ex = new SubqueryException(inner, outer);

            // Then
            assertThat(ex.wrapped()).isSameAs(inner);
            assertThat(ex.getCause()).isSameAs(inner);
            assertThat(ex.getKind()).isEqualTo(ErrorKind.CAST_ERROR);
            assertThat(ex.innerKind()).isEqualTo(ErrorKind.CAST_ERROR);
            assertThat(ex.getQuery()).isSameAs(outer);
            assertThat(ex.getMessage()).isEqualTo(SubqueryException.PREAMBLE + "\n\n"
                + "    value `1` in `where` cannot be cast to type string in query:\n"
                + "\n"
                + "    from p in Post, where: p.title == ^1\n"
                + "\nThe subquery originated from the following query:\n\n"
                + "from p in subquery(from p in Post, where: p.title == ^1)");
        }

        @Test
        @DisplayName("Technical message carries the cause")
        void testTechnicalMessage() {
            CastException inner = new CastException(1, StringType.get(), Clause.WHERE, query);

            SubqueryException ex = new SubqueryException(inner, Query.from(Subquery.of(query)));

            assertThat(ex.getTechnicalMessage()).contains("Cause: value `1` in `where`");
        }
    }
}
