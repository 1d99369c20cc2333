package com.nestplan.query;

import com.nestplan.expression.SortOrder;
import com.nestplan.test.TestBase;
import com.nestplan.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.nestplan.expression.Expressions.*;
import static com.nestplan.test.Fixtures.normalize;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link QueryRenderer}.
 */
@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("QueryRenderer Tests")
public class QueryRendererTest extends TestBase {

    @Test
    @DisplayName("Renders every clause with binding names and bound values")
    void testAllClauses() {
        // Given
        Query query = Query.from("Post")
            .joinAssoc(JoinQualifier.INNER, 0, "comments", "c")
            .where(eq(field(0, "title"), param(0)), "hello")
            .orWhere(eq(field(1, "text"), literal(null)))
            .orderBy(orderBy(SortOrder.desc(field(0, "id"))))
            .limit(10)
            .select(source(0))
            .preload("comments", 1);

        // When
        String rendered = QueryRenderer.render(query);

        // Then
        assertThat(rendered).isEqualTo("from p in Post, join: c in assoc(p, :comments), "
            + "where: p.title == ^\"hello\", or_where: c.text == nil, order_by: [desc: p.id], "
            + "limit: 10, select: p, preload: [comments: c]");
    }

    @Test
    @DisplayName("Renders schemaless tables and join conditions")
    void testJoinWithOn() {
        Query query = Query.from(TableSource.schemaless("posts"))
            .join(JoinQualifier.LEFT, TableSource.entity("Comment"), "c",
                QueryExpr.of(eq(field(1, "post_id"), field(0, "id"))));

        assertThat(query.toString())
            .isEqualTo("from p in \"posts\", left_join: c in Comment, on: c.post_id == p.id");
    }

    @Test
    @DisplayName("Duplicate binding names get their position appended")
    void testDuplicateBindings() {
        Query query = Query.from("Post").join(TableSource.entity("Post"), "p", null);

        assertThat(QueryRenderer.render(query)).isEqualTo("from p in Post, join: p1 in Post");
    }

    @Test
    @DisplayName("Update operations are grouped by kind")
    void testUpdates() {
        Query query = Query.from("Post").update(
            List.of(UpdateOp.set("title", literal(null)), UpdateOp.inc("views", param(0)),
                UpdateOp.set("text", param(1))),
            List.of(1, "x"));

        assertThat(QueryRenderer.render(query))
            .isEqualTo("from p in Post, update: [set: [title: nil, text: ^\"x\"], inc: [views: ^1]]");
    }

    @Test
    @DisplayName("Subqueries render inline")
    void testSubquery() {
        Query inner = Query.from("Post").where(eq(field(0, "title"), param(0)), "a");

        assertThat(QueryRenderer.render(Query.from(Subquery.of(inner))))
            .isEqualTo("from p in subquery(from p in Post, where: p.title == ^\"a\")");
    }

    @Test
    @DisplayName("Normalized queries render positional placeholders")
    void testNormalized() {
        Query query = normalize(Query.from("Post").where(eq(field(0, "title"), param(0)), "a")).query();

        assertThat(QueryRenderer.render(query)).isEqualTo("from p in Post, where: p.title == ^0, select: p");
    }

    @Test
    @DisplayName("Single expressions resolve the query's bindings")
    void testRenderExpression() {
        Query query = Query.from("Post").as("post");

        assertThat(QueryRenderer.renderExpression(query, eq(field(0, "id"), param(0)), List.of("1-a")))
            .isEqualTo("post.id == ^\"1-a\"");
    }
}
