package com.nestplan.planner;

import com.nestplan.exception.CastException;
import com.nestplan.exception.ErrorKind;
import com.nestplan.exception.QueryCompilationException;
import com.nestplan.exception.SubqueryException;
import com.nestplan.expression.SourceRef;
import com.nestplan.query.JoinExpr;
import com.nestplan.query.JoinQualifier;
import com.nestplan.query.Operation;
import com.nestplan.query.Query;
import com.nestplan.query.QueryExpr;
import com.nestplan.query.Subquery;
import com.nestplan.query.TableSource;
import com.nestplan.query.UpdateOp;
import com.nestplan.schema.EntitySchema;
import com.nestplan.schema.SchemaRegistry;
import com.nestplan.types.ArrayType;
import com.nestplan.types.StringType;
import com.nestplan.test.TestBase;
import com.nestplan.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.nestplan.expression.Expressions.*;
import static com.nestplan.test.Fixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Planner} on queries over tables.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Planner Tests")
public class PlannerTest extends TestBase {

    // ==================== Parameter Order ====================

    @Nested
    @DisplayName("Parameter Order")
    class ParameterOrder {

        @Test
        @DisplayName("all: values follow select, join, where, having and limit")
        void testAllOrder() {
            // Given
            Query query = Query.from("Post")
                .join(TableSource.entity("Comment"), "c", QueryExpr.of(eq(field(1, "text"), param(0)), "j"))
                .where(eq(field(0, "title"), param(0)), "w")
                .groupBy(field(0, "text"))
                .having(eq(field(0, "text"), param(0)), "h")
                .orderBy(field(0, "title"))
                .limitParam("10")
                .select(list(field(0, "title"), param(0)), "s");

            // When
            Normalized result = normalize(query);

            // Then
            assertThat(result.prepared().params()).containsExactly("s", "j", "w", "h", 10L);
            Query normalized = result.query();
            assertThat(normalized.select().expr()).isEqualTo(list(field(0, "title"), param(0)));
            assertThat(normalized.joins().get(0).on().expr()).isEqualTo(eq(field(1, "text"), param(1)));
            assertThat(normalized.wheres().get(0).expr()).isEqualTo(eq(field(0, "title"), param(2)));
            assertThat(normalized.havings().get(0).expr()).isEqualTo(eq(field(0, "text"), param(3)));
            assertThat(normalized.limit().expr()).isEqualTo(param(4));
        }

        @Test
        @DisplayName("update_all: update values come first")
        void testUpdateAllOrder() {
            // Given
            Query query = Query.from("Post")
                .where(eq(field(0, "title"), param(0)), "w")
                .update(List.of(UpdateOp.set("text", param(0))), List.of("u"));

            // When
            Normalized result = normalize(query, Operation.UPDATE_ALL);

            // Then
            assertThat(result.prepared().params()).containsExactly("u", "w");
            assertThat(result.query().updates().get(0).ops().get(0).value()).isEqualTo(param(0));
            assertThat(result.query().wheres().get(0).expr()).isEqualTo(eq(field(0, "title"), param(1)));
            assertThat(result.query().select()).isNull();
        }

        @Test
        @DisplayName("delete_all: where values in order")
        void testDeleteAllOrder() {
            Query query = Query.from("Post")
                .where(eq(field(0, "title"), param(0)), "a")
                .orWhere(eq(field(0, "text"), param(0)), "b");

            Normalized result = normalize(query, Operation.DELETE_ALL);

            assertThat(result.prepared().params()).containsExactly("a", "b");
            assertThat(result.query().wheres().get(1).expr()).isEqualTo(eq(field(0, "text"), param(1)));
        }
    }

    // ==================== Casting ====================

    @Nested
    @DisplayName("Casting")
    class Casting {

        @Test
        @DisplayName("Compared values take the field type")
        void testComparisonCast() {
            PreparedQuery prepared = prepare(Query.from("Post").where(eq(field(0, "id"), param(0)), "5-slug"));

            assertThat(prepared.params()).containsExactly(5L);
            assertThat(prepared.query().wheres().get(0).params()).containsExactly(5L);
        }

        @Test
        @DisplayName("A value on the left side of a comparison is cast too")
        void testReversedComparison() {
            PreparedQuery prepared = prepare(Query.from("Comment").where(lt(param(0), field(0, "id")), "7"));

            assertThat(prepared.params()).containsExactly(7L);
        }

        @Test
        @DisplayName("in with a bound list casts every element")
        void testInParameter() {
            PreparedQuery prepared = prepare(Query.from("Post")
                .where(in(field(0, "id"), param(0)), List.of("1-a", "2-b")));

            assertThat(prepared.params()).containsExactly(List.of(1L, 2L));
        }

        @Test
        @DisplayName("in with a literal list casts each bound element")
        void testInList() {
            PreparedQuery prepared = prepare(Query.from("Comment")
                .where(in(field(0, "id"), list(param(0), param(1))), "1", "2"));

            assertThat(prepared.params()).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("Values in other positions are kept as given")
        void testUntypedValue() {
            PreparedQuery prepared = prepare(Query.from("Post")
                .select(fragment("coalesce(?, ?)", field(0, "title"), param(0)), 42));

            assertThat(prepared.params()).containsExactly(42);
        }

        @Test
        @DisplayName("Limit values are cast to integer")
        void testLimitCast() {
            assertThatThrownBy(() -> prepare(Query.from("Post").limitParam("ten")))
                .isExactlyInstanceOf(CastException.class)
                .hasMessageContaining("value `\"ten\"` in `limit` cannot be cast to type integer");
        }

        @Test
        @DisplayName("Literals compared with a field are checked")
        void testLiteralCheck() {
            Query query = Query.from("Post").where(eq(field(0, "title"), literal(1)));

            assertThatThrownBy(() -> prepare(query))
                .isExactlyInstanceOf(CastException.class)
                .hasMessageContaining("value `1` in `where` cannot be cast to type string");

            Planner lenient = new Planner(REGISTRY, PlannerConfig.defaults().withCheckLiteralCasts(false));
            PreparedQuery prepared = lenient.prepare(query, Operation.ALL, ADAPTER, 0);
            assertThat(prepared.query().wheres().get(0).expr()).isEqualTo(eq(field(0, "title"), literal(1)));
        }

        @Test
        @DisplayName("Update values take the field type, push takes the element type")
        void testUpdateCast() {
            // Given
            EntitySchema tagged = EntitySchema.builder("Tagged", "tagged")
                .primaryKey("id", PERMALINK)
                .field("tags", new ArrayType(StringType.get()))
                .build();
            Planner planner = new Planner(SchemaRegistry.of(tagged));
            Query setId = Query.from("Tagged").update(List.of(UpdateOp.set("id", param(0))), List.of("3-x"));
            Query push = Query.from("Tagged")
                .update(List.of(new UpdateOp(UpdateOp.Kind.PUSH, "tags", param(0))), List.of(1));

            // When/Then
            assertThat(planner.prepare(setId, Operation.UPDATE_ALL, ADAPTER, 0).params()).containsExactly(3L);
            assertThatThrownBy(() -> planner.prepare(push, Operation.UPDATE_ALL, ADAPTER, 0))
                .isExactlyInstanceOf(CastException.class)
                .hasMessageContaining("value `1` in `update` cannot be cast to type string");
        }
    }

    // ==================== Association Joins ====================

    @Nested
    @DisplayName("Association Joins")
    class AssociationJoins {

        @Test
        @DisplayName("has_many joins on the foreign key of the related table")
        void testHasMany() {
            // Given
            Query query = Query.from("Post")
                .joinAssoc(JoinQualifier.INNER, 0, "comments", "c", QueryExpr.of(eq(field(1, "text"), param(0)), "x"));

            // When
            PreparedQuery prepared = prepare(query);

            // Then
            JoinExpr join = prepared.query().joins().get(0);
            assertThat(join.isAssociationJoin()).isFalse();
            assertThat(join.source()).isEqualTo(new TableSource("comments", "Comment"));
            assertThat(join.on().expr())
                .isEqualTo(and(eq(field(1, "post_id"), field(0, "id")), eq(field(1, "text"), param(0))));
            assertThat(prepared.params()).containsExactly("x");
        }

        @Test
        @DisplayName("belongs_to joins on the primary key of the related table")
        void testBelongsTo() {
            JoinExpr join = prepare(Query.from("Comment").joinAssoc(JoinQualifier.LEFT, 0, "post", "p"))
                .query().joins().get(0);

            assertThat(join.qualifier()).isEqualTo(JoinQualifier.LEFT);
            assertThat(join.source()).isEqualTo(new TableSource("posts", "Post"));
            assertThat(join.on().expr()).isEqualTo(eq(field(1, "id"), field(0, "post_id")));
        }

        @Test
        @DisplayName("Chained association joins expand in order")
        void testChained() {
            Query query = Query.from("Comment")
                .joinAssoc(JoinQualifier.INNER, 0, "post", "p")
                .joinAssoc(JoinQualifier.INNER, 1, "comments", "pc");

            JoinExpr second = prepare(query).query().joins().get(1);

            assertThat(second.source()).isEqualTo(new TableSource("comments", "Comment"));
            assertThat(second.on().expr()).isEqualTo(eq(field(2, "post_id"), field(1, "id")));
        }

        @Test
        @DisplayName("Unknown associations are reported with the schema name")
        void testUnknownAssociation() {
            assertThatThrownBy(() -> prepare(Query.from("Post").joinAssoc(JoinQualifier.INNER, 0, "authors", "a")))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("could not find association `authors` on schema Post")
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.UNKNOWN_ASSOCIATION);
        }

        @Test
        @DisplayName("Schemaless tables have no associations")
        void testSchemalessParent() {
            Query query = Query.from(TableSource.schemaless("posts")).joinAssoc(JoinQualifier.INNER, 0, "comments", "c");

            assertThatThrownBy(() -> prepare(query))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("cannot perform association join on \"posts\" because it does not have a schema");
        }
    }

    // ==================== Field Validation ====================

    @Nested
    @DisplayName("Field Validation")
    class FieldValidation {

        @Test
        @DisplayName("Unknown fields are reported with the clause")
        void testUnknownField() {
            assertThatThrownBy(() -> prepare(Query.from("Post").where(eq(field(0, "unknown"), param(0)), 1)))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("field `unknown` in `where` does not exist in schema Post")
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.UNKNOWN_FIELD);
        }

        @Test
        @DisplayName("Virtual fields cannot be queried")
        void testVirtualField() {
            assertThatThrownBy(() -> prepare(Query.from("Comment").where(eq(field(0, "temp"), param(0)), "x")))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.VIRTUAL_FIELD);
        }

        @Test
        @DisplayName("Unknown entities fail")
        void testUnknownSchema() {
            assertThatThrownBy(() -> prepare(Query.from("Nope")))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("schema `Nope` is not known")
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.UNKNOWN_SCHEMA);
        }

        @Test
        @DisplayName("Schemaless tables accept any field")
        void testSchemaless() {
            PreparedQuery prepared = prepare(Query.from(TableSource.schemaless("posts"))
                .where(eq(field(0, "anything"), param(0)), "x"));

            assertThat(prepared.params()).containsExactly("x");
        }

        @Test
        @DisplayName("Selecting a schemaless source fails on normalize")
        void testSchemalessSelect() {
            assertThatThrownBy(() -> normalize(Query.from(TableSource.schemaless("posts"))))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.SCHEMALESS_SOURCE_SELECT);
        }
    }

    // ==================== Operations ====================

    @Nested
    @DisplayName("Operation Checks")
    class OperationChecks {

        @Test
        @DisplayName("all rejects update expressions")
        void testAllWithUpdate() {
            Query query = Query.from("Post").update(UpdateOp.set("title", literal("x")));

            assertThatThrownBy(() -> normalize(query))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("`all` does not allow `update` expressions in query")
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.ILLEGAL_UPDATE);
        }

        @Test
        @DisplayName("update_all needs at least one update")
        void testUpdateAllWithoutUpdate() {
            assertThatThrownBy(() -> normalize(Query.from("Post"), Operation.UPDATE_ALL))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("`update_all` requires at least one field to be updated")
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.MISSING_UPDATE);
        }

        @Test
        @DisplayName("Bulk operations reject order_by, limit and preload")
        void testBulkClauses() {
            assertThatThrownBy(() -> prepare(Query.from("Post").orderBy(field(0, "title")), Operation.DELETE_ALL))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("`delete_all` allows only `join`, `where` and `select` expressions")
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.ILLEGAL_BULK_CLAUSE);

            assertThatThrownBy(() -> prepare(Query.from("Post").limit(1), Operation.DELETE_ALL))
                .isExactlyInstanceOf(QueryCompilationException.class);

            Query preload = Query.from("Post").preload("comments").update(UpdateOp.set("title", literal("x")));
            assertThatThrownBy(() -> prepare(preload, Operation.UPDATE_ALL))
                .isExactlyInstanceOf(QueryCompilationException.class);
        }

        @Test
        @DisplayName("delete_all rejects subqueries in from")
        void testDeleteAllFromSubquery() {
            assertThatThrownBy(() -> prepare(Query.from(Subquery.of(Query.from("Post"))), Operation.DELETE_ALL))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("`delete_all` does not allow subqueries in `from`")
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.SUBQUERY_NOT_ALLOWED_IN_BULK_FROM);
        }
    }

    // ==================== Select ====================

    @Nested
    @DisplayName("Select")
    class Select {

        @Test
        @DisplayName("ensureSelect selects the first source only when fields are required")
        void testEnsureSelect() {
            Planner planner = planner();
            Query query = Query.from("Post");

            assertThat(planner.ensureSelect(query, false)).isSameAs(query);
            assertThat(planner.ensureSelect(query, true).select().expr()).isEqualTo(new SourceRef(0));
        }

        @Test
        @DisplayName("Selecting a source expands to its persisted fields")
        void testSourceFields() {
            assertThat(normalize(Query.from("Comment")).query().select().fields())
                .containsExactly(field(0, "id"), field(0, "text"), field(0, "post_id"));
        }

        @Test
        @DisplayName("Selecting a subset keeps the requested fields")
        void testSubset() {
            assertThat(normalize(Query.from("Post").select(take(0, "title", "id"))).query().select().fields())
                .containsExactly(field(0, "title"), field(0, "id"));
        }

        @Test
        @DisplayName("Selecting a binding the query does not have fails")
        void testUnboundSource() {
            assertThatThrownBy(() -> normalize(Query.from("Post").select(source(3))))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("binding `&3` referenced in `select` does not exist in query")
                .extracting(e -> ((QueryCompilationException) e).getKind())
                .isEqualTo(ErrorKind.UNKNOWN_FIELD);
            assertThatThrownBy(() -> normalize(Query.from("Post").select(take(2, "id"))))
                .isExactlyInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("binding `&2` referenced in `select` does not exist");
        }
    }

    // ==================== Normalize ====================

    @Nested
    @DisplayName("Normalize")
    class Normalize {

        @Test
        @DisplayName("Normalizing twice at the same base changes nothing")
        void testIdempotent() {
            // Given
            Planner planner = planner();
            Query query = Query.from(Subquery.of(Query.from("Post").where(eq(field(0, "title"), param(0)), "a")))
                .where(eq(field(0, "text"), param(0)), "b");
            PreparedQuery prepared = planner.prepare(query, Operation.ALL, ADAPTER, 0);
            PreparedQuery selected = prepared.withQuery(planner.ensureSelect(prepared.query(), true));

            // When
            NormalizedQuery once = planner.normalize(selected, Operation.ALL, ADAPTER, 0);
            NormalizedQuery twice = planner.normalize(prepared.withQuery(once.query()), Operation.ALL, ADAPTER, 0);

            // Then
            assertThat(twice.query()).isEqualTo(once.query());
            assertThat(twice.nextParamIndex()).isEqualTo(2);
        }

        @Test
        @DisplayName("Normalizing again at another base moves every placeholder")
        void testRebase() {
            // Given
            Planner planner = planner();
            Query query = Query.from(Subquery.of(Query.from("Post").where(eq(field(0, "title"), param(0)), "a")))
                .where(eq(field(0, "text"), param(0)), "b");
            PreparedQuery prepared = planner.prepare(query, Operation.ALL, ADAPTER, 0);
            NormalizedQuery once = planner.normalize(prepared, Operation.ALL, ADAPTER, 0);

            // When
            NormalizedQuery moved = planner.normalize(prepared.withQuery(once.query()), Operation.ALL, ADAPTER, 3);

            // Then
            Subquery sub = (Subquery) moved.query().from().source();
            assertThat(sub.paramOffset()).isEqualTo(3);
            assertThat(sub.query().wheres().get(0).expr()).isEqualTo(eq(field(0, "title"), param(3)));
            assertThat(moved.query().wheres().get(0).expr()).isEqualTo(eq(field(0, "text"), param(4)));
            assertThat(moved.nextParamIndex()).isEqualTo(5);
        }

        @Test
        @DisplayName("prepare rejects normalized queries")
        void testPrepareNormalized() {
            Query normalized = normalize(Query.from("Post")).query();

            assertThatThrownBy(() -> prepare(normalized))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already normalized");
        }
    }

    // ==================== Cache Key ====================

    @Nested
    @DisplayName("Cache Key")
    class CacheKeys {

        @Test
        @DisplayName("Keys ignore the bound values")
        void testValueIndependent() {
            Query first = Query.from("Post").where(eq(field(0, "title"), param(0)), "a");
            Query second = Query.from("Post").where(eq(field(0, "title"), param(0)), "b");

            assertThat(prepare(first).cacheKey()).isEqualTo(prepare(second).cacheKey());
        }

        @Test
        @DisplayName("Keys differ when the query shape differs")
        void testShapeDependent() {
            Query first = Query.from("Post").where(eq(field(0, "title"), param(0)), "a");
            Query second = Query.from("Post").where(eq(field(0, "text"), param(0)), "a");
            Query third = Query.from("Post").orWhere(eq(field(0, "title"), param(0)), "a");

            assertThat(prepare(first).cacheKey())
                .isNotEqualTo(prepare(second).cacheKey())
                .isNotEqualTo(prepare(third).cacheKey());
        }

        @Test
        @DisplayName("Keys differ per operation")
        void testOperationDependent() {
            Query query = Query.from("Post").where(eq(field(0, "title"), param(0)), "a");

            assertThat(prepare(query).cacheKey()).isNotEqualTo(prepare(query, Operation.DELETE_ALL).cacheKey());
        }
    }

    // ==================== Nesting ====================

    @Test
    @DisplayName("Subqueries nested deeper than the configured limit fail")
    void testDepthLimit() {
        // Given
        Planner planner = new Planner(REGISTRY, PlannerConfig.defaults().withMaxSubqueryDepth(1));
        Query nested = Query.from(Subquery.of(Query.from(Subquery.of(Query.from("Post")))));

        // When
        Throwable thrown = catchThrowable(() -> planner.prepare(nested, Operation.ALL, ADAPTER, 0));

        // Then
        assertThat(thrown).isInstanceOf(SubqueryException.class);
        SubqueryException error = (SubqueryException) thrown;
        assertThat(error.getKind()).isEqualTo(ErrorKind.SUBQUERY_TOO_DEEP);
        assertThat(error.wrapped()).isInstanceOf(SubqueryException.class);
        assertThat(error.getMessage()).contains("subqueries are nested 2 levels deep, at most 1 are allowed");

        PreparedQuery shallow = planner.prepare(Query.from(Subquery.of(Query.from("Post"))), Operation.ALL, ADAPTER, 0);
        assertThat(((Subquery) shallow.query().from().source()).isCompiled()).isTrue();
    }
}
