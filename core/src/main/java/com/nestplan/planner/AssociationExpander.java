package com.nestplan.planner;

import static com.nestplan.expression.Expressions.and;
import static com.nestplan.expression.Expressions.eq;
import static com.nestplan.expression.Expressions.field;

import com.nestplan.exception.ErrorKind;
import com.nestplan.exception.QueryCompilationException;
import com.nestplan.expression.Expression;
import com.nestplan.query.AssocRef;
import com.nestplan.query.Clause;
import com.nestplan.query.JoinExpr;
import com.nestplan.query.Query;
import com.nestplan.query.QueryExpr;
import com.nestplan.query.Source;
import com.nestplan.query.Subquery;
import com.nestplan.query.TableSource;
import com.nestplan.schema.Association;
import com.nestplan.schema.EntitySchema;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites {@code join c in assoc(p, :comments)} into a plain join on the related table:
 * <pre>
 *   join c in Comment, on: c.post_id == p.id
 * </pre>
 * An explicit {@code on} given with the association join is AND-ed to the key condition.
 */
final class AssociationExpander {

    private final FieldResolver fields;

    AssociationExpander(FieldResolver fields) {
        this.fields = Objects.requireNonNull(fields, "fields must not be null");
    }

    /**
     * Expands an association join.
     *
     * @param query the query whose earlier joins are already expanded
     * @param join the association join
     * @param context the query reported on failure
     * @return the plain join, association reference cleared
     */
    JoinExpr expand(Query query, JoinExpr join, Query context) {
        AssocRef ref = join.assoc();
        if (ref.parentIndex() >= join.index()) {
            throw new QueryCompilationException(ErrorKind.UNKNOWN_ASSOCIATION,
                "association join `" + ref.name() + "` refers to binding `&" + ref.parentIndex()
                    + "` which is not bound before it", context, Clause.JOIN);
        }

        EntitySchema owner = ownerSchema(query.sourceAt(ref.parentIndex()), context);
        Association assoc = owner.association(ref.name()).orElseThrow(() -> new QueryCompilationException(
            ErrorKind.UNKNOWN_ASSOCIATION,
            "could not find association `" + ref.name() + "` on schema " + owner.name(), context, Clause.JOIN));
        EntitySchema related = fields.requireSchema(assoc.related(), context);

        Expression on = eq(field(join.index(), assoc.relatedKey()), field(ref.parentIndex(), assoc.ownerKey()));
        List<Object> params = List.of();
        if (join.on() != null) {
            on = and(on, join.on().expr());
            params = join.on().params();
        }
        return join.expanded(new TableSource(related.table(), related.name()), new QueryExpr(on, params));
    }

    private EntitySchema ownerSchema(Source parent, Query context) {
        if (parent instanceof Subquery sub) {
            return sub.shape().schema().orElseThrow(() -> new QueryCompilationException(
                ErrorKind.ASSOCIATION_REQUIRES_SOURCE_SCHEMA,
                "can only perform association joins on subqueries that return a source with schema in select",
                context, Clause.JOIN));
        }
        TableSource table = (TableSource) parent;
        if (!table.hasSchema()) {
            throw new QueryCompilationException(ErrorKind.ASSOCIATION_REQUIRES_SOURCE_SCHEMA,
                "cannot perform association join on " + table + " because it does not have a schema",
                context, Clause.JOIN);
        }
        return fields.requireSchema(table.entity(), context);
    }
}
