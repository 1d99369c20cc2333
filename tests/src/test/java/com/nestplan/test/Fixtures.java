package com.nestplan.test;

import com.nestplan.planner.AdapterContext;
import com.nestplan.planner.NormalizedQuery;
import com.nestplan.planner.Planner;
import com.nestplan.planner.PreparedQuery;
import com.nestplan.query.Operation;
import com.nestplan.query.Query;
import com.nestplan.schema.EntitySchema;
import com.nestplan.schema.SchemaRegistry;
import com.nestplan.types.CastResult;
import com.nestplan.types.CustomType;
import com.nestplan.types.IntegerType;
import com.nestplan.types.StringType;

/**
 * Shared schemas, types and planner helpers.
 *
 * <pre>
 *   Post    (posts):    id permalink, title string (column post_title), text string
 *                       has_many comments
 *   Comment (comments): id integer, text string, temp string (virtual), post_id integer
 *                       belongs_to post
 * </pre>
 */
public final class Fixtures {

    private Fixtures() {}

    public static final Permalink PERMALINK = new Permalink();

    public static final EntitySchema POST = EntitySchema.builder("Post", "posts")
        .primaryKey("id", PERMALINK)
        .field("title", StringType.get(), "post_title")
        .field("text", StringType.get())
        .hasMany("comments", "Comment", "post_id")
        .build();

    public static final EntitySchema COMMENT = EntitySchema.builder("Comment", "comments")
        .primaryKey("id", IntegerType.get())
        .field("text", StringType.get())
        .virtualField("temp", StringType.get())
        .belongsTo("post", "Post")
        .build();

    public static final SchemaRegistry REGISTRY = SchemaRegistry.of(POST, COMMENT);

    public static final AdapterContext ADAPTER = () -> "test";

    public static Planner planner() {
        return new Planner(REGISTRY);
    }

    public static PreparedQuery prepare(Query query) {
        return prepare(query, Operation.ALL);
    }

    public static PreparedQuery prepare(Query query, Operation operation) {
        return planner().prepare(query, operation, ADAPTER, 0);
    }

    /**
     * Runs prepare, ensureSelect and normalize at base 0.
     */
    public static Normalized normalize(Query query, Operation operation) {
        Planner planner = planner();
        PreparedQuery prepared = planner.prepare(query, operation, ADAPTER, 0);
        Query selected = planner.ensureSelect(prepared.query(), operation == Operation.ALL);
        NormalizedQuery normalized = planner.normalize(prepared.withQuery(selected), operation, ADAPTER, 0);
        return new Normalized(normalized.query(), prepared);
    }

    public static Normalized normalize(Query query) {
        return normalize(query, Operation.ALL);
    }

    /**
     * A normalized query with the prepare result it came from.
     */
    public record Normalized(Query query, PreparedQuery prepared) {
    }

    /**
     * Ids written as {@code "<id>-<slug>"}; the slug is dropped on cast.
     */
    public static final class Permalink extends CustomType {

        Permalink() {
            super("permalink");
        }

        @Override
        public CastResult cast(Object value) {
            if (value instanceof Long || value instanceof Integer) {
                return CastResult.ok(((Number) value).longValue());
            }
            if (value instanceof String str) {
                int dash = str.indexOf('-');
                String digits = dash < 0 ? str : str.substring(0, dash);
                try {
                    return CastResult.ok(Long.parseLong(digits));
                } catch (NumberFormatException e) {
                    return CastResult.error();
                }
            }
            return CastResult.error();
        }
    }
}
