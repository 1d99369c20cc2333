package com.nestplan.planner;

import com.nestplan.exception.ErrorKind;
import com.nestplan.exception.QueryCompilationException;
import com.nestplan.expression.Atom;
import com.nestplan.expression.Expression;
import com.nestplan.expression.FieldAccess;
import com.nestplan.expression.FieldSubset;
import com.nestplan.expression.ListExpression;
import com.nestplan.expression.Literal;
import com.nestplan.expression.MapEntry;
import com.nestplan.expression.MapLiteral;
import com.nestplan.expression.MapUpdate;
import com.nestplan.expression.Merge;
import com.nestplan.expression.SortOrder;
import com.nestplan.expression.SourceRef;
import com.nestplan.expression.StructLiteral;
import com.nestplan.query.Clause;
import com.nestplan.query.MapShape;
import com.nestplan.query.MergeShape;
import com.nestplan.query.Query;
import com.nestplan.query.QueryRenderer;
import com.nestplan.query.RowShape;
import com.nestplan.query.SelectShape;
import com.nestplan.query.ShapeField;
import com.nestplan.query.Source;
import com.nestplan.query.StructShape;
import com.nestplan.query.Subquery;
import com.nestplan.query.TableSource;
import com.nestplan.schema.EntitySchema;
import com.nestplan.schema.SchemaField;
import com.nestplan.types.AnyType;
import com.nestplan.types.DataType;
import com.nestplan.types.TypeCaster;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles the select expression of a subquery into the {@link SelectShape} the outer
 * query sees.
 *
 * <p>Accepted selects:
 * <ul>
 *   <li>a source {@code p}: every field of its schema, or of the subquery it reads from</li>
 *   <li>a field {@code p.text}: a one-field map keyed by the field name</li>
 *   <li>a map {@code %{text: p.text}} with atom keys</li>
 *   <li>a struct {@code %Post{text: p.text}}: every field of the schema</li>
 *   <li>a map update {@code %{p | text: p.title}} on a source with schema</li>
 *   <li>{@code merge(left, right)} of any of the above, right side winning per key</li>
 * </ul>
 * Anything else fails with {@link ErrorKind#UNSUPPORTED_SUBQUERY_SELECT}.
 */
final class SelectCompiler {

    private final FieldResolver fields;

    SelectCompiler(FieldResolver fields) {
        this.fields = Objects.requireNonNull(fields, "fields must not be null");
    }

    /**
     * Compiles the select of a prepared inner query; a missing select selects the first source.
     *
     * @param query the prepared inner query
     * @param context the inner query as written, reported on failure
     * @return the shape
     */
    SelectShape compile(Query query, Query context) {
        Expression expr = query.select() != null ? query.select().expr() : new SourceRef(0);
        List<Object> params = query.select() != null ? query.select().params() : List.of();
        return new Compilation(query, params, context).shape(expr);
    }

    /**
     * State of one select compilation.
     */
    private final class Compilation {

        private final Query query;
        private final List<Object> params;
        private final Query context;

        Compilation(Query query, List<Object> params, Query context) {
            this.query = query;
            this.params = params;
            this.context = context;
        }

        SelectShape shape(Expression expr) {
            if (expr instanceof SourceRef ref) {
                return sourceShape(ref);
            }
            if (expr instanceof FieldAccess field) {
                return new MapShape(List.of(new ShapeField(field.field(), field, typeOf(field))));
            }
            if (expr instanceof MapLiteral map) {
                return mapShape(map);
            }
            if (expr instanceof StructLiteral struct) {
                return structShape(struct);
            }
            if (expr instanceof MapUpdate update) {
                return updateShape(update);
            }
            if (expr instanceof Merge merge) {
                return mergeShape(merge);
            }
            throw error(ErrorKind.UNSUPPORTED_SUBQUERY_SELECT,
                "subquery must select a source (t), a field (t.field) or a map, got: `" + render(expr) + "`");
        }

        private SelectShape sourceShape(SourceRef ref) {
            Source source = fields.requireSource(query, ref.index(), Clause.SELECT, context);
            if (source instanceof Subquery sub) {
                List<ShapeField> exposed = new ArrayList<>();
                for (ShapeField inner : sub.shape().fields()) {
                    exposed.add(new ShapeField(inner.name(), new FieldAccess(ref.index(), inner.name()), inner.type()));
                }
                Optional<EntitySchema> schema = sub.shape().schema();
                if (schema.isPresent()) {
                    return new StructShape(schema.get(), exposed, Set.of());
                }
                return new MapShape(exposed);
            }
            TableSource table = (TableSource) source;
            if (!table.hasSchema()) {
                throw error(ErrorKind.UNSUPPORTED_SUBQUERY_SELECT,
                    "subquery must select a source (t), a field (t.field) or a map, got: `" + render(ref)
                        + "` which is the schemaless source " + table);
            }
            EntitySchema schema = fields.requireSchema(table.entity(), context);
            List<ShapeField> exposed = new ArrayList<>();
            for (SchemaField field : schema.fields()) {
                exposed.add(new ShapeField(field.name(), new FieldAccess(ref.index(), field.name()), field.dataType()));
            }
            return new RowShape(schema, exposed);
        }

        private SelectShape mapShape(MapLiteral map) {
            List<ShapeField> exposed = new ArrayList<>();
            for (MapEntry entry : map.entries()) {
                String key = atomKey(entry, "only atom keys are allowed when selecting a map in subquery, got: `"
                    + render(entry.key()) + "`");
                exposed.add(valueField(key, entry.value()));
            }
            return new MapShape(exposed);
        }

        private SelectShape structShape(StructLiteral struct) {
            EntitySchema schema = fields.requireSchema(struct.entity(), context);
            Map<String, Expression> explicit = new LinkedHashMap<>();
            for (MapEntry entry : struct.entries()) {
                String key = atomKey(entry, "only atom keys are allowed when selecting a struct in subquery, got: `"
                    + render(entry.key()) + "`");
                if (schema.field(key).filter(f -> !f.virtual()).isEmpty()) {
                    throw error(ErrorKind.INVALID_MAP_KEY,
                        "invalid key `:" + key + "` for struct " + schema.name() + " in subquery");
                }
                explicit.put(key, entry.value());
            }

            int readThrough = bindingWithSchema(schema);
            List<ShapeField> exposed = new ArrayList<>();
            for (SchemaField field : schema.fields()) {
                Expression value = explicit.get(field.name());
                if (value != null) {
                    exposed.add(valueField(field.name(), value));
                } else if (readThrough >= 0 && exposes(readThrough, field.name())) {
                    FieldAccess access = new FieldAccess(readThrough, field.name());
                    exposed.add(new ShapeField(field.name(), access, typeOf(access)));
                } else {
                    exposed.add(new ShapeField(field.name(), Literal.nil(), field.dataType()));
                }
            }
            return new StructShape(schema, exposed, explicit.keySet());
        }

        private SelectShape updateShape(MapUpdate update) {
            if (!(update.base() instanceof SourceRef)) {
                throw error(ErrorKind.UNSUPPORTED_SUBQUERY_SELECT,
                    "map update in subquery requires a source as base, got: `" + render(update.base()) + "`");
            }
            SelectShape base = shape(update.base());
            EntitySchema schema = base.schema().orElseThrow(() -> error(ErrorKind.UNSUPPORTED_SUBQUERY_SELECT,
                "map update in subquery requires a source with schema, got: `" + render(update.base()) + "`"));

            Map<String, ShapeField> merged = new LinkedHashMap<>();
            for (ShapeField field : base.fields()) {
                merged.put(field.name(), field);
            }
            Set<String> overridden = new LinkedHashSet<>(overriddenKeys(base));
            for (MapEntry entry : update.updates()) {
                String key = atomKey(entry, "only atom keys are allowed on map update in subquery, got: `"
                    + render(entry.key()) + "`");
                if (!merged.containsKey(key)) {
                    throw error(ErrorKind.INVALID_MAP_KEY, "invalid key `:" + key + "` on map update in subquery");
                }
                merged.put(key, valueField(key, entry.value()));
                overridden.add(key);
            }
            return new StructShape(schema, new ArrayList<>(merged.values()), overridden);
        }

        private SelectShape mergeShape(Merge merge) {
            SelectShape left = shape(merge.left());
            SelectShape right = shape(merge.right());
            Optional<EntitySchema> leftSchema = left.schema();
            Optional<EntitySchema> rightSchema = right.schema();

            if (leftSchema.isEmpty() && rightSchema.isPresent()) {
                throw error(ErrorKind.ILLEGAL_MERGE_TARGET, "cannot merge because the left side is a map and the "
                    + "right side is a " + rightSchema.get().name() + " struct");
            }
            if (leftSchema.isPresent() && rightSchema.isPresent()
                    && !leftSchema.get().name().equals(rightSchema.get().name())) {
                throw error(ErrorKind.ILLEGAL_MERGE_TARGET, "cannot merge because the left side is a "
                    + leftSchema.get().name() + " and the right side is a " + rightSchema.get().name());
            }
            return new MergeShape(left, right);
        }

        private Set<String> overriddenKeys(SelectShape shape) {
            if (shape instanceof StructShape struct) {
                return struct.overridden();
            }
            return shape instanceof MergeShape merge ? merge.overridden() : Set.of();
        }

        private ShapeField valueField(String key, Expression value) {
            if ((value instanceof Atom atom && !atom.isBoolean())
                    || value instanceof MapLiteral || value instanceof StructLiteral
                    || value instanceof MapUpdate || value instanceof Merge
                    || value instanceof ListExpression || value instanceof SourceRef
                    || value instanceof FieldSubset || value instanceof SortOrder) {
                throw error(ErrorKind.UNSUPPORTED_SUBQUERY_SELECT,
                    "atoms, maps, lists and sources are not allowed as map values in subquery, got: `"
                        + render(value) + "`");
            }
            return new ShapeField(key, value, typeOf(value));
        }

        private String atomKey(MapEntry entry, String message) {
            if (!entry.hasAtomKey()) {
                throw error(ErrorKind.INVALID_MAP_KEY, message);
            }
            return entry.keyName();
        }

        private int bindingWithSchema(EntitySchema schema) {
            for (int i = 0; i < query.sourceCount(); i++) {
                Optional<EntitySchema> bound = fields.schemaOf(query.sourceAt(i));
                if (bound.isPresent() && bound.get().name().equals(schema.name())) {
                    return i;
                }
            }
            return -1;
        }

        private boolean exposes(int index, String field) {
            Source source = query.sourceAt(index);
            return !(source instanceof Subquery sub) || sub.fieldType(field).isPresent();
        }

        private DataType typeOf(Expression expr) {
            if (expr instanceof FieldAccess field) {
                return fields.fieldType(query, field.sourceIndex(), field.field(), Clause.SELECT, context);
            }
            if (expr instanceof Literal literal) {
                return TypeCaster.inferType(literal.value());
            }
            return AnyType.get();
        }

        private String render(Expression expr) {
            return QueryRenderer.renderExpression(query, expr, params);
        }

        private QueryCompilationException error(ErrorKind kind, String message) {
            return new QueryCompilationException(kind, message, context, Clause.SELECT);
        }
    }
}
