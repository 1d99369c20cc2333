package com.nestplan.planner;

import com.nestplan.exception.CastException;
import com.nestplan.expression.BinaryExpression;
import com.nestplan.expression.Expression;
import com.nestplan.expression.ExpressionUtils;
import com.nestplan.expression.FieldAccess;
import com.nestplan.expression.ListExpression;
import com.nestplan.expression.Literal;
import com.nestplan.expression.Parameter;
import com.nestplan.query.Clause;
import com.nestplan.query.Query;
import com.nestplan.types.AnyType;
import com.nestplan.types.ArrayType;
import com.nestplan.types.CastResult;
import com.nestplan.types.DataType;
import com.nestplan.types.TypeCaster;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Casts the values bound by a clause to the types their placeholders are used with.
 *
 * <p>The type of a placeholder is taken from the first context that fixes one:
 * <ul>
 *   <li>{@code field <op> ^i} and {@code ^i <op> field} for comparison operators: the field type</li>
 *   <li>{@code field in ^i}: an array of the field type</li>
 *   <li>{@code field in [^i, ...]}: the field type for every element</li>
 *   <li>an explicit type supplied by the caller (update values, limit, offset)</li>
 * </ul>
 * Every other placeholder is cast as {@code any}. Literals compared with a typed
 * field are checked the same way, without being rewritten.
 *
 * <p>Cast values are then dumped through the adapter.
 */
final class ParameterCaster {

    private final FieldResolver fields;
    private final AdapterContext adapter;
    private final PlannerConfig config;

    ParameterCaster(FieldResolver fields, AdapterContext adapter, PlannerConfig config) {
        this.fields = Objects.requireNonNull(fields, "fields must not be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * The values of one clause, cast and dumped.
     *
     * @param cast the cast values, kept on the clause
     * @param dumped the dumped values, appended to the flat parameter list
     */
    record CastValues(List<Object> cast, List<Object> dumped) {
    }

    /**
     * Validates the field references of a clause expression and casts its values.
     *
     * @param query the prepared query the clause belongs to
     * @param expr the clause expression
     * @param params the clause values
     * @param clause the clause kind
     * @param context the query reported on failure
     * @return the cast values
     */
    CastValues cast(Query query, Expression expr, List<Object> params, Clause clause, Query context) {
        DataType[] types = new DataType[params.size()];
        inferTypes(query, expr, clause, context, types);
        return castAll(params, types, clause, context);
    }

    /**
     * Casts clause values with types fixed up front, falling back to the inferred ones.
     *
     * @param query the prepared query the clause belongs to
     * @param exprs the clause expressions, each paired with the type its root placeholder takes
     * @param rootTypes the type for a placeholder standing alone as the expression (may contain nulls)
     * @param params the clause values
     * @param clause the clause kind
     * @param context the query reported on failure
     * @return the cast values
     */
    CastValues cast(Query query, List<Expression> exprs, List<DataType> rootTypes, List<Object> params,
                    Clause clause, Query context) {
        DataType[] types = new DataType[params.size()];
        for (int i = 0; i < exprs.size(); i++) {
            Expression expr = exprs.get(i);
            DataType rootType = rootTypes.get(i);
            if (expr instanceof Parameter p && rootType != null) {
                assign(types, p.index(), rootType);
            } else if (expr instanceof Literal literal && rootType != null) {
                checkLiteral(literal, rootType, clause, context);
            }
            inferTypes(query, expr, clause, context, types);
        }
        return castAll(params, types, clause, context);
    }

    private CastValues castAll(List<Object> params, DataType[] types, Clause clause, Query context) {
        List<Object> cast = new ArrayList<>(params.size());
        List<Object> dumped = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            DataType type = types[i] != null ? types[i] : AnyType.get();
            Object value = params.get(i);
            CastResult result = TypeCaster.cast(type, value);
            if (result.isError()) {
                throw new CastException(value, type, clause, context);
            }
            CastResult dump = adapter.dump(type, result.value());
            if (dump.isError()) {
                throw new CastException(value, type, clause, context);
            }
            cast.add(result.value());
            dumped.add(dump.value());
        }
        return new CastValues(cast, dumped);
    }

    private void inferTypes(Query query, Expression expr, Clause clause, Query context, DataType[] types) {
        ExpressionUtils.walk(expr, node -> {
            if (node instanceof FieldAccess f) {
                fields.fieldType(query, f.sourceIndex(), f.field(), clause, context);
            } else if (node instanceof BinaryExpression b) {
                if (b.operator().isComparison()) {
                    bindComparison(query, b.left(), b.right(), clause, context, types);
                    bindComparison(query, b.right(), b.left(), clause, context, types);
                } else if (b.operator() == BinaryExpression.Operator.IN && b.left() instanceof FieldAccess member) {
                    DataType type = fields.fieldType(query, member.sourceIndex(), member.field(), clause, context);
                    bindMembership(b.right(), type, clause, context, types);
                }
            }
        });
    }

    private void bindComparison(Query query, Expression fieldSide, Expression valueSide, Clause clause,
                                Query context, DataType[] types) {
        if (!(fieldSide instanceof FieldAccess f)) {
            return;
        }
        DataType type = fields.fieldType(query, f.sourceIndex(), f.field(), clause, context);
        if (valueSide instanceof Parameter p) {
            assign(types, p.index(), type);
        } else if (valueSide instanceof Literal literal) {
            checkLiteral(literal, type, clause, context);
        }
    }

    private void bindMembership(Expression values, DataType elementType, Clause clause, Query context,
                                DataType[] types) {
        if (values instanceof Parameter p) {
            assign(types, p.index(), new ArrayType(elementType));
        } else if (values instanceof ListExpression list) {
            for (Expression element : list.elements()) {
                if (element instanceof Parameter p) {
                    assign(types, p.index(), elementType);
                } else if (element instanceof Literal literal) {
                    checkLiteral(literal, elementType, clause, context);
                }
            }
        }
    }

    private static void assign(DataType[] types, int index, DataType type) {
        if (index >= 0 && index < types.length && types[index] == null) {
            types[index] = type;
        }
    }

    private void checkLiteral(Literal literal, DataType type, Clause clause, Query context) {
        if (!config.checkLiteralCasts()) {
            return;
        }
        if (TypeCaster.cast(type, literal.value()).isError()) {
            throw new CastException(literal.value(), type, clause, context);
        }
    }
}
