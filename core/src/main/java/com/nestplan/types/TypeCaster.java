package com.nestplan.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Centralized casting, dumping and inference of runtime values.
 *
 * <h2>Cast rules</h2>
 * <ul>
 *   <li>{@code null} casts to {@code null} for every type</li>
 *   <li>integer: integral numbers and integer strings, held as {@code Long}</li>
 *   <li>float: any number or numeric string, held as {@code Double}</li>
 *   <li>decimal: any number or numeric string, held as {@code BigDecimal}</li>
 *   <li>boolean: booleans and the strings "true", "false", "1", "0"</li>
 *   <li>string: character sequences only</li>
 *   <li>date: {@code LocalDate} or ISO-8601 date strings</li>
 *   <li>array: lists whose every element casts to the element type</li>
 *   <li>map: {@code java.util.Map} instances</li>
 *   <li>any: every value, unchanged</li>
 *   <li>custom: delegated to {@link CustomType#cast(Object)}</li>
 * </ul>
 */
public final class TypeCaster {

    private TypeCaster() {
        // Utility class - prevent instantiation
    }

    // ========================================================================
    // Casting
    // ========================================================================

    /**
     * Casts an external value to the given type.
     *
     * @param type the target type
     * @param value the value (may be null)
     * @return the cast result
     */
    public static CastResult cast(DataType type, Object value) {
        Objects.requireNonNull(type, "type must not be null");
        if (value == null || type.isAny()) {
            return CastResult.ok(value);
        }

        if (type instanceof IntegerType) {
            return castInteger(value);
        }
        if (type instanceof FloatType) {
            return castFloat(value);
        }
        if (type instanceof DecimalType) {
            return castDecimal(value);
        }
        if (type instanceof BooleanType) {
            return castBoolean(value);
        }
        if (type instanceof StringType) {
            return value instanceof CharSequence ? CastResult.ok(value.toString()) : CastResult.error();
        }
        if (type instanceof DateType) {
            return castDate(value);
        }
        if (type instanceof ArrayType array) {
            return castArray(array, value);
        }
        if (type instanceof MapType) {
            return value instanceof Map ? CastResult.ok(value) : CastResult.error();
        }
        if (type instanceof CustomType custom) {
            return custom.cast(value);
        }
        return CastResult.error();
    }

    private static CastResult castInteger(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return CastResult.ok(((Number) value).longValue());
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return CastResult.ok(big.longValue());
        }
        if (value instanceof String str) {
            try {
                return CastResult.ok(Long.parseLong(str));
            } catch (NumberFormatException e) {
                return CastResult.error();
            }
        }
        return CastResult.error();
    }

    private static CastResult castFloat(Object value) {
        if (value instanceof Number number) {
            return CastResult.ok(number.doubleValue());
        }
        if (value instanceof String str) {
            try {
                return CastResult.ok(Double.parseDouble(str));
            } catch (NumberFormatException e) {
                return CastResult.error();
            }
        }
        return CastResult.error();
    }

    private static CastResult castDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return CastResult.ok(value);
        }
        if (value instanceof BigInteger big) {
            return CastResult.ok(new BigDecimal(big));
        }
        if (value instanceof Double || value instanceof Float) {
            return CastResult.ok(BigDecimal.valueOf(((Number) value).doubleValue()));
        }
        if (value instanceof Number number) {
            return CastResult.ok(BigDecimal.valueOf(number.longValue()));
        }
        if (value instanceof String str) {
            try {
                return CastResult.ok(new BigDecimal(str));
            } catch (NumberFormatException e) {
                return CastResult.error();
            }
        }
        return CastResult.error();
    }

    private static CastResult castBoolean(Object value) {
        if (value instanceof Boolean) {
            return CastResult.ok(value);
        }
        if (value instanceof String str) {
            return switch (str) {
                case "true", "1" -> CastResult.ok(Boolean.TRUE);
                case "false", "0" -> CastResult.ok(Boolean.FALSE);
                default -> CastResult.error();
            };
        }
        return CastResult.error();
    }

    private static CastResult castDate(Object value) {
        if (value instanceof LocalDate) {
            return CastResult.ok(value);
        }
        if (value instanceof String str) {
            try {
                return CastResult.ok(LocalDate.parse(str));
            } catch (DateTimeParseException e) {
                return CastResult.error();
            }
        }
        return CastResult.error();
    }

    private static CastResult castArray(ArrayType type, Object value) {
        if (!(value instanceof List<?> list)) {
            return CastResult.error();
        }
        List<Object> cast = new ArrayList<>(list.size());
        for (Object element : list) {
            CastResult result = cast(type.elementType(), element);
            if (result.isError()) {
                return result;
            }
            cast.add(result.value());
        }
        return CastResult.ok(cast);
    }

    // ========================================================================
    // Dumping
    // ========================================================================

    /**
     * Dumps a cast value into its adapter representation.
     *
     * <p>Built-in types dump to themselves; custom types and arrays of custom types
     * delegate to {@link CustomType#dump(Object)}.
     *
     * @param type the value's type
     * @param value the cast value (may be null)
     * @return the dump result
     */
    public static CastResult dump(DataType type, Object value) {
        Objects.requireNonNull(type, "type must not be null");
        if (value == null) {
            return CastResult.ok(null);
        }
        if (type instanceof CustomType custom) {
            return custom.dump(value);
        }
        if (type instanceof ArrayType array && value instanceof List<?> list) {
            List<Object> dumped = new ArrayList<>(list.size());
            for (Object element : list) {
                CastResult result = dump(array.elementType(), element);
                if (result.isError()) {
                    return result;
                }
                dumped.add(result.value());
            }
            return CastResult.ok(dumped);
        }
        return CastResult.ok(value);
    }

    // ========================================================================
    // Inference
    // ========================================================================

    /**
     * Infers the type of a literal runtime value.
     *
     * @param value the value (may be null)
     * @return the inferred type, {@link AnyType} when unknown
     */
    public static DataType inferType(Object value) {
        if (value instanceof CharSequence) {
            return StringType.get();
        }
        if (value instanceof Boolean) {
            return BooleanType.get();
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return IntegerType.get();
        }
        if (value instanceof Double || value instanceof Float) {
            return FloatType.get();
        }
        if (value instanceof BigDecimal) {
            return DecimalType.get();
        }
        if (value instanceof LocalDate) {
            return DateType.get();
        }
        if (value instanceof List) {
            return new ArrayType(AnyType.get());
        }
        if (value instanceof Map) {
            return MapType.get();
        }
        return AnyType.get();
    }

    /**
     * Renders a runtime value the way it appears in error messages and query renderings.
     *
     * @param value the value (may be null)
     * @return the rendered value
     */
    public static String inspect(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof CharSequence) {
            return "\"" + value.toString().replace("\"", "\\\"") + "\"";
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>(list.size());
            for (Object element : list) {
                parts.add(inspect(element));
            }
            return "[" + String.join(", ", parts) + "]";
        }
        return value.toString();
    }
}
