package io.github.cyfko.entityql.jpa.utils;

import java.lang.reflect.Constructor;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Converts loosely typed operand values to the Java type of a JPA attribute.
 * <p>
 * Operands reach the store as whatever the caller passed ({@code 5} for a {@code Long} id,
 * {@code "ACTIVE"} for an enum column...). Criteria parameters must match the attribute type,
 * so each value is converted before it is bound.
 * </p>
 *
 * <p><strong>Supported Conversions:</strong></p>
 * <ul>
 *   <li>Numeric types (primitives and wrappers), {@link BigDecimal}, {@link BigInteger}</li>
 *   <li>Enums, by exact constant name</li>
 *   <li>Boolean, from booleans, numbers and {@code "true"}/{@code "false"}</li>
 *   <li>{@link LocalDate}, {@link LocalDateTime}, {@link LocalTime}, {@link Instant}</li>
 *   <li>{@link UUID} and {@link String}</li>
 *   <li>Any type with a public {@code String} constructor</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JpaValueConverter {

    private JpaValueConverter() {
        throw new UnsupportedOperationException("JpaValueConverter is a utility class and cannot be instantiated");
    }

    /**
     * Converts {@code value} to {@code targetType}.
     *
     * @param targetType the attribute type
     * @param value      the value, may be {@code null}
     * @return the converted value, {@code null} when {@code value} is {@code null}
     * @throws IllegalArgumentException if the conversion is not possible
     */
    public static Object convert(Class<?> targetType, Object value) {
        if (value == null || targetType == null) {
            return value;
        }
        Class<?> type = wrap(targetType);
        if (type.isInstance(value)) {
            return value;
        }

        try {
            if (type == BigDecimal.class) return new BigDecimal(value.toString());
            if (type == BigInteger.class) {
                return value instanceof Number n ? BigInteger.valueOf(n.longValue()) : new BigInteger(value.toString());
            }
            if (Number.class.isAssignableFrom(type)) return convertToNumeric(type, value);
            if (type.isEnum()) return convertToEnum(type, value);
            if (type == Boolean.class) return convertToBoolean(value);
            if (type == LocalDate.class) return LocalDate.parse(value.toString());
            if (type == LocalDateTime.class) return LocalDateTime.parse(value.toString());
            if (type == LocalTime.class) return LocalTime.parse(value.toString());
            if (type == Instant.class) {
                if (value instanceof Long epochMillis) return Instant.ofEpochMilli(epochMillis);
                if (value instanceof LocalDateTime ldt) return ldt.atZone(ZoneId.systemDefault()).toInstant();
                return Instant.parse(value.toString());
            }
            if (type == UUID.class) return UUID.fromString(value.toString());
            if (type == String.class) {
                return value instanceof Enum<?> constant ? constant.name() : value.toString();
            }

            Constructor<?> constructor = type.getConstructor(String.class);
            return constructor.newInstance(value.toString());
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format("Cannot convert value '%s' (type: %s) to %s",
                            value, value.getClass().getName(), targetType.getName()), e);
        }
    }

    /**
     * Converts every element of {@code values} to {@code elementType}.
     *
     * @param elementType the element type
     * @param values      the values
     * @return the converted values, in order
     */
    public static List<Object> convertAll(Class<?> elementType, Collection<?> values) {
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(convert(elementType, value));
        }
        return converted;
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        return type;
    }

    private static Object convertToNumeric(Class<?> type, Object value) {
        if (value instanceof Number num) {
            if (type == Integer.class) return num.intValue();
            if (type == Long.class) return num.longValue();
            if (type == Double.class) return num.doubleValue();
            if (type == Float.class) return num.floatValue();
            if (type == Short.class) return num.shortValue();
            if (type == Byte.class) return num.byteValue();
        }

        String str = value.toString().trim();
        if (type == Integer.class) return Integer.valueOf(str);
        if (type == Long.class) return Long.valueOf(str);
        if (type == Double.class) return Double.valueOf(str);
        if (type == Float.class) return Float.valueOf(str);
        if (type == Short.class) return Short.valueOf(str);
        if (type == Byte.class) return Byte.valueOf(str);

        throw new IllegalArgumentException("Unsupported numeric type: " + type);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convertToEnum(Class<?> type, Object value) {
        String name = value instanceof Enum<?> constant ? constant.name() : value.toString();
        try {
            return Enum.valueOf((Class) type, name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid value '%s' for enum %s", name, type.getSimpleName()), e);
        }
    }

    private static Boolean convertToBoolean(Object value) {
        if (value instanceof Number num) return num.intValue() != 0;
        String normalized = value.toString().trim().toLowerCase();
        if ("true".equals(normalized)) return Boolean.TRUE;
        if ("false".equals(normalized)) return Boolean.FALSE;
        throw new IllegalArgumentException("Not a boolean: " + value);
    }
}
