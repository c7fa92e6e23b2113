package com.settingsproxy.core.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts setting values between their typed, in-memory form and the string
 * form in which they are persisted.
 *
 * <h3>Serialization</h3>
 * <ul>
 * <li>{@link String} is stored unchanged</li>
 * <li>{@link Boolean} is stored as {@code "True"} / {@code "False"}</li>
 * <li>{@link Integer}, {@link Long}, {@link Short}, {@link Byte},
 * {@link Double} and {@link Float} are stored in decimal notation</li>
 * <li>{@link List} is stored as JSON</li>
 * </ul>
 * <p>
 * Anything else, including {@link Map}, is rejected with a
 * {@link SerializationException}.
 * </p>
 *
 * <h3>Unserialization</h3>
 * <p>
 * Values already of the requested type are returned as-is. Booleans are read
 * case-sensitively: only the literal {@code "True"} is {@code true}.
 * {@link Map} and {@link List} types, including concrete implementations such
 * as {@link java.util.ArrayList}, are decoded from JSON. Numbers are never
 * narrowed silently: a value outside the requested type's range, or NaN and
 * infinity requested as a whole number, is an error. Conversion failures
 * surface as {@link TypeCoercionException}.
 * </p>
 *
 * <h3>Round trips</h3>
 * <p>
 * Every type accepted by {@link #serialize(Object)} reads back equal when the
 * same type is requested. List elements are the exception: they go through
 * JSON, so they come back as the types Jackson picks ({@link String},
 * {@link Integer} or {@link Long} by magnitude, {@link Double},
 * {@link Boolean}, nested {@link List} and {@link Map}). {@code List.of(1L)}
 * therefore reads back as a list holding {@code Integer 1} and is not equal to
 * the original.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingValueCodec {

    static final String TRUE_LITERAL = "True";
    static final String FALSE_LITERAL = "False";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            double.class, Double.class,
            float.class, Float.class,
            short.class, Short.class,
            byte.class, Byte.class,
            boolean.class, Boolean.class);

    private SettingValueCodec() {
        // utility class
    }

    /**
     * Turn a typed value into its persisted string form.
     *
     * @param value the value to store
     * @return the serialized form
     * @throws SerializationException if the value's type is not supported or
     *                                {@code value} is {@code null}
     */
    public static String serialize(Object value) {
        if (value == null) {
            throw new SerializationException("Unable to serialize null into a setting");
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Boolean b) {
            return b ? TRUE_LITERAL : FALSE_LITERAL;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof Double || value instanceof Float) {
            return value.toString();
        }
        if (value instanceof List<?> list) {
            try {
                return MAPPER.writeValueAsString(list);
            } catch (JsonProcessingException e) {
                throw new SerializationException(
                        "Unable to serialize list into a setting: " + e.getOriginalMessage(), e);
            }
        }
        throw new SerializationException(
                "Unable to serialize " + value.getClass().getName() + " into a setting");
    }

    /**
     * Convert a stored (or caller-supplied default) value to the requested type.
     *
     * @param value raw value, usually the persisted string; may be {@code null}
     * @param type  the requested type; primitive types are treated as their
     *              wrappers
     * @param <T>   requested type
     * @return the converted value; {@code null} for a {@code null} input, except
     *         {@link Boolean} which yields {@code false}
     * @throws TypeCoercionException if the value cannot be converted, including
     *                               numbers outside the requested type's range
     */
    public static <T> T unserialize(Object value, Class<T> type) {
        Objects.requireNonNull(type, "Requested type must not be null");
        Class<T> target = wrap(type);

        if (value == null) {
            return target == Boolean.class ? target.cast(Boolean.FALSE) : null;
        }
        if (target.isInstance(value)) {
            return target.cast(value);
        }

        try {
            if (target == Integer.class) {
                return target.cast(value instanceof Number n
                        ? Integer.valueOf(integral(n).intValueExact())
                        : Integer.valueOf(value.toString().trim()));
            }
            if (target == Long.class) {
                return target.cast(value instanceof Number n
                        ? Long.valueOf(integral(n).longValueExact())
                        : Long.valueOf(value.toString().trim()));
            }
            if (target == Short.class) {
                return target.cast(value instanceof Number n
                        ? Short.valueOf(integral(n).shortValueExact())
                        : Short.valueOf(value.toString().trim()));
            }
            if (target == Byte.class) {
                return target.cast(value instanceof Number n
                        ? Byte.valueOf(integral(n).byteValueExact())
                        : Byte.valueOf(value.toString().trim()));
            }
            if (target == Double.class) {
                return target.cast(value instanceof Number n
                        ? Double.valueOf(n.doubleValue())
                        : Double.valueOf(value.toString().trim()));
            }
            if (target == Float.class) {
                return target.cast(value instanceof Number n
                        ? Float.valueOf(n.floatValue())
                        : Float.valueOf(value.toString().trim()));
            }
            if (Map.class.isAssignableFrom(target) || List.class.isAssignableFrom(target)) {
                if (!(value instanceof String json)) {
                    throw new TypeCoercionException(
                            "Cannot decode " + value.getClass().getName() + " as JSON "
                                    + target.getSimpleName(), target);
                }
                return MAPPER.readValue(json, target);
            }
        } catch (NumberFormatException | ArithmeticException | JsonProcessingException e) {
            throw new TypeCoercionException(value, target, e);
        }

        if (target == Boolean.class) {
            return target.cast(TRUE_LITERAL.equals(value.toString()));
        }
        if (target == String.class) {
            return target.cast(value.toString());
        }
        throw new TypeCoercionException(
                "Unsupported setting type: " + target.getName(), target);
    }

    /**
     * Whole-number part of {@code n}; fractions are truncated toward zero.
     *
     * @throws ArithmeticException if {@code n} is NaN or infinite
     */
    private static BigInteger integral(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return BigInteger.valueOf(n.longValue());
        }
        if (n instanceof BigInteger big) {
            return big;
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (!Double.isFinite(d)) {
                throw new ArithmeticException("Not a finite number: " + d);
            }
            return BigDecimal.valueOf(d).toBigInteger();
        }
        return new BigDecimal(n.toString()).toBigInteger();
    }

    @SuppressWarnings("unchecked")
    private static <T> Class<T> wrap(Class<T> type) {
        return type.isPrimitive()
                ? (Class<T>) PRIMITIVE_WRAPPERS.getOrDefault(type, type)
                : type;
    }
}
