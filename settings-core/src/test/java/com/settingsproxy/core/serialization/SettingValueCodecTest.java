package com.settingsproxy.core.serialization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link SettingValueCodec}.
 */
class SettingValueCodecTest {

    @Nested
    @DisplayName("serialize")
    class Serialize {

        @Test
        @DisplayName("Should keep strings unchanged")
        void shouldKeepStrings() {
            assertThat(SettingValueCodec.serialize("hello")).isEqualTo("hello");
            assertThat(SettingValueCodec.serialize("")).isEmpty();
        }

        @Test
        @DisplayName("Should write booleans as True / False")
        void shouldWriteBooleanLiterals() {
            assertThat(SettingValueCodec.serialize(true)).isEqualTo("True");
            assertThat(SettingValueCodec.serialize(Boolean.FALSE)).isEqualTo("False");
        }

        @Test
        @DisplayName("Should write numbers in decimal notation")
        void shouldWriteNumbers() {
            assertThat(SettingValueCodec.serialize(10)).isEqualTo("10");
            assertThat(SettingValueCodec.serialize(-3L)).isEqualTo("-3");
            assertThat(SettingValueCodec.serialize(2.5)).isEqualTo("2.5");
            assertThat(SettingValueCodec.serialize(1.5f)).isEqualTo("1.5");
        }

        @Test
        @DisplayName("Should write lists as JSON")
        void shouldWriteListsAsJson() {
            assertThat(SettingValueCodec.serialize(List.of("a", "b")))
                    .isEqualTo("[\"a\",\"b\"]");
            assertThat(SettingValueCodec.serialize(List.of(1, 2, 3))).isEqualTo("[1,2,3]");
        }

        @Test
        @DisplayName("Should reject maps and name the type")
        void shouldRejectMaps() {
            assertThatThrownBy(() -> SettingValueCodec.serialize(Map.of("a", 1)))
                    .isInstanceOf(SerializationException.class)
                    .hasMessageContaining("Unable to serialize")
                    .hasMessageContaining("Map");
        }

        @Test
        @DisplayName("Should reject null and other unsupported types")
        void shouldRejectUnsupportedTypes() {
            assertThatThrownBy(() -> SettingValueCodec.serialize(null))
                    .isInstanceOf(SerializationException.class);
            assertThatThrownBy(() -> SettingValueCodec.serialize(new Object()))
                    .isInstanceOf(SerializationException.class)
                    .hasMessageContaining("java.lang.Object");
        }
    }

    @Nested
    @DisplayName("unserialize")
    class Unserialize {

        @Test
        @DisplayName("Should return values already of the requested type as-is")
        void shouldPassThroughMatchingType() {
            List<String> list = List.of("x");
            assertThat(SettingValueCodec.unserialize(list, List.class)).isSameAs(list);
            assertThat(SettingValueCodec.unserialize(7, Integer.class)).isEqualTo(7);
        }

        @Test
        @DisplayName("Should parse integers, longs and floating point numbers")
        void shouldParseNumbers() {
            assertThat(SettingValueCodec.unserialize("10", Integer.class)).isEqualTo(10);
            assertThat(SettingValueCodec.unserialize(" 42 ", int.class)).isEqualTo(42);
            assertThat(SettingValueCodec.unserialize("9000000000", Long.class))
                    .isEqualTo(9_000_000_000L);
            assertThat(SettingValueCodec.unserialize("2.5", Double.class)).isEqualTo(2.5);
            assertThat(SettingValueCodec.unserialize("3", Double.class)).isEqualTo(3.0);
            assertThat(SettingValueCodec.unserialize("1.5", Float.class)).isEqualTo(1.5f);
        }

        @Test
        @DisplayName("Should convert typed numbers between numeric types")
        void shouldConvertNumbers() {
            assertThat(SettingValueCodec.unserialize(5, Long.class)).isEqualTo(5L);
            assertThat(SettingValueCodec.unserialize(5, Double.class)).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Should read only the literal True as true")
        void shouldReadBooleanLiteral() {
            assertThat(SettingValueCodec.unserialize("True", Boolean.class)).isTrue();
            assertThat(SettingValueCodec.unserialize("true", Boolean.class)).isFalse();
            assertThat(SettingValueCodec.unserialize("1", Boolean.class)).isFalse();
            assertThat(SettingValueCodec.unserialize("", Boolean.class)).isFalse();
            assertThat(SettingValueCodec.unserialize("False", boolean.class)).isFalse();
        }

        @Test
        @DisplayName("Should decode JSON lists and maps")
        @SuppressWarnings("unchecked")
        void shouldDecodeJson() {
            List<Object> list = SettingValueCodec.unserialize("[\"a\",\"b\"]", List.class);
            assertThat(list).containsExactly("a", "b");
            Map<String, Object> map = SettingValueCodec.unserialize("{\"a\":1,\"b\":[true]}", Map.class);
            assertThat(map).containsEntry("a", 1).containsEntry("b", List.of(true));
        }

        @Test
        @DisplayName("Should map null to null, and to false for booleans")
        void shouldHandleNull() {
            assertThat(SettingValueCodec.unserialize(null, String.class)).isNull();
            assertThat(SettingValueCodec.unserialize(null, Integer.class)).isNull();
            assertThat(SettingValueCodec.unserialize(null, List.class)).isNull();
            assertThat(SettingValueCodec.unserialize(null, Boolean.class)).isFalse();
        }

        @Test
        @DisplayName("Should render non-string values as strings when a String is requested")
        void shouldStringify() {
            assertThat(SettingValueCodec.unserialize(12, String.class)).isEqualTo("12");
        }

        @Test
        @DisplayName("Should fail with TypeCoercionException on unparsable input")
        void shouldFailOnBadInput() {
            assertThatThrownBy(() -> SettingValueCodec.unserialize("abc", Integer.class))
                    .isInstanceOf(TypeCoercionException.class)
                    .hasCauseInstanceOf(NumberFormatException.class)
                    .hasMessageContaining("Integer");
            assertThatThrownBy(() -> SettingValueCodec.unserialize("1.5", Integer.class))
                    .isInstanceOf(TypeCoercionException.class);
            assertThatThrownBy(() -> SettingValueCodec.unserialize("not json", List.class))
                    .isInstanceOf(TypeCoercionException.class);
            assertThatThrownBy(() -> SettingValueCodec.unserialize("[1,2]", Map.class))
                    .isInstanceOf(TypeCoercionException.class);
        }

        @Test
        @DisplayName("Should reject target types it cannot produce")
        void shouldRejectUnsupportedTarget() {
            TypeCoercionException e = catchThrowableOfType(
                    () -> SettingValueCodec.unserialize("x", StringBuilder.class),
                    TypeCoercionException.class);

            assertThat(e).hasMessageContaining("Unsupported setting type");
            assertThat(e.getTargetType()).isEqualTo(StringBuilder.class);
        }

        @Test
        @DisplayName("Should read back what serialize wrote")
        @SuppressWarnings("unchecked")
        void shouldReadBackSerializedValues() {
            assertThat(SettingValueCodec.unserialize(SettingValueCodec.serialize(true), Boolean.class))
                    .isTrue();
            assertThat(SettingValueCodec.unserialize(SettingValueCodec.serialize(-17L), Long.class))
                    .isEqualTo(-17L);
            List<Object> list = SettingValueCodec.unserialize(
                    SettingValueCodec.serialize(List.of("a", 1)), List.class);
            assertThat(list).containsExactly("a", 1);
        }
    
        @Test
        @DisplayName("Should read back every serializable scalar type")
        void shouldRoundTripEveryScalarType() {
            assertRoundTrip("text", String.class);
            assertRoundTrip(Boolean.TRUE, Boolean.class);
            assertRoundTrip(Boolean.FALSE, Boolean.class);
            assertRoundTrip(42, Integer.class);
            assertRoundTrip(-9_000_000_000L, Long.class);
            assertRoundTrip((short) 5, Short.class);
            assertRoundTrip((byte) -7, Byte.class);
            assertRoundTrip(2.75, Double.class);
            assertRoundTrip(0.5f, Float.class);
            assertRoundTrip(List.of("a", "b"), List.class);

            assertThat(SettingValueCodec.unserialize("5", short.class)).isEqualTo((short) 5);
            assertThat(SettingValueCodec.unserialize("5", byte.class)).isEqualTo((byte) 5);
        }

        @Test
        @DisplayName("Should reject short and byte values out of range")
        void shouldRejectOutOfRangeShortAndByte() {
            assertThatThrownBy(() -> SettingValueCodec.unserialize("40000", Short.class))
                    .isInstanceOf(TypeCoercionException.class);
            assertThatThrownBy(() -> SettingValueCodec.unserialize(300, Byte.class))
                    .isInstanceOf(TypeCoercionException.class)
                    .hasCauseInstanceOf(ArithmeticException.class);
        }

        @Test
        @DisplayName("Should not narrow numbers that overflow the requested type")
        void shouldRejectOverflowingNumbers() {
            assertThatThrownBy(() -> SettingValueCodec.unserialize(10_000_000_000L, Integer.class))
                    .isInstanceOf(TypeCoercionException.class)
                    .hasCauseInstanceOf(ArithmeticException.class);
            assertThatThrownBy(() -> SettingValueCodec.unserialize(1e30, Long.class))
                    .isInstanceOf(TypeCoercionException.class);
            assertThatThrownBy(() -> SettingValueCodec.unserialize("10000000000", Integer.class))
                    .isInstanceOf(TypeCoercionException.class);
        }

        @Test
        @DisplayName("Should reject NaN and infinity as whole numbers")
        void shouldRejectNonFiniteWholeNumbers() {
            assertThatThrownBy(() -> SettingValueCodec.unserialize(Double.NaN, Integer.class))
                    .isInstanceOf(TypeCoercionException.class)
                    .hasCauseInstanceOf(ArithmeticException.class);
            assertThatThrownBy(() -> SettingValueCodec.unserialize(Float.POSITIVE_INFINITY, Long.class))
                    .isInstanceOf(TypeCoercionException.class);
        }

        @Test
        @DisplayName("Should truncate finite fractions toward zero")
        void shouldTruncateFractions() {
            assertThat(SettingValueCodec.unserialize(1.9, Integer.class)).isEqualTo(1);
            assertThat(SettingValueCodec.unserialize(-1.9, Long.class)).isEqualTo(-1L);
        }

        @Test
        @DisplayName("Should decode JSON into concrete collection types")
        void shouldDecodeConcreteCollections() {
            String json = SettingValueCodec.serialize(new ArrayList<>(List.of("x", "y")));

            ArrayList<?> list = SettingValueCodec.unserialize(json, ArrayList.class);
            assertThat(list).isInstanceOf(ArrayList.class).hasSize(2);
            assertThat(list.get(0)).isEqualTo("x");

            LinkedHashMap<?, ?> map = SettingValueCodec.unserialize("{\"a\":1}", LinkedHashMap.class);
            assertThat(map.get("a")).isEqualTo(1);
        }

        @Test
        @DisplayName("List elements should come back as the JSON-decoded types")
        void listElementsShouldUseJsonTypes() {
            List<?> list = SettingValueCodec.unserialize(
                    SettingValueCodec.serialize(List.of(1L)), List.class);

            assertThat(list.get(0)).isEqualTo(1);
            assertThat(list).isNotEqualTo(List.of(1L));
        }

        private <T> void assertRoundTrip(T value, Class<T> type) {
            assertThat(SettingValueCodec.unserialize(SettingValueCodec.serialize(value), type))
                    .isEqualTo(value);
        }
    }
}
