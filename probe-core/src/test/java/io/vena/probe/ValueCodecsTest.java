package io.vena.probe;

import io.vena.probe.exceptions.ConversionException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueCodecsTest {

	static Stream<Arguments> validText() {
		return Stream.of(
			Arguments.of(int.class, "42", 42),
			Arguments.of(Integer.class, "-7", -7),
			Arguments.of(long.class, "9000000000", 9_000_000_000L),
			Arguments.of(short.class, "123", (short) 123),
			Arguments.of(byte.class, "-128", (byte) -128),
			Arguments.of(double.class, "1.5", 1.5),
			Arguments.of(float.class, "0.25", 0.25f),
			Arguments.of(boolean.class, "TRUE", true),
			Arguments.of(Boolean.class, "0", false),
			Arguments.of(char.class, "q", 'q'),
			Arguments.of(String.class, "", ""),
			Arguments.of(String.class, "hello_world", "hello_world"),
			Arguments.of(BigInteger.class, "123456789012345678901234567890", new BigInteger("123456789012345678901234567890")),
			Arguments.of(BigDecimal.class, "3.14159", new BigDecimal("3.14159")),
			Arguments.of(Identifier.class, "record_1", Identifier.from("record_1")),
			Arguments.of(Gadget.Mode.class, "RUNNING", Gadget.Mode.RUNNING)
		);
	}

	@ParameterizedTest
	@MethodSource("validText")
	void validText_decodes(Class<?> type, String text, Object expected) throws ConversionException {
		assertEquals(expected, codec(type).fromText(text));
	}

	static Stream<Arguments> invalidText() {
		return Stream.of(
			Arguments.of(int.class, "abc"),
			Arguments.of(int.class, ""),
			Arguments.of(int.class, " 42"),
			Arguments.of(int.class, "42x"),
			Arguments.of(int.class, "2147483648"),
			Arguments.of(byte.class, "128"),
			Arguments.of(double.class, "1.5d"),
			Arguments.of(double.class, "1.5 "),
			Arguments.of(float.class, "2f"),
			Arguments.of(boolean.class, "yes"),
			Arguments.of(boolean.class, ""),
			Arguments.of(char.class, ""),
			Arguments.of(char.class, "ab"),
			Arguments.of(BigDecimal.class, "one"),
			Arguments.of(Identifier.class, "has.dot"),
			Arguments.of(Gadget.Mode.class, "running")
		);
	}

	@ParameterizedTest
	@MethodSource("invalidText")
	void invalidText_throws(Class<?> type, String text) {
		assertThrows(ConversionException.class, () -> codec(type).fromText(text));
	}

	@Test
	void toText_usesCanonicalForm() {
		assertEquals("42", codec(int.class).toText(42));
		assertEquals("true", codec(boolean.class).toText(true));
		assertEquals("1.5", codec(double.class).toText(1.5));
		assertEquals("STOPPED", codec(Gadget.Mode.class).toText(Gadget.Mode.STOPPED));
		assertEquals("", codec(String.class).toText(null));
	}

	@Test
	void primitiveAndBoxed_shareCodec() {
		assertEquals(ValueCodecs.forClass(int.class), ValueCodecs.forClass(Integer.class));
	}

	@Test
	void unknownClass_hasNoCodec() {
		assertFalse(ValueCodecs.hasCodec(Object.class));
		assertFalse(ValueCodecs.hasCodec(TestRecord.class));
		assertTrue(ValueCodecs.hasCodec(Gadget.Mode.class));
	}

	@Test
	void registeredCodec_isUsed() throws ConversionException {
		ValueCodecs.register(LocalDate.class, new ValueCodec<>() {
			@Override
			public Class<?> valueType() {
				return LocalDate.class;
			}

			@Override
			public String toText(LocalDate value) {
				return value.toString();
			}

			@Override
			public LocalDate fromText(String text) throws ConversionException {
				try {
					return LocalDate.parse(text);
				} catch (DateTimeParseException e) {
					throw new ConversionException("Not a date: " + text, e);
				}
			}
		});
		ValueCodec<LocalDate> codec = codec(LocalDate.class);
		assertEquals(LocalDate.of(2024, 2, 29), codec.fromText("2024-02-29"));
		assertEquals("2024-02-29", codec.toText(LocalDate.of(2024, 2, 29)));
		assertThrows(ConversionException.class, () -> codec.fromText("2023-02-29"));
	}

	@Test
	@SuppressWarnings({"unchecked", "rawtypes"})
	void codecForOtherType_cannotBeRegistered() {
		ValueCodec stringCodec = codec(String.class);
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
			() -> ValueCodecs.register(StringBuilder.class, stringCodec));
		assertThat(e.getMessage(), containsString("StringBuilder"));
		assertFalse(ValueCodecs.hasCodec(StringBuilder.class));
	}

	@Test
	void builtInCodecs_reportBoxedValueType() {
		assertEquals(Integer.class, codec(int.class).valueType());
		assertEquals(Integer.class, codec(Integer.class).valueType());
		assertEquals(String.class, codec(String.class).valueType());
		assertEquals(Gadget.Mode.class, codec(Gadget.Mode.class).valueType());
	}

	@Test
	void primitiveCodec_cannotBeReplaced() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
			() -> ValueCodecs.register(int.class, codec(int.class)));
		assertThat(e.getMessage(), containsString("primitive"));
	}

	private static <T> ValueCodec<T> codec(Class<T> type) {
		return ValueCodecs.forClass(type)
			.orElseThrow(() -> new AssertionError("Expected a codec for " + type));
	}
}
