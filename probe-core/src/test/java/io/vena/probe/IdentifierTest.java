package io.vena.probe;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentifierTest {

	@ParameterizedTest
	@MethodSource("validString")
	void validString_survivesRoundTrip(String validString) {
		assertEquals(validString, Identifier.from(validString).toString());
		assertTrue(Identifier.isValid(validString));
	}

	@ParameterizedTest
	@MethodSource("invalidString")
	void invalidString_throws(String invalidString) {
		assertThrows(IllegalArgumentException.class, () -> Identifier.from(invalidString));
		assertFalse(Identifier.isValid(invalidString));
	}

	@Test
	void null_throws() {
		assertThrows(IllegalArgumentException.class, () -> Identifier.from(null));
		assertFalse(Identifier.isValid(null));
	}

	@Test
	void equalStrings_equalIdentifiers() {
		assertEquals(Identifier.from("test_object"), Identifier.from("test_object"));
		assertEquals(Identifier.from("test_object").hashCode(), Identifier.from("test_object").hashCode());
		assertNotEquals(Identifier.from("test_object"), Identifier.from("Test_Object"));
	}

	@SuppressWarnings("unused")
	static Stream<String> validString() {
		return Stream.of(
			"test",
			"test_object",
			"unicode🌳",
			"name/with/slashes",
			"-startsWithDash",
			"123"
		);
	}

	@SuppressWarnings("unused")
	static Stream<String> invalidString() {
		return Stream.of(
			"",
			"name with spaces",
			"name.with.dots",
			"name=value",
			"name\nwith\nnewlines",
			"name\twith\ttabs"
		);
	}
}
