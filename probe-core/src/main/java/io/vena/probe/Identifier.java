package io.vena.probe;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * The name under which a {@link Reflectable} object is registered,
 * and the first segment of every command path that addresses it.
 *
 * <p>
 * Identifiers are unique only within one {@link ObjectRegistry};
 * objects of different types may share an identifier.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class Identifier {
	@NonNull final String value;

	/**
	 * @throws IllegalArgumentException if <code>value</code> is empty, or
	 * contains a character that the command grammar uses as a delimiter
	 * (whitespace, <code>'.'</code> or <code>'='</code>).
	 */
	public static Identifier from(String value) {
		if (value == null || value.isEmpty()) {
			throw new IllegalArgumentException("Identifier can't be empty");
		}
		int badIndex = firstDelimiterIndex(value);
		if (badIndex >= 0) {
			throw new IllegalArgumentException("Identifier can't contain '" + value.charAt(badIndex) + "': \"" + value + "\"");
		}
		return new Identifier(value);
	}

	public static boolean isValid(String value) {
		return value != null && !value.isEmpty() && firstDelimiterIndex(value) < 0;
	}

	private static int firstDelimiterIndex(String value) {
		for (int i = 0; i < value.length(); i++) {
			char ch = value.charAt(i);
			if (ch == '.' || ch == '=' || Character.isWhitespace(ch)) {
				return i;
			}
		}
		return -1;
	}

	@Override public String toString() { return value; }
}
