package io.vena.probe;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Builder
@Accessors(fluent = true)
public class DispatcherSettings {
	/**
	 * Whether failed commands are logged. The caller always gets the
	 * failure in the {@link CommandResult} either way.
	 */
	@Default boolean logFailures = true;

	@Default String getKeyword = "get";
	@Default String setKeyword = "set";

	public static DispatcherSettings defaults() {
		return builder().build();
	}

	public void validate() {
		if (isBlankKeyword(getKeyword) || isBlankKeyword(setKeyword)) {
			throw new IllegalArgumentException("Operation keywords must be non-blank single words");
		} else if (getKeyword.equals(setKeyword)) {
			throw new IllegalArgumentException("Get and set keywords must differ: \"" + getKeyword + "\"");
		}
	}

	private static boolean isBlankKeyword(String keyword) {
		return keyword == null || keyword.isBlank() || !keyword.equals(keyword.strip()) || keyword.chars().anyMatch(Character::isWhitespace);
	}
}
