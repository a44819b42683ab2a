package io.vena.probe;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of {@link CommandDispatcher#execute(String)}.
 * Unlike the bare string from {@link CommandDispatcher#parseAndExecute},
 * this distinguishes a failure from a successful empty value.
 */
@Value
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Accessors(fluent = true)
public class CommandResult {
	@Nullable String text;
	@Nullable FailureKind failureKind;
	@Nullable String message;

	public static CommandResult success(String text) {
		return new CommandResult(text, null, null);
	}

	public static CommandResult failure(FailureKind kind, String message) {
		return new CommandResult(null, kind, message);
	}

	public boolean isSuccess() {
		return failureKind == null;
	}

	public Optional<String> value() {
		return Optional.ofNullable(text);
	}

	/**
	 * @return the value text on success, or the empty string on failure
	 */
	public String textOrEmpty() {
		return isSuccess() ? text : "";
	}

	@Override
	public String toString() {
		return isSuccess()
			? "Success(\"" + text + "\")"
			: "Failure(" + failureKind + ": " + message + ")";
	}
}
