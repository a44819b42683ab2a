package io.vena.probe.exceptions;

import io.vena.probe.CommandDispatcher;
import io.vena.probe.FailureKind;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A command that could not be carried out.
 * These are expected, recoverable conditions; {@link CommandDispatcher}
 * turns them into a failed result rather than letting them escape.
 */
@SuppressWarnings("serial")
@Getter
@Accessors(fluent = true)
public abstract class CommandException extends RuntimeException {
	private final FailureKind kind;

	protected CommandException(FailureKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	protected CommandException(FailureKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}
}
