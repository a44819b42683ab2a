package io.vena.probe.exceptions;

import static io.vena.probe.FailureKind.MALFORMED_COMMAND;

@SuppressWarnings("serial")
public class MalformedCommandException extends CommandException {
	public MalformedCommandException(String message) { super(MALFORMED_COMMAND, message); }
	public MalformedCommandException(String message, Throwable cause) { super(MALFORMED_COMMAND, message, cause); }
}
