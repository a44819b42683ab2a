package io.vena.probe.exceptions;

import static io.vena.probe.FailureKind.NOT_A_LEAF;

/**
 * A nested field with no codec was addressed as if it held a text value.
 */
@SuppressWarnings("serial")
public class NotALeafException extends CommandException {
	public NotALeafException(String message) { super(NOT_A_LEAF, message); }
	public NotALeafException(String message, Throwable cause) { super(NOT_A_LEAF, message, cause); }
}
