package io.vena.probe.exceptions;

import static io.vena.probe.FailureKind.OBJECT_NOT_FOUND;

@SuppressWarnings("serial")
public class ObjectNotFoundException extends CommandException {
	public ObjectNotFoundException(String message) { super(OBJECT_NOT_FOUND, message); }
	public ObjectNotFoundException(String message, Throwable cause) { super(OBJECT_NOT_FOUND, message, cause); }
}
