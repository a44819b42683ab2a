package io.vena.probe.exceptions;

import static io.vena.probe.FailureKind.CONVERSION_FAILURE;

@SuppressWarnings("serial")
public class ConversionFailedException extends CommandException {
	public ConversionFailedException(String message) { super(CONVERSION_FAILURE, message); }
	public ConversionFailedException(String message, Throwable cause) { super(CONVERSION_FAILURE, message, cause); }
}
