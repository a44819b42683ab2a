package io.vena.probe.exceptions;

/**
 * Indicates that a class can't be declared as a reflectable type.
 */
@SuppressWarnings("serial")
public class InvalidTypeException extends Exception {
	public InvalidTypeException(String message) { super(message); }
	public InvalidTypeException(String message, Throwable cause) { super(message, cause); }
}
