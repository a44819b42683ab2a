package io.vena.probe.exceptions;

import io.vena.probe.ValueCodec;

/**
 * Thrown by {@link ValueCodec#fromText} when the text is not a valid
 * representation of the codec's type.
 */
@SuppressWarnings("serial")
public class ConversionException extends Exception {
	public ConversionException(String message) { super(message); }
	public ConversionException(String message, Throwable cause) { super(message, cause); }
}
