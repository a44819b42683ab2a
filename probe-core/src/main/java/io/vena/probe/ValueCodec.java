package io.vena.probe;

import io.vena.probe.exceptions.ConversionException;

/**
 * Converts values of a leaf field type to and from their text form.
 *
 * @see ValueCodecs
 */
public interface ValueCodec<T> {
	/**
	 * The class of the values this codec produces and accepts.
	 * A field can use this codec only if its own class, boxed if primitive, is exactly this.
	 */
	Class<?> valueType();

	/**
	 * Must succeed for every value the field can hold.
	 */
	String toText(T value);

	/**
	 * @throws ConversionException if <code>text</code> is not a valid representation of <code>T</code>.
	 */
	T fromText(String text) throws ConversionException;
}
