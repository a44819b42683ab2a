package io.vena.probe;

import io.vena.probe.exceptions.NotALeafException;
import java.util.Optional;

/**
 * Text access to one declared field of one live object, whatever the field's type.
 *
 * <p>
 * Accessors are cheap, transient bindings created by {@link Reflector}.
 * Don't hold on to them between commands.
 */
public interface FieldAccessor {
	String name();

	Class<?> type();

	/**
	 * @return true if the field's value has a text form, meaning
	 * {@link #getText()} and {@link #setText} may be called.
	 */
	boolean isLeaf();

	/**
	 * @return true if the field's type is itself a {@link ReflectableType},
	 * so a command path may continue into it.
	 */
	boolean isNavigable();

	/**
	 * @throws NotALeafException if not {@link #isLeaf()}
	 */
	String getText();

	/**
	 * Assigns the decoded <code>text</code> to the field.
	 * If decoding fails, the field is left unchanged.
	 *
	 * @return true if the field was assigned
	 * @throws NotALeafException if not {@link #isLeaf()}
	 */
	boolean setText(String text);

	/**
	 * @return the object currently held by the field, for navigation;
	 * empty if the field holds <code>null</code>.
	 */
	Optional<Object> value();
}
