package io.vena.probe;

import io.vena.probe.exceptions.ConversionException;
import io.vena.probe.exceptions.NotALeafException;
import java.lang.reflect.Field;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declaration-time metadata for one field of a {@link ReflectableType}:
 * its name, where it lives, and how to turn it into text.
 *
 * <p>
 * A descriptor has a codec, a nested reflectable type, or both.
 * {@link ReflectableType.Builder} won't create one with neither.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
@Accessors(fluent = true)
public final class FieldDescriptor {
	private final String name;
	private final Field field;
	private final @Nullable ValueCodec<Object> codec;
	private final boolean navigable;

	public Class<?> type() {
		return field.getType();
	}

	public boolean isLeaf() {
		return codec != null;
	}

	public FieldAccessor bind(Object instance) {
		if (!field.getDeclaringClass().isInstance(instance)) {
			throw new IllegalArgumentException("Field " + this + " doesn't belong to " + instance.getClass().getSimpleName());
		}
		return new BoundAccessor(instance);
	}

	@Override
	public String toString() {
		return field.getDeclaringClass().getSimpleName() + "." + name;
	}

	@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
	private final class BoundAccessor implements FieldAccessor {
		private final Object instance;

		@Override public String name() { return name; }
		@Override public Class<?> type() { return field.getType(); }
		@Override public boolean isLeaf() { return codec != null; }
		@Override public boolean isNavigable() { return navigable; }

		@Override
		public String getText() {
			Object value = read();
			return value == null ? "" : requireCodec().toText(value);
		}

		@Override
		public boolean setText(String text) {
			ValueCodec<Object> leafCodec = requireCodec();
			Object newValue;
			try {
				newValue = leafCodec.fromText(text);
			} catch (ConversionException e) {
				LOGGER.debug("Rejected value for {}: {}", FieldDescriptor.this, e.getMessage());
				return false;
			}
			try {
				field.set(instance, newValue);
			} catch (IllegalAccessException e) {
				throw new AssertionError("Field " + FieldDescriptor.this + " should have been made accessible", e);
			}
			LOGGER.trace("Set {} to {}", FieldDescriptor.this, newValue);
			return true;
		}

		@Override
		public Optional<Object> value() {
			return Optional.ofNullable(read());
		}

		private Object read() {
			try {
				return field.get(instance);
			} catch (IllegalAccessException e) {
				throw new AssertionError("Field " + FieldDescriptor.this + " should have been made accessible", e);
			}
		}

		private ValueCodec<Object> requireCodec() {
			if (codec == null) {
				throw new NotALeafException("Field " + FieldDescriptor.this + " has no text form; address one of its members instead");
			}
			return codec;
		}

		@Override
		public String toString() {
			return "FieldAccessor(" + FieldDescriptor.this + ")";
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldDescriptor.class);
}
