package io.vena.probe;

import io.vena.probe.exceptions.InvalidFieldTypeException;
import io.vena.probe.exceptions.InvalidTypeException;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.pcollections.OrderedPMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.probe.util.ReflectionHelpers.setAccessible;
import static java.lang.reflect.Modifier.isFinal;
import static java.lang.reflect.Modifier.isStatic;

/**
 * The ordered list of fields that a class exposes to commands.
 *
 * <p>
 * A class declares its fields once, normally from its static initializer:
 *
 * <pre>
 * public class Sensor extends Reflectable&lt;Sensor&gt; {
 *     static {
 *         ReflectableType.declare(Sensor.class, "threshold", "calibration");
 *     }
 *     int threshold;
 *     Calibration calibration;
 *     ...
 * }
 * </pre>
 *
 * Every field must be non-private, non-static and non-final, and its type must
 * either have a {@link ValueCodec} or be a declared reflectable type itself
 * (in which case commands can navigate into it). A codec's
 * {@link ValueCodec#valueType() value type} must match the field's type. These rules are checked when
 * the type is declared, so a bad declaration fails class initialization rather
 * than some later command.
 *
 * <p>
 * Fields of a superclass's declaration are not inherited. A class with no
 * declaration of its own uses that of its nearest declared superclass.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Accessors(fluent = true)
public final class ReflectableType<T> {
	private final Class<T> type;
	private final OrderedPMap<String, FieldDescriptor> fieldsByName;

	private static final Map<Class<?>, ReflectableType<?>> TYPES = new ConcurrentHashMap<>();

	public static <T> Builder<T> builder(Class<T> type) {
		return new Builder<>(type);
	}

	/**
	 * Declares <code>type</code> with the named fields, in order, each using the
	 * codec from {@link ValueCodecs} (if any).
	 *
	 * @throws IllegalArgumentException if the declaration is invalid.
	 * Use {@link #builder} to get a checked {@link InvalidTypeException} instead.
	 */
	public static <T> ReflectableType<T> declare(Class<T> type, String... fieldNames) {
		Builder<T> builder = builder(type);
		for (String fieldName: fieldNames) {
			builder.field(fieldName);
		}
		try {
			return builder.register();
		} catch (InvalidTypeException e) {
			throw new IllegalArgumentException("Invalid reflectable type " + type.getSimpleName() + ": " + e.getMessage(), e);
		}
	}

	/**
	 * @return the declaration for <code>theClass</code>, or for its nearest declared superclass.
	 */
	public static Optional<ReflectableType<?>> forClass(Class<?> theClass) {
		for (Class<?> c = theClass; c != null && c != Object.class; c = c.getSuperclass()) {
			ReflectableType<?> result = TYPES.get(c);
			if (result != null) {
				return Optional.of(result);
			}
		}
		return Optional.empty();
	}

	/**
	 * Like {@link #forClass}, but first initializes <code>theClass</code> so
	 * that a declaration in its static initializer has a chance to run.
	 */
	static Optional<ReflectableType<?>> forInitializedClass(Class<?> theClass) {
		if (!theClass.isPrimitive() && !theClass.isArray()) {
			try {
				Class.forName(theClass.getName(), true, theClass.getClassLoader());
			} catch (ClassNotFoundException e) {
				throw new AssertionError("Class " + theClass.getName() + " must be loadable from its own class loader", e);
			}
		}
		return forClass(theClass);
	}

	public Collection<FieldDescriptor> fields() {
		return fieldsByName.values();
	}

	public Optional<FieldDescriptor> field(String name) {
		return Optional.ofNullable(fieldsByName.get(name));
	}

	@Override
	public String toString() {
		return "ReflectableType(" + type.getSimpleName() + fieldsByName.keySet() + ")";
	}

	public static final class Builder<T> {
		private final Class<T> type;
		private final List<PendingField> pending = new ArrayList<>();

		private Builder(Class<T> type) {
			this.type = type;
		}

		/**
		 * Adds the named field, using the codec that {@link ValueCodecs} has for its class, if any.
		 */
		public Builder<T> field(String name) {
			pending.add(new PendingField(name, null));
			return this;
		}

		/**
		 * Adds the named field with an explicit codec, which takes precedence over {@link ValueCodecs}.
		 */
		public <V> Builder<T> field(String name, ValueCodec<V> codec) {
			pending.add(new PendingField(name, codec));
			return this;
		}

		/**
		 * Validates the fields and makes this declaration visible to {@link Reflector}.
		 *
		 * @throws InvalidTypeException if <code>type</code> is already declared,
		 * or any field breaks the rules described in {@link ReflectableType}.
		 */
		public ReflectableType<T> register() throws InvalidTypeException {
			ReflectableType<T> result = build();
			if (TYPES.putIfAbsent(type, result) != null) {
				throw new InvalidTypeException("Reflectable type " + type.getSimpleName() + " is already declared");
			}
			LOGGER.debug("Declared {}", result);
			return result;
		}

		private ReflectableType<T> build() throws InvalidTypeException {
			if (type.isPrimitive() || type.isArray() || type.isInterface() || type.isEnum()) {
				throw new InvalidTypeException("Only classes can be reflectable: " + type.getName());
			}
			OrderedPMap<String, FieldDescriptor> fields = OrderedPMap.empty();
			for (PendingField p: pending) {
				if (fields.containsKey(p.name)) {
					throw new InvalidFieldTypeException(type, p.name, "declared twice");
				}
				fields = fields.plus(p.name, descriptorFor(p));
			}
			return new ReflectableType<>(type, fields);
		}

		@SuppressWarnings({"unchecked", "rawtypes"})
		private FieldDescriptor descriptorFor(PendingField p) throws InvalidTypeException {
			Field field;
			try {
				field = type.getDeclaredField(p.name);
			} catch (NoSuchFieldException e) {
				throw new InvalidFieldTypeException(type, p.name, "no such field declared in " + type.getSimpleName(), e);
			}
			int modifiers = field.getModifiers();
			if (isStatic(modifiers)) {
				throw new InvalidFieldTypeException(type, p.name, "field is static");
			} else if (isFinal(modifiers)) {
				throw new InvalidFieldTypeException(type, p.name, "field is final");
			}
			try {
				setAccessible(field);
			} catch (IllegalArgumentException e) {
				throw new InvalidFieldTypeException(type, p.name, e.getMessage(), e);
			} catch (RuntimeException e) {
				// Typically InaccessibleObjectException from a module that isn't open to us
				throw new InvalidFieldTypeException(type, p.name, "can't be made accessible: " + e.getMessage(), e);
			}

			Class<?> fieldClass = field.getType();

			// Initializes fieldClass, whose static initializer might register a codec, so this comes first
			boolean navigable = isNavigable(fieldClass);
			ValueCodec<?> codec = (p.codec != null) ? p.codec : ValueCodecs.forClass(fieldClass).orElse(null);
			if (codec == null && !navigable) {
				throw new InvalidFieldTypeException(type, p.name,
					fieldClass.getSimpleName() + " has no codec and is not a reflectable type");
			} else if (codec != null && codec.valueType() != boxed(fieldClass)) {
				throw new InvalidFieldTypeException(type, p.name,
					"codec for " + codec.valueType().getSimpleName() + " doesn't match field type " + fieldClass.getSimpleName());
			}
			return new FieldDescriptor(p.name, field, (ValueCodec) codec, navigable);
		}

		private boolean isNavigable(Class<?> fieldClass) {
			if (fieldClass == type) {
				// Self-reference; we're mid-declaration so it's not in TYPES yet
				return true;
			} else if (fieldClass.isPrimitive() || fieldClass.isArray() || fieldClass.isEnum()) {
				return false;
			} else {
				return forInitializedClass(fieldClass).isPresent();
			}
		}
	}

	private static Class<?> boxed(Class<?> c) {
		if (!c.isPrimitive()) {
			return c;
		} else if (c == int.class) {
			return Integer.class;
		} else if (c == long.class) {
			return Long.class;
		} else if (c == boolean.class) {
			return Boolean.class;
		} else if (c == double.class) {
			return Double.class;
		} else if (c == float.class) {
			return Float.class;
		} else if (c == char.class) {
			return Character.class;
		} else if (c == short.class) {
			return Short.class;
		} else if (c == byte.class) {
			return Byte.class;
		} else {
			throw new AssertionError("Unexpected primitive type: " + c);
		}
	}

	@RequiredArgsConstructor
	private static final class PendingField {
		final String name;
		final ValueCodec<?> codec;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ReflectableType.class);
}
