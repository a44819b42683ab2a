package io.vena.probe;

import org.jetbrains.annotations.Nullable;

import static io.vena.probe.util.ReflectionHelpers.parameterType;
import static io.vena.probe.util.ReflectionHelpers.rawClass;

/**
 * An object that registers itself in the {@link ObjectRegistry} for <code>T</code>
 * under an {@link Identifier}, so commands can address it.
 *
 * <p>
 * The object is registered from the moment it's constructed until it's {@link #close() closed}.
 * {@link #registerAs} moves it to a different identifier. Subclasses must also
 * declare their fields with {@link ReflectableType}, normally in a static initializer.
 *
 * <p>
 * Registration happens in this class's constructor, before any subclass
 * constructor runs, and it replaces whatever object held the identifier.
 * A subclass constructor that throws therefore leaves a half-built object
 * registered. Such constructors should {@link #close()} before rethrowing:
 *
 * <pre>
 * Sensor(String id, Calibration calibration) {
 *     super(id);
 *     try {
 *         this.calibration = calibration.validated();
 *     } catch (RuntimeException e) {
 *         close();
 *         throw e;
 *     }
 * }
 * </pre>
 *
 * The previous holder of the identifier stays evicted either way.
 *
 * <p>
 * <code>T</code> is the class whose registry is used, so a subclass of
 * <code>Sensor extends Reflectable&lt;Sensor&gt;</code> is still found by
 * looking up <code>Sensor</code>s.
 *
 * @param <T> the registered type; must be the class that directly extends <code>Reflectable</code>,
 * or one of its superclasses.
 */
public abstract class Reflectable<T extends Reflectable<T>> implements AutoCloseable {
	private final ObjectRegistry<T> registry;
	private @Nullable Identifier objectId;

	/**
	 * @throws IllegalArgumentException if <code>id</code> isn't a valid {@link Identifier}
	 * @throws IllegalStateException if this class has no {@link ReflectableType} declaration
	 */
	protected Reflectable(String id) {
		Identifier newId = Identifier.from(id);
		if (ReflectableType.forClass(getClass()).isEmpty()) {
			throw new IllegalStateException("Reflectable class " + getClass().getSimpleName() + " must be declared with " + ReflectableType.class.getSimpleName());
		}
		this.registry = ObjectRegistry.forType(registeredType());
		this.objectId = newId;
		registry.register(newId, self());
	}

	/**
	 * @return the current identifier, or null if {@link #close() closed}
	 */
	public final @Nullable Identifier objectId() {
		return objectId;
	}

	public final boolean isRegistered() {
		return objectId != null;
	}

	/**
	 * Moves this object to a new identifier. A closed object becomes registered again.
	 *
	 * @throws IllegalArgumentException if <code>id</code> isn't a valid {@link Identifier},
	 * in which case the existing registration is unchanged.
	 */
	public final void registerAs(String id) {
		Identifier newId = Identifier.from(id);
		if (objectId != null) {
			registry.unregister(objectId, self());
		}
		objectId = newId;
		registry.register(newId, self());
	}

	/**
	 * Removes this object from its registry. Idempotent.
	 */
	@Override
	public void close() {
		if (objectId != null) {
			registry.unregister(objectId, self());
			objectId = null;
		}
	}

	@SuppressWarnings("unchecked")
	private T self() {
		return (T) this;
	}

	@SuppressWarnings("unchecked")
	private Class<T> registeredType() {
		return (Class<T>) rawClass(parameterType(getClass(), Reflectable.class, 0));
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + objectId + ")";
	}
}
