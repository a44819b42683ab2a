package io.vena.probe;

import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link Identifier}s to live objects of one type.
 *
 * <p>
 * There is one registry per type, obtained from {@link #forType}, and it lasts
 * as long as the process. The registry does not own the objects: it holds them
 * weakly, and {@link Reflectable} objects remove themselves when closed.
 *
 * <p>
 * Not thread-safe. Callers that register, unregister or look up objects of
 * the same type from multiple threads must provide their own locking.
 */
@Accessors(fluent = true)
public final class ObjectRegistry<T> {
	@Getter
	private final Class<T> type;
	private final Map<Identifier, WeakReference<T>> objects = new HashMap<>();

	private static final Map<Class<?>, ObjectRegistry<?>> REGISTRIES = new ConcurrentHashMap<>();

	private ObjectRegistry(Class<T> type) {
		this.type = type;
	}

	@SuppressWarnings("unchecked")
	public static <T> ObjectRegistry<T> forType(Class<T> type) {
		return (ObjectRegistry<T>) REGISTRIES.computeIfAbsent(type, ObjectRegistry::new);
	}

	/**
	 * Maps <code>id</code> to <code>instance</code>, replacing any existing mapping.
	 */
	public void register(Identifier id, T instance) {
		WeakReference<T> old = objects.put(id, new WeakReference<>(type.cast(instance)));
		if (old == null || old.get() == null) {
			LOGGER.debug("Registered {} \"{}\"", type.getSimpleName(), id);
		} else if (old.get() != instance) {
			LOGGER.debug("Registered {} \"{}\", replacing a different object", type.getSimpleName(), id);
		}
	}

	/**
	 * Removes the mapping for <code>id</code>, whatever object it refers to.
	 * Does nothing if there is none.
	 */
	public void unregister(Identifier id) {
		if (objects.remove(id) != null) {
			LOGGER.debug("Unregistered {} \"{}\"", type.getSimpleName(), id);
		}
	}

	/**
	 * Removes the mapping for <code>id</code> only if it refers to <code>instance</code>.
	 * An object calls this when it stops using <code>id</code>, so that it can't evict
	 * a newer object that has since registered under the same identifier.
	 *
	 * @return true if a mapping was removed
	 */
	public boolean unregister(Identifier id, T instance) {
		WeakReference<T> ref = objects.get(id);
		if (ref != null && ref.get() == instance) {
			objects.remove(id);
			LOGGER.debug("Unregistered {} \"{}\"", type.getSimpleName(), id);
			return true;
		} else {
			LOGGER.debug("Not unregistering {} \"{}\": registered to a different object", type.getSimpleName(), id);
			return false;
		}
	}

	public Optional<T> lookup(Identifier id) {
		WeakReference<T> ref = objects.get(id);
		if (ref == null) {
			return Optional.empty();
		}
		T result = ref.get();
		if (result == null) {
			LOGGER.debug("Discarding collected {} \"{}\"", type.getSimpleName(), id);
			objects.remove(id);
		}
		return Optional.ofNullable(result);
	}

	public boolean contains(Identifier id) {
		return lookup(id).isPresent();
	}

	/**
	 * @return the identifiers of all live registered objects, at this moment
	 */
	public Set<Identifier> ids() {
		purgeCollected();
		return Set.copyOf(objects.keySet());
	}

	public int size() {
		purgeCollected();
		return objects.size();
	}

	private void purgeCollected() {
		for (Iterator<WeakReference<T>> iter = objects.values().iterator(); iter.hasNext(); ) {
			if (iter.next().get() == null) {
				iter.remove();
			}
		}
	}

	@Override
	public String toString() {
		return "ObjectRegistry(" + type.getSimpleName() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ObjectRegistry.class);
}
