package io.vena.probe;

import java.util.Map;
import org.pcollections.OrderedPMap;

/**
 * Binds the declared fields of an object to {@link FieldAccessor}s.
 */
public final class Reflector {

	/**
	 * @return the object's declared fields, in declaration order, keyed by name.
	 * The result is a snapshot bound to <code>instance</code>; compute a fresh one
	 * for each command rather than holding on to it.
	 * @throws IllegalArgumentException if the object's class has no {@link ReflectableType}
	 */
	public static Map<String, FieldAccessor> reflect(Object instance) {
		ReflectableType<?> type = ReflectableType.forClass(instance.getClass())
			.orElseThrow(() -> new IllegalArgumentException("No " + ReflectableType.class.getSimpleName() + " declared for " + instance.getClass().getSimpleName()));
		return reflect(instance, type);
	}

	public static Map<String, FieldAccessor> reflect(Object instance, ReflectableType<?> type) {
		OrderedPMap<String, FieldAccessor> result = OrderedPMap.empty();
		for (FieldDescriptor descriptor: type.fields()) {
			result = result.plus(descriptor.name(), descriptor.bind(instance));
		}
		return result;
	}

	public static boolean isReflectable(Object instance) {
		return ReflectableType.forClass(instance.getClass()).isPresent();
	}

}
