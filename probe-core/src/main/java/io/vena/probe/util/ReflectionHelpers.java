package io.vena.probe.util;

import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.Arrays;

import static java.lang.String.format;
import static java.lang.reflect.Modifier.isPrivate;

public final class ReflectionHelpers {

	public static Field setAccessible(Field field) {
		makeAccessible(field, field.getModifiers());
		return field;
	}

	private static void makeAccessible(AccessibleObject object, int modifiers) {
		// Private fields stay private: their owners can rename and
		// retype them without breaking any console command.
		//
		if (isPrivate(modifiers)) {
			throw new IllegalArgumentException("Access to private " + object.getClass().getSimpleName() + " is forbidden: " + object);
		}

		object.setAccessible(true);
	}

	public static Class<?> rawClass(Type sourceType) {
		if (sourceType instanceof ParameterizedType) {
			return (Class<?>)((ParameterizedType) sourceType).getRawType();
		} else if (sourceType instanceof Class) {
			return (Class<?>)sourceType;
		} else {
			throw new IllegalArgumentException("Not a class or parameterized type: " + sourceType);
		}
	}

	/**
	 * @return the <code>index</code>th type argument that <code>actualType</code>
	 * supplies to <code>genericClass</code>, resolved through any intervening
	 * superclasses and interfaces. The result may be a {@link TypeVariable} if
	 * <code>actualType</code> itself leaves it unresolved.
	 */
	public static Type parameterType(Type actualType, Class<?> genericClass, int index) {
		Class<?> actualClass = rawClass(actualType);
		if (!genericClass.isAssignableFrom(actualClass)) {
			throw new IllegalArgumentException(genericClass.getSimpleName() + " must be assignable from " + actualType);
		}
		if (actualClass == genericClass) {
			if (actualType instanceof ParameterizedType) {
				return ((ParameterizedType)actualType).getActualTypeArguments()[index];
			} else {
				throw new IllegalArgumentException("Raw use of " + genericClass.getSimpleName() + " has no type arguments");
			}
		}

		// Find which of our supertypes leads to genericClass.
		// Java requires repeated inheritance of an interface to use consistent
		// type arguments, so the first match will do.
		Type supertype = actualClass.getGenericSuperclass();
		if (supertype == null || !genericClass.isAssignableFrom(rawClass(supertype))) {
			supertype = Arrays.stream(actualClass.getGenericInterfaces())
				.filter(candidate -> genericClass.isAssignableFrom(rawClass(candidate)))
				.findFirst()
				.orElseThrow(() -> new AssertionError(format("No supertype of %s leads to %s", actualClass.getSimpleName(), genericClass.getSimpleName())));
		}

		Type returned = parameterType(supertype, genericClass, index);
		if (returned instanceof TypeVariable && actualType instanceof ParameterizedType) {
			// If actualType is C<String> and C is declared as C<T> extends S<T>,
			// the recursive call gave us T, which we map back to String.
			TypeVariable<?>[] typeVariables = actualClass.getTypeParameters();
			for (int i = 0; i < typeVariables.length; i++) {
				if (returned.equals(typeVariables[i])) {
					return ((ParameterizedType)actualType).getActualTypeArguments()[i];
				}
			}
		}
		return returned;
	}

}
