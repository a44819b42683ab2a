package io.vena.probe;

import io.vena.probe.exceptions.ConversionException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static lombok.AccessLevel.PRIVATE;

/**
 * The process-wide table of {@link ValueCodec}s, keyed by leaf field class.
 *
 * <p>
 * Built-in codecs cover strings, the primitive types and their wrappers,
 * {@link BigInteger}, {@link BigDecimal}, {@link Identifier}, and all enums (by constant name).
 * Applications add their own value types with {@link #register}.
 * Registration must happen before any {@link ReflectableType} that uses
 * the type is declared, because field types are checked at declaration time.
 *
 * <p>
 * Parsing is strict: the text must be exactly the value's representation,
 * with no surrounding whitespace.
 */
public final class ValueCodecs {
	private static final Map<Class<?>, ValueCodec<?>> CODECS = new ConcurrentHashMap<>();

	static {
		ValueCodec<String> stringCodec = new StringCodec();
		ValueCodec<Boolean> booleanCodec = parsing(Boolean.class, ValueCodecs::parseBoolean);
		ValueCodec<Character> charCodec = parsing(Character.class, ValueCodecs::parseChar);
		ValueCodec<Byte> byteCodec = parsing(Byte.class, Byte::valueOf);
		ValueCodec<Short> shortCodec = parsing(Short.class, Short::valueOf);
		ValueCodec<Integer> intCodec = parsing(Integer.class, Integer::valueOf);
		ValueCodec<Long> longCodec = parsing(Long.class, Long::valueOf);
		ValueCodec<Float> floatCodec = parsing(Float.class, s -> Float.valueOf(strictDecimal(s)));
		ValueCodec<Double> doubleCodec = parsing(Double.class, s -> Double.valueOf(strictDecimal(s)));

		CODECS.put(String.class, stringCodec);
		CODECS.put(boolean.class, booleanCodec);
		CODECS.put(Boolean.class, booleanCodec);
		CODECS.put(char.class, charCodec);
		CODECS.put(Character.class, charCodec);
		CODECS.put(byte.class, byteCodec);
		CODECS.put(Byte.class, byteCodec);
		CODECS.put(short.class, shortCodec);
		CODECS.put(Short.class, shortCodec);
		CODECS.put(int.class, intCodec);
		CODECS.put(Integer.class, intCodec);
		CODECS.put(long.class, longCodec);
		CODECS.put(Long.class, longCodec);
		CODECS.put(float.class, floatCodec);
		CODECS.put(Float.class, floatCodec);
		CODECS.put(double.class, doubleCodec);
		CODECS.put(Double.class, doubleCodec);
		CODECS.put(BigInteger.class, parsing(BigInteger.class, BigInteger::new));
		CODECS.put(BigDecimal.class, parsing(BigDecimal.class, BigDecimal::new));
		CODECS.put(Identifier.class, parsing(Identifier.class, Identifier::from));
	}

	/**
	 * Adds or replaces the codec for <code>type</code>.
	 *
	 * @throws IllegalArgumentException if <code>type</code> is primitive
	 * (primitive fields always use the built-in codecs), or isn't the codec's
	 * {@link ValueCodec#valueType() value type}.
	 */
	public static <T> void register(Class<T> type, ValueCodec<T> codec) {
		if (type.isPrimitive()) {
			throw new IllegalArgumentException("Can't replace codec for primitive type " + type);
		} else if (codec.valueType() != type) {
			throw new IllegalArgumentException("Codec for " + codec.valueType().getName() + " can't be registered for " + type.getName());
		}
		ValueCodec<?> old = CODECS.put(type, codec);
		if (old == null) {
			LOGGER.debug("Registered codec for {}", type.getName());
		} else {
			LOGGER.debug("Replaced codec for {}", type.getName());
		}
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	public static <T> Optional<ValueCodec<T>> forClass(Class<T> type) {
		ValueCodec<?> result = CODECS.get(type);
		if (result == null && type.isEnum()) {
			result = CODECS.computeIfAbsent(type, t -> new EnumCodec(t));
		}
		return Optional.ofNullable((ValueCodec<T>) result);
	}

	public static boolean hasCodec(Class<?> type) {
		return forClass(type).isPresent();
	}

	private static <T> ValueCodec<T> parsing(Class<T> type, Function<String, T> parser) {
		return new ParsingCodec<>(type, parser);
	}

	/**
	 * Adapts the usual <code>valueOf</code>-style parser, whose failures are
	 * unchecked {@link IllegalArgumentException}s such as {@link NumberFormatException}.
	 */
	@RequiredArgsConstructor(access = PRIVATE)
	private static final class ParsingCodec<T> implements ValueCodec<T> {
		private final Class<T> type;
		private final Function<String, T> parser;

		@Override
		public Class<?> valueType() {
			return type;
		}

		@Override
		public String toText(T value) {
			return String.valueOf(value);
		}

		@Override
		public T fromText(String text) throws ConversionException {
			try {
				return parser.apply(text);
			} catch (IllegalArgumentException e) {
				throw new ConversionException("Invalid " + type.getSimpleName() + ": \"" + text + "\"", e);
			}
		}

		@Override
		public String toString() {
			return getClass().getSimpleName() + "(" + type.getSimpleName() + ")";
		}
	}

	private static final class StringCodec implements ValueCodec<String> {
		@Override
		public Class<?> valueType() {
			return String.class;
		}

		@Override
		public String toText(String value) {
			return value == null ? "" : value;
		}

		@Override
		public String fromText(String text) {
			return text;
		}
	}

	@RequiredArgsConstructor(access = PRIVATE)
	private static final class EnumCodec<E extends Enum<E>> implements ValueCodec<E> {
		private final Class<E> type;

		@Override
		public Class<?> valueType() {
			return type;
		}

		@Override
		public String toText(E value) {
			return value.name();
		}

		@Override
		public E fromText(String text) throws ConversionException {
			try {
				return Enum.valueOf(type, text);
			} catch (IllegalArgumentException e) {
				throw new ConversionException("No " + type.getSimpleName() + " constant named \"" + text + "\"", e);
			}
		}
	}

	private static Boolean parseBoolean(String text) {
		if ("true".equalsIgnoreCase(text) || "1".equals(text)) {
			return true;
		} else if ("false".equalsIgnoreCase(text) || "0".equals(text)) {
			return false;
		} else {
			throw new IllegalArgumentException("Not a boolean: \"" + text + "\"");
		}
	}

	private static Character parseChar(String text) {
		if (text.length() == 1) {
			return text.charAt(0);
		} else {
			throw new IllegalArgumentException("Expected exactly one character: \"" + text + "\"");
		}
	}

	/**
	 * {@link Double#valueOf} is lenient about whitespace and accepts Java literal suffixes.
	 * We want neither.
	 */
	private static String strictDecimal(String text) {
		if (text.isEmpty()) {
			throw new NumberFormatException("Empty number");
		}
		char first = text.charAt(0);
		char last = text.charAt(text.length() - 1);
		if (Character.isWhitespace(first) || Character.isWhitespace(last)) {
			throw new NumberFormatException("Whitespace around number: \"" + text + "\"");
		}
		switch (last) {
			case 'd': case 'D': case 'f': case 'F':
				throw new NumberFormatException("Unexpected suffix: \"" + text + "\"");
			default:
				return text;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValueCodecs.class);
}
