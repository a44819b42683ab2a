package io.vena.probe.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.vena.probe.ReflectableType;
import io.vena.probe.ValueCodec;
import io.vena.probe.exceptions.ConversionException;

import static com.fasterxml.jackson.databind.SerializationFeature.INDENT_OUTPUT;

/**
 * A {@link ValueCodec} whose text form is compact JSON, for leaf fields
 * holding lists, maps, or value classes that have no codec of their own.
 *
 * <pre>
 * ReflectableType.builder(Sensor.class)
 *     .field("tags", JacksonValueCodec.of(mapper, new TypeReference&lt;List&lt;String&gt;&gt;(){}))
 *     .register();
 * </pre>
 *
 * The JSON is written without indentation, so it contains whitespace only
 * inside string values. Since commands can't contain whitespace, values with
 * embedded spaces can be read with <code>get</code> but not written with <code>set</code>.
 *
 * @see ReflectableType.Builder#field(String, ValueCodec)
 */
public final class JacksonValueCodec<T> implements ValueCodec<T> {
	private final JavaType type;
	private final ObjectReader reader;
	private final ObjectWriter writer;

	private JacksonValueCodec(ObjectMapper mapper, JavaType type) {
		this.type = type;
		this.reader = mapper.readerFor(type);
		this.writer = mapper.writerFor(type).without(INDENT_OUTPUT);
	}

	public static <T> JacksonValueCodec<T> of(ObjectMapper mapper, Class<T> type) {
		return new JacksonValueCodec<>(mapper, mapper.constructType(type));
	}

	public static <T> JacksonValueCodec<T> of(ObjectMapper mapper, TypeReference<T> type) {
		return new JacksonValueCodec<>(mapper, mapper.constructType(type));
	}

	@Override
	public Class<?> valueType() {
		return type.getRawClass();
	}

	@Override
	public String toText(T value) {
		try {
			return writer.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to write " + type + " as JSON: " + e.getOriginalMessage(), e);
		}
	}

	@Override
	public T fromText(String text) throws ConversionException {
		try {
			return reader.readValue(text);
		} catch (JsonProcessingException e) {
			throw new ConversionException("Invalid JSON for " + type + ": " + e.getOriginalMessage(), e);
		}
	}

	@Override
	public String toString() {
		return "JacksonValueCodec(" + type + ")";
	}
}
