package io.vena.probe.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.vena.probe.Identifier;
import java.io.IOException;

/**
 * Teaches Jackson to write {@link Identifier}s as plain JSON strings,
 * so they can appear inside values handled by {@link JacksonValueCodec}.
 */
public final class ProbeJacksonModule extends SimpleModule {
	public ProbeJacksonModule() {
		super(ProbeJacksonModule.class.getSimpleName());
		addSerializer(Identifier.class, new IdentifierSerializer());
		addDeserializer(Identifier.class, new IdentifierDeserializer());
	}

	private static final class IdentifierSerializer extends JsonSerializer<Identifier> {
		@Override
		public void serialize(Identifier value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeString(value.toString());
		}
	}

	private static final class IdentifierDeserializer extends JsonDeserializer<Identifier> {
		@Override
		public Identifier deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			if (p.currentToken() != JsonToken.VALUE_STRING) {
				return (Identifier) ctxt.handleUnexpectedToken(Identifier.class, p);
			}
			try {
				return Identifier.from(p.getText());
			} catch (IllegalArgumentException e) {
				return (Identifier) ctxt.handleWeirdStringValue(Identifier.class, p.getText(), "%s", e.getMessage());
			}
		}
	}
}
