package io.vena.console.state;

import io.vena.probe.ReflectableType;
import io.vena.probe.ValueCodec;
import io.vena.probe.ValueCodecs;
import io.vena.probe.exceptions.ConversionException;

/**
 * A nested value. Commands can address its members individually
 * (<code>test_object.d.a</code>) or the whole thing as <code>a,b</code>
 * (<code>test_object.d</code>).
 */
public class DemoRecord {
	static {
		ValueCodecs.register(DemoRecord.class, new Codec());
		ReflectableType.declare(DemoRecord.class, "a", "b");
	}

	int a;
	String b;

	public DemoRecord(int a, String b) {
		this.a = a;
		this.b = b;
	}

	public int a() { return a; }
	public String b() { return b; }

	@Override
	public String toString() {
		return "DemoRecord(" + a + ", " + b + ")";
	}

	static final class Codec implements ValueCodec<DemoRecord> {
		@Override
		public Class<?> valueType() {
			return DemoRecord.class;
		}

		@Override
		public String toText(DemoRecord value) {
			return value.a + "," + (value.b == null ? "" : value.b);
		}

		@Override
		public DemoRecord fromText(String text) throws ConversionException {
			int comma = text.indexOf(',');
			if (comma < 0) {
				throw new ConversionException("Expected a,b: \"" + text + "\"");
			}
			try {
				return new DemoRecord(Integer.parseInt(text.substring(0, comma)), text.substring(comma + 1));
			} catch (NumberFormatException e) {
				throw new ConversionException("Expected an integer before the comma: \"" + text + "\"", e);
			}
		}
	}
}
