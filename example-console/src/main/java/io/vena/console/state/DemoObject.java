package io.vena.console.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.probe.Reflectable;
import io.vena.probe.ReflectableType;
import io.vena.probe.exceptions.InvalidTypeException;
import io.vena.probe.jackson.JacksonValueCodec;
import io.vena.probe.jackson.ProbeJacksonModule;
import java.util.List;

import static java.util.Arrays.asList;

/**
 * The console's root object type.
 */
public class DemoObject extends Reflectable<DemoObject> {
	private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new ProbeJacksonModule());

	static {
		try {
			ReflectableType.builder(DemoObject.class)
				.field("a")
				.field("d")
				.field("tags", JacksonValueCodec.of(MAPPER, new TypeReference<List<String>>() {}))
				.register();
		} catch (InvalidTypeException e) {
			throw new ExceptionInInitializerError(e);
		}
	}

	int a = 1;
	DemoRecord d = new DemoRecord(2, "hello");
	List<String> tags = asList("demo", "console");

	/**
	 * Not declared, so no command can reach it.
	 */
	String nonreflectable = "secret";

	public DemoObject(String id) {
		super(id);
	}

	public int a() { return a; }
	public DemoRecord d() { return d; }
	public List<String> tags() { return tags; }
}
