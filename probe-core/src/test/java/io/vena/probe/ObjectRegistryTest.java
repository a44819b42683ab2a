package io.vena.probe;

import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObjectRegistryTest {
	ObjectRegistry<Plain> registry;
	Identifier id1;
	Identifier id2;

	// The registry holds these weakly, so the test must hold them strongly
	Plain p1;
	Plain p2;

	/**
	 * Not {@link Reflectable}, so nothing registers it except these tests.
	 */
	static class Plain {
		final String name;

		Plain(String name) {
			this.name = name;
		}
	}

	@BeforeEach
	void setup() {
		registry = ObjectRegistry.forType(Plain.class);
		registry.ids().forEach(registry::unregister);
		id1 = Identifier.from("plain_1");
		id2 = Identifier.from("plain_2");
		p1 = new Plain("p1");
		p2 = new Plain("p2");
	}

	@Test
	void forType_returnsSameRegistry() {
		assertSame(registry, ObjectRegistry.forType(Plain.class));
		assertEquals(Plain.class, registry.type());
	}

	@Test
	void registeredObject_isFound() {
		registry.register(id1, p1);
		assertSame(p1, registry.lookup(id1).orElseThrow());
		assertTrue(registry.contains(id1));
		assertFalse(registry.contains(id2));
		assertEquals(1, registry.size());
	}

	@Test
	void lastRegistration_wins() {
		registry.register(id1, p1);
		registry.register(id1, p2);
		assertSame(p2, registry.lookup(id1).orElseThrow());
		assertEquals(1, registry.size());
	}

	@Test
	void unregister_removesWhateverIsThere() {
		registry.register(id1, p1);
		registry.unregister(id1);
		assertFalse(registry.lookup(id1).isPresent());

		// Absent is fine
		registry.unregister(id1);
		assertEquals(0, registry.size());
	}

	@Test
	void unregisterInstance_onlyRemovesThatInstance() {
		registry.register(id1, p1);
		registry.register(id1, p2);

		assertFalse(registry.unregister(id1, p1));
		assertSame(p2, registry.lookup(id1).orElseThrow());

		assertTrue(registry.unregister(id1, p2));
		assertFalse(registry.lookup(id1).isPresent());
	}

	@Test
	void ids_isSnapshot() {
		registry.register(id1, p1);
		registry.register(id2, p2);
		Set<Identifier> ids = registry.ids();
		assertThat(ids, containsInAnyOrder(id1, id2));

		registry.unregister(id1);
		assertThat(ids, containsInAnyOrder(id1, id2));
		assertThat(registry.ids(), containsInAnyOrder(id2));

		registry.unregister(id2);
		assertThat(registry.ids(), empty());
	}

	@Test
	void collectedObject_isNotFound() throws InterruptedException {
		registerUnreachable(id1);
		for (int attempt = 0; attempt < 100 && registry.contains(id1); attempt++) {
			System.gc();
			Thread.sleep(10);
		}
		assertFalse(registry.lookup(id1).isPresent());
		assertThat(registry.ids(), empty());
	}

	/**
	 * Separate method so no local variable in the test keeps the object reachable.
	 */
	private void registerUnreachable(Identifier id) {
		registry.register(id, new Plain("garbage"));
	}

	@Test
	void registry_isPerType() {
		registry.register(id1, p1);
		assertFalse(ObjectRegistry.forType(String.class).lookup(id1).isPresent());
	}
}
