package io.vena.probe;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReflectableTest extends AbstractProbeTest {
	final ObjectRegistry<TestObject> registry = ObjectRegistry.forType(TestObject.class);

	@Test
	void construction_registers() {
		String id = uniqueId("construct");
		TestObject object = newTestObject(id);
		assertEquals(Identifier.from(id), object.objectId());
		assertTrue(object.isRegistered());
		assertSame(object, registry.lookup(Identifier.from(id)).orElseThrow());
	}

	@Test
	void invalidId_throwsWithoutRegistering() {
		int before = registry.size();
		assertThrows(IllegalArgumentException.class, () -> new TestObject(""));
		assertThrows(IllegalArgumentException.class, () -> new TestObject("has space"));
		assertEquals(before, registry.size());
	}

	@Test
	void close_unregisters() {
		String id = uniqueId("close");
		TestObject object = newTestObject(id);
		object.close();
		assertFalse(object.isRegistered());
		assertNull(object.objectId());
		assertFalse(registry.lookup(Identifier.from(id)).isPresent());
	}

	@Test
	void close_isIdempotent() {
		TestObject object = newTestObject(uniqueId("idempotent"));
		object.close();
		object.close();
		assertFalse(object.isRegistered());
	}

	@Test
	void tryWithResources_unregisters() {
		String id = uniqueId("scoped");
		try (TestObject object = new TestObject(id)) {
			assertSame(object, registry.lookup(Identifier.from(id)).orElseThrow());
		}
		assertFalse(registry.lookup(Identifier.from(id)).isPresent());
	}

	@Test
	void registerAs_moves() {
		String oldId = uniqueId("old");
		String newId = uniqueId("new");
		TestObject object = newTestObject(oldId);
		object.registerAs(newId);
		assertEquals(Identifier.from(newId), object.objectId());
		assertFalse(registry.lookup(Identifier.from(oldId)).isPresent());
		assertSame(object, registry.lookup(Identifier.from(newId)).orElseThrow());
	}

	@Test
	void registerAs_invalidId_keepsRegistration() {
		String id = uniqueId("keep");
		TestObject object = newTestObject(id);
		assertThrows(IllegalArgumentException.class, () -> object.registerAs(""));
		assertEquals(Identifier.from(id), object.objectId());
		assertSame(object, registry.lookup(Identifier.from(id)).orElseThrow());
	}

	@Test
	void registerAs_afterClose_registersAgain() {
		String id = uniqueId("revived");
		TestObject object = newTestObject(uniqueId("closed"));
		object.close();
		object.registerAs(id);
		assertTrue(object.isRegistered());
		assertSame(object, registry.lookup(Identifier.from(id)).orElseThrow());
	}

	@Test
	void reusedId_laterObjectWins() {
		String id = uniqueId("reused");
		TestObject first = newTestObject(id);
		TestObject second = newTestObject(id);
		assertSame(second, registry.lookup(Identifier.from(id)).orElseThrow());

		// The first object no longer owns the id, so closing it leaves the second in place
		first.close();
		assertSame(second, registry.lookup(Identifier.from(id)).orElseThrow());

		second.close();
		assertFalse(registry.lookup(Identifier.from(id)).isPresent());
	}

	@Test
	void renamedObject_doesNotEvictNewOwner() {
		String id = uniqueId("contested");
		TestObject first = newTestObject(id);
		TestObject second = newTestObject(id);
		first.registerAs(uniqueId("elsewhere"));
		assertSame(second, registry.lookup(Identifier.from(id)).orElseThrow());
	}

	@Test
	void subclass_usesDeclaredTypeRegistry() {
		String id = uniqueId("special");
		SpecialTestObject object = track(new SpecialTestObject(id));
		assertSame(object, registry.lookup(Identifier.from(id)).orElseThrow());
		assertFalse(ObjectRegistry.forType(SpecialTestObject.class).lookup(Identifier.from(id)).isPresent());
	}

	@Test
	void undeclaredSubclass_throws() {
		IllegalStateException e = assertThrows(IllegalStateException.class, () -> new Undeclared("undeclared"));
		assertThat(e.getMessage(), containsString(ReflectableType.class.getSimpleName()));
		assertFalse(ObjectRegistry.forType(Undeclared.class).contains(Identifier.from("undeclared")));
	}

	@Test
	void failedSubclassConstructor_closesItself() {
		String id = uniqueId("failing");
		newTestObject(id);
		assertThrows(IllegalStateException.class, () -> new FailingTestObject(id));
		assertFalse(registry.lookup(Identifier.from(id)).isPresent());
		assertEquals("", CommandDispatcher.forRootType(TestObject.class).parseAndExecute("get " + id + ".a"));
	}

	@Test
	void toString_showsId() {
		String id = uniqueId("shown");
		assertEquals("TestObject(" + id + ")", newTestObject(id).toString());
	}

	static class FailingTestObject extends TestObject {
		FailingTestObject(String id) {
			super(id);
			try {
				a = 777;
				throw new IllegalStateException("Can't finish constructing " + id);
			} catch (RuntimeException e) {
				close();
				throw e;
			}
		}
	}

	static class Undeclared extends Reflectable<Undeclared> {
		Undeclared(String id) {
			super(id);
		}
	}
}
