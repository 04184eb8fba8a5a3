package works.cairn;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import works.cairn.exceptions.DerivationCycleException;
import works.cairn.exceptions.HandlerConflictException;
import works.cairn.exceptions.MissingCapabilityException;
import works.cairn.exceptions.UnknownTypeException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.cairn.ConflictPolicy.ERROR;
import static works.cairn.ConflictPolicy.KEEP_EXISTING;
import static works.cairn.ConflictPolicy.REPLACE;

class TypeRegistryTest {
	final TypeRegistry registry = new TypeRegistry();
	final ValidateFunction original = (path, metadata, context) -> { };
	final ValidateFunction replacement = (path, metadata, context) -> { };

	@Test
	void keepExisting_keepsOriginal() {
		assertTrue(registry.registerValidate("X", original, KEEP_EXISTING));
		assertFalse(registry.registerValidate("X", replacement, KEEP_EXISTING));
		assertSame(original, registry.validateFunction("X"));
	}

	@Test
	void replace_replaces() {
		registry.registerValidate("X", original, ERROR);
		assertTrue(registry.registerValidate("X", replacement, REPLACE));
		assertSame(replacement, registry.validateFunction("X"));
	}

	@Test
	void error_failsWithoutChange() {
		registry.registerValidate("X", original, ERROR);
		HandlerConflictException e = assertThrows(HandlerConflictException.class,
			() -> registry.registerValidate("X", replacement, ERROR));
		assertEquals("X", e.type());
		assertEquals(Capability.VALIDATE, e.capability());
		assertThat(e.getMessage(), containsString("'X'"));
		assertSame(original, registry.validateFunction("X"));
	}

	@Test
	void nullFunction_removesRegardlessOfPolicy() {
		registry.registerValidate("X", original, ERROR);
		assertTrue(registry.registerValidate("X", null, ERROR));
		assertFalse(registry.registerValidate("X", null, KEEP_EXISTING), "Nothing left to remove");
		assertFalse(registry.isKnown("X"));
		assertThrows(UnknownTypeException.class, () -> registry.validateFunction("X"));
	}

	@Test
	void capabilitiesAreIndependent() {
		registry.registerHeight("X", (path, metadata, context) -> 3, ERROR);
		assertTrue(registry.hasCapability("X", Capability.HEIGHT));
		assertFalse(registry.hasCapability("X", Capability.VALIDATE));

		MissingCapabilityException e = assertThrows(MissingCapabilityException.class, () -> registry.validateFunction("X"));
		assertEquals(Capability.VALIDATE, e.capability());
		assertEquals("X", e.type());

		UnknownTypeException unknown = assertThrows(UnknownTypeException.class, () -> registry.heightFunction("Y"));
		assertEquals("Y", unknown.type());
	}

	@Test
	void readFunctionsFollowThePolicy() {
		ReadFunction first = (path, metadata, reader) -> "first";
		ReadFunction second = (path, metadata, reader) -> "second";
		assertTrue(registry.registerRead("X", first, ERROR));
		assertFalse(registry.registerRead("X", second, KEEP_EXISTING));
		assertSame(first, registry.readFunction("X"));

		HandlerConflictException e = assertThrows(HandlerConflictException.class, () -> registry.registerRead("X", second, ERROR));
		assertEquals(Capability.READ, e.capability());

		assertTrue(registry.registerRead("X", second, REPLACE));
		assertSame(second, registry.readFunction("X"));
		assertTrue(registry.hasCapability("X", Capability.READ));
		assertFalse(registry.hasCapability("X", Capability.VALIDATE));

		assertTrue(registry.registerRead("X", null, ERROR));
		assertFalse(registry.isKnown("X"));
	}

	@Test
	void interfacesAreInheritedThroughDerivation() {
		registry.declareInterface("base", "SIMPLE_LIST");
		registry.declareDerivation("middle", "base");
		registry.declareDerivation("leaf", "middle");

		assertTrue(registry.satisfiesInterface("base", "SIMPLE_LIST"));
		assertTrue(registry.satisfiesInterface("leaf", "SIMPLE_LIST"));
		assertFalse(registry.satisfiesInterface("leaf", "DATA_FRAME"));
		assertTrue(registry.derivedFrom("leaf", "base"));
		assertTrue(registry.derivedFrom("leaf", "leaf"));
		assertFalse(registry.derivedFrom("base", "leaf"));

		assertTrue(registry.revokeDerivation("middle", "base"));
		assertFalse(registry.satisfiesInterface("leaf", "SIMPLE_LIST"));
		assertFalse(registry.derivedFrom("leaf", "base"));
	}

	@Test
	void revokeInterface() {
		assertTrue(registry.declareInterface("X", "SIMPLE_LIST"));
		assertFalse(registry.declareInterface("X", "SIMPLE_LIST"));
		assertTrue(registry.revokeInterface("X", "SIMPLE_LIST"));
		assertFalse(registry.satisfiesInterface("X", "SIMPLE_LIST"));
		assertFalse(registry.revokeInterface("X", "SIMPLE_LIST"));
	}

	@Test
	void derivationCycles_rejected() {
		registry.declareDerivation("A", "B");
		registry.declareDerivation("B", "C");
		assertThrows(DerivationCycleException.class, () -> registry.declareDerivation("C", "A"));
		assertThrows(DerivationCycleException.class, () -> registry.declareDerivation("A", "A"));
		assertFalse(registry.derivedFrom("C", "A"));
	}

	@Test
	void knownTypes() {
		registry.registerValidate("X", original, ERROR);
		registry.declareInterface("Y", "SIMPLE_LIST");
		registry.declareDerivation("Z", "Y");
		assertEquals(Set.of("X", "Y", "Z"), registry.knownTypes());
	}

	@Test
	void concurrentRegistrationAndLookup() throws Exception {
		registry.registerValidate("X", original, ERROR);
		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int t = 0; t < 8; t++) {
				boolean writer = t % 2 == 0;
				futures.add(executor.submit(() -> {
					for (int i = 0; i < 1000; i++) {
						if (writer) {
							registry.registerValidate("X", (i % 2 == 0) ? replacement : original, REPLACE);
						} else {
							ValidateFunction found = registry.validateFunction("X");
							assertTrue(found == original || found == replacement);
						}
					}
				}));
			}
			for (Future<?> future : futures) {
				future.get(30, TimeUnit.SECONDS);
			}
		} finally {
			executor.shutdownNow();
		}
	}

}
