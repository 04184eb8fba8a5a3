package works.cairn;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.exceptions.DerivationCycleException;
import works.cairn.exceptions.HandlerConflictException;
import works.cairn.exceptions.MissingCapabilityException;
import works.cairn.exceptions.UnknownTypeException;

import static java.util.Objects.requireNonNull;

/**
 * Maps object type tags to the functions that understand them.
 * <p>
 * Each capability ({@link Capability#VALIDATE validate}, {@link Capability#HEIGHT height},
 * {@link Capability#DIMENSIONS dimensions}, {@link Capability#READ read}) is registered independently,
 * so a type can have a {@code validate} function without a {@code height} function.
 * Alongside the functions, the registry records which named interfaces each type satisfies
 * and which base types it derives from; a derived type inherits its bases' interfaces.
 * <p>
 * Registries are ordinary objects, so tests and applications can keep several
 * isolated ones in the same process.
 * All operations are thread-safe: mutations, including the {@link ConflictPolicy} decision,
 * happen atomically under a single write lock, and lookups observe either
 * the old or the new state, never a mixture.
 */
public final class TypeRegistry {
	private final Map<String, ValidateFunction> validateFunctions = new HashMap<>();
	private final Map<String, HeightFunction> heightFunctions = new HashMap<>();
	private final Map<String, DimensionsFunction> dimensionsFunctions = new HashMap<>();
	private final Map<String, ReadFunction> readFunctions = new HashMap<>();
	private final Map<String, Set<String>> interfaces = new HashMap<>();
	private final Map<String, Set<String>> bases = new HashMap<>();

	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	/**
	 * @param function if null, removes any existing function for {@code type} regardless of {@code policy}
	 * @return true if the registry changed
	 * @throws HandlerConflictException if {@code policy} is {@link ConflictPolicy#ERROR ERROR}
	 * and a function is already registered
	 */
	public boolean registerValidate(String type, @Nullable ValidateFunction function, ConflictPolicy policy) {
		return register(validateFunctions, Capability.VALIDATE, type, function, policy);
	}

	/**
	 * @see #registerValidate
	 */
	public boolean registerHeight(String type, @Nullable HeightFunction function, ConflictPolicy policy) {
		return register(heightFunctions, Capability.HEIGHT, type, function, policy);
	}

	/**
	 * @see #registerValidate
	 */
	public boolean registerDimensions(String type, @Nullable DimensionsFunction function, ConflictPolicy policy) {
		return register(dimensionsFunctions, Capability.DIMENSIONS, type, function, policy);
	}

	/**
	 * @see #registerValidate
	 */
	public boolean registerRead(String type, @Nullable ReadFunction function, ConflictPolicy policy) {
		return register(readFunctions, Capability.READ, type, function, policy);
	}

	private <F> boolean register(Map<String, F> functions, Capability capability, String type, @Nullable F function, ConflictPolicy policy) {
		requireNonNull(type);
		requireNonNull(policy);
		Lock w = lock.writeLock();
		w.lock();
		try {
			if (function == null) {
				boolean removed = functions.remove(type) != null;
				if (removed) {
					LOGGER.debug("Deregistered '{}' function for '{}'", capability.functionName(), type);
				}
				return removed;
			}
			if (functions.containsKey(type)) {
				switch (policy) {
					case KEEP_EXISTING:
						LOGGER.debug("Keeping existing '{}' function for '{}'", capability.functionName(), type);
						return false;
					case ERROR:
						throw new HandlerConflictException(capability, type);
					case REPLACE:
						break;
				}
			}
			functions.put(type, function);
			LOGGER.debug("Registered '{}' function for '{}'", capability.functionName(), type);
			return true;
		} finally {
			w.unlock();
		}
	}

	/**
	 * @return true if the registry changed
	 */
	public boolean declareInterface(String type, String interfaceName) {
		requireNonNull(type);
		requireNonNull(interfaceName);
		Lock w = lock.writeLock();
		w.lock();
		try {
			return interfaces.computeIfAbsent(type, __ -> new LinkedHashSet<>()).add(interfaceName);
		} finally {
			w.unlock();
		}
	}

	/**
	 * @return true if the registry changed
	 */
	public boolean revokeInterface(String type, String interfaceName) {
		Lock w = lock.writeLock();
		w.lock();
		try {
			return removeFromSet(interfaces, type, interfaceName);
		} finally {
			w.unlock();
		}
	}

	/**
	 * Records that {@code type} derives from {@code base},
	 * so that {@code type} satisfies every interface {@code base} satisfies
	 * and {@link #derivedFrom derivedFrom(type, base)} is true.
	 *
	 * @return true if the registry changed
	 * @throws DerivationCycleException if {@code base} is {@code type}
	 * or already derives (directly or transitively) from {@code type}
	 */
	public boolean declareDerivation(String type, String base) {
		requireNonNull(type);
		requireNonNull(base);
		Lock w = lock.writeLock();
		w.lock();
		try {
			if (type.equals(base) || reaches(base, type)) {
				throw new DerivationCycleException(type, base);
			}
			return bases.computeIfAbsent(type, __ -> new LinkedHashSet<>()).add(base);
		} finally {
			w.unlock();
		}
	}

	/**
	 * @return true if the registry changed
	 */
	public boolean revokeDerivation(String type, String base) {
		Lock w = lock.writeLock();
		w.lock();
		try {
			return removeFromSet(bases, type, base);
		} finally {
			w.unlock();
		}
	}

	private static boolean removeFromSet(Map<String, Set<String>> map, String key, String value) {
		Set<String> set = map.get(key);
		if (set == null || !set.remove(value)) {
			return false;
		}
		if (set.isEmpty()) {
			map.remove(key);
		}
		return true;
	}

	/**
	 * @return true if {@code type}, or any type it derives from, declares {@code interfaceName}
	 */
	public boolean satisfiesInterface(String type, String interfaceName) {
		Lock r = lock.readLock();
		r.lock();
		try {
			for (String t : selfAndBases(type)) {
				if (interfaces.getOrDefault(t, Set.of()).contains(interfaceName)) {
					return true;
				}
			}
			return false;
		} finally {
			r.unlock();
		}
	}

	/**
	 * @return true if {@code type} equals {@code base} or derives from it, directly or transitively
	 */
	public boolean derivedFrom(String type, String base) {
		if (type.equals(base)) {
			return true;
		}
		Lock r = lock.readLock();
		r.lock();
		try {
			return reaches(type, base);
		} finally {
			r.unlock();
		}
	}

	/**
	 * @throws UnknownTypeException if nothing at all is registered for {@code type}
	 * @throws MissingCapabilityException if {@code type} is known but has no validate function
	 */
	public ValidateFunction validateFunction(String type) {
		return lookup(validateFunctions, Capability.VALIDATE, type);
	}

	/**
	 * @see #validateFunction
	 */
	public HeightFunction heightFunction(String type) {
		return lookup(heightFunctions, Capability.HEIGHT, type);
	}

	/**
	 * @see #validateFunction
	 */
	public DimensionsFunction dimensionsFunction(String type) {
		return lookup(dimensionsFunctions, Capability.DIMENSIONS, type);
	}

	/**
	 * @see #validateFunction
	 */
	public ReadFunction readFunction(String type) {
		return lookup(readFunctions, Capability.READ, type);
	}

	private <F> F lookup(Map<String, F> functions, Capability capability, String type) {
		Lock r = lock.readLock();
		r.lock();
		try {
			F result = functions.get(type);
			if (result != null) {
				return result;
			} else if (isKnownWhileLocked(type)) {
				throw new MissingCapabilityException(capability, type);
			} else {
				throw new UnknownTypeException(capability, type);
			}
		} finally {
			r.unlock();
		}
	}

	public boolean hasCapability(String type, Capability capability) {
		Lock r = lock.readLock();
		r.lock();
		try {
			switch (capability) {
				case VALIDATE: return validateFunctions.containsKey(type);
				case HEIGHT: return heightFunctions.containsKey(type);
				case DIMENSIONS: return dimensionsFunctions.containsKey(type);
				case READ: return readFunctions.containsKey(type);
				default: throw new AssertionError("Unexpected capability: " + capability);
			}
		} finally {
			r.unlock();
		}
	}

	/**
	 * @return true if anything at all has been registered or declared for {@code type}
	 */
	public boolean isKnown(String type) {
		Lock r = lock.readLock();
		r.lock();
		try {
			return isKnownWhileLocked(type);
		} finally {
			r.unlock();
		}
	}

	private boolean isKnownWhileLocked(String type) {
		return validateFunctions.containsKey(type)
			|| heightFunctions.containsKey(type)
			|| dimensionsFunctions.containsKey(type)
			|| readFunctions.containsKey(type)
			|| interfaces.containsKey(type)
			|| bases.containsKey(type);
	}

	public Set<String> knownTypes() {
		Lock r = lock.readLock();
		r.lock();
		try {
			Set<String> result = new HashSet<>();
			result.addAll(validateFunctions.keySet());
			result.addAll(heightFunctions.keySet());
			result.addAll(dimensionsFunctions.keySet());
			result.addAll(readFunctions.keySet());
			result.addAll(interfaces.keySet());
			result.addAll(bases.keySet());
			return Set.copyOf(result);
		} finally {
			r.unlock();
		}
	}

	/**
	 * Caller must hold the lock.
	 */
	private boolean reaches(String from, String to) {
		return selfAndBases(from).contains(to);
	}

	/**
	 * Caller must hold the lock.
	 * Derivation graphs may contain diamonds, so each type is visited once.
	 */
	private Set<String> selfAndBases(String type) {
		Set<String> visited = new LinkedHashSet<>();
		Deque<String> pending = new ArrayDeque<>();
		pending.add(type);
		while (!pending.isEmpty()) {
			String t = pending.removeFirst();
			if (visited.add(t)) {
				pending.addAll(bases.getOrDefault(t, Set.of()));
			}
		}
		return visited;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);
}
