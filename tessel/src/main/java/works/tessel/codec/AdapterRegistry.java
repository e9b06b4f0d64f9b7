package works.tessel.codec;

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessel.exceptions.UnsupportedTypeException;
import works.tessel.types.QualifierDeclaration;
import works.tessel.types.QualifierMarker;
import works.tessel.types.TypeDescriptor;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toSet;

/**
 * Finds the {@link JsonAdapter} for a {@link TypeDescriptor type usage}
 * by asking each {@link JsonAdapter.Factory factory} in turn; the first to respond wins.
 * Factories added by the user come first, in the order they were added,
 * followed by the built-in factories.
 * <p>
 * Results are cached, so each distinct descriptor is resolved at most once,
 * and all callers share one adapter instance.
 * The registry is immutable and thread-safe.
 * <p>
 * Resolution is reentrant: factories may call back into the registry for nested types,
 * including the very type they are building, in which case they receive a placeholder
 * that forwards to the real adapter once it's complete.
 */
public final class AdapterRegistry {
	private final List<JsonAdapter.Factory> userFactories;
	private final List<JsonAdapter.Factory> factories;
	private final Settings settings;
	private final Map<TypeDescriptor, JsonAdapter<?>> cache = new ConcurrentHashMap<>();
	private final ThreadLocal<LookupChain> lookupChains = new ThreadLocal<>();

	/**
	 * @param maxLookupDepth the number of nested lookups beyond which resolution fails.
	 *                       Guards against types that expand without bound,
	 *                       like a {@code Box<T>} containing a {@code Box<List<T>>}.
	 * @param includeBuiltIns whether to append the built-in factories after the user's
	 */
	public record Settings(int maxLookupDepth, boolean includeBuiltIns) {
		public Settings {
			if (maxLookupDepth < 1) {
				throw new IllegalArgumentException("maxLookupDepth must be positive: " + maxLookupDepth);
			}
		}

		public static final Settings DEFAULT = new Settings(255, true);

		public Settings withMaxLookupDepth(int maxLookupDepth) {
			return new Settings(maxLookupDepth, includeBuiltIns);
		}

		public Settings withIncludeBuiltIns(boolean includeBuiltIns) {
			return new Settings(maxLookupDepth, includeBuiltIns);
		}
	}

	private AdapterRegistry(List<JsonAdapter.Factory> userFactories, Settings settings) {
		this.userFactories = List.copyOf(userFactories);
		this.settings = settings;
		List<JsonAdapter.Factory> all = new ArrayList<>(userFactories);
		if (settings.includeBuiltIns()) {
			all.addAll(BUILT_IN_FACTORIES);
		}
		this.factories = List.copyOf(all);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a builder with this registry's factories and settings,
	 * to which more factories may be added
	 */
	public Builder newBuilder() {
		Builder result = new Builder();
		result.factories.addAll(userFactories);
		result.settings = settings;
		return result;
	}

	public Settings settings() {
		return settings;
	}

	public <T> JsonAdapter<T> adapter(Class<T> type) {
		return adapterFor(TypeDescriptor.of(type));
	}

	public <T> JsonAdapter<T> adapter(Type type) {
		return adapterFor(TypeDescriptor.of(type));
	}

	public <T> JsonAdapter<T> adapter(Type type, Set<QualifierMarker> qualifiers) {
		return adapterFor(TypeDescriptor.of(type).withQualifiers(qualifiers));
	}

	/**
	 * @throws UnsupportedTypeException if no factory produces an adapter for {@code type}
	 */
	@SuppressWarnings("unchecked")
	public <T> JsonAdapter<T> adapterFor(TypeDescriptor type) {
		requireNonNull(type);
		JsonAdapter<?> cached = cache.get(type);
		if (cached != null) {
			return (JsonAdapter<T>) cached;
		}

		LookupChain chain = lookupChains.get();
		if (chain == null) {
			chain = new LookupChain();
			lookupChains.set(chain);
		}

		Lookup existing = chain.find(type);
		if (existing != null) {
			LOGGER.trace("Reentrant lookup for {}", type);
			return (JsonAdapter<T>) existing.current();
		}
		if (chain.depth() >= settings.maxLookupDepth()) {
			// Leave it to the outermost lookup to clean up the chain
			throw new UnsupportedTypeException(type, "Lookup depth exceeded " + settings.maxLookupDepth()
				+ " for " + type.description() + "; is this type infinitely expanding?");
		}

		Lookup lookup = chain.push(type);
		boolean success = false;
		try {
			lookup.complete(createAdapter(type));
			success = true;
		} catch (UnsupportedTypeException e) {
			if (e.type().equals(type)) {
				throw e;
			}
			// Each enclosing lookup adds itself to the path
			throw new UnsupportedTypeException(e.type(), e.getMessage() + "\nfor " + type.description(), e);
		} finally {
			chain.pop(lookup, success);
			if (chain.depth() == 0) {
				lookupChains.remove();
			}
		}

		if (chain.depth() == 0) {
			// Outermost lookup: everything built along the way is now complete
			for (Lookup l : chain.completed()) {
				JsonAdapter<?> winner = cache.putIfAbsent(l.type, l.adapter);
				if (winner != null) {
					LOGGER.debug("Another thread already resolved {}; using its adapter", l.type);
				}
			}
			return (JsonAdapter<T>) cache.get(type);
		} else {
			return (JsonAdapter<T>) lookup.adapter;
		}
	}

	private JsonAdapter<?> createAdapter(TypeDescriptor type) {
		for (JsonAdapter.Factory factory : factories) {
			LOGGER.trace("Asking {} for {}", factory, type);
			JsonAdapter<?> result = factory.create(type, this);
			if (result != null) {
				LOGGER.debug("{} matched {}: {}", factory, type.description(), result);
				return result;
			}
		}
		throw new UnsupportedTypeException(type);
	}

	@Override
	public String toString() {
		return "AdapterRegistry" + factories.stream()
			.map(Object::toString)
			.collect(joining(", ", "[", "]"));
	}

	/**
	 * One type being resolved in the current thread.
	 * The deferred adapter is handed out to reentrant requests until the real one is ready.
	 */
	private static final class Lookup {
		final TypeDescriptor type;
		final int index;
		final DeferredAdapter<Object> deferred;
		JsonAdapter<Object> adapter;

		/**
		 * @param index position in the chain's start order
		 */
		Lookup(TypeDescriptor type, int index) {
			this.type = type;
			this.index = index;
			this.deferred = new DeferredAdapter<>(type);
		}

		JsonAdapter<Object> current() {
			return adapter == null ? deferred : adapter;
		}

		@SuppressWarnings("unchecked")
		void complete(JsonAdapter<?> result) {
			adapter = (JsonAdapter<Object>) result;
			deferred.bind(adapter);
		}
	}

	/**
	 * The lookups in progress in one thread, plus those completed since
	 * the outermost lookup began.
	 */
	private static final class LookupChain {
		private final Deque<Lookup> stack = new ArrayDeque<>();
		private final Map<TypeDescriptor, Lookup> lookups = new HashMap<>();

		/**
		 * All of {@link #lookups}, in the order they began.
		 */
		private final List<Lookup> started = new ArrayList<>();

		@Nullable Lookup find(TypeDescriptor type) {
			return lookups.get(type);
		}

		Lookup push(TypeDescriptor type) {
			Lookup result = new Lookup(type, started.size());
			stack.push(result);
			lookups.put(type, result);
			started.add(result);
			return result;
		}

		/**
		 * On failure, discards {@code lookup} along with every lookup that began after it,
		 * since any of those may hold its placeholder, which will never be bound.
		 */
		void pop(Lookup lookup, boolean success) {
			Lookup popped = stack.pop();
			assert popped == lookup;
			if (!success) {
				List<Lookup> discarded = started.subList(lookup.index, started.size());
				for (Lookup l : discarded) {
					lookups.remove(l.type);
				}
				LOGGER.trace("Discarded {} lookups after failing to resolve {}", discarded.size(), lookup.type);
				discarded.clear();
			}
		}

		int depth() {
			return stack.size();
		}

		Iterable<Lookup> completed() {
			return started;
		}
	}

	public static final class Builder {
		private final List<JsonAdapter.Factory> factories = new ArrayList<>();
		private Settings settings = Settings.DEFAULT;

		private Builder() { }

		public Builder add(JsonAdapter.Factory factory) {
			factories.add(requireNonNull(factory));
			return this;
		}

		/**
		 * Uses {@code adapter} for {@code type} with no qualifiers.
		 */
		public Builder add(Type type, JsonAdapter<?> adapter) {
			return add(type, Set.of(), adapter);
		}

		/**
		 * Uses {@code adapter} for {@code type} with exactly the given qualifiers.
		 */
		public Builder add(Type type, Set<QualifierMarker> qualifiers, JsonAdapter<?> adapter) {
			requireNonNull(type);
			requireNonNull(qualifiers);
			requireNonNull(adapter);
			return add(new ExactMatchFactory(TypeDescriptor.of(type).withQualifiers(qualifiers), adapter));
		}

		/**
		 * Uses {@code adapter} for {@code type} with exactly one qualifier,
		 * which must have default values for all its elements.
		 */
		public Builder add(Type type, Class<? extends Annotation> qualifier, JsonAdapter<?> adapter) {
			return add(type, Set.of(QualifierDeclaration.of(qualifier).marker()), adapter);
		}

		/**
		 * Uses {@code adapter} for {@code type} with exactly the given qualifiers,
		 * each of which must have default values for all its elements.
		 */
		public Builder add(Type type, List<Class<? extends Annotation>> qualifiers, JsonAdapter<?> adapter) {
			return add(type, qualifiers.stream()
				.map(q -> QualifierDeclaration.of(q).marker())
				.collect(toSet()), adapter);
		}

		public Builder settings(Settings settings) {
			this.settings = requireNonNull(settings);
			return this;
		}

		public AdapterRegistry build() {
			return new AdapterRegistry(factories, settings);
		}
	}

	private record ExactMatchFactory(TypeDescriptor type, JsonAdapter<?> adapter) implements JsonAdapter.Factory {
		@Override
		public JsonAdapter<?> create(TypeDescriptor requested, AdapterRegistry registry) {
			return type.equals(requested) ? adapter : null;
		}

		@Override
		public String toString() {
			return "ExactMatchFactory(" + type.description() + " -> " + adapter + ")";
		}
	}

	private static final List<JsonAdapter.Factory> BUILT_IN_FACTORIES = Stream.of(
		StandardAdapters.FACTORY,
		CollectionAdapterFactory.INSTANCE,
		MapAdapterFactory.INSTANCE,
		ArrayAdapter.FACTORY
	).toList();

	private static final Logger LOGGER = LoggerFactory.getLogger(AdapterRegistry.class);
}
