package works.tessel.types;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic type usage that a {@link Class} literal can't express.
 * Create an anonymous subclass:
 *
 * <pre>
 *     registry.adapterFor(TypeDescriptor.of(new TypeReference&lt;Map&lt;String, List&lt;Item&gt;&gt;&gt;() {}));
 * </pre>
 */
@SuppressWarnings("unused") // T is read reflectively
public abstract class TypeReference<T> {
	private final Type type;

	protected TypeReference() {
		if (getClass().getGenericSuperclass() instanceof ParameterizedType p) {
			this.type = p.getActualTypeArguments()[0];
		} else {
			throw new IllegalStateException("TypeReference must be subclassed with a type argument: " + getClass());
		}
	}

	public Type type() {
		return type;
	}
}
