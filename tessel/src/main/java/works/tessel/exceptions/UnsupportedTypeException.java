package works.tessel.exceptions;

import works.tessel.types.TypeDescriptor;

/**
 * No factory in an {@link works.tessel.codec.AdapterRegistry AdapterRegistry}
 * could produce an adapter for the requested type.
 */
public class UnsupportedTypeException extends IllegalArgumentException {
	private final TypeDescriptor type;

	public UnsupportedTypeException(TypeDescriptor type) {
		this(type, "No JsonAdapter for " + type.description());
	}

	public UnsupportedTypeException(TypeDescriptor type, String message) {
		super(message);
		this.type = type;
	}

	public UnsupportedTypeException(TypeDescriptor type, String message, Throwable cause) {
		super(message, cause);
		this.type = type;
	}

	public TypeDescriptor type() {
		return type;
	}
}
