package works.tessel.exceptions;

import java.util.List;

/**
 * A JSON object was read completely, but some of the required properties
 * were never given a value.
 * All missing properties are reported together, in declaration order.
 */
public final class MissingPropertiesException extends JsonContentException {
	public static final String MESSAGE_PREFIX = "The following properties were null: ";

	private final List<String> propertyNames;

	public MissingPropertiesException(List<String> propertyNames) {
		super(MESSAGE_PREFIX + String.join(", ", propertyNames));
		this.propertyNames = List.copyOf(propertyNames);
	}

	/**
	 * @return the field names of the missing properties, in declaration order
	 */
	public List<String> propertyNames() {
		return propertyNames;
	}
}
