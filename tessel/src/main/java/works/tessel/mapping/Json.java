package works.tessel.mapping;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Overrides the JSON key for a record component, or the JSON string for an enum constant.
 */
@Retention(RUNTIME)
@Target({RECORD_COMPONENT, FIELD})
public @interface Json {
	String name();
}
