package works.tessel.mapping;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a record component that may be missing or {@code null} in JSON,
 * in which case it takes its {@link JsonDefaultValue default}, if any, or else {@code null}.
 * <p>
 * Has no effect on primitive components, which are always required unless they have a default.
 * Hand-written descriptors use {@link PropertyDescriptor.Builder#nullable()} instead.
 */
@Documented
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface Nullable {
}
