package works.tessel.mapping;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.ANNOTATION_TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks an annotation type as a qualifier.
 * When a qualifier annotation appears on a record component, it becomes part of
 * the component's {@link works.tessel.types.TypeDescriptor TypeDescriptor},
 * so that only adapters registered for that exact set of qualifiers will match.
 * <p>
 * Qualifier annotations must have runtime retention.
 */
@Retention(RUNTIME)
@Target(ANNOTATION_TYPE)
public @interface JsonQualifier {
}
