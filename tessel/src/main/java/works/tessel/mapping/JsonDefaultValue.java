package works.tessel.mapping;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * On a static, zero-argument method of a record: supplies the default value
 * of the component named by {@link #value()}, used when that component is absent or null in JSON.
 * <p>
 * On an enum constant: that constant is used for any JSON string that doesn't name a constant.
 * {@link #value()} is ignored.
 */
@Retention(RUNTIME)
@Target({METHOD, FIELD})
public @interface JsonDefaultValue {
	String value() default "";
}
