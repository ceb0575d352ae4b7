package io.forgedi.di;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks the constructor, fields and methods used when a class is autowired.
 * A non-empty value names the entry to inject instead of the declared type.
 */
@Target({FIELD, CONSTRUCTOR, METHOD, PARAMETER})
@Retention(RUNTIME)
public @interface Inject {
	String value() default "";
}
